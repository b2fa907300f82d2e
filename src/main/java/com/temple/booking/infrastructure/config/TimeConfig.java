package com.temple.booking.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 시간 관련 빈. 모든 "오늘" 계산은 이 Clock 하나를 거침
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock bookingClock(BookingProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
