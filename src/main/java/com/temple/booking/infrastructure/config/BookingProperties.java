package com.temple.booking.infrastructure.config;

import com.temple.booking.domain.window.SelectionFlow;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "booking")
public class BookingProperties {
    // "오늘"을 계산할 때 쓰는 시간대
    private String zone = "Asia/Kolkata";
    private String defaultSurface = "hall-detail";
    private Map<String, SurfaceConfig> surfaces = new LinkedHashMap<>();
    private HoldConfig hold = new HoldConfig();
    private IndexConfig index = new IndexConfig();
    private LockConfig lock = new LockConfig();

    @Getter
    @Setter
    public static class SurfaceConfig {
        private int horizonMonths;
        private SelectionFlow flow = SelectionFlow.HOLD;
    }

    @Getter
    @Setter
    public static class HoldConfig {
        private Duration ttl = Duration.ofMinutes(15);
        private long sweepIntervalMs = 30_000;
    }

    @Getter
    @Setter
    public static class IndexConfig {
        private long refreshIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class LockConfig {
        // local | redis
        private String mode = "local";
        private Duration waitTimeout = Duration.ofSeconds(3);
        private long ttlSeconds = 10;
        private int retryCount = 30;
        private long retryDelayMillis = 100;
    }
}
