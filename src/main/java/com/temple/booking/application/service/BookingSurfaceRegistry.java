package com.temple.booking.application.service;

import com.temple.booking.domain.availability.exception.UnknownBookingSurfaceException;
import com.temple.booking.domain.window.BookingSurface;
import com.temple.booking.infrastructure.config.BookingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 설정된 예약 화면 조회
 * - 화면마다 horizon 을 하드코딩하지 않고 설정 값 하나로 주입
 */
@Component
@RequiredArgsConstructor
public class BookingSurfaceRegistry {

    private final BookingProperties properties;

    public BookingSurface get(String name) {
        String surfaceName = (name == null || name.isBlank()) ? properties.getDefaultSurface() : name;
        BookingProperties.SurfaceConfig config = properties.getSurfaces().get(surfaceName);
        if (config == null) {
            throw new UnknownBookingSurfaceException(surfaceName);
        }
        return new BookingSurface(surfaceName, config.getHorizonMonths(), config.getFlow());
    }
}
