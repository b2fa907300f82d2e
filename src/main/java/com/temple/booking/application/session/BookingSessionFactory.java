package com.temple.booking.application.session;

import com.temple.booking.application.index.AvailabilityIndex;
import com.temple.booking.application.port.out.HallDirectoryPort;
import com.temple.booking.application.service.BookingSurfaceRegistry;
import com.temple.booking.application.service.ConflictResolver;
import com.temple.booking.domain.availability.RequesterId;
import com.temple.booking.domain.window.CalendarCursor;
import com.temple.booking.domain.window.WindowPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class BookingSessionFactory {

    private final BookingSurfaceRegistry surfaces;
    private final WindowPolicy windowPolicy;
    private final AvailabilityIndex index;
    private final ConflictResolver resolver;
    private final HallDirectoryPort hallDirectory;
    private final Clock clock;

    public BookingSession open(String surface, RequesterId requester) {
        return open(surface, requester, null);
    }

    /**
     * @param cursor 이전 요청에서 보던 달 (없으면 이번 달)
     */
    public BookingSession open(String surface, RequesterId requester, CalendarCursor cursor) {
        return new BookingSession(
                surfaces.get(surface),
                requester,
                cursor,
                windowPolicy,
                index,
                resolver,
                hallDirectory,
                clock
        );
    }
}
