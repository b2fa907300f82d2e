package com.temple.booking.application.session;

import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.hall.Hall;
import com.temple.booking.domain.window.CalendarCursor;

import java.time.LocalDate;
import java.util.List;

/**
 * 한 홀의 보이는 달 (달력 화면 한 장)
 */
public record MonthView(
        String surface,
        Hall hall,
        CalendarCursor cursor,
        boolean canGoBack,
        boolean canGoForward,
        List<DayView> days
) {

    public record DayView(LocalDate date, DateStatus status) {

        public boolean selectable() {
            return status.isAvailable();
        }
    }
}
