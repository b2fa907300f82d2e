package com.temple.booking.web.hall.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temple.booking.application.session.MonthView;
import com.temple.booking.domain.availability.BookingCategory;
import com.temple.booking.domain.availability.DateState;

import java.time.LocalDate;
import java.util.List;

public record CalendarMonthResponse(
        String surface,
        @JsonProperty("hall_id") int hallId,
        @JsonProperty("hall_name") String hallName,
        int year,
        int month,
        boolean canGoBack,
        boolean canGoForward,
        List<Day> days
) {

    public record Day(
            LocalDate date,
            DateState state,
            String reason,
            BookingCategory category,
            boolean selectable
    ) {}

    public static CalendarMonthResponse from(MonthView view) {
        List<Day> days = view.days().stream()
                .map(day -> new Day(
                        day.date(),
                        day.status().getState(),
                        day.status().getReason(),
                        day.status().getCategory(),
                        day.selectable()))
                .toList();
        return new CalendarMonthResponse(
                view.surface(),
                view.hall().id(),
                view.hall().name(),
                view.cursor().year(),
                view.cursor().month(),
                view.canGoBack(),
                view.canGoForward(),
                days
        );
    }
}
