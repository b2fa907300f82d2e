package com.temple.booking.web.hall.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temple.booking.application.port.in.AvailabilityQueryUseCase.HallDateView;
import com.temple.booking.domain.availability.BookingCategory;

import java.time.LocalDate;

public record AvailabilityItemResponse(
        LocalDate date,
        String reason,
        @JsonProperty("is_booked") boolean booked,
        BookingCategory category,
        HallRef hall
) {

    public record HallRef(
            @JsonProperty("hall_id") int hallId,
            String name
    ) {}

    public static AvailabilityItemResponse from(HallDateView view) {
        return new AvailabilityItemResponse(
                view.date(),
                view.reason(),
                view.booked(),
                view.status().getCategory(),
                new HallRef(view.hallId(), view.hallName())
        );
    }
}
