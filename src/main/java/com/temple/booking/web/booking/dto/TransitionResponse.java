package com.temple.booking.web.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temple.booking.domain.availability.BookingCategory;
import com.temple.booking.domain.availability.DateState;
import com.temple.booking.domain.availability.TransitionOutcome;
import com.temple.booking.domain.availability.TransitionResult;

import java.time.Instant;
import java.time.LocalDate;

public record TransitionResponse(
        TransitionOutcome outcome,
        @JsonProperty("hall_id") int hallId,
        LocalDate date,
        DateState state,
        String reason,
        BookingCategory category,
        Instant holdExpiresAt
) {

    public static TransitionResponse from(TransitionResult result) {
        return new TransitionResponse(
                result.outcome(),
                result.key().hallId(),
                result.key().date(),
                result.status().getState(),
                result.status().getReason(),
                result.status().getCategory(),
                result.holdExpiresAt()
        );
    }
}
