package com.temple.booking.web.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temple.booking.application.session.SelectionOutcome;
import com.temple.booking.application.session.SelectionResult;
import com.temple.booking.domain.availability.BookingCategory;
import com.temple.booking.domain.availability.DateState;

import java.time.Instant;
import java.time.LocalDate;

public record SelectionResponse(
        SelectionOutcome outcome,
        @JsonProperty("hall_id") int hallId,
        LocalDate date,
        DateState state,
        String reason,
        BookingCategory category,
        Instant holdExpiresAt
) {

    public static SelectionResponse from(SelectionResult result) {
        var status = result.status();
        return new SelectionResponse(
                result.outcome(),
                result.key().hallId(),
                result.key().date(),
                status == null ? null : status.getState(),
                result.reason(),
                status == null ? null : status.getCategory(),
                result.holdExpiresAt()
        );
    }
}
