package com.temple.booking.web.booking.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record DateRequest(
        @NotNull LocalDate date,
        String surface
) {}
