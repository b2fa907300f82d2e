package com.temple.booking.web.booking.dto;

import jakarta.validation.constraints.*;

import java.time.LocalDate;

public record SelectDateRequest(
        @NotNull LocalDate date,
        String surface,
        @NotBlank @Size(max = 100) String reason
) {}
