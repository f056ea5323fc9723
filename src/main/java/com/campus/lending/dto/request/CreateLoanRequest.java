package com.campus.lending.dto.request;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * {@code checkedOutAt} defaults to now and {@code dueAt} to {@code checkedOutAt} plus the
 * configured default loan period when omitted.
 */
public record CreateLoanRequest(

    @NotNull(message = "Reservation ID is required")
    Long reservationId,

    LocalDateTime checkedOutAt,

    LocalDateTime dueAt
) {}
