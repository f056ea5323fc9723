package com.campus.lending.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;
import java.util.List;

public record CreateReservationRequest(

    @NotNull(message = "Equipment ID list must not be null")
    @NotEmpty(message = "Please select at least one piece of equipment")
    List<@NotNull Long> equipmentIds,

    @NotNull(message = "Start date is required")
    LocalDateTime startAt,

    @NotNull(message = "End date is required")
    LocalDateTime endAt
) {}
