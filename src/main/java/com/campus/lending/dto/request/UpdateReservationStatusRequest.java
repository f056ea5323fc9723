package com.campus.lending.dto.request;

import com.campus.lending.entity.ReservationStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateReservationStatusRequest(

    @NotNull(message = "Status is required")
    ReservationStatus status
) {}
