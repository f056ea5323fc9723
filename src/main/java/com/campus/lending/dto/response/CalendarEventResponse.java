package com.campus.lending.dto.response;

import com.campus.lending.entity.ReservationStatus;

import java.time.LocalDateTime;

public record CalendarEventResponse(
    Long reservationId,
    String title,
    LocalDateTime start,
    LocalDateTime end,
    ReservationStatus status,
    String color
) {}
