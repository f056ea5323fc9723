package com.campus.lending.dto.response;

import java.time.LocalDateTime;

public record AvailabilityResponse(
    Long equipmentId,
    String equipmentName,
    LocalDateTime startAt,
    LocalDateTime endAt,
    int dailyLimit,
    long overlappingBookings,
    boolean available
) {}
