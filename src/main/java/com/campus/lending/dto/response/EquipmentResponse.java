package com.campus.lending.dto.response;

import java.time.Instant;

public record EquipmentResponse(
    Long id,
    String name,
    String category,
    String serialNumber,
    String condition,
    String location,
    int dailyLimit,
    Instant createdAt,
    Instant updatedAt
) {}
