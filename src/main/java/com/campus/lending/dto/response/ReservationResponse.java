package com.campus.lending.dto.response;

import com.campus.lending.entity.ReservationStatus;

import java.time.LocalDateTime;
import java.util.List;

public record ReservationResponse(
    Long id,
    Long userId,
    String userFullName,
    LocalDateTime startAt,
    LocalDateTime endAt,
    ReservationStatus status,
    List<EquipmentSummary> items,
    Long loanId
) {
    public record EquipmentSummary(Long id, String name) {}
}
