package com.campus.lending.dto.response;

import com.campus.lending.entity.TicketSeverity;
import com.campus.lending.entity.TicketStatus;

import java.time.LocalDateTime;

public record TicketResponse(
    Long id,
    Long equipmentId,
    String equipmentName,
    TicketSeverity severity,
    TicketStatus status,
    String description,
    UserSummary openedBy,
    UserSummary assignedTo,
    LocalDateTime openedAt,
    LocalDateTime closedAt
) {
    public record UserSummary(Long id, String fullName) {}
}
