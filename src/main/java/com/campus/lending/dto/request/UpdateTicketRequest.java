package com.campus.lending.dto.request;

import com.campus.lending.entity.TicketStatus;

/**
 * Partial ticket edit. Null fields keep the current value. {@code unassign = true} clears
 * the assignee and cannot be combined with an {@code assigneeId}.
 */
public record UpdateTicketRequest(
    TicketStatus status,
    Long assigneeId,
    boolean unassign
) {
    public UpdateTicketRequest(TicketStatus status, Long assigneeId) {
        this(status, assigneeId, false);
    }
}
