package com.campus.lending.dto.request;

import com.campus.lending.entity.TicketSeverity;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateTicketRequest(

    @NotNull(message = "Equipment ID is required")
    Long equipmentId,

    @NotNull(message = "Severity is required")
    TicketSeverity severity,

    @Size(max = 10000, message = "Description must not exceed 10000 characters")
    String description,

    /** Honoured only when the caller is staff. */
    Long assigneeId
) {}
