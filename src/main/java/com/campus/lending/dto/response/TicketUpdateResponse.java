package com.campus.lending.dto.response;

import java.time.LocalDateTime;

public record TicketUpdateResponse(
    Long id,
    Long authorId,
    String authorFullName,
    String note,
    LocalDateTime addedAt
) {}
