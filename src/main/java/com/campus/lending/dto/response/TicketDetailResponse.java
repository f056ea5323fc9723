package com.campus.lending.dto.response;

import java.util.List;

/** A ticket together with its notes, most recent first. */
public record TicketDetailResponse(
    TicketResponse ticket,
    List<TicketUpdateResponse> updates
) {}
