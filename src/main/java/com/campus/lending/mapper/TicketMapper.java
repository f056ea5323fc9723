package com.campus.lending.mapper;

import com.campus.lending.dto.response.TicketResponse;
import com.campus.lending.dto.response.TicketUpdateResponse;
import com.campus.lending.entity.ServiceTicket;
import com.campus.lending.entity.TicketUpdate;
import com.campus.lending.entity.User;

public final class TicketMapper {

    private TicketMapper() {}

    public static TicketResponse toResponse(ServiceTicket ticket) {
        return new TicketResponse(
            ticket.getId(),
            ticket.getEquipment().getId(),
            ticket.getEquipment().getName(),
            ticket.getSeverity(),
            ticket.getStatus(),
            ticket.getDescription(),
            summarize(ticket.getOpenedBy()),
            summarize(ticket.getAssignedTo()),
            ticket.getOpenedAt(),
            ticket.getClosedAt()
        );
    }

    public static TicketUpdateResponse toResponse(TicketUpdate update) {
        return new TicketUpdateResponse(
            update.getId(),
            update.getAuthor().getId(),
            update.getAuthor().getFullName(),
            update.getNote(),
            update.getAddedAt()
        );
    }

    private static TicketResponse.UserSummary summarize(User user) {
        return user != null ? new TicketResponse.UserSummary(user.getId(), user.getFullName()) : null;
    }
}
