package com.campus.lending.exception;

import com.campus.lending.entity.TicketStatus;

public class InvalidTicketStateException extends RuntimeException {

    public InvalidTicketStateException(Long ticketId, TicketStatus currentStatus, TicketStatus requested) {
        super("Ticket " + ticketId + " cannot move from " + currentStatus + " to " + requested);
    }
}
