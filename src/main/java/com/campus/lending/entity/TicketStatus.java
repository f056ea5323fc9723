package com.campus.lending.entity;

/**
 * Service ticket states, in the only order they may be visited.
 *
 * <p>A ticket moves forward (it may skip {@link #IN_PROGRESS}) and never back; there is no
 * reopen. Setting the current status again is allowed and changes nothing.
 */
public enum TicketStatus {
    OPEN,
    IN_PROGRESS,
    CLOSED;

    public boolean canTransitionTo(TicketStatus target) {
        return target.ordinal() >= ordinal();
    }
}
