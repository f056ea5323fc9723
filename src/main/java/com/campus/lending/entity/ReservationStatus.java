package com.campus.lending.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a {@link Reservation}.
 *
 * <ul>
 *   <li>{@link #PENDING} initial state, awaiting a staff decision</li>
 *   <li>{@link #APPROVED} accepted; may later be converted into a loan</li>
 *   <li>{@link #DENIED} rejected; final, the user must submit a new reservation</li>
 * </ul>
 *
 * Pending and Approved reservations hold equipment capacity; Denied ones do not.
 */
public enum ReservationStatus {
    PENDING,
    APPROVED,
    DENIED;

    public static final Set<ReservationStatus> BLOCKING = EnumSet.of(PENDING, APPROVED);

    public boolean canTransitionTo(ReservationStatus target) {
        return this == target || (this == PENDING && target != PENDING);
    }
}
