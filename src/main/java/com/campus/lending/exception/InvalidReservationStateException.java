package com.campus.lending.exception;

import com.campus.lending.entity.ReservationStatus;

public class InvalidReservationStateException extends RuntimeException {

    public InvalidReservationStateException(Long reservationId, ReservationStatus currentStatus,
                                            String attemptedAction) {
        super("Reservation " + reservationId + " cannot be " + attemptedAction
            + " (current status is " + currentStatus + ")");
    }
}
