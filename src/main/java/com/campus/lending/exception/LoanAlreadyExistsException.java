package com.campus.lending.exception;

public class LoanAlreadyExistsException extends RuntimeException {

    public LoanAlreadyExistsException(Long reservationId) {
        super("Reservation " + reservationId + " already has a loan");
    }
}
