package com.campus.lending.exception;

public class InvalidTimeWindowException extends RuntimeException {

    public InvalidTimeWindowException(String message) {
        super(message);
    }
}
