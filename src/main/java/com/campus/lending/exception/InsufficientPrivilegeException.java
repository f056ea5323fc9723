package com.campus.lending.exception;

public class InsufficientPrivilegeException extends RuntimeException {

    public InsufficientPrivilegeException(String message) {
        super(message);
    }
}
