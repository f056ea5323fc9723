package com.campus.lending.exception;

public class DuplicateSerialNumberException extends RuntimeException {

    public DuplicateSerialNumberException(String serialNumber) {
        super("Serial number already exists: " + serialNumber);
    }
}
