package com.campus.lending.exception;

public class EquipmentInUseException extends RuntimeException {

    public EquipmentInUseException(Long equipmentId) {
        super("Equipment " + equipmentId + " has reservation or ticket history and cannot be deleted");
    }
}
