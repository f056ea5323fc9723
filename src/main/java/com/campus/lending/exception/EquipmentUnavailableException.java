package com.campus.lending.exception;

import java.util.List;

/**
 * Raised when at least one requested item has no free capacity in the window.
 * Carries the display names of every unavailable item, not just the first.
 */
public class EquipmentUnavailableException extends RuntimeException {

    private final List<String> unavailableItems;

    public EquipmentUnavailableException(List<String> unavailableItems) {
        super("Some items are not available for that time window: " + String.join(", ", unavailableItems));
        this.unavailableItems = List.copyOf(unavailableItems);
    }

    public List<String> getUnavailableItems() {
        return unavailableItems;
    }
}
