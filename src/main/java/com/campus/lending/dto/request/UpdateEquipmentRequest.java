package com.campus.lending.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields keep their current value. Present text fields
 * must contain at least one non-whitespace character.
 */
public record UpdateEquipmentRequest(

    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    String name,

    @Pattern(regexp = ".*\\S.*", message = "Category must not be blank")
    @Size(max = 100, message = "Category must not exceed 100 characters")
    String category,

    @Pattern(regexp = ".*\\S.*", message = "Serial number must not be blank")
    @Size(max = 100, message = "Serial number must not exceed 100 characters")
    String serialNumber,

    @Size(max = 50, message = "Condition must not exceed 50 characters")
    String condition,

    @Pattern(regexp = ".*\\S.*", message = "Location must not be blank")
    @Size(max = 100, message = "Location must not exceed 100 characters")
    String location,

    @Min(value = 1, message = "Daily limit must be at least 1")
    Integer dailyLimit
) {}
