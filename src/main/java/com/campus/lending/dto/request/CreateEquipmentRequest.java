package com.campus.lending.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateEquipmentRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    String name,

    @NotBlank(message = "Category must not be blank")
    @Size(max = 100, message = "Category must not exceed 100 characters")
    String category,

    @NotBlank(message = "Serial number must not be blank")
    @Size(max = 100, message = "Serial number must not exceed 100 characters")
    String serialNumber,

    @Size(max = 50, message = "Condition must not exceed 50 characters")
    String condition,

    @NotBlank(message = "Location must not be blank")
    @Size(max = 100, message = "Location must not exceed 100 characters")
    String location,

    @Min(value = 1, message = "Daily limit must be at least 1")
    Integer dailyLimit
) {}
