package com.campus.lending.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddTicketUpdateRequest(

    @NotBlank(message = "Note must not be blank")
    @Size(max = 10000, message = "Note must not exceed 10000 characters")
    String note
) {}
