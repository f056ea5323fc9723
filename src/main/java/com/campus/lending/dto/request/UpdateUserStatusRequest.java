package com.campus.lending.dto.request;

import com.campus.lending.entity.UserStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateUserStatusRequest(

    @NotNull(message = "Status is required")
    UserStatus status
) {}
