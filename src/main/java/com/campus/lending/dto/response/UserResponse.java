package com.campus.lending.dto.response;

import com.campus.lending.entity.RoleName;
import com.campus.lending.entity.UserStatus;

public record UserResponse(
    Long id,
    String email,
    String fullName,
    RoleName role,
    boolean staff,
    UserStatus status
) {}
