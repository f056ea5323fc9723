package com.campus.lending.mapper;

import com.campus.lending.dto.response.UserResponse;
import com.campus.lending.entity.User;

public final class UserMapper {

    private UserMapper() {}

    public static UserResponse toResponse(User user) {
        return new UserResponse(
            user.getId(),
            user.getEmail(),
            user.getFullName(),
            user.getRoleName(),
            user.isStaff(),
            user.getStatus()
        );
    }
}
