package com.campus.lending.security;

import com.campus.lending.entity.RoleName;

import java.util.Objects;

/**
 * The authenticated caller of a service operation.
 *
 * <p>Controllers build an {@code Actor} from the Spring Security principal and pass it
 * explicitly into the service layer. Services never read the security context themselves.
 */
public record Actor(Long userId, RoleName role) {

    public Actor {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }

    public boolean isStaff() {
        return role.isStaff();
    }

    public boolean isSystemAdmin() {
        return role == RoleName.SYSTEM_ADMIN;
    }

    public boolean is(Long otherUserId) {
        return userId.equals(otherUserId);
    }
}
