package com.campus.lending.entity;

/**
 * Closed set of roles. Stored by name in {@code roles.name}.
 *
 * <p>{@link #isStaff()} is the only place that decides which roles carry staff
 * privileges; handlers and services never compare role names themselves.
 */
public enum RoleName {
    STUDENT(false),
    TECH_STAFF(true),
    SYSTEM_ADMIN(true);

    private final boolean staff;

    RoleName(boolean staff) {
        this.staff = staff;
    }

    public boolean isStaff() {
        return staff;
    }
}
