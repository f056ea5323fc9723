package com.campus.lending.entity;

/**
 * Account status. {@link #INACTIVE} accounts are kept for history but cannot log in.
 */
public enum UserStatus {
    ACTIVE,
    INACTIVE
}
