package com.campus.lending.entity;

/**
 * Derived from {@code loans.returned_at}; not stored.
 */
public enum LoanState {
    OUTSTANDING,
    RETURNED
}
