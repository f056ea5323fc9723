package com.campus.lending.dto.response;

/**
 * Result of a return request. {@code alreadyReturned} is true when the loan had been
 * returned before this call; the loan is then reported unchanged.
 */
public record LoanReturnResponse(
    LoanResponse loan,
    boolean alreadyReturned
) {}
