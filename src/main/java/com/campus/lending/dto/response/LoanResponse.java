package com.campus.lending.dto.response;

import com.campus.lending.entity.LoanState;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record LoanResponse(
    Long id,
    Long reservationId,
    Long borrowerId,
    String borrowerFullName,
    LocalDateTime checkedOutAt,
    LocalDateTime dueAt,
    LocalDateTime returnedAt,
    BigDecimal overdueFee,
    LoanState state,
    boolean overdue
) {}
