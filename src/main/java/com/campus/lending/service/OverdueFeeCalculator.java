package com.campus.lending.service;

import com.campus.lending.config.LendingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Late-return fee: the configured daily rate times the number of calendar days between the
 * due date and the return date. Time of day is ignored, so a loan due at 23:00 and returned
 * at 01:00 the next day is one day late.
 */
@Component
@RequiredArgsConstructor
public class OverdueFeeCalculator {

    private final LendingProperties properties;

    public long daysLate(LocalDateTime dueAt, LocalDateTime returnedAt) {
        long days = ChronoUnit.DAYS.between(dueAt.toLocalDate(), returnedAt.toLocalDate());
        return Math.max(days, 0);
    }

    public BigDecimal feeFor(LocalDateTime dueAt, LocalDateTime returnedAt) {
        long days = daysLate(dueAt, returnedAt);
        return properties.loan().overdueFeePerDay()
            .multiply(BigDecimal.valueOf(days))
            .setScale(2, RoundingMode.HALF_UP);
    }
}
