package com.campus.lending.mapper;

import com.campus.lending.dto.response.LoanResponse;
import com.campus.lending.entity.Loan;
import com.campus.lending.entity.Reservation;

import java.time.LocalDateTime;

public final class LoanMapper {

    private LoanMapper() {}

    public static LoanResponse toResponse(Loan loan, LocalDateTime now) {
        Reservation reservation = loan.getReservation();
        return new LoanResponse(
            loan.getId(),
            reservation.getId(),
            reservation.getUser().getId(),
            reservation.getUser().getFullName(),
            loan.getCheckedOutAt(),
            loan.getDueAt(),
            loan.getReturnedAt(),
            loan.getOverdueFee(),
            loan.getState(),
            loan.isOverdueAt(now)
        );
    }
}
