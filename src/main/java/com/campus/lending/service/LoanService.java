package com.campus.lending.service;

import com.campus.lending.config.LendingProperties;
import com.campus.lending.dto.request.CreateLoanRequest;
import com.campus.lending.dto.response.LoanResponse;
import com.campus.lending.dto.response.LoanReturnResponse;
import com.campus.lending.entity.Loan;
import com.campus.lending.entity.LoanState;
import com.campus.lending.entity.Reservation;
import com.campus.lending.entity.ReservationStatus;
import com.campus.lending.exception.InvalidReservationStateException;
import com.campus.lending.exception.InvalidTimeWindowException;
import com.campus.lending.exception.LoanAlreadyExistsException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.mapper.LoanMapper;
import com.campus.lending.repository.LoanRepository;
import com.campus.lending.repository.ReservationRepository;
import com.campus.lending.security.AccessPolicy;
import com.campus.lending.security.Actor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Service
@RequiredArgsConstructor
public class LoanService {

    private static final Logger log = LoggerFactory.getLogger(LoanService.class);

    private final LoanRepository loanRepository;
    private final ReservationRepository reservationRepository;
    private final OverdueFeeCalculator overdueFeeCalculator;
    private final LendingProperties properties;
    private final Clock clock;

    /**
     * Hands out the equipment of a reservation. A pending reservation is approved as part of
     * the checkout; a denied one cannot be loaned. At most one loan exists per reservation.
     */
    @Transactional
    public LoanResponse create(Actor actor, CreateLoanRequest request) {
        AccessPolicy.requireStaff(actor, "create loans");

        LocalDateTime now = now();
        LocalDateTime checkedOutAt = request.checkedOutAt() != null ? request.checkedOutAt() : now;
        LocalDateTime dueAt = request.dueAt() != null
            ? request.dueAt()
            : checkedOutAt.plus(properties.loan().defaultPeriod());
        if (!dueAt.isAfter(checkedOutAt)) {
            throw new InvalidTimeWindowException("Due date must be after the checkout time");
        }

        Long reservationId = request.reservationId();
        Reservation reservation = reservationRepository.findByIdWithUser(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

        if (reservation.getStatus() == ReservationStatus.DENIED) {
            throw new InvalidReservationStateException(reservationId, reservation.getStatus(), "loaned");
        }
        if (loanRepository.existsByReservationId(reservationId)) {
            throw new LoanAlreadyExistsException(reservationId);
        }

        if (reservation.getStatus() == ReservationStatus.PENDING) {
            reservation.setStatus(ReservationStatus.APPROVED);
            reservationRepository.save(reservation);
        }

        Loan loan = new Loan();
        loan.setReservation(reservation);
        loan.setCheckedOutAt(checkedOutAt);
        loan.setDueAt(dueAt);
        loan.setOverdueFee(BigDecimal.ZERO);
        Loan saved = loanRepository.save(loan);

        log.info("Loan {} created for reservation {} by user {}, due {}",
            saved.getId(), reservationId, actor.userId(), dueAt);
        return LoanMapper.toResponse(saved, now);
    }

    /**
     * Records the return and the overdue fee. Returning an already returned loan changes
     * nothing and reports {@code alreadyReturned = true}.
     */
    @Transactional
    public LoanReturnResponse returnLoan(Actor actor, Long loanId) {
        AccessPolicy.requireStaff(actor, "mark loans as returned");

        Loan loan = loanRepository.findByIdForUpdate(loanId)
            .orElseThrow(() -> new ResourceNotFoundException("Loan", loanId));
        LocalDateTime now = now();

        if (loan.isReturned()) {
            log.info("Loan {} already returned at {}", loanId, loan.getReturnedAt());
            return new LoanReturnResponse(LoanMapper.toResponse(loan, now), true);
        }

        loan.setReturnedAt(now);
        loan.setOverdueFee(overdueFeeCalculator.feeFor(loan.getDueAt(), now));
        Loan saved = loanRepository.save(loan);

        log.info("Loan {} returned by user {}, overdue fee {}", loanId, actor.userId(), saved.getOverdueFee());
        return new LoanReturnResponse(LoanMapper.toResponse(saved, now), false);
    }

    @Transactional(readOnly = true)
    public Page<LoanResponse> findAll(Actor actor, LoanState state, Pageable pageable) {
        AccessPolicy.requireStaff(actor, "view loans");

        Page<Loan> loans;
        if (state == LoanState.OUTSTANDING) {
            loans = loanRepository.findAllByReturnedAtIsNull(pageable);
        } else if (state == LoanState.RETURNED) {
            loans = loanRepository.findAllByReturnedAtIsNotNull(pageable);
        } else {
            loans = loanRepository.findAll(pageable);
        }

        LocalDateTime now = now();
        return loans.map(loan -> LoanMapper.toResponse(loan, now));
    }

    @Transactional(readOnly = true)
    public LoanResponse findById(Actor actor, Long loanId) {
        AccessPolicy.requireStaff(actor, "view loans");

        Loan loan = loanRepository.findByIdWithReservation(loanId)
            .orElseThrow(() -> new ResourceNotFoundException("Loan", loanId));
        return LoanMapper.toResponse(loan, now());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
