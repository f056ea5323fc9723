package com.campus.lending.repository;

import com.campus.lending.entity.Loan;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LoanRepository extends JpaRepository<Loan, Long> {

    boolean existsByReservationId(Long reservationId);

    Optional<Loan> findByReservationId(Long reservationId);

    @Query("SELECT l FROM Loan l JOIN FETCH l.reservation r JOIN FETCH r.user WHERE l.id = :id")
    Optional<Loan> findByIdWithReservation(@Param("id") Long id);

    /** Row lock for the return path; concurrent returns of the same loan run one after the other. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT l FROM Loan l WHERE l.id = :id")
    Optional<Loan> findByIdForUpdate(@Param("id") Long id);

    List<Loan> findAllByReservationIdIn(Collection<Long> reservationIds);

    @Override
    @EntityGraph(attributePaths = {"reservation", "reservation.user"})
    Page<Loan> findAll(Pageable pageable);

    @EntityGraph(attributePaths = {"reservation", "reservation.user"})
    Page<Loan> findAllByReturnedAtIsNull(Pageable pageable);

    @EntityGraph(attributePaths = {"reservation", "reservation.user"})
    Page<Loan> findAllByReturnedAtIsNotNull(Pageable pageable);

    long countByReturnedAtIsNull();

    @Query("SELECT COUNT(l) FROM Loan l WHERE l.returnedAt IS NULL AND l.dueAt < :now")
    long countOverdue(@Param("now") LocalDateTime now);
}
