package com.campus.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Physical checkout of the equipment on a reservation.
 *
 * <p>A loan is {@link LoanState#OUTSTANDING} while {@link #returnedAt} is null and
 * {@link LoanState#RETURNED} once it is set. {@link #overdueFee} is written in the same
 * update as {@code returnedAt} and is not recomputed afterwards.
 *
 * <p>At most one loan exists per reservation ({@code uk_loans_reservation}). The return
 * path locks the row; {@link #version} catches any other concurrent write.
 */
@Entity
@Table(name = "loans")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Loan extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "reservation_id", nullable = false, unique = true)
    private Reservation reservation;

    @Column(name = "checked_out_at", nullable = false)
    private LocalDateTime checkedOutAt;

    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    @Column(name = "returned_at")
    private LocalDateTime returnedAt;

    @Column(name = "overdue_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal overdueFee = BigDecimal.ZERO;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public LoanState getState() {
        return returnedAt == null ? LoanState.OUTSTANDING : LoanState.RETURNED;
    }

    public boolean isReturned() {
        return returnedAt != null;
    }

    public boolean isOverdueAt(LocalDateTime now) {
        return returnedAt == null && now.isAfter(dueAt);
    }
}
