package com.campus.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * JPA entity for a reservation of one or more equipment items over a time window.
 *
 * <p>The window is half-open, {@code [startAt, endAt)}: a reservation ending at 11:00 does
 * not overlap one starting at 11:00. {@code end_at > start_at} is enforced by the
 * {@code ck_reservations_window} check constraint as well as by {@code ReservationService}.
 *
 * <p>The requested items are {@link ReservationItem} rows pointing back at this
 * reservation. They are created in the same transaction as the reservation and read via
 * {@code ReservationItemRepository}; this entity holds no collection of them.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} guards against two staff members
 * deciding the same reservation concurrently. The loser receives a 409.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isOwnedBy(Long userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }
}
