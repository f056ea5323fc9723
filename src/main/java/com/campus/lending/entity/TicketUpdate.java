package com.campus.lending.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only note on a {@link ServiceTicket}. All columns are {@code updatable = false}
 * and the class exposes no setters; notes are built once through the constructor.
 */
@Entity
@Table(name = "ticket_updates")
@Getter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class TicketUpdate extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "ticket_id", nullable = false, updatable = false)
    private ServiceTicket ticket;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "updated_by", nullable = false, updatable = false)
    private User author;

    @Column(name = "note", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String note;

    @Column(name = "added_at", nullable = false, updatable = false)
    private LocalDateTime addedAt;

    public TicketUpdate(ServiceTicket ticket, User author, String note, LocalDateTime addedAt) {
        this.ticket = ticket;
        this.author = author;
        this.note = note;
        this.addedAt = addedAt;
    }
}
