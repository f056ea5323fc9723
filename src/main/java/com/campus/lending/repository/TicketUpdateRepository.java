package com.campus.lending.repository;

import com.campus.lending.entity.TicketUpdate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TicketUpdateRepository extends JpaRepository<TicketUpdate, Long> {

    @Query("""
        SELECT u FROM TicketUpdate u JOIN FETCH u.author
        WHERE u.ticket.id = :ticketId
        ORDER BY u.addedAt DESC, u.id DESC
        """)
    List<TicketUpdate> findAllByTicketIdNewestFirst(@Param("ticketId") Long ticketId);
}
