package com.campus.lending.repository;

import com.campus.lending.entity.ServiceTicket;
import com.campus.lending.entity.TicketStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ServiceTicketRepository extends JpaRepository<ServiceTicket, Long>,
        JpaSpecificationExecutor<ServiceTicket> {

    @Query("""
        SELECT t FROM ServiceTicket t
        JOIN FETCH t.equipment JOIN FETCH t.openedBy LEFT JOIN FETCH t.assignedTo
        WHERE t.id = :id
        """)
    Optional<ServiceTicket> findByIdWithParticipants(@Param("id") Long id);

    @Override
    @EntityGraph(attributePaths = {"equipment", "openedBy", "assignedTo"})
    Page<ServiceTicket> findAll(Specification<ServiceTicket> spec, Pageable pageable);

    boolean existsByEquipmentId(Long equipmentId);

    long countByStatusNot(TicketStatus status);

    long countByOpenedByIdAndStatusNot(Long userId, TicketStatus status);
}
