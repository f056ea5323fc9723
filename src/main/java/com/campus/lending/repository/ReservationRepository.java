package com.campus.lending.repository;

import com.campus.lending.entity.Reservation;
import com.campus.lending.entity.ReservationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, Long>,
        JpaSpecificationExecutor<Reservation> {

    @Query("SELECT r FROM Reservation r JOIN FETCH r.user WHERE r.id = :id")
    Optional<Reservation> findByIdWithUser(@Param("id") Long id);

    long countByStatus(ReservationStatus status);

    long countByUserIdAndStatus(Long userId, ReservationStatus status);

    @Override
    @EntityGraph(attributePaths = "user")
    Page<Reservation> findAll(Specification<Reservation> spec, Pageable pageable);

    @Override
    @EntityGraph(attributePaths = "user")
    List<Reservation> findAll(Specification<Reservation> spec, Sort sort);
}
