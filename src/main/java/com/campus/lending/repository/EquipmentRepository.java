package com.campus.lending.repository;

import com.campus.lending.entity.Equipment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Collection;
import java.util.List;

public interface EquipmentRepository extends JpaRepository<Equipment, Long> {

    boolean existsBySerialNumber(String serialNumber);

    boolean existsBySerialNumberAndIdNot(String serialNumber, Long id);

    /**
     * Locks the given equipment rows ({@code SELECT ... FOR UPDATE}) in ascending id order.
     * Two bookings touching the same items therefore acquire the locks in the same order
     * and cannot deadlock each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT e FROM Equipment e WHERE e.id IN :ids ORDER BY e.id")
    List<Equipment> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);
}
