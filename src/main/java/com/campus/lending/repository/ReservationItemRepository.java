package com.campus.lending.repository;

import com.campus.lending.entity.ReservationItem;
import com.campus.lending.entity.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface ReservationItemRepository extends JpaRepository<ReservationItem, Long> {

    /**
     * Counts items on {@code equipmentId} whose reservation is in one of {@code statuses}
     * and whose window intersects {@code [start, end)}.
     *
     * <p>Half-open overlap: {@code existing.start < end AND existing.end > start}. A booking
     * that ends exactly when the requested one starts is not counted.
     */
    @Query("""
        SELECT COUNT(ri) FROM ReservationItem ri JOIN ri.reservation r
        WHERE ri.equipment.id = :equipmentId
          AND r.status IN :statuses
          AND r.startAt < :end
          AND r.endAt > :start
        """)
    long countOverlapping(@Param("equipmentId") Long equipmentId,
                          @Param("start") LocalDateTime start,
                          @Param("end") LocalDateTime end,
                          @Param("statuses") Collection<ReservationStatus> statuses);

    @Query("SELECT ri FROM ReservationItem ri JOIN FETCH ri.equipment WHERE ri.reservation.id IN :reservationIds")
    List<ReservationItem> findAllByReservationIdIn(@Param("reservationIds") Collection<Long> reservationIds);

    boolean existsByEquipmentId(Long equipmentId);

    @Query("""
        SELECT e.name AS equipmentName, COUNT(ri) AS reservationCount
        FROM ReservationItem ri JOIN ri.equipment e
        GROUP BY e.id, e.name
        ORDER BY e.id
        """)
    List<EquipmentReservationCount> countGroupedByEquipment();

    interface EquipmentReservationCount {
        String getEquipmentName();

        Long getReservationCount();
    }
}
