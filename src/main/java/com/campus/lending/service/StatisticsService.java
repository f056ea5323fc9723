package com.campus.lending.service;

import com.campus.lending.dto.response.ReservationStatsResponse;
import com.campus.lending.repository.ReservationItemRepository;
import com.campus.lending.repository.ReservationItemRepository.EquipmentReservationCount;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class StatisticsService {

    private final ReservationItemRepository reservationItemRepository;

    /** Reservation item counts per equipment name, for charting. Unbooked equipment is left out. */
    @Transactional(readOnly = true)
    public ReservationStatsResponse reservationsByEquipment() {
        List<EquipmentReservationCount> rows = reservationItemRepository.countGroupedByEquipment();
        return new ReservationStatsResponse(
            rows.stream().map(EquipmentReservationCount::getEquipmentName).toList(),
            rows.stream().map(EquipmentReservationCount::getReservationCount).toList());
    }
}
