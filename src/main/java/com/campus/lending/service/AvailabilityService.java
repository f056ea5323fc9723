package com.campus.lending.service;

import com.campus.lending.dto.response.AvailabilityResponse;
import com.campus.lending.entity.Equipment;
import com.campus.lending.entity.ReservationStatus;
import com.campus.lending.exception.InvalidTimeWindowException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.repository.EquipmentRepository;
import com.campus.lending.repository.ReservationItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Decides whether an equipment item can take one more booking in a window.
 *
 * <p>Demand is the number of Pending or Approved reservation items on the equipment whose
 * window intersects the requested {@code [start, end)}. The item is available while demand
 * is below {@link Equipment#effectiveDailyLimit()}. Denied reservations never count.
 *
 * <p>This class only reads. Callers that go on to insert a booking must hold the equipment
 * row lock ({@code EquipmentRepository.findAllByIdForUpdate}) across the check and the insert.
 */
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final EquipmentRepository equipmentRepository;
    private final ReservationItemRepository reservationItemRepository;

    public static void requireValidWindow(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new InvalidTimeWindowException("Start and end date are required");
        }
        if (!end.isAfter(start)) {
            throw new InvalidTimeWindowException("End date must be after start date");
        }
    }

    /** Unknown equipment is reported as unavailable. */
    @Transactional(readOnly = true)
    public boolean isAvailable(Long equipmentId, LocalDateTime start, LocalDateTime end) {
        requireValidWindow(start, end);
        return equipmentRepository.findById(equipmentId)
            .map(equipment -> isAvailable(equipment, start, end))
            .orElse(false);
    }

    public boolean isAvailable(Equipment equipment, LocalDateTime start, LocalDateTime end) {
        return overlappingBookings(equipment.getId(), start, end) < equipment.effectiveDailyLimit();
    }

    public long overlappingBookings(Long equipmentId, LocalDateTime start, LocalDateTime end) {
        return reservationItemRepository.countOverlapping(
            equipmentId, start, end, ReservationStatus.BLOCKING);
    }

    @Transactional(readOnly = true)
    public AvailabilityResponse describe(Long equipmentId, LocalDateTime start, LocalDateTime end) {
        requireValidWindow(start, end);
        Equipment equipment = equipmentRepository.findById(equipmentId)
            .orElseThrow(() -> new ResourceNotFoundException("Equipment", equipmentId));
        long overlapping = overlappingBookings(equipmentId, start, end);
        int limit = equipment.effectiveDailyLimit();
        return new AvailabilityResponse(
            equipment.getId(), equipment.getName(), start, end, limit, overlapping, overlapping < limit);
    }
}
