package com.campus.lending.mapper;

import com.campus.lending.dto.response.CalendarEventResponse;
import com.campus.lending.dto.response.ReservationResponse;
import com.campus.lending.entity.Equipment;
import com.campus.lending.entity.Loan;
import com.campus.lending.entity.Reservation;
import com.campus.lending.entity.ReservationItem;
import com.campus.lending.entity.ReservationStatus;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public final class ReservationMapper {

    private ReservationMapper() {}

    /**
     * @param items the reservation's items; the equipment association must be initialised
     * @param loan  the reservation's loan, or {@code null}
     */
    public static ReservationResponse toResponse(Reservation reservation,
                                                 Collection<ReservationItem> items,
                                                 Loan loan) {
        List<ReservationResponse.EquipmentSummary> equipment = items.stream()
            .map(ReservationItem::getEquipment)
            .sorted(Comparator.comparing(Equipment::getId))
            .map(e -> new ReservationResponse.EquipmentSummary(e.getId(), e.getName()))
            .toList();

        return new ReservationResponse(
            reservation.getId(),
            reservation.getUser().getId(),
            reservation.getUser().getFullName(),
            reservation.getStartAt(),
            reservation.getEndAt(),
            reservation.getStatus(),
            equipment,
            loan != null ? loan.getId() : null
        );
    }

    /**
     * @param revealOwner when false the owner's name is replaced by a neutral label
     */
    public static CalendarEventResponse toCalendarEvent(Reservation reservation, boolean revealOwner) {
        String label = revealOwner ? reservation.getUser().getFullName() : "Reserved";
        return new CalendarEventResponse(
            reservation.getId(),
            "#" + reservation.getId() + " - " + label,
            reservation.getStartAt(),
            reservation.getEndAt(),
            reservation.getStatus(),
            colorFor(reservation.getStatus())
        );
    }

    static String colorFor(ReservationStatus status) {
        return switch (status) {
            case APPROVED -> "#28a745";
            case PENDING -> "#ffc107";
            case DENIED -> "#dc3545";
        };
    }
}
