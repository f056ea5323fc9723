package com.campus.lending.service;

import com.campus.lending.dto.request.CreateReservationRequest;
import com.campus.lending.dto.response.CalendarEventResponse;
import com.campus.lending.dto.response.ReservationResponse;
import com.campus.lending.entity.Equipment;
import com.campus.lending.entity.Loan;
import com.campus.lending.entity.Reservation;
import com.campus.lending.entity.ReservationItem;
import com.campus.lending.entity.ReservationStatus;
import com.campus.lending.entity.User;
import com.campus.lending.exception.EquipmentUnavailableException;
import com.campus.lending.exception.InvalidReservationStateException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.mapper.ReservationMapper;
import com.campus.lending.repository.EquipmentRepository;
import com.campus.lending.repository.LoanRepository;
import com.campus.lending.repository.ReservationItemRepository;
import com.campus.lending.repository.ReservationRepository;
import com.campus.lending.repository.UserRepository;
import com.campus.lending.security.AccessPolicy;
import com.campus.lending.security.Actor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final ReservationRepository reservationRepository;
    private final ReservationItemRepository reservationItemRepository;
    private final EquipmentRepository equipmentRepository;
    private final UserRepository userRepository;
    private final LoanRepository loanRepository;
    private final AvailabilityService availabilityService;

    /**
     * Books every requested item for the window, or none of them.
     *
     * <p>The requested equipment rows are locked before any overlap is counted, so a
     * concurrent booking of the same item waits here and then sees this reservation's items.
     */
    @Transactional
    public ReservationResponse create(Actor actor, CreateReservationRequest request) {
        AvailabilityService.requireValidWindow(request.startAt(), request.endAt());

        User user = userRepository.findById(actor.userId())
            .orElseThrow(() -> new ResourceNotFoundException("User", actor.userId()));

        SortedSet<Long> equipmentIds = new TreeSet<>(request.equipmentIds());
        Map<Long, Equipment> lockedEquipment = equipmentRepository.findAllByIdForUpdate(equipmentIds)
            .stream()
            .collect(Collectors.toMap(Equipment::getId, Function.identity()));

        List<String> unavailable = new ArrayList<>();
        for (Long equipmentId : equipmentIds) {
            Equipment equipment = lockedEquipment.get(equipmentId);
            if (equipment == null) {
                unavailable.add("ID " + equipmentId);
            } else if (!availabilityService.isAvailable(equipment, request.startAt(), request.endAt())) {
                unavailable.add(equipment.getName());
            }
        }
        if (!unavailable.isEmpty()) {
            log.info("Rejected reservation by user {} for {} - {}: unavailable {}",
                actor.userId(), request.startAt(), request.endAt(), unavailable);
            throw new EquipmentUnavailableException(unavailable);
        }

        Reservation reservation = new Reservation();
        reservation.setUser(user);
        reservation.setStartAt(request.startAt());
        reservation.setEndAt(request.endAt());
        reservation.setStatus(ReservationStatus.PENDING);
        Reservation saved = reservationRepository.save(reservation);

        List<ReservationItem> items = equipmentIds.stream()
            .map(id -> new ReservationItem(saved, lockedEquipment.get(id)))
            .toList();
        reservationItemRepository.saveAll(items);

        log.info("Reservation {} created by user {} for equipment {}", saved.getId(), actor.userId(), equipmentIds);
        return ReservationMapper.toResponse(saved, items, null);
    }

    /**
     * Staff decision on a reservation. Only {@code PENDING} reservations can change;
     * re-applying the current status is accepted and changes nothing.
     */
    @Transactional
    public ReservationResponse updateStatus(Actor actor, Long reservationId, ReservationStatus newStatus) {
        AccessPolicy.requireStaff(actor, "change reservation status");

        Reservation reservation = reservationRepository.findByIdWithUser(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

        ReservationStatus current = reservation.getStatus();
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidReservationStateException(reservationId, current, "set to " + newStatus);
        }

        if (current != newStatus) {
            reservation.setStatus(newStatus);
            reservation = reservationRepository.save(reservation);
            log.info("Reservation {} moved from {} to {} by user {}", reservationId, current, newStatus, actor.userId());
        }
        return toResponse(reservation);
    }

    @Transactional(readOnly = true)
    public ReservationResponse findById(Actor actor, Long reservationId) {
        Reservation reservation = reservationRepository.findByIdWithUser(reservationId)
            .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        AccessPolicy.requireOwnerOrStaff(actor, reservation.getUser().getId(), "reservation");
        return toResponse(reservation);
    }

    /**
     * Staff see every reservation and may filter by user; everyone else sees only their own,
     * whatever {@code userId} they pass.
     */
    @Transactional(readOnly = true)
    public Page<ReservationResponse> findAll(Actor actor, ReservationStatus status, Long userId,
                                             Pageable pageable) {
        Long ownerFilter = actor.isStaff() ? userId : actor.userId();

        Specification<Reservation> spec = Specification.where(null);
        if (ownerFilter != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("user").get("id"), ownerFilter));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }

        Page<Reservation> page = reservationRepository.findAll(spec, pageable);
        List<Long> ids = page.getContent().stream().map(Reservation::getId).toList();
        Map<Long, List<ReservationItem>> itemsByReservation = itemsByReservation(ids);
        Map<Long, Loan> loansByReservation = loansByReservation(ids);

        return page.map(r -> ReservationMapper.toResponse(
            r,
            itemsByReservation.getOrDefault(r.getId(), List.of()),
            loansByReservation.get(r.getId())));
    }

    /**
     * Every booking overlapping the optional window, ordered by start. Non-staff callers see
     * other users' bookings without the owner's name.
     */
    @Transactional(readOnly = true)
    public List<CalendarEventResponse> calendar(Actor actor, LocalDateTime from, LocalDateTime to) {
        Specification<Reservation> spec = Specification.where(null);
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThan(root.get("endAt"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("startAt"), to));
        }

        return reservationRepository.findAll(spec, Sort.by("startAt", "id")).stream()
            .map(r -> ReservationMapper.toCalendarEvent(r, actor.isStaff() || r.isOwnedBy(actor.userId())))
            .toList();
    }

    private ReservationResponse toResponse(Reservation reservation) {
        List<ReservationItem> items = reservationItemRepository.findAllByReservationIdIn(List.of(reservation.getId()));
        Loan loan = loanRepository.findByReservationId(reservation.getId()).orElse(null);
        return ReservationMapper.toResponse(reservation, items, loan);
    }

    private Map<Long, List<ReservationItem>> itemsByReservation(Collection<Long> reservationIds) {
        if (reservationIds.isEmpty()) {
            return Map.of();
        }
        return reservationItemRepository.findAllByReservationIdIn(reservationIds).stream()
            .collect(Collectors.groupingBy(item -> item.getReservation().getId()));
    }

    private Map<Long, Loan> loansByReservation(Collection<Long> reservationIds) {
        if (reservationIds.isEmpty()) {
            return Map.of();
        }
        return loanRepository.findAllByReservationIdIn(reservationIds).stream()
            .collect(Collectors.toMap(loan -> loan.getReservation().getId(), Function.identity()));
    }
}
