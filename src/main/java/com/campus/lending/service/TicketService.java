package com.campus.lending.service;

import com.campus.lending.dto.request.AddTicketUpdateRequest;
import com.campus.lending.dto.request.CreateTicketRequest;
import com.campus.lending.dto.request.UpdateTicketRequest;
import com.campus.lending.dto.response.TicketDetailResponse;
import com.campus.lending.dto.response.TicketResponse;
import com.campus.lending.dto.response.TicketUpdateResponse;
import com.campus.lending.entity.Equipment;
import com.campus.lending.entity.ServiceTicket;
import com.campus.lending.entity.TicketStatus;
import com.campus.lending.entity.TicketUpdate;
import com.campus.lending.entity.User;
import com.campus.lending.exception.InvalidTicketStateException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.mapper.TicketMapper;
import com.campus.lending.repository.EquipmentRepository;
import com.campus.lending.repository.ServiceTicketRepository;
import com.campus.lending.repository.TicketUpdateRepository;
import com.campus.lending.repository.UserRepository;
import com.campus.lending.security.AccessPolicy;
import com.campus.lending.security.Actor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@RequiredArgsConstructor
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private final ServiceTicketRepository ticketRepository;
    private final TicketUpdateRepository ticketUpdateRepository;
    private final EquipmentRepository equipmentRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * Opens a ticket in {@code OPEN}. The assignee is honoured only when a staff member opens
     * the ticket; for everyone else it is ignored.
     */
    @Transactional
    public TicketResponse create(Actor actor, CreateTicketRequest request) {
        Equipment equipment = equipmentRepository.findById(request.equipmentId())
            .orElseThrow(() -> new ResourceNotFoundException("Equipment", request.equipmentId()));
        User opener = getUser(actor.userId());

        User assignee = null;
        if (actor.isStaff() && request.assigneeId() != null) {
            assignee = resolveAssignee(request.assigneeId());
        }

        ServiceTicket ticket = new ServiceTicket();
        ticket.setEquipment(equipment);
        ticket.setSeverity(request.severity());
        ticket.setStatus(TicketStatus.OPEN);
        ticket.setDescription(request.description() != null ? request.description().trim() : null);
        ticket.setOpenedBy(opener);
        ticket.setAssignedTo(assignee);
        ticket.setOpenedAt(now());
        ServiceTicket saved = ticketRepository.save(ticket);

        log.info("Ticket {} opened on equipment {} by user {} ({})",
            saved.getId(), equipment.getId(), actor.userId(), saved.getSeverity());
        return TicketMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public TicketDetailResponse findById(Actor actor, Long ticketId) {
        ServiceTicket ticket = getTicket(ticketId);
        AccessPolicy.requireOwnerOrStaff(actor, ticket.getOpenedBy().getId(), "ticket");

        List<TicketUpdateResponse> updates = ticketUpdateRepository.findAllByTicketIdNewestFirst(ticketId)
            .stream()
            .map(TicketMapper::toResponse)
            .toList();
        return new TicketDetailResponse(TicketMapper.toResponse(ticket), updates);
    }

    /** Staff see all tickets; other users only the ones they opened. */
    @Transactional(readOnly = true)
    public Page<TicketResponse> findAll(Actor actor, TicketStatus status, Pageable pageable) {
        Specification<ServiceTicket> spec = Specification.where(null);
        if (!actor.isStaff()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("openedBy").get("id"), actor.userId()));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        return ticketRepository.findAll(spec, pageable)
            .map(TicketMapper::toResponse);
    }

    /**
     * Staff edit. Status only moves forward (OPEN, IN_PROGRESS, CLOSED); the first move to
     * CLOSED stamps {@code closedAt}. The assignee changes only when {@code assigneeId} or
     * {@code unassign} is given.
     */
    @Transactional
    public TicketResponse update(Actor actor, Long ticketId, UpdateTicketRequest request) {
        AccessPolicy.requireStaff(actor, "edit tickets");

        if (request.unassign() && request.assigneeId() != null) {
            throw new IllegalArgumentException("Give either an assignee or unassign, not both");
        }

        ServiceTicket ticket = getTicket(ticketId);
        TicketStatus previous = ticket.getStatus();

        if (request.status() != null) {
            if (!previous.canTransitionTo(request.status())) {
                throw new InvalidTicketStateException(ticketId, previous, request.status());
            }
            ticket.applyStatus(request.status(), now());
        }
        if (request.unassign()) {
            ticket.setAssignedTo(null);
        } else if (request.assigneeId() != null) {
            ticket.setAssignedTo(resolveAssignee(request.assigneeId()));
        }

        ServiceTicket saved = ticketRepository.save(ticket);
        log.info("Ticket {} updated by user {}: status {} -> {}, assignee {}",
            ticketId, actor.userId(), previous, saved.getStatus(),
            saved.getAssignedTo() != null ? saved.getAssignedTo().getId() : null);
        return TicketMapper.toResponse(saved);
    }

    /** Appends a note. Notes are never edited or removed. */
    @Transactional
    public TicketUpdateResponse addUpdate(Actor actor, Long ticketId, AddTicketUpdateRequest request) {
        ServiceTicket ticket = getTicket(ticketId);
        AccessPolicy.requireOwnerOrStaff(actor, ticket.getOpenedBy().getId(), "ticket");

        User author = getUser(actor.userId());
        TicketUpdate saved = ticketUpdateRepository.save(
            new TicketUpdate(ticket, author, request.note().trim(), now()));

        log.info("Note {} added to ticket {} by user {}", saved.getId(), ticketId, actor.userId());
        return TicketMapper.toResponse(saved);
    }

    private User resolveAssignee(Long assigneeId) {
        User assignee = getUser(assigneeId);
        if (!assignee.isStaff()) {
            throw new IllegalArgumentException("Tickets can only be assigned to staff members");
        }
        return assignee;
    }

    private ServiceTicket getTicket(Long ticketId) {
        return ticketRepository.findByIdWithParticipants(ticketId)
            .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
    }

    private User getUser(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
