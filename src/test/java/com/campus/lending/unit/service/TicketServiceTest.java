package com.campus.lending.unit.service;

import com.campus.lending.dto.request.AddTicketUpdateRequest;
import com.campus.lending.dto.request.CreateTicketRequest;
import com.campus.lending.dto.request.UpdateTicketRequest;
import com.campus.lending.dto.response.TicketDetailResponse;
import com.campus.lending.dto.response.TicketResponse;
import com.campus.lending.dto.response.TicketUpdateResponse;
import com.campus.lending.entity.Equipment;
import com.campus.lending.entity.Role;
import com.campus.lending.entity.RoleName;
import com.campus.lending.entity.ServiceTicket;
import com.campus.lending.entity.TicketSeverity;
import com.campus.lending.entity.TicketStatus;
import com.campus.lending.entity.TicketUpdate;
import com.campus.lending.entity.User;
import com.campus.lending.exception.InsufficientPrivilegeException;
import com.campus.lending.exception.InvalidTicketStateException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.repository.EquipmentRepository;
import com.campus.lending.repository.ServiceTicketRepository;
import com.campus.lending.repository.TicketUpdateRepository;
import com.campus.lending.repository.UserRepository;
import com.campus.lending.security.Actor;
import com.campus.lending.service.TicketService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TicketServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    private static final Actor STUDENT = new Actor(1L, RoleName.STUDENT);
    private static final Actor OTHER_STUDENT = new Actor(2L, RoleName.STUDENT);
    private static final Actor STAFF = new Actor(5L, RoleName.TECH_STAFF);

    @Mock
    private ServiceTicketRepository ticketRepository;

    @Mock
    private TicketUpdateRepository ticketUpdateRepository;

    @Mock
    private EquipmentRepository equipmentRepository;

    @Mock
    private UserRepository userRepository;

    private TicketService ticketService;

    private User student;
    private User technician;
    private Equipment projector;

    @BeforeEach
    void setUp() {
        ticketService = new TicketService(ticketRepository, ticketUpdateRepository, equipmentRepository,
            userRepository, Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
        student = createTestUser(1L, "Alice Student", RoleName.STUDENT);
        technician = createTestUser(5L, "Terry Tech", RoleName.TECH_STAFF);
        projector = new Equipment();
        ReflectionTestUtils.setField(projector, "id", 3L);
        projector.setName("Projector");
    }

    @Test
    void create_byStudent_opensTicketAndIgnoresAssignee() {
        when(equipmentRepository.findById(3L)).thenReturn(Optional.of(projector));
        when(userRepository.findById(1L)).thenReturn(Optional.of(student));
        when(ticketRepository.save(any(ServiceTicket.class))).thenAnswer(invocation -> {
            ServiceTicket saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 20L);
            return saved;
        });

        TicketResponse response = ticketService.create(STUDENT,
            new CreateTicketRequest(3L, TicketSeverity.HIGH, "  Lamp flickers ", 5L));

        assertThat(response.id()).isEqualTo(20L);
        assertThat(response.status()).isEqualTo(TicketStatus.OPEN);
        assertThat(response.description()).isEqualTo("Lamp flickers");
        assertThat(response.openedBy().id()).isEqualTo(1L);
        assertThat(response.assignedTo()).isNull();
        assertThat(response.openedAt()).isEqualTo(NOW);
        verify(userRepository, never()).findById(5L);
    }

    @Test
    void create_byStaffWithAssignee_assignsTicket() {
        when(equipmentRepository.findById(3L)).thenReturn(Optional.of(projector));
        when(userRepository.findById(5L)).thenReturn(Optional.of(technician));
        when(ticketRepository.save(any(ServiceTicket.class))).thenAnswer(invocation -> invocation.getArgument(0));

        TicketResponse response = ticketService.create(STAFF,
            new CreateTicketRequest(3L, TicketSeverity.LOW, null, 5L));

        assertThat(response.assignedTo().fullName()).isEqualTo("Terry Tech");
    }

    @Test
    void create_byStaffAssigningStudent_throwsIllegalArgumentException() {
        when(equipmentRepository.findById(3L)).thenReturn(Optional.of(projector));
        when(userRepository.findById(5L)).thenReturn(Optional.of(technician));
        when(userRepository.findById(1L)).thenReturn(Optional.of(student));

        assertThatThrownBy(() -> ticketService.create(STAFF,
                new CreateTicketRequest(3L, TicketSeverity.LOW, null, 1L)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("staff");

        verify(ticketRepository, never()).save(any());
    }

    @Test
    void create_forUnknownEquipment_throwsResourceNotFoundException() {
        when(equipmentRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ticketService.create(STUDENT,
                new CreateTicketRequest(99L, TicketSeverity.LOW, null, null)))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Equipment");
    }

    @Test
    void update_toClosed_stampsClosedAtOnce() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.IN_PROGRESS);
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(ticket)).thenReturn(ticket);

        TicketResponse response = ticketService.update(STAFF, 20L, new UpdateTicketRequest(TicketStatus.CLOSED, null));

        assertThat(response.status()).isEqualTo(TicketStatus.CLOSED);
        assertThat(response.closedAt()).isEqualTo(NOW);
    }

    @Test
    void update_closedToClosed_keepsOriginalClosedAt() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.CLOSED);
        LocalDateTime closedEarlier = NOW.minusDays(1);
        ticket.setClosedAt(closedEarlier);
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(ticket)).thenReturn(ticket);

        TicketResponse response = ticketService.update(STAFF, 20L, new UpdateTicketRequest(TicketStatus.CLOSED, null));

        assertThat(response.closedAt()).isEqualTo(closedEarlier);
    }

    @Test
    void update_closedToOpen_throwsInvalidTicketStateException() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.CLOSED);
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));

        assertThatThrownBy(() -> ticketService.update(STAFF, 20L, new UpdateTicketRequest(TicketStatus.OPEN, null)))
            .isInstanceOf(InvalidTicketStateException.class)
            .hasMessageContaining("CLOSED");

        verify(ticketRepository, never()).save(any());
    }

    @Test
    void update_statusOnly_keepsAssignee() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.IN_PROGRESS);
        ticket.setAssignedTo(technician);
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(ticket)).thenReturn(ticket);

        TicketResponse response = ticketService.update(STAFF, 20L, new UpdateTicketRequest(TicketStatus.CLOSED, null));

        assertThat(response.status()).isEqualTo(TicketStatus.CLOSED);
        assertThat(response.assignedTo().id()).isEqualTo(5L);
        verify(userRepository, never()).findById(any());
    }

    @Test
    void update_withUnassign_clearsAssignee() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.OPEN);
        ticket.setAssignedTo(technician);
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(ticket)).thenReturn(ticket);

        TicketResponse response = ticketService.update(STAFF, 20L, new UpdateTicketRequest(null, null, true));

        assertThat(response.assignedTo()).isNull();
        assertThat(response.status()).isEqualTo(TicketStatus.OPEN);
    }

    @Test
    void update_withAssigneeAndUnassign_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> ticketService.update(STAFF, 20L, new UpdateTicketRequest(null, 5L, true)))
            .isInstanceOf(IllegalArgumentException.class);

        verify(ticketRepository, never()).save(any());
    }

    @Test
    void update_byStudent_throwsInsufficientPrivilegeException() {
        assertThatThrownBy(() -> ticketService.update(STUDENT, 20L, new UpdateTicketRequest(TicketStatus.CLOSED, null)))
            .isInstanceOf(InsufficientPrivilegeException.class);

        verify(ticketRepository, never()).findByIdWithParticipants(any());
    }

    @Test
    void findById_byOpener_returnsTicketWithNotesNewestFirst() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.OPEN);
        TicketUpdate older = new TicketUpdate(ticket, student, "First", NOW.minusHours(2));
        TicketUpdate newer = new TicketUpdate(ticket, technician, "Second", NOW.minusHours(1));
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));
        when(ticketUpdateRepository.findAllByTicketIdNewestFirst(20L)).thenReturn(List.of(newer, older));

        TicketDetailResponse response = ticketService.findById(STUDENT, 20L);

        assertThat(response.ticket().id()).isEqualTo(20L);
        assertThat(response.updates()).extracting(TicketUpdateResponse::note).containsExactly("Second", "First");
    }

    @Test
    void findById_byAnotherStudent_throwsInsufficientPrivilegeException() {
        when(ticketRepository.findByIdWithParticipants(20L))
            .thenReturn(Optional.of(createTestTicket(20L, TicketStatus.OPEN)));

        assertThatThrownBy(() -> ticketService.findById(OTHER_STUDENT, 20L))
            .isInstanceOf(InsufficientPrivilegeException.class);
    }

    @Test
    void addUpdate_byOpener_appendsNote() {
        ServiceTicket ticket = createTestTicket(20L, TicketStatus.OPEN);
        when(ticketRepository.findByIdWithParticipants(20L)).thenReturn(Optional.of(ticket));
        when(userRepository.findById(1L)).thenReturn(Optional.of(student));
        when(ticketUpdateRepository.save(any(TicketUpdate.class))).thenAnswer(invocation -> {
            TicketUpdate saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 7L);
            return saved;
        });

        TicketUpdateResponse response = ticketService.addUpdate(STUDENT, 20L, new AddTicketUpdateRequest(" Still broken "));

        assertThat(response.id()).isEqualTo(7L);
        assertThat(response.authorId()).isEqualTo(1L);
        assertThat(response.note()).isEqualTo("Still broken");
        assertThat(response.addedAt()).isEqualTo(NOW);
    }

    @Test
    void addUpdate_byAnotherStudent_throwsInsufficientPrivilegeException() {
        when(ticketRepository.findByIdWithParticipants(20L))
            .thenReturn(Optional.of(createTestTicket(20L, TicketStatus.OPEN)));

        assertThatThrownBy(() -> ticketService.addUpdate(OTHER_STUDENT, 20L, new AddTicketUpdateRequest("note")))
            .isInstanceOf(InsufficientPrivilegeException.class);

        verify(ticketUpdateRepository, never()).save(any());
    }

    private User createTestUser(Long id, String fullName, RoleName roleName) {
        Role role = new Role();
        role.setName(roleName);
        User user = new User();
        ReflectionTestUtils.setField(user, "id", id);
        user.setFullName(fullName);
        user.setRole(role);
        return user;
    }

    private ServiceTicket createTestTicket(Long id, TicketStatus status) {
        ServiceTicket ticket = new ServiceTicket();
        ReflectionTestUtils.setField(ticket, "id", id);
        ticket.setEquipment(projector);
        ticket.setSeverity(TicketSeverity.MEDIUM);
        ticket.setStatus(status);
        ticket.setOpenedBy(student);
        ticket.setOpenedAt(NOW.minusDays(2));
        return ticket;
    }
}
