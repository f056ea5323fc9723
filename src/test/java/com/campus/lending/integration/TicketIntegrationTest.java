package com.campus.lending.integration;

import com.campus.lending.dto.request.AddTicketUpdateRequest;
import com.campus.lending.dto.request.CreateEquipmentRequest;
import com.campus.lending.dto.request.CreateTicketRequest;
import com.campus.lending.dto.request.UpdateTicketRequest;
import com.campus.lending.dto.response.EquipmentResponse;
import com.campus.lending.dto.response.ErrorResponse;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.dto.response.TicketDetailResponse;
import com.campus.lending.dto.response.TicketResponse;
import com.campus.lending.dto.response.TicketUpdateResponse;
import com.campus.lending.entity.TicketSeverity;
import com.campus.lending.entity.TicketStatus;
import com.campus.lending.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TicketIntegrationTest extends AbstractIntegrationTest {

    private static final String TICKETS_URL = "/api/v1/tickets";

    private User technician;
    private User alice;
    private User bob;
    private Long projectorId;

    @BeforeEach
    void createFixtures() {
        technician = createTechnician("Terry Tech");
        alice = createStudent("Alice Student");
        bob = createStudent("Bob Student");
        projectorId = as(technician).postForEntity("/api/v1/equipment",
            new CreateEquipmentRequest("Projector", "AV", "PRJ-001", null, "Room 101", 1),
            EquipmentResponse.class).getBody().id();
    }

    @Test
    void ticketLifecycle_openWorkCloseWithNotes() {
        // OPEN as a student; the assignee is ignored
        ResponseEntity<TicketResponse> created = as(alice).postForEntity(TICKETS_URL,
            new CreateTicketRequest(projectorId, TicketSeverity.HIGH, "Lamp does not turn on", technician.getId()),
            TicketResponse.class);

        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        TicketResponse ticket = created.getBody();
        assertThat(ticket.status()).isEqualTo(TicketStatus.OPEN);
        assertThat(ticket.equipmentName()).isEqualTo("Projector");
        assertThat(ticket.openedBy().id()).isEqualTo(alice.getId());
        assertThat(ticket.assignedTo()).isNull();
        assertThat(ticket.closedAt()).isNull();

        Long ticketId = ticket.id();

        // ASSIGN and start work
        ResponseEntity<TicketResponse> inProgress = update(technician, ticketId,
            new UpdateTicketRequest(TicketStatus.IN_PROGRESS, technician.getId()), TicketResponse.class);

        assertThat(inProgress.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(inProgress.getBody().status()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(inProgress.getBody().assignedTo().fullName()).isEqualTo("Terry Tech");

        // NOTES from the reporter and the technician
        ResponseEntity<TicketUpdateResponse> firstNote = as(alice).postForEntity(TICKETS_URL + "/" + ticketId + "/updates",
            new AddTicketUpdateRequest("It smells burnt"), TicketUpdateResponse.class);
        assertThat(firstNote.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        as(technician).postForEntity(TICKETS_URL + "/" + ticketId + "/updates",
            new AddTicketUpdateRequest("Replacing the lamp"), TicketUpdateResponse.class);

        // CLOSE
        ResponseEntity<TicketResponse> closed = update(technician, ticketId,
            new UpdateTicketRequest(TicketStatus.CLOSED, technician.getId()), TicketResponse.class);

        assertThat(closed.getBody().status()).isEqualTo(TicketStatus.CLOSED);
        LocalDateTime closedAt = closed.getBody().closedAt();
        assertThat(closedAt).isNotNull();

        // CLOSE again keeps the first timestamp
        ResponseEntity<TicketResponse> closedAgain = update(technician, ticketId,
            new UpdateTicketRequest(TicketStatus.CLOSED, technician.getId()), TicketResponse.class);
        assertThat(closedAgain.getBody().closedAt()).isEqualTo(closedAt);

        // DETAIL as the reporter: notes newest first
        ResponseEntity<TicketDetailResponse> detail =
            as(alice).getForEntity(TICKETS_URL + "/" + ticketId, TicketDetailResponse.class);

        assertThat(detail.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(detail.getBody().updates()).extracting(TicketUpdateResponse::note)
            .containsExactly("Replacing the lamp", "It smells burnt");
    }

    @Test
    void closedTicket_cannotBeReopened() {
        Long ticketId = openTicket(alice);
        update(technician, ticketId, new UpdateTicketRequest(TicketStatus.CLOSED, null), TicketResponse.class);

        ResponseEntity<ErrorResponse> response = update(technician, ticketId,
            new UpdateTicketRequest(TicketStatus.OPEN, null), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT status FROM service_tickets WHERE id = ?", String.class, ticketId)).isEqualTo("CLOSED");
    }

    @Test
    void update_statusOnly_keepsAssignee_untilExplicitlyUnassigned() {
        Long ticketId = openTicket(alice);
        update(technician, ticketId, new UpdateTicketRequest(null, technician.getId()), TicketResponse.class);

        ResponseEntity<TicketResponse> inProgress = update(technician, ticketId,
            new UpdateTicketRequest(TicketStatus.IN_PROGRESS, null), TicketResponse.class);

        assertThat(inProgress.getBody().status()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(inProgress.getBody().assignedTo().id()).isEqualTo(technician.getId());

        ResponseEntity<TicketResponse> unassigned = update(technician, ticketId,
            new UpdateTicketRequest(null, null, true), TicketResponse.class);

        assertThat(unassigned.getBody().assignedTo()).isNull();
        assertThat(unassigned.getBody().status()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT assigned_to IS NULL FROM service_tickets WHERE id = ?", Boolean.class, ticketId)).isTrue();
    }

    @Test
    void update_assigningStudent_returns400() {
        Long ticketId = openTicket(alice);

        ResponseEntity<ErrorResponse> response = update(technician, ticketId,
            new UpdateTicketRequest(null, bob.getId()), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void update_byStudent_returns403() {
        Long ticketId = openTicket(alice);

        ResponseEntity<ErrorResponse> response = update(alice, ticketId,
            new UpdateTicketRequest(TicketStatus.CLOSED, null), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void otherStudents_cannotSeeOrAnnotateTicket() {
        Long ticketId = openTicket(alice);

        ResponseEntity<ErrorResponse> view = as(bob).getForEntity(TICKETS_URL + "/" + ticketId, ErrorResponse.class);
        ResponseEntity<ErrorResponse> note = as(bob).postForEntity(TICKETS_URL + "/" + ticketId + "/updates",
            new AddTicketUpdateRequest("me too"), ErrorResponse.class);

        assertThat(view.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(note.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ticket_updates", Long.class)).isZero();
    }

    @Test
    void addUpdate_withBlankNote_returns400() {
        Long ticketId = openTicket(alice);

        ResponseEntity<ErrorResponse> response = as(alice).postForEntity(TICKETS_URL + "/" + ticketId + "/updates",
            new AddTicketUpdateRequest("   "), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void findAll_isScopedToReporterForStudents() {
        openTicket(alice);
        openTicket(bob);

        PagedResponse<TicketResponse> aliceTickets = listTickets(alice);
        PagedResponse<TicketResponse> staffTickets = listTickets(technician);

        assertThat(aliceTickets.content()).extracting(t -> t.openedBy().id()).containsOnly(alice.getId());
        assertThat(staffTickets.totalElements()).isEqualTo(2);
    }

    private Long openTicket(User reporter) {
        return as(reporter).postForEntity(TICKETS_URL,
            new CreateTicketRequest(projectorId, TicketSeverity.MEDIUM, "Flickering", null),
            TicketResponse.class).getBody().id();
    }

    private <T> ResponseEntity<T> update(User user, Long ticketId, UpdateTicketRequest request, Class<T> type) {
        return as(user).exchange(TICKETS_URL + "/" + ticketId, HttpMethod.PATCH, new HttpEntity<>(request), type);
    }

    private PagedResponse<TicketResponse> listTickets(User user) {
        return as(user).exchange(TICKETS_URL, HttpMethod.GET, null,
            new ParameterizedTypeReference<PagedResponse<TicketResponse>>() {}).getBody();
    }
}
