package com.campus.lending.integration;

import com.campus.lending.dto.request.CreateEquipmentRequest;
import com.campus.lending.dto.request.CreateReservationRequest;
import com.campus.lending.dto.request.UpdateReservationStatusRequest;
import com.campus.lending.dto.response.CalendarEventResponse;
import com.campus.lending.dto.response.EquipmentResponse;
import com.campus.lending.dto.response.ErrorResponse;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.dto.response.ReservationResponse;
import com.campus.lending.dto.response.ReservationStatsResponse;
import com.campus.lending.entity.ReservationStatus;
import com.campus.lending.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReservationIntegrationTest extends AbstractIntegrationTest {

    private static final String RESERVATIONS_URL = "/api/v1/reservations";
    private static final LocalDateTime DAY = LocalDateTime.of(2030, 6, 3, 0, 0);

    private User technician;
    private User alice;
    private User bob;

    @BeforeEach
    void createUsers() {
        technician = createTechnician("Terry Tech");
        alice = createStudent("Alice Student");
        bob = createStudent("Bob Student");
    }

    @Test
    void backToBackBookings_shareSingleUnit_butOverlapIsRejected() {
        Long projectorId = createEquipment("Projector", "PRJ-001", 1);

        ResponseEntity<ReservationResponse> morning = reserve(alice, List.of(projectorId), DAY.withHour(9), DAY.withHour(10));
        ResponseEntity<ReservationResponse> nextSlot = reserve(bob, List.of(projectorId), DAY.withHour(10), DAY.withHour(11));

        assertThat(morning.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(morning.getBody().status()).isEqualTo(ReservationStatus.PENDING);
        assertThat(nextSlot.getStatusCode()).isEqualTo(HttpStatus.CREATED);

        ResponseEntity<ErrorResponse> overlapping = as(bob).postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(List.of(projectorId), DAY.withHour(9).withMinute(30), DAY.withHour(10).withMinute(30)),
            ErrorResponse.class);

        assertThat(overlapping.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(overlapping.getBody().message())
            .isEqualTo("Some items are not available for that time window: Projector");
        assertThat(overlapping.getBody().details()).containsExactly("Projector");
    }

    @Test
    void deniedReservation_releasesCapacity() {
        Long projectorId = createEquipment("Projector", "PRJ-001", 1);
        Long reservationId = reserve(alice, List.of(projectorId), DAY.withHour(9), DAY.withHour(12)).getBody().id();

        ResponseEntity<ReservationResponse> denied = changeStatus(technician, reservationId, ReservationStatus.DENIED);
        assertThat(denied.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(denied.getBody().status()).isEqualTo(ReservationStatus.DENIED);

        ResponseEntity<ReservationResponse> retry = reserve(bob, List.of(projectorId), DAY.withHour(10), DAY.withHour(11));
        assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    }

    @Test
    void multiItemReservation_isAllOrNothing() {
        Long cameraId = createEquipment("Camera", "CAM-001", 1);
        Long tripodId = createEquipment("Tripod", "TRI-001", 1);
        reserve(alice, List.of(cameraId), DAY.withHour(9), DAY.withHour(17));

        ResponseEntity<ErrorResponse> response = as(bob).postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(List.of(tripodId, cameraId), DAY.withHour(12), DAY.withHour(13)),
            ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().details()).containsExactly("Camera");
        assertThat(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM reservation_items WHERE equipment_id = ?", Long.class, tripodId)).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM reservations", Long.class)).isEqualTo(1);
    }

    @Test
    void dailyLimitAboveOne_allowsParallelBookings() {
        Long cameraId = createEquipment("Camera", "CAM-001", 2);

        assertThat(reserve(alice, List.of(cameraId), DAY.withHour(9), DAY.withHour(12)).getStatusCode())
            .isEqualTo(HttpStatus.CREATED);
        assertThat(reserve(bob, List.of(cameraId), DAY.withHour(10), DAY.withHour(11)).getStatusCode())
            .isEqualTo(HttpStatus.CREATED);

        ResponseEntity<ErrorResponse> third = as(bob).postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(List.of(cameraId), DAY.withHour(10), DAY.withHour(11)), ErrorResponse.class);
        assertThat(third.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void create_withEndBeforeStart_returns400() {
        Long cameraId = createEquipment("Camera", "CAM-001", 1);

        ResponseEntity<ErrorResponse> response = as(alice).postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(List.of(cameraId), DAY.withHour(12), DAY.withHour(9)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("End date must be after start date");
    }

    @Test
    void create_withoutEquipment_returns400() {
        ResponseEntity<ErrorResponse> response = as(alice).postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(List.of(), DAY.withHour(9), DAY.withHour(12)), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().fieldErrors()).isNotEmpty();
    }

    @Test
    void statusChange_byStudent_returns403AndLeavesReservationPending() {
        Long cameraId = createEquipment("Camera", "CAM-001", 1);
        Long reservationId = reserve(alice, List.of(cameraId), DAY.withHour(9), DAY.withHour(12)).getBody().id();

        ResponseEntity<ErrorResponse> response = as(alice).exchange(RESERVATIONS_URL + "/" + reservationId + "/status",
            HttpMethod.PATCH, new HttpEntity<>(new UpdateReservationStatusRequest(ReservationStatus.APPROVED)),
            ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT status FROM reservations WHERE id = ?", String.class, reservationId)).isEqualTo("PENDING");
    }

    @Test
    void deniedReservation_cannotBeApproved() {
        Long cameraId = createEquipment("Camera", "CAM-001", 1);
        Long reservationId = reserve(alice, List.of(cameraId), DAY.withHour(9), DAY.withHour(12)).getBody().id();
        changeStatus(technician, reservationId, ReservationStatus.DENIED);

        ResponseEntity<ErrorResponse> response = as(technician).exchange(RESERVATIONS_URL + "/" + reservationId + "/status",
            HttpMethod.PATCH, new HttpEntity<>(new UpdateReservationStatusRequest(ReservationStatus.APPROVED)),
            ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void listAndView_areScopedToOwnerForStudents() {
        Long cameraId = createEquipment("Camera", "CAM-001", 5);
        Long aliceReservation = reserve(alice, List.of(cameraId), DAY.withHour(9), DAY.withHour(10)).getBody().id();
        reserve(bob, List.of(cameraId), DAY.withHour(9), DAY.withHour(10));

        ResponseEntity<PagedResponse<ReservationResponse>> bobList = as(bob).exchange(
            RESERVATIONS_URL + "?userId=" + alice.getId(), HttpMethod.GET, null,
            new ParameterizedTypeReference<PagedResponse<ReservationResponse>>() {});
        assertThat(bobList.getBody().content()).extracting(ReservationResponse::userId).containsOnly(bob.getId());

        ResponseEntity<PagedResponse<ReservationResponse>> staffList = as(technician).exchange(
            RESERVATIONS_URL, HttpMethod.GET, null,
            new ParameterizedTypeReference<PagedResponse<ReservationResponse>>() {});
        assertThat(staffList.getBody().totalElements()).isEqualTo(2);

        ResponseEntity<ErrorResponse> bobViewsAlice =
            as(bob).getForEntity(RESERVATIONS_URL + "/" + aliceReservation, ErrorResponse.class);
        assertThat(bobViewsAlice.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

        ResponseEntity<ReservationResponse> aliceViewsOwn =
            as(alice).getForEntity(RESERVATIONS_URL + "/" + aliceReservation, ReservationResponse.class);
        assertThat(aliceViewsOwn.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(aliceViewsOwn.getBody().items()).extracting(ReservationResponse.EquipmentSummary::name)
            .containsExactly("Camera");
    }

    @Test
    void calendar_hidesOtherUsersNamesFromStudents() {
        Long cameraId = createEquipment("Camera", "CAM-001", 5);
        Long aliceReservation = reserve(alice, List.of(cameraId), DAY.withHour(9), DAY.withHour(10)).getBody().id();
        Long bobReservation = reserve(bob, List.of(cameraId), DAY.withHour(11), DAY.withHour(12)).getBody().id();
        changeStatus(technician, aliceReservation, ReservationStatus.APPROVED);

        ResponseEntity<List<CalendarEventResponse>> aliceView = as(alice).exchange(
            RESERVATIONS_URL + "/calendar", HttpMethod.GET, null,
            new ParameterizedTypeReference<List<CalendarEventResponse>>() {});

        assertThat(aliceView.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(aliceView.getBody()).extracting(CalendarEventResponse::title)
            .containsExactly("#" + aliceReservation + " - Alice Student", "#" + bobReservation + " - Reserved");
        assertThat(aliceView.getBody()).extracting(CalendarEventResponse::color)
            .containsExactly("#28a745", "#ffc107");

        ResponseEntity<List<CalendarEventResponse>> staffView = as(technician).exchange(
            RESERVATIONS_URL + "/calendar?from=2030-06-03T10:30:00", HttpMethod.GET, null,
            new ParameterizedTypeReference<List<CalendarEventResponse>>() {});

        assertThat(staffView.getBody()).extracting(CalendarEventResponse::title)
            .containsExactly("#" + bobReservation + " - Bob Student");
    }

    @Test
    void stats_countReservationsPerEquipment() {
        Long cameraId = createEquipment("Camera", "CAM-001", 5);
        Long tripodId = createEquipment("Tripod", "TRI-001", 5);
        createEquipment("Unused", "UNU-001", 5);
        reserve(alice, List.of(cameraId, tripodId), DAY.withHour(9), DAY.withHour(10));
        reserve(bob, List.of(cameraId), DAY.withHour(11), DAY.withHour(12));

        ResponseEntity<ReservationStatsResponse> response =
            as(alice).getForEntity("/api/v1/stats/reservations-by-equipment", ReservationStatsResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().labels()).containsExactly("Camera", "Tripod");
        assertThat(response.getBody().values()).containsExactly(2L, 1L);
    }

    private Long createEquipment(String name, String serialNumber, int dailyLimit) {
        var request = new CreateEquipmentRequest(name, "General", serialNumber, null, "Media Lab", dailyLimit);
        return as(technician).postForEntity("/api/v1/equipment", request, EquipmentResponse.class).getBody().id();
    }

    private ResponseEntity<ReservationResponse> reserve(User user, List<Long> equipmentIds,
                                                        LocalDateTime start, LocalDateTime end) {
        return as(user).postForEntity(RESERVATIONS_URL,
            new CreateReservationRequest(equipmentIds, start, end), ReservationResponse.class);
    }

    private ResponseEntity<ReservationResponse> changeStatus(User user, Long reservationId, ReservationStatus status) {
        return as(user).exchange(RESERVATIONS_URL + "/" + reservationId + "/status", HttpMethod.PATCH,
            new HttpEntity<>(new UpdateReservationStatusRequest(status)), ReservationResponse.class);
    }
}
