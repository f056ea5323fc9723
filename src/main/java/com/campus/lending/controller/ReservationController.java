package com.campus.lending.controller;

import com.campus.lending.dto.request.CreateReservationRequest;
import com.campus.lending.dto.request.UpdateReservationStatusRequest;
import com.campus.lending.dto.response.CalendarEventResponse;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.dto.response.ReservationResponse;
import com.campus.lending.entity.ReservationStatus;
import com.campus.lending.security.UserPrincipal;
import com.campus.lending.service.ReservationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
@Tag(name = "Reservations", description = "Equipment reservations with availability control")
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    @Operation(summary = "Create a reservation", description = "Books one or more equipment items for a window. "
        + "Either every item is booked or none is; the new reservation is PENDING.")
    @ApiResponse(responseCode = "201", description = "Reservation created")
    @ApiResponse(responseCode = "400", description = "Validation error or end not after start")
    @ApiResponse(responseCode = "409", description = "Some items are not available for the window")
    public ResponseEntity<ReservationResponse> create(@Valid @RequestBody CreateReservationRequest request,
                                                      @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(reservationService.create(principal.toActor(), request));
    }

    @PatchMapping("/{id}/status")
    @Operation(summary = "Approve or deny a reservation", description = "Staff only. Only pending reservations can change.")
    @ApiResponse(responseCode = "200", description = "Status updated")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    @ApiResponse(responseCode = "409", description = "Reservation is no longer pending")
    public ResponseEntity<ReservationResponse> updateStatus(@PathVariable Long id,
                                                            @Valid @RequestBody UpdateReservationStatusRequest request,
                                                            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(reservationService.updateStatus(principal.toActor(), id, request.status()));
    }

    @GetMapping
    @Operation(summary = "List reservations", description = "Staff see all reservations; other users their own.")
    public ResponseEntity<PagedResponse<ReservationResponse>> findAll(
            @Parameter(description = "Filter by status (PENDING, APPROVED, DENIED)") @RequestParam(required = false) ReservationStatus status,
            @Parameter(description = "Filter by user ID (staff only)") @RequestParam(required = false) Long userId,
            @PageableDefault(sort = "startAt") Pageable pageable,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(
            PagedResponse.from(reservationService.findAll(principal.toActor(), status, userId, pageable)));
    }

    @GetMapping("/calendar")
    @Operation(summary = "Calendar events", description = "All bookings overlapping the optional window. "
        + "Other users' bookings are shown as 'Reserved' to non-staff.")
    public ResponseEntity<List<CalendarEventResponse>> calendar(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(reservationService.calendar(principal.toActor(), from, to));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get reservation by ID", description = "Visible to its owner and to staff.")
    @ApiResponse(responseCode = "200", description = "Reservation found")
    @ApiResponse(responseCode = "403", description = "Not the owner")
    @ApiResponse(responseCode = "404", description = "Reservation not found")
    public ResponseEntity<ReservationResponse> findById(@PathVariable Long id,
                                                        @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(reservationService.findById(principal.toActor(), id));
    }
}
