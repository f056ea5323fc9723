package com.campus.lending.controller;

import com.campus.lending.dto.request.AddTicketUpdateRequest;
import com.campus.lending.dto.request.CreateTicketRequest;
import com.campus.lending.dto.request.UpdateTicketRequest;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.dto.response.TicketDetailResponse;
import com.campus.lending.dto.response.TicketResponse;
import com.campus.lending.dto.response.TicketUpdateResponse;
import com.campus.lending.entity.TicketStatus;
import com.campus.lending.security.UserPrincipal;
import com.campus.lending.service.TicketService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
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

@RestController
@RequestMapping("/api/v1/tickets")
@RequiredArgsConstructor
@Tag(name = "Service tickets", description = "Equipment fault reports and their notes")
public class TicketController {

    private final TicketService ticketService;

    @PostMapping
    @Operation(summary = "Open a ticket", description = "Any user may report a problem. "
        + "An assignee is only taken into account when the reporter is staff.")
    @ApiResponse(responseCode = "201", description = "Ticket opened")
    @ApiResponse(responseCode = "400", description = "Validation error or assignee is not staff")
    @ApiResponse(responseCode = "404", description = "Equipment or assignee not found")
    public ResponseEntity<TicketResponse> create(@Valid @RequestBody CreateTicketRequest request,
                                                 @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.create(principal.toActor(), request));
    }

    @GetMapping
    @Operation(summary = "List tickets", description = "Staff see all tickets; other users those they opened.")
    public ResponseEntity<PagedResponse<TicketResponse>> findAll(
            @Parameter(description = "Filter by status (OPEN, IN_PROGRESS, CLOSED)") @RequestParam(required = false) TicketStatus status,
            @PageableDefault(sort = "openedAt", direction = Sort.Direction.DESC) Pageable pageable,
            @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(PagedResponse.from(ticketService.findAll(principal.toActor(), status, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get ticket with notes", description = "Notes are listed most recent first.")
    @ApiResponse(responseCode = "200", description = "Ticket found")
    @ApiResponse(responseCode = "403", description = "Neither the reporter nor staff")
    @ApiResponse(responseCode = "404", description = "Ticket not found")
    public ResponseEntity<TicketDetailResponse> findById(@PathVariable Long id,
                                                         @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(ticketService.findById(principal.toActor(), id));
    }

    @PostMapping("/{id}/updates")
    @Operation(summary = "Add a note")
    @ApiResponse(responseCode = "201", description = "Note added")
    @ApiResponse(responseCode = "400", description = "Empty note")
    @ApiResponse(responseCode = "403", description = "Neither the reporter nor staff")
    @ApiResponse(responseCode = "404", description = "Ticket not found")
    public ResponseEntity<TicketUpdateResponse> addUpdate(@PathVariable Long id,
                                                          @Valid @RequestBody AddTicketUpdateRequest request,
                                                          @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ticketService.addUpdate(principal.toActor(), id, request));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update status and assignee", description = "Staff only. Status only moves forward; "
        + "omitted fields keep their value, unassign=true clears the assignee.")
    @ApiResponse(responseCode = "200", description = "Ticket updated")
    @ApiResponse(responseCode = "400", description = "Assignee is not staff, or assignee given together with unassign")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "404", description = "Ticket or assignee not found")
    @ApiResponse(responseCode = "409", description = "Status would move backwards")
    public ResponseEntity<TicketResponse> update(@PathVariable Long id,
                                                 @Valid @RequestBody UpdateTicketRequest request,
                                                 @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(ticketService.update(principal.toActor(), id, request));
    }
}
