package com.campus.lending.controller;

import com.campus.lending.dto.request.CreateEquipmentRequest;
import com.campus.lending.dto.request.UpdateEquipmentRequest;
import com.campus.lending.dto.response.AvailabilityResponse;
import com.campus.lending.dto.response.EquipmentResponse;
import com.campus.lending.dto.response.PagedResponse;
import com.campus.lending.security.UserPrincipal;
import com.campus.lending.service.AvailabilityService;
import com.campus.lending.service.EquipmentService;
import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/equipment")
@RequiredArgsConstructor
@Tag(name = "Equipment", description = "Equipment inventory")
public class EquipmentController {

    private final EquipmentService equipmentService;
    private final AvailabilityService availabilityService;

    @GetMapping
    @Operation(summary = "List equipment", description = "Returns a paginated list of equipment ordered by name.")
    public ResponseEntity<PagedResponse<EquipmentResponse>> findAll(@PageableDefault(sort = "name") Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(equipmentService.findAll(pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get equipment by ID")
    @ApiResponse(responseCode = "200", description = "Equipment found")
    @ApiResponse(responseCode = "404", description = "Equipment not found")
    public ResponseEntity<EquipmentResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(equipmentService.findById(id));
    }

    @GetMapping("/{id}/availability")
    @Operation(summary = "Check availability", description = "Counts pending and approved bookings overlapping "
        + "the window and compares them with the daily limit.")
    @ApiResponse(responseCode = "200", description = "Availability computed")
    @ApiResponse(responseCode = "400", description = "End is not after start")
    @ApiResponse(responseCode = "404", description = "Equipment not found")
    public ResponseEntity<AvailabilityResponse> availability(
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        return ResponseEntity.ok(availabilityService.describe(id, start, end));
    }

    @PostMapping
    @Operation(summary = "Add equipment", description = "Staff only.")
    @ApiResponse(responseCode = "201", description = "Equipment created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "409", description = "Serial number already exists")
    public ResponseEntity<EquipmentResponse> create(@Valid @RequestBody CreateEquipmentRequest request,
                                                    @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(equipmentService.create(principal.toActor(), request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update equipment", description = "Staff only. Fields left null keep their value.")
    @ApiResponse(responseCode = "200", description = "Equipment updated")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "404", description = "Equipment not found")
    @ApiResponse(responseCode = "409", description = "Serial number already exists")
    public ResponseEntity<EquipmentResponse> update(@PathVariable Long id,
                                                    @Valid @RequestBody UpdateEquipmentRequest request,
                                                    @AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(equipmentService.update(principal.toActor(), id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete equipment", description = "Staff only. Equipment with reservation or ticket history is kept.")
    @ApiResponse(responseCode = "204", description = "Equipment deleted")
    @ApiResponse(responseCode = "403", description = "Caller is not staff")
    @ApiResponse(responseCode = "404", description = "Equipment not found")
    @ApiResponse(responseCode = "409", description = "Equipment has history")
    public ResponseEntity<Void> delete(@PathVariable Long id, @AuthenticationPrincipal UserPrincipal principal) {
        equipmentService.delete(principal.toActor(), id);
        return ResponseEntity.noContent().build();
    }
}
