package com.campus.lending.controller;

import com.campus.lending.dto.response.ReservationStatsResponse;
import com.campus.lending.service.StatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
@Tag(name = "Statistics", description = "Chart data")
public class StatsController {

    private final StatisticsService statisticsService;

    @GetMapping("/reservations-by-equipment")
    @Operation(summary = "Reservation counts per equipment",
        description = "Labels are equipment names, values the number of reservations including each item.")
    public ResponseEntity<ReservationStatsResponse> reservationsByEquipment() {
        return ResponseEntity.ok(statisticsService.reservationsByEquipment());
    }
}
