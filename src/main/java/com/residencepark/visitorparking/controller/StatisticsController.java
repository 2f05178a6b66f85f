package com.residencepark.visitorparking.controller;

import com.residencepark.visitorparking.dto.ApiResponse;
import com.residencepark.visitorparking.dto.ParkingStatistics;
import com.residencepark.visitorparking.service.ParkingStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/statistics — occupancy snapshot (counts, available spots, level).
 */
@RestController
@RequestMapping("/api/statistics")
@RequiredArgsConstructor
public class StatisticsController {

    private final ParkingStatisticsService statisticsService;

    @GetMapping
    public ResponseEntity<ApiResponse> statistics() {
        ParkingStatistics stats = statisticsService.getStatistics();
        return ResponseEntity.ok(ApiResponse.success(stats,
                stats.getAvailableSpots() + "/" + stats.getCapacity() + " spots available"));
    }
}
