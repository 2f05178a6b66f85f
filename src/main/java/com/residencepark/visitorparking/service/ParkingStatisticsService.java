package com.residencepark.visitorparking.service;

import com.residencepark.visitorparking.dto.OccupancyLevel;
import com.residencepark.visitorparking.dto.ParkingStatistics;
import com.residencepark.visitorparking.entity.VisitorStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Occupancy view over the visitor records.
 *
 * available = capacity - active (floored at 0), and the verdict is
 * FULL at 0 available, LOW below 20, AVAILABLE otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingStatisticsService {

    private final VisitorService visitorService;

    /** Total visitor parking spots in the complex */
    @Value("${parking.capacity:105}")
    private int capacity;

    public ParkingStatistics getStatistics() {
        long active = visitorService.countByStatus(VisitorStatus.ACTIVE);
        long left   = visitorService.countByStatus(VisitorStatus.LEFT);
        long total  = visitorService.countAll();

        long available = Math.max(0, capacity - active);
        double occupancyRate = capacity > 0
                ? Math.round(active * 1000.0 / capacity) / 10.0
                : 0.0;

        ParkingStatistics stats = ParkingStatistics.builder()
                .capacity(capacity)
                .activeCount(active)
                .leftCount(left)
                .totalCount(total)
                .availableSpots(available)
                .occupancyRate(occupancyRate)
                .level(OccupancyLevel.of(available))
                .build();

        log.debug("Occupancy — active: {}, left: {}, total: {}, available: {}/{}",
                active, left, total, available, capacity);
        return stats;
    }
}
