package com.residencepark.visitorparking.dto;

import lombok.*;

/**
 * Point-in-time occupancy snapshot of the visitor car park.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParkingStatistics {

    /** Total visitor parking spots (configured) */
    private int capacity;

    private long activeCount;

    private long leftCount;

    /** All records, active and left */
    private long totalCount;

    /** capacity - activeCount, never below zero */
    private long availableSpots;

    /** activeCount / capacity as a percentage, one decimal */
    private double occupancyRate;

    private OccupancyLevel level;
}
