package com.residencepark.visitorparking.dto;

/**
 * One-word occupancy verdict derived from the number of available spots.
 */
public enum OccupancyLevel {

    /** No spots left */
    FULL,

    /** Fewer than {@link #LOW_THRESHOLD} spots left */
    LOW,

    AVAILABLE;

    public static final int LOW_THRESHOLD = 20;

    public static OccupancyLevel of(long available) {
        if (available <= 0) {
            return FULL;
        }
        return available < LOW_THRESHOLD ? LOW : AVAILABLE;
    }
}
