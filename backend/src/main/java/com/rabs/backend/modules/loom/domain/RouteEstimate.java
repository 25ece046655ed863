package com.rabs.backend.modules.loom.domain;

/**
 * Linear placeholder for route cost until real routing is wired in.
 */
public record RouteEstimate(int stops, int durationMinutes, int distanceKm) {

    static final int MINUTES_PER_STOP = 10;
    static final int KM_PER_STOP = 5;

    public static RouteEstimate forStops(int stops) {
        return new RouteEstimate(stops, stops * MINUTES_PER_STOP, stops * KM_PER_STOP);
    }
}
