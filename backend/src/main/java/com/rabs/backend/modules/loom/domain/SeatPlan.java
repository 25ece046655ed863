package com.rabs.backend.modules.loom.domain;

import java.util.List;

/**
 * Result of packing passengers into vehicles. When {@code sufficient} is false
 * no loads are produced and {@code seatBudget} is the total passenger seats found.
 */
public record SeatPlan<V, P>(boolean sufficient, int seatBudget, int passengerCount, List<Load<V, P>> loads) {

    public record Load<V, P>(V vehicle, List<P> passengers) {
    }
}
