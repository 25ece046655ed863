package com.rabs.backend.modules.loom.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Sequential bin packing of passengers into vehicles taken in the given order.
 */
public final class SeatPlanner {

    private SeatPlanner() {
    }

    public static <V, P> SeatPlan<V, P> plan(List<V> candidates, ToIntFunction<V> passengerSeats, List<P> passengers) {
        int needed = passengers.size();
        List<V> chosen = new ArrayList<>();
        int budget = 0;
        for (V candidate : candidates) {
            if (budget >= needed) {
                break;
            }
            int seats = passengerSeats.applyAsInt(candidate);
            if (seats <= 0) {
                continue;
            }
            chosen.add(candidate);
            budget += seats;
        }
        if (budget < needed) {
            return new SeatPlan<>(false, budget, needed, List.of());
        }

        List<SeatPlan.Load<V, P>> loads = new ArrayList<>();
        int cursor = 0;
        for (V vehicle : chosen) {
            int take = Math.min(passengerSeats.applyAsInt(vehicle), needed - cursor);
            if (take <= 0) {
                break;
            }
            loads.add(new SeatPlan.Load<>(vehicle, List.copyOf(passengers.subList(cursor, cursor + take))));
            cursor += take;
        }
        return new SeatPlan<>(true, budget, needed, List.copyOf(loads));
    }
}
