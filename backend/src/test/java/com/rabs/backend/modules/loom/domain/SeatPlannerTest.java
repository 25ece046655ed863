package com.rabs.backend.modules.loom.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SeatPlannerTest {

    private record Van(String registration, int passengerSeats) {
    }

    @Test
    @DisplayName("vehicles are filled in order until every passenger has a seat")
    void fillsVehiclesSequentially() {
        List<Van> vans = List.of(new Van("AAA111", 3), new Van("BBB222", 4), new Van("CCC333", 7));
        List<String> passengers = List.of("p1", "p2", "p3", "p4", "p5");

        SeatPlan<Van, String> plan = SeatPlanner.plan(vans, Van::passengerSeats, passengers);

        assertThat(plan.sufficient()).isTrue();
        assertThat(plan.seatBudget()).isEqualTo(7);
        assertThat(plan.loads()).hasSize(2);
        assertThat(plan.loads().get(0).vehicle().registration()).isEqualTo("AAA111");
        assertThat(plan.loads().get(0).passengers()).containsExactly("p1", "p2", "p3");
        assertThat(plan.loads().get(1).passengers()).containsExactly("p4", "p5");
    }

    @Test
    @DisplayName("vehicles without passenger seats are skipped")
    void skipsVehiclesWithoutSeats() {
        List<Van> vans = List.of(new Van("CAR000", 0), new Van("BUS111", 10));

        SeatPlan<Van, String> plan = SeatPlanner.plan(vans, Van::passengerSeats, List.of("p1"));

        assertThat(plan.loads()).singleElement()
                .satisfies(load -> assertThat(load.vehicle().registration()).isEqualTo("BUS111"));
    }

    @Test
    @DisplayName("a short seat budget produces no loads")
    void insufficientBudget() {
        List<Van> vans = List.of(new Van("AAA111", 2));

        SeatPlan<Van, String> plan = SeatPlanner.plan(vans, Van::passengerSeats, List.of("p1", "p2", "p3"));

        assertThat(plan.sufficient()).isFalse();
        assertThat(plan.seatBudget()).isEqualTo(2);
        assertThat(plan.passengerCount()).isEqualTo(3);
        assertThat(plan.loads()).isEmpty();
    }

    @Test
    @DisplayName("route estimate is linear in stops")
    void routeEstimate() {
        RouteEstimate estimate = RouteEstimate.forStops(4);

        assertThat(estimate.durationMinutes()).isEqualTo(40);
        assertThat(estimate.distanceKm()).isEqualTo(20);
    }
}
