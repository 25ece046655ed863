package com.rabs.backend.modules.loom.presentation.dto;

import java.util.List;
import java.util.UUID;

public record VehicleAssignmentResponse(
        UUID instanceId,
        boolean transportRequired,
        int passengerCount,
        int seatBudget,
        List<VehicleRunResponse> runs
) {
}
