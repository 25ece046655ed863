package com.rabs.backend.modules.loom.presentation.dto;

import java.util.UUID;

import com.rabs.backend.modules.loom.application.LoomResult;

public record ReoptimizationResponse(
        UUID instanceId,
        LoomResult<ParticipantAllocationResponse> participants,
        LoomResult<StaffAssignmentResponse> staff,
        LoomResult<VehicleAssignmentResponse> vehicles
) {
}
