package com.rabs.backend.modules.loom.presentation.dto;

import java.util.List;
import java.util.UUID;

public record ParticipantAllocationResponse(
        UUID instanceId,
        List<UUID> createdAllocationIds,
        long plannedParticipants
) {
}
