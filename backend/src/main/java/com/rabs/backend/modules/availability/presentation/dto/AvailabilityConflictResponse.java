package com.rabs.backend.modules.availability.presentation.dto;

import java.util.List;
import java.util.UUID;

public record AvailabilityConflictResponse(UUID recordId, List<UUID> affectedInstanceIds) {
}
