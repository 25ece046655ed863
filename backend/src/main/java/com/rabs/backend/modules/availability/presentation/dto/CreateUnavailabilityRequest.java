package com.rabs.backend.modules.availability.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateUnavailabilityRequest(
        @NotNull(message = "START_AT_REQUIRED")
        OffsetDateTime startAt,
        @NotNull(message = "END_AT_REQUIRED")
        OffsetDateTime endAt,
        @Size(max = 200, message = "REASON_TOO_LONG")
        String reason
) {
}
