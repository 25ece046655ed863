package com.rabs.backend.modules.loom.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record LoomWindowRequest(
        @NotNull(message = "WEEKS_REQUIRED")
        Integer weeks
) {
}
