package com.rabs.backend.modules.loom.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record UpdateLoomSettingsRequest(
        @NotNull(message = "RATIO_REQUIRED")
        @Min(value = 1, message = "RATIO_TOO_SMALL")
        @Max(value = 20, message = "RATIO_TOO_LARGE")
        Integer participantsPerSupportWorker
) {
}
