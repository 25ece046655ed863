package com.rabs.backend.modules.availability.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

public record AvailabilityCheckResponse(UUID id, LocalDate date, LocalTime startTime, LocalTime endTime, boolean available) {
}
