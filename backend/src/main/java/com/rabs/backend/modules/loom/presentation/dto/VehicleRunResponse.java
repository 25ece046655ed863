package com.rabs.backend.modules.loom.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.VehicleRun;

public record VehicleRunResponse(
        UUID runId,
        UUID vehicleId,
        String registration,
        int seatsUsed,
        int estimatedDurationMinutes,
        int estimatedDistanceKm,
        Map<String, Object> routeData
) {

    public static VehicleRunResponse from(VehicleRun run) {
        return new VehicleRunResponse(
                run.getId(),
                run.getVehicle() != null ? run.getVehicle().getId() : null,
                run.getVehicle() != null ? run.getVehicle().getRegistration() : null,
                run.getSeatsUsed(),
                run.getEstimatedDurationMinutes(),
                run.getEstimatedDistanceKm(),
                run.getRouteData()
        );
    }
}
