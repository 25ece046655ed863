package com.rabs.backend.modules.availability.presentation.dto;

import java.util.UUID;

import com.rabs.backend.modules.vehicle.domain.Vehicle;

public record AvailableVehicleResponse(UUID id, String registration, int seats) {

    public static AvailableVehicleResponse from(Vehicle vehicle) {
        return new AvailableVehicleResponse(vehicle.getId(), vehicle.getRegistration(), vehicle.getSeats());
    }
}
