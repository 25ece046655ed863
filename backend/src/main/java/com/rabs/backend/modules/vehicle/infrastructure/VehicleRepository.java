package com.rabs.backend.modules.vehicle.infrastructure;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.vehicle.domain.Vehicle;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VehicleRepository extends JpaRepository<Vehicle, UUID> {

    List<Vehicle> findByActiveTrueOrderByRegistrationAsc();
}
