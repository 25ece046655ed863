package com.rabs.backend.modules.availability.presentation;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.availability.application.AvailabilityService;
import com.rabs.backend.modules.availability.presentation.dto.AvailabilityCheckResponse;
import com.rabs.backend.modules.availability.presentation.dto.AvailabilityConflictResponse;
import com.rabs.backend.modules.availability.presentation.dto.AvailableStaffResponse;
import com.rabs.backend.modules.availability.presentation.dto.AvailableVehicleResponse;
import com.rabs.backend.modules.availability.presentation.dto.CreateUnavailabilityRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/availability")
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    public AvailabilityController(AvailabilityService availabilityService) {
        this.availabilityService = availabilityService;
    }

    @GetMapping("/staff/{staffId}")
    @Operation(summary = "Check whether a staff member is free for an interval")
    public ResponseEntity<AvailabilityCheckResponse> checkStaff(
            @PathVariable("staffId") UUID staffId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime end
    ) {
        boolean available = availabilityService.isStaffAvailable(staffId, date, start, end);
        return ResponseEntity.ok(new AvailabilityCheckResponse(staffId, date, start, end, available));
    }

    @GetMapping("/vehicles/{vehicleId}")
    @Operation(summary = "Check whether a vehicle is free for an interval")
    public ResponseEntity<AvailabilityCheckResponse> checkVehicle(
            @PathVariable("vehicleId") UUID vehicleId,
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime end
    ) {
        boolean available = availabilityService.isVehicleAvailable(vehicleId, date, start, end);
        return ResponseEntity.ok(new AvailabilityCheckResponse(vehicleId, date, start, end, available));
    }

    @GetMapping("/staff")
    public ResponseEntity<List<AvailableStaffResponse>> listAvailableStaff(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime end
    ) {
        return ResponseEntity.ok(availabilityService.getAvailableStaff(date, start, end).stream()
                .map(AvailableStaffResponse::from)
                .toList());
    }

    @GetMapping("/vehicles")
    public ResponseEntity<List<AvailableVehicleResponse>> listAvailableVehicles(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime end
    ) {
        return ResponseEntity.ok(availabilityService.getAvailableVehicles(date, start, end).stream()
                .map(AvailableVehicleResponse::from)
                .toList());
    }

    @PostMapping("/staff/{staffId}/unavailabilities")
    @Operation(summary = "Record staff unavailability and flag affected instances")
    public ResponseEntity<AvailabilityConflictResponse> createStaffUnavailability(
            @PathVariable("staffId") UUID staffId,
            @Valid @RequestBody CreateUnavailabilityRequest request
    ) {
        AvailabilityConflictResponse response = availabilityService.createStaffUnavailability(
                staffId, request.startAt(), request.endAt(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/vehicles/{vehicleId}/blackouts")
    @Operation(summary = "Record a vehicle blackout and flag affected instances")
    public ResponseEntity<AvailabilityConflictResponse> createVehicleBlackout(
            @PathVariable("vehicleId") UUID vehicleId,
            @Valid @RequestBody CreateUnavailabilityRequest request
    ) {
        AvailabilityConflictResponse response = availabilityService.createVehicleBlackout(
                vehicleId, request.startAt(), request.endAt(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
