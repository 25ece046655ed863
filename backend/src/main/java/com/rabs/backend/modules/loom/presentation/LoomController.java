package com.rabs.backend.modules.loom.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.rabs.backend.modules.loom.application.LoomEngine;
import com.rabs.backend.modules.loom.application.LoomResult;
import com.rabs.backend.modules.loom.presentation.dto.CancellationRequest;
import com.rabs.backend.modules.loom.presentation.dto.CancellationResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomInstanceDetailResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomInstanceSummaryResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomWindowRequest;
import com.rabs.backend.modules.loom.presentation.dto.LoomWindowResponse;
import com.rabs.backend.modules.loom.presentation.dto.ParticipantAllocationResponse;
import com.rabs.backend.modules.loom.presentation.dto.ReoptimizationResponse;
import com.rabs.backend.modules.loom.presentation.dto.SicknessResponse;
import com.rabs.backend.modules.loom.presentation.dto.StaffAssignmentResponse;
import com.rabs.backend.modules.loom.presentation.dto.UpdateLoomSettingsRequest;
import com.rabs.backend.modules.loom.presentation.dto.VehicleAssignmentResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/loom")
public class LoomController {

    private final LoomEngine loomEngine;

    public LoomController(LoomEngine loomEngine) {
        this.loomEngine = loomEngine;
    }

    @GetMapping("/window")
    public ResponseEntity<LoomResult<LoomWindowResponse>> getWindow() {
        return respond(loomEngine.getLoomSettings());
    }

    @PostMapping("/window")
    @Operation(summary = "Generate instances for every active program inside the window")
    public ResponseEntity<LoomResult<LoomWindowResponse>> generateWindow(@Valid @RequestBody LoomWindowRequest request) {
        return respond(loomEngine.generateLoomWindow(request.weeks()));
    }

    @PutMapping("/window")
    @Operation(summary = "Grow or shrink the window without touching instances inside both")
    public ResponseEntity<LoomResult<LoomWindowResponse>> resizeWindow(@Valid @RequestBody LoomWindowRequest request) {
        return respond(loomEngine.resizeLoomWindow(request.weeks()));
    }

    @PatchMapping("/settings")
    public ResponseEntity<LoomResult<LoomWindowResponse>> updateSettings(@Valid @RequestBody UpdateLoomSettingsRequest request) {
        return respond(loomEngine.updateParticipantsPerSupportWorker(request.participantsPerSupportWorker()));
    }

    @GetMapping("/instances")
    public ResponseEntity<LoomResult<List<LoomInstanceSummaryResponse>>> listInstances(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return respond(loomEngine.getLoomInstances(start, end));
    }

    @GetMapping("/instances/{instanceId}")
    public ResponseEntity<LoomResult<LoomInstanceDetailResponse>> getInstance(@PathVariable("instanceId") UUID instanceId) {
        return respond(loomEngine.getLoomInstanceDetails(instanceId));
    }

    @PostMapping("/instances/{instanceId}/participants")
    public ResponseEntity<LoomResult<ParticipantAllocationResponse>> allocateParticipants(
            @PathVariable("instanceId") UUID instanceId
    ) {
        return respond(loomEngine.allocateParticipants(instanceId));
    }

    @PostMapping("/instances/{instanceId}/staff")
    public ResponseEntity<LoomResult<StaffAssignmentResponse>> assignStaff(@PathVariable("instanceId") UUID instanceId) {
        return respond(loomEngine.assignStaff(instanceId));
    }

    @PostMapping("/instances/{instanceId}/vehicles")
    public ResponseEntity<LoomResult<VehicleAssignmentResponse>> assignVehicles(@PathVariable("instanceId") UUID instanceId) {
        return respond(loomEngine.assignVehicles(instanceId));
    }

    @PostMapping("/instances/{instanceId}/reoptimize")
    @Operation(summary = "Clear staff and transport, then rerun allocation, staffing and transport")
    public ResponseEntity<LoomResult<ReoptimizationResponse>> reoptimize(@PathVariable("instanceId") UUID instanceId) {
        return respond(loomEngine.reoptimizeInstance(instanceId));
    }

    @PostMapping("/allocations/{allocationId}/cancellation")
    public ResponseEntity<LoomResult<CancellationResponse>> cancelParticipant(
            @PathVariable("allocationId") UUID allocationId,
            @RequestBody CancellationRequest request
    ) {
        return respond(loomEngine.handleParticipantCancellation(allocationId, request.type()));
    }

    @PostMapping("/shifts/{shiftId}/sickness")
    public ResponseEntity<LoomResult<SicknessResponse>> reportSickness(@PathVariable("shiftId") UUID shiftId) {
        return respond(loomEngine.handleStaffSickness(shiftId));
    }

    static <T> ResponseEntity<LoomResult<T>> respond(LoomResult<T> result) {
        if (result.success() || result.error() == null) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = switch (result.error().kind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INSUFFICIENT_RESOURCES -> HttpStatus.OK;
            case STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(result);
    }
}
