package com.rabs.backend.modules.loom.application;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.loom.domain.CancellationType;
import com.rabs.backend.modules.loom.presentation.dto.CancellationResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomInstanceDetailResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomInstanceSummaryResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomWindowResponse;
import com.rabs.backend.modules.loom.presentation.dto.ParticipantAllocationResponse;
import com.rabs.backend.modules.loom.presentation.dto.ReoptimizationResponse;
import com.rabs.backend.modules.loom.presentation.dto.SicknessResponse;
import com.rabs.backend.modules.loom.presentation.dto.StaffAssignmentResponse;
import com.rabs.backend.modules.loom.presentation.dto.VehicleAssignmentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every loom operation. Each call delegates to a transactional
 * service and folds its outcome, including raised problems, into a
 * {@link LoomResult}; nothing escapes as an exception.
 *
 * <p>Not transactional; the steps of a reoptimisation commit independently.</p>
 */
@Service
public class LoomEngine {

    private static final Logger log = LoggerFactory.getLogger(LoomEngine.class);

    private final LoomWindowService loomWindowService;
    private final LoomSettingsService loomSettingsService;
    private final ParticipantAllocationService participantAllocationService;
    private final StaffAssignmentService staffAssignmentService;
    private final VehicleAssignmentService vehicleAssignmentService;
    private final LoomReoptimizationService loomReoptimizationService;
    private final LoomRebalanceService loomRebalanceService;
    private final LoomQueryService loomQueryService;

    public LoomEngine(
            LoomWindowService loomWindowService,
            LoomSettingsService loomSettingsService,
            ParticipantAllocationService participantAllocationService,
            StaffAssignmentService staffAssignmentService,
            VehicleAssignmentService vehicleAssignmentService,
            LoomReoptimizationService loomReoptimizationService,
            LoomRebalanceService loomRebalanceService,
            LoomQueryService loomQueryService
    ) {
        this.loomWindowService = loomWindowService;
        this.loomSettingsService = loomSettingsService;
        this.participantAllocationService = participantAllocationService;
        this.staffAssignmentService = staffAssignmentService;
        this.vehicleAssignmentService = vehicleAssignmentService;
        this.loomReoptimizationService = loomReoptimizationService;
        this.loomRebalanceService = loomRebalanceService;
        this.loomQueryService = loomQueryService;
    }

    public LoomResult<LoomWindowResponse> generateLoomWindow(int weeks) {
        return execute("generateLoomWindow", () -> {
            loomSettingsService.validateWindowWeeks(weeks);
            LoomWindowResponse window = loomWindowService.generateWindow(weeks);
            return LoomResult.ok("Generated %d instance(s) for %d weeks".formatted(window.instancesCreated(), weeks), window);
        });
    }

    public LoomResult<LoomWindowResponse> resizeLoomWindow(int weeks) {
        return execute("resizeLoomWindow", () -> {
            loomSettingsService.validateWindowWeeks(weeks);
            LoomWindowResponse window = loomWindowService.resizeWindow(weeks);
            return LoomResult.ok("Window resized to %d weeks".formatted(weeks), window);
        });
    }

    public LoomResult<LoomWindowResponse> getLoomSettings() {
        return execute("getLoomSettings", () -> LoomResult.ok("Current loom window", loomWindowService.describeWindow()));
    }

    public LoomResult<LoomWindowResponse> updateParticipantsPerSupportWorker(int participantsPerSupportWorker) {
        return execute("updateLoomSettings", () -> {
            loomSettingsService.updateParticipantsPerSupportWorker(participantsPerSupportWorker);
            return LoomResult.ok("Loom settings updated", loomWindowService.describeWindow());
        });
    }

    public LoomResult<ParticipantAllocationResponse> allocateParticipants(UUID instanceId) {
        return execute("allocateParticipants", () -> participantAllocationService.allocateParticipants(instanceId));
    }

    public LoomResult<StaffAssignmentResponse> assignStaff(UUID instanceId) {
        return execute("assignStaff", () -> staffAssignmentService.assignStaff(instanceId));
    }

    public LoomResult<VehicleAssignmentResponse> assignVehicles(UUID instanceId) {
        return execute("assignVehicles", () -> vehicleAssignmentService.assignVehicles(instanceId));
    }

    /**
     * Clears planning in one transaction, then reruns allocation, staffing and
     * transport as separate steps. A failed allocation stops the chain.
     */
    public LoomResult<ReoptimizationResponse> reoptimizeInstance(UUID instanceId) {
        return execute("reoptimizeInstance", () -> {
            loomReoptimizationService.prepare(instanceId);
            LoomResult<ParticipantAllocationResponse> participants = allocateParticipants(instanceId);
            if (!participants.success()) {
                LoomResult.Error error = participants.error();
                return new LoomResult<>(false, "Reoptimisation stopped: " + participants.message(),
                        new ReoptimizationResponse(instanceId, participants, null, null), error);
            }
            LoomResult<StaffAssignmentResponse> staff = assignStaff(instanceId);
            LoomResult<VehicleAssignmentResponse> vehicles = assignVehicles(instanceId);
            ReoptimizationResponse response = new ReoptimizationResponse(instanceId, participants, staff, vehicles);
            if (!staff.success()) {
                return new LoomResult<>(false, "Reoptimised with staffing issues: " + staff.message(), response, staff.error());
            }
            if (!vehicles.success()) {
                return new LoomResult<>(false, "Reoptimised with transport issues: " + vehicles.message(), response, vehicles.error());
            }
            return LoomResult.ok("Instance reoptimised", response);
        });
    }

    public LoomResult<CancellationResponse> handleParticipantCancellation(UUID allocationId, String type) {
        return execute("handleParticipantCancellation", () -> {
            Optional<CancellationType> parsed = CancellationType.parse(type);
            if (parsed.isEmpty()) {
                throw ProblemException.badRequest("INVALID_CANCELLATION_TYPE",
                        "Cancellation type must be normal or short_notice, got " + type);
            }
            return loomRebalanceService.cancelParticipant(allocationId, parsed.get());
        });
    }

    public LoomResult<SicknessResponse> handleStaffSickness(UUID shiftId) {
        return execute("handleStaffSickness", () -> loomRebalanceService.handleStaffSickness(shiftId));
    }

    public LoomResult<List<LoomInstanceSummaryResponse>> getLoomInstances(LocalDate startDate, LocalDate endDate) {
        return execute("getLoomInstances", () -> {
            List<LoomInstanceSummaryResponse> instances = loomQueryService.listInstances(startDate, endDate);
            return LoomResult.ok("Found %d instance(s)".formatted(instances.size()), instances);
        });
    }

    public LoomResult<LoomInstanceDetailResponse> getLoomInstanceDetails(UUID instanceId) {
        return execute("getLoomInstanceDetails", () -> LoomResult.ok("Instance details", loomQueryService.getInstanceDetails(instanceId)));
    }

    private <T> LoomResult<T> execute(String operation, Supplier<LoomResult<T>> action) {
        LoomResult<T> result;
        try {
            result = action.get();
        } catch (ProblemException problem) {
            LoomFailureKind kind = kindOf(problem);
            log.info("{} rejected: {} ({})", operation, problem.getCode(), problem.getDetailMessage());
            return LoomResult.failure(kind, problem.getCode(), problem.getDetailMessage());
        } catch (RuntimeException ex) {
            log.error("{} failed", operation, ex);
            return LoomResult.failure(LoomFailureKind.STORAGE, "STORAGE_ERROR", operation + " could not be completed");
        }
        if (result.success()) {
            log.info("{} completed: {}", operation, result.message());
        } else {
            log.warn("{} finished without success: {}", operation, result.message());
        }
        return result;
    }

    static LoomFailureKind kindOf(ProblemException problem) {
        int status = problem.getStatusCode().value();
        if (status == 404) {
            return LoomFailureKind.NOT_FOUND;
        }
        if (status == 409) {
            return LoomFailureKind.CONFLICT;
        }
        if (status >= 500) {
            return LoomFailureKind.STORAGE;
        }
        return LoomFailureKind.VALIDATION;
    }
}
