package com.rabs.backend.modules.loom.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.availability.application.AvailabilityService;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.domain.RouteEstimate;
import com.rabs.backend.modules.loom.domain.SeatPlan;
import com.rabs.backend.modules.loom.domain.SeatPlanner;
import com.rabs.backend.modules.loom.domain.StepStatus;
import com.rabs.backend.modules.loom.domain.VehicleRun;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.infrastructure.VehicleRunRepository;
import com.rabs.backend.modules.loom.presentation.dto.VehicleAssignmentResponse;
import com.rabs.backend.modules.loom.presentation.dto.VehicleRunResponse;
import com.rabs.backend.modules.participant.domain.Participant;
import com.rabs.backend.modules.vehicle.domain.Vehicle;
import com.rabs.backend.modules.vehicle.infrastructure.VehicleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class VehicleAssignmentService {

    private final LoomInstanceRepository loomInstanceRepository;
    private final ParticipantAllocationRepository participantAllocationRepository;
    private final VehicleRunRepository vehicleRunRepository;
    private final VehicleRepository vehicleRepository;
    private final AvailabilityService availabilityService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public VehicleAssignmentService(
            LoomInstanceRepository loomInstanceRepository,
            ParticipantAllocationRepository participantAllocationRepository,
            VehicleRunRepository vehicleRunRepository,
            VehicleRepository vehicleRepository,
            AvailabilityService availabilityService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.loomInstanceRepository = loomInstanceRepository;
        this.participantAllocationRepository = participantAllocationRepository;
        this.vehicleRunRepository = vehicleRunRepository;
        this.vehicleRepository = vehicleRepository;
        this.availabilityService = availabilityService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Replaces the instance's runs with a fresh seat plan over planned participants.
     * Vehicles already running elsewhere that day or blacked out during the
     * instance are never offered.
     */
    public LoomResult<VehicleAssignmentResponse> assignVehicles(UUID instanceId) {
        LoomInstance instance = loomInstanceRepository.findWithProgramById(instanceId)
                .orElseThrow(() -> ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "Instance " + instanceId + " does not exist"));

        if (instance.getProgram().isCentreBased()) {
            return LoomResult.ok("Centre-based program; no transport required",
                    new VehicleAssignmentResponse(instanceId, false, 0, 0, List.of()));
        }

        vehicleRunRepository.deleteByInstance(instanceId);
        List<Participant> passengers = participantAllocationRepository
                .findByInstanceAndStatusForRouting(instanceId, AllocationStatus.PLANNED)
                .stream()
                .map(ParticipantAllocation::getParticipant)
                .toList();

        if (passengers.isEmpty()) {
            instance.recordTransport(StepStatus.COMPLETE);
            return LoomResult.ok("No planned participants to transport",
                    new VehicleAssignmentResponse(instanceId, true, 0, 0, List.of()));
        }

        Set<UUID> usedOnDate = vehicleRunRepository.findVehicleIdsUsedOn(instance.getInstanceDate(), instanceId);
        Set<UUID> blackedOut = availabilityService.blackedOutVehicleIds(instance.interval(clock.getZone()));
        List<Vehicle> candidates = vehicleRepository.findByActiveTrueOrderByRegistrationAsc().stream()
                .filter(vehicle -> !usedOnDate.contains(vehicle.getId()))
                .filter(vehicle -> !blackedOut.contains(vehicle.getId()))
                .toList();

        SeatPlan<Vehicle, Participant> plan = SeatPlanner.plan(candidates, Vehicle::getPassengerSeats, passengers);
        if (!plan.sufficient()) {
            Map<String, Object> before = instance.toAuditState();
            instance.recordTransport(StepStatus.INSUFFICIENT);
            Map<String, Object> after = new LinkedHashMap<>(instance.toAuditState());
            after.put("passengerCount", plan.passengerCount());
            after.put("seatBudget", plan.seatBudget());
            after.put("candidateVehicles", candidates.size());
            auditLogService.record(new AuditLogCommand(instanceId, AuditAction.VEHICLES_INSUFFICIENT, before, after));
            return LoomResult.insufficient(
                    "INSUFFICIENT_VEHICLES",
                    "Need %d seats but only %d available".formatted(plan.passengerCount(), plan.seatBudget()),
                    new VehicleAssignmentResponse(instanceId, true, plan.passengerCount(), plan.seatBudget(), List.of())
            );
        }

        List<VehicleRunResponse> runs = new ArrayList<>();
        List<Object> runSummaries = new ArrayList<>();
        for (SeatPlan.Load<Vehicle, Participant> load : plan.loads()) {
            VehicleRun run = new VehicleRun(instance, load.vehicle());
            run.setRouteData(routeData(load.passengers()));
            RouteEstimate estimate = RouteEstimate.forStops(load.passengers().size());
            run.setSeatsUsed(load.passengers().size());
            run.setEstimatedDurationMinutes(estimate.durationMinutes());
            run.setEstimatedDistanceKm(estimate.distanceKm());
            VehicleRun saved = vehicleRunRepository.save(run);
            runs.add(VehicleRunResponse.from(saved));

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("vehicleId", load.vehicle().getId().toString());
            summary.put("registration", load.vehicle().getRegistration());
            summary.put("seatsUsed", saved.getSeatsUsed());
            runSummaries.add(summary);
        }
        instance.recordTransport(StepStatus.COMPLETE);

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("passengerCount", plan.passengerCount());
        after.put("runs", runSummaries);
        auditLogService.record(AuditLogCommand.of(instanceId, AuditAction.VEHICLES_ASSIGNED, after));

        return LoomResult.ok(
                "Assigned %d vehicle(s) for %d passengers".formatted(runs.size(), plan.passengerCount()),
                new VehicleAssignmentResponse(instanceId, true, plan.passengerCount(), plan.seatBudget(), runs)
        );
    }

    private static Map<String, Object> routeData(List<Participant> passengers) {
        List<Object> stops = new ArrayList<>();
        int sequence = 1;
        for (Participant participant : passengers) {
            Map<String, Object> stop = new LinkedHashMap<>();
            stop.put("sequence", sequence++);
            stop.put("participantId", participant.getId().toString());
            stop.put("name", participant.getFullName());
            stop.put("address", participant.getAddress());
            stop.put("suburb", participant.getSuburb());
            stops.add(stop);
        }
        Map<String, Object> routeData = new LinkedHashMap<>();
        routeData.put("stops", stops);
        return routeData;
    }
}
