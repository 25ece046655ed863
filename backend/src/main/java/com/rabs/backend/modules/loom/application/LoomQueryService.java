package com.rabs.backend.modules.loom.application;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.domain.AuditLog;
import com.rabs.backend.modules.audit.infrastructure.AuditLogRepository;
import com.rabs.backend.modules.loom.domain.InstanceTimeSlot;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.OptimisationState;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.VehicleRun;
import com.rabs.backend.modules.loom.infrastructure.InstanceTimeSlotRepository;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.loom.infrastructure.VehicleRunRepository;
import com.rabs.backend.modules.loom.presentation.dto.LoomInstanceDetailResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomInstanceSummaryResponse;
import com.rabs.backend.modules.loom.presentation.dto.StaffShiftResponse;
import com.rabs.backend.modules.loom.presentation.dto.VehicleRunResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class LoomQueryService {

    private final LoomInstanceRepository loomInstanceRepository;
    private final InstanceTimeSlotRepository instanceTimeSlotRepository;
    private final ParticipantAllocationRepository participantAllocationRepository;
    private final StaffShiftRepository staffShiftRepository;
    private final VehicleRunRepository vehicleRunRepository;
    private final AuditLogRepository auditLogRepository;

    public LoomQueryService(
            LoomInstanceRepository loomInstanceRepository,
            InstanceTimeSlotRepository instanceTimeSlotRepository,
            ParticipantAllocationRepository participantAllocationRepository,
            StaffShiftRepository staffShiftRepository,
            VehicleRunRepository vehicleRunRepository,
            AuditLogRepository auditLogRepository
    ) {
        this.loomInstanceRepository = loomInstanceRepository;
        this.instanceTimeSlotRepository = instanceTimeSlotRepository;
        this.participantAllocationRepository = participantAllocationRepository;
        this.staffShiftRepository = staffShiftRepository;
        this.vehicleRunRepository = vehicleRunRepository;
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * Instances dated within {@code [startDate, endDate]}, both ends inclusive.
     */
    public List<LoomInstanceSummaryResponse> listInstances(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw ProblemException.badRequest("DATE_RANGE_REQUIRED", "Both start and end dates are required");
        }
        if (endDate.isBefore(startDate)) {
            throw ProblemException.badRequest("INVALID_DATE_RANGE", "End date must not precede start date");
        }
        List<LoomInstance> instances = loomInstanceRepository.findBetween(startDate, endDate);
        if (instances.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = instances.stream().map(LoomInstance::getId).toList();
        Map<UUID, Long> participants = toCountMap(participantAllocationRepository.countPlannedByInstances(ids));
        Map<UUID, Long> staff = toCountMap(staffShiftRepository.countPlannedByInstances(ids));
        Map<UUID, Long> vehicles = toCountMap(vehicleRunRepository.countAssignedByInstances(ids));

        return instances.stream()
                .map(instance -> toSummary(
                        instance,
                        participants.getOrDefault(instance.getId(), 0L),
                        staff.getOrDefault(instance.getId(), 0L),
                        vehicles.getOrDefault(instance.getId(), 0L)))
                .toList();
    }

    public LoomInstanceDetailResponse getInstanceDetails(UUID instanceId) {
        LoomInstance instance = loomInstanceRepository.findWithProgramById(instanceId)
                .orElseThrow(() -> ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "Instance " + instanceId + " does not exist"));

        List<LoomInstanceDetailResponse.TimeSlotItem> timeSlots = instanceTimeSlotRepository
                .findByLoomInstance_IdOrderBySeqAsc(instanceId).stream()
                .map(LoomQueryService::toTimeSlotItem)
                .toList();
        List<ParticipantAllocation> allocations = participantAllocationRepository.findByInstanceWithParticipant(instanceId);
        List<LoomInstanceDetailResponse.ParticipantItem> participants = allocations.stream()
                .map(LoomQueryService::toParticipantItem)
                .toList();
        List<StaffShift> shifts = staffShiftRepository.findByInstance(instanceId);
        List<VehicleRun> runs = vehicleRunRepository.findByInstance(instanceId);
        List<LoomInstanceDetailResponse.AuditItem> audit = auditLogRepository
                .findByLoomInstanceIdOrderByEntrySeqDesc(instanceId).stream()
                .map(LoomQueryService::toAuditItem)
                .toList();

        long plannedParticipants = allocations.stream().filter(ParticipantAllocation::isPlanned).count();
        long plannedStaff = shifts.stream().filter(StaffShift::isPlanned).count();
        long assignedVehicles = runs.stream().filter(run -> !run.isPlaceholder()).count();

        return new LoomInstanceDetailResponse(
                toSummary(instance, plannedParticipants, plannedStaff, assignedVehicles),
                timeSlots,
                participants,
                shifts.stream().map(StaffShiftResponse::from).toList(),
                runs.stream().map(VehicleRunResponse::from).toList(),
                audit
        );
    }

    private static Map<UUID, Long> toCountMap(List<Object[]> rows) {
        Map<UUID, Long> counts = new HashMap<>();
        for (Object[] row : rows) {
            counts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static LoomInstanceSummaryResponse toSummary(LoomInstance instance, long participants, long staff, long vehicles) {
        OptimisationState state = instance.getOptimisationState();
        return new LoomInstanceSummaryResponse(
                instance.getId(),
                instance.getProgram().getId(),
                instance.getProgram().getName(),
                instance.getInstanceDate(),
                instance.getStartTime(),
                instance.getEndTime(),
                instance.getVenue() != null ? instance.getVenue().getName() : null,
                instance.getStatus().name(),
                state.getStaffingStatus() != null ? state.getStaffingStatus().name() : null,
                state.getVehicleStatus() != null ? state.getVehicleStatus().name() : null,
                state.isReoptimized(),
                instance.getCapacity(),
                participants,
                staff,
                vehicles
        );
    }

    private static LoomInstanceDetailResponse.TimeSlotItem toTimeSlotItem(InstanceTimeSlot slot) {
        return new LoomInstanceDetailResponse.TimeSlotItem(
                slot.getSeq(),
                slot.getLabel(),
                slot.getSlotType().name(),
                slot.getStartTime(),
                slot.getEndTime()
        );
    }

    private static LoomInstanceDetailResponse.ParticipantItem toParticipantItem(ParticipantAllocation allocation) {
        return new LoomInstanceDetailResponse.ParticipantItem(
                allocation.getId(),
                allocation.getParticipant().getId(),
                allocation.getParticipant().getFullName(),
                allocation.getBillingCode(),
                allocation.getPlannedRate(),
                allocation.getStatus().name(),
                allocation.getCancellationType() != null ? allocation.getCancellationType().name() : null,
                allocation.getCancelledAt()
        );
    }

    private static LoomInstanceDetailResponse.AuditItem toAuditItem(AuditLog entry) {
        return new LoomInstanceDetailResponse.AuditItem(
                entry.getId(),
                entry.getAction().name(),
                entry.getBeforeState(),
                entry.getAfterState(),
                entry.getActor(),
                entry.getCreatedAt()
        );
    }
}
