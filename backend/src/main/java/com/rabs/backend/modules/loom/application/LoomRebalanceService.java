package com.rabs.backend.modules.loom.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.loom.application.StaffCandidateFinder.StaffCandidate;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.CancellationType;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.domain.StaffRole;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.StaffShiftStatus;
import com.rabs.backend.modules.loom.domain.StaffingRequirement;
import com.rabs.backend.modules.loom.domain.StepStatus;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.loom.presentation.dto.CancellationResponse;
import com.rabs.backend.modules.loom.presentation.dto.SicknessResponse;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.staff.domain.Staff;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reacts to changes on an already planned instance: participant cancellations
 * shed surplus support workers, staff sickness triggers a replacement search.
 */
@Service
@Transactional
public class LoomRebalanceService {

    private static final Set<StaffRole> NON_DRIVER_ROLES = EnumSet.of(StaffRole.LEAD, StaffRole.SUPPORT);

    private final ParticipantAllocationRepository participantAllocationRepository;
    private final StaffShiftRepository staffShiftRepository;
    private final StaffCandidateFinder staffCandidateFinder;
    private final LoomSettingsService loomSettingsService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public LoomRebalanceService(
            ParticipantAllocationRepository participantAllocationRepository,
            StaffShiftRepository staffShiftRepository,
            StaffCandidateFinder staffCandidateFinder,
            LoomSettingsService loomSettingsService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.participantAllocationRepository = participantAllocationRepository;
        this.staffShiftRepository = staffShiftRepository;
        this.staffCandidateFinder = staffCandidateFinder;
        this.loomSettingsService = loomSettingsService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public LoomResult<CancellationResponse> cancelParticipant(UUID allocationId, CancellationType type) {
        ParticipantAllocation allocation = participantAllocationRepository.findWithInstanceById(allocationId)
                .orElseThrow(() -> ProblemException.notFound("ALLOCATION_NOT_FOUND", "Allocation " + allocationId + " does not exist"));
        if (!allocation.isPlanned()) {
            throw ProblemException.conflict("ALLOCATION_ALREADY_CANCELLED",
                    "Allocation " + allocationId + " is already " + allocation.getStatus());
        }

        LoomInstance instance = allocation.getLoomInstance();
        UUID instanceId = instance.getId();
        allocation.cancel(type, OffsetDateTime.now(clock));

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("status", AllocationStatus.PLANNED.name());
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("allocationId", allocationId.toString());
        after.put("participantId", allocation.getParticipant().getId().toString());
        after.put("status", allocation.getStatus().name());
        after.put("cancellationType", type.name());
        auditLogService.record(new AuditLogCommand(instanceId, AuditAction.PARTICIPANT_CANCELLED, before, after));

        participantAllocationRepository.flush();
        long planned = participantAllocationRepository.countByLoomInstance_IdAndStatus(instanceId, AllocationStatus.PLANNED);
        Program program = instance.getProgram();
        int required = StaffingRequirement.of(
                (int) planned,
                loomSettingsService.participantsPerSupportWorker(),
                program.getAdditionalStaffCount(),
                false
        ).nonDriverCount();
        long assigned = staffShiftRepository.countByInstanceAndStatusAndRoles(instanceId, StaffShiftStatus.PLANNED, NON_DRIVER_ROLES);

        List<UUID> released = new ArrayList<>();
        if (assigned > required) {
            long surplus = assigned - required;
            List<StaffShift> newestSupport = staffShiftRepository
                    .findByInstanceAndStatusAndRoleNewestFirst(instanceId, StaffShiftStatus.PLANNED, StaffRole.SUPPORT);
            String note = "Released after cancellation: %d participants planned".formatted(planned);
            for (StaffShift shift : newestSupport.subList(0, (int) Math.min(surplus, newestSupport.size()))) {
                Map<String, Object> shiftBefore = shift.toAuditState();
                shift.release(note);
                auditLogService.record(new AuditLogCommand(instanceId, AuditAction.STAFF_RELEASED, shiftBefore, shift.toAuditState()));
                released.add(shift.getId());
            }
        }

        String message = released.isEmpty()
                ? "Participant cancelled; staffing unchanged"
                : "Participant cancelled; released %d support worker(s)".formatted(released.size());
        return LoomResult.ok(message,
                new CancellationResponse(allocationId, instanceId, type.name(), planned, required, released));
    }

    public LoomResult<SicknessResponse> handleStaffSickness(UUID shiftId) {
        StaffShift shift = staffShiftRepository.findWithInstanceById(shiftId)
                .orElseThrow(() -> ProblemException.notFound("SHIFT_NOT_FOUND", "Shift " + shiftId + " does not exist"));
        if (!shift.isPlanned() || shift.getStaff() == null) {
            throw ProblemException.conflict("SHIFT_NOT_ELIGIBLE_FOR_SICKNESS",
                    "Shift " + shiftId + " is " + shift.getStatus() + " and has no planned staff member");
        }

        LoomInstance instance = shift.getLoomInstance();
        UUID instanceId = instance.getId();
        Staff sick = shift.getStaff();
        Map<String, Object> before = shift.toAuditState();

        Set<UUID> excluded = new HashSet<>(staffShiftRepository.findStaffIdsOnInstance(instanceId));
        excluded.add(sick.getId());
        Optional<StaffCandidate> replacement = staffCandidateFinder.findCandidates(instance, excluded).stream().findFirst();

        if (replacement.isPresent()) {
            Staff substitute = replacement.get().staff();
            shift.markReplaced("Sick, replaced by " + substitute.getFullName());
            StaffShift cover = new StaffShift(instance, substitute, shift.getRole(),
                    shift.getStartAt(), shift.getEndAt(), staffShiftRepository.findMaxAssignmentOrder(instanceId) + 1);
            cover.annotate("Replacement for " + sick.getFullName() + " (sick)");
            StaffShift saved = staffShiftRepository.save(cover);

            Map<String, Object> after = new LinkedHashMap<>();
            after.put("replacedShift", shift.toAuditState());
            after.put("replacementShift", saved.toAuditState());
            auditLogService.record(new AuditLogCommand(instanceId, AuditAction.STAFF_REPLACED, before, after));
            return LoomResult.ok("Replaced " + sick.getFullName() + " with " + substitute.getFullName(),
                    new SicknessResponse(shiftId, instanceId, SicknessResponse.REPLACED,
                            saved.getId(), substitute.getId(), substitute.getFullName()));
        }

        shift.flag("Sick, no replacement available");
        instance.recordStaffing(StepStatus.NEEDS_ATTENTION);
        Map<String, Object> after = new LinkedHashMap<>(shift.toAuditState());
        after.put("instance", instance.toAuditState());
        auditLogService.record(new AuditLogCommand(instanceId, AuditAction.STAFF_FLAGGED, before, after));
        return LoomResult.insufficient("NO_REPLACEMENT_STAFF",
                "No replacement available for " + sick.getFullName(),
                new SicknessResponse(shiftId, instanceId, SicknessResponse.FLAGGED, null, null, null));
    }
}
