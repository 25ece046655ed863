package com.rabs.backend.modules.loom.application;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.availability.domain.TimeInterval;
import com.rabs.backend.modules.loom.application.StaffCandidateFinder.StaffCandidate;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.StaffRole;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.StaffingRequirement;
import com.rabs.backend.modules.loom.domain.StepStatus;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.loom.presentation.dto.StaffAssignmentResponse;
import com.rabs.backend.modules.loom.presentation.dto.StaffShiftResponse;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.staff.domain.Staff;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Fills the staffing requirement of an instance from ranked candidates. Either
 * every missing position is filled or none is, and the shortfall is recorded on
 * the instance. Open placeholders left from manual staffing are filled first.
 */
@Service
@Transactional
public class StaffAssignmentService {

    private final LoomInstanceRepository loomInstanceRepository;
    private final ParticipantAllocationRepository participantAllocationRepository;
    private final StaffShiftRepository staffShiftRepository;
    private final StaffCandidateFinder staffCandidateFinder;
    private final LoomSettingsService loomSettingsService;
    private final PlaceholderShiftService placeholderShiftService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public StaffAssignmentService(
            LoomInstanceRepository loomInstanceRepository,
            ParticipantAllocationRepository participantAllocationRepository,
            StaffShiftRepository staffShiftRepository,
            StaffCandidateFinder staffCandidateFinder,
            LoomSettingsService loomSettingsService,
            PlaceholderShiftService placeholderShiftService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.loomInstanceRepository = loomInstanceRepository;
        this.participantAllocationRepository = participantAllocationRepository;
        this.staffShiftRepository = staffShiftRepository;
        this.staffCandidateFinder = staffCandidateFinder;
        this.loomSettingsService = loomSettingsService;
        this.placeholderShiftService = placeholderShiftService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public LoomResult<StaffAssignmentResponse> assignStaff(UUID instanceId) {
        LoomInstance instance = loomInstanceRepository.findWithProgramById(instanceId)
                .orElseThrow(() -> ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "Instance " + instanceId + " does not exist"));
        Program program = instance.getProgram();
        long participantCount = participantAllocationRepository.countByLoomInstance_IdAndStatus(instanceId, AllocationStatus.PLANNED);
        List<StaffShift> existing = staffShiftRepository.findByInstance(instanceId);

        if (program.isManualStaffing()) {
            return ensureManualPlaceholders(instance, participantCount, existing);
        }

        StaffingRequirement requirement = StaffingRequirement.of(
                (int) participantCount,
                loomSettingsService.participantsPerSupportWorker(),
                program.getAdditionalStaffCount(),
                !program.isCentreBased()
        );
        Map<StaffRole, Integer> missing = missingPositions(requirement, existing);
        int needed = missing.values().stream().mapToInt(Integer::intValue).sum();

        List<StaffCandidate> candidates = staffCandidateFinder.findCandidates(
                instance, staffShiftRepository.findStaffIdsOnInstance(instanceId));

        if (candidates.size() < needed) {
            Map<String, Object> before = instance.toAuditState();
            instance.recordStaffing(StepStatus.INSUFFICIENT);
            Map<String, Object> after = new LinkedHashMap<>(instance.toAuditState());
            after.put("participantCount", participantCount);
            after.put("requiredStaff", needed);
            after.put("availableStaff", candidates.size());
            auditLogService.record(new AuditLogCommand(instanceId, AuditAction.STAFF_INSUFFICIENT, before, after));
            return LoomResult.insufficient(
                    "INSUFFICIENT_STAFF",
                    "Need %d staff but only %d available".formatted(needed, candidates.size()),
                    new StaffAssignmentResponse(instanceId, false, participantCount, needed, candidates.size(), List.of())
            );
        }

        TimeInterval interval = instance.interval(clock.getZone());
        int order = staffShiftRepository.findMaxAssignmentOrder(instanceId);
        Map<StaffRole, Deque<StaffShift>> open = openPlaceholders(existing);
        Iterator<StaffCandidate> ranked = candidates.iterator();
        List<StaffShiftResponse> assigned = new ArrayList<>();
        for (StaffRole role : StaffRole.values()) {
            for (int i = 0; i < missing.get(role); i++) {
                Staff staff = ranked.next().staff();
                StaffShift placeholder = open.get(role).poll();
                StaffShift saved;
                if (placeholder != null) {
                    Map<String, Object> before = placeholder.toAuditState();
                    placeholder.fill(staff, ++order);
                    saved = placeholder;
                    auditLogService.record(new AuditLogCommand(instanceId, AuditAction.STAFF_ASSIGNED, before, saved.toAuditState()));
                } else {
                    saved = staffShiftRepository.save(new StaffShift(instance, staff, role,
                            interval.start(), interval.end(), ++order));
                    auditLogService.record(AuditLogCommand.of(instanceId, AuditAction.STAFF_ASSIGNED, saved.toAuditState()));
                }
                assigned.add(StaffShiftResponse.from(saved));
            }
        }
        int released = releaseUnusedPlaceholders(instanceId, open);
        instance.recordStaffing(StepStatus.COMPLETE);

        String message = assigned.isEmpty()
                ? "Staffing already complete"
                : "Assigned %d staff".formatted(assigned.size());
        if (released > 0) {
            message += "; released %d unused placeholder(s)".formatted(released);
        }
        return LoomResult.ok(message,
                new StaffAssignmentResponse(instanceId, false, participantCount, needed, candidates.size(), assigned));
    }

    /**
     * Manual programs are staffed by a coordinator. When nothing is planned on
     * the instance, e.g. after a reoptimisation, the open positions are laid
     * out again as placeholders.
     */
    private LoomResult<StaffAssignmentResponse> ensureManualPlaceholders(
            LoomInstance instance, long participantCount, List<StaffShift> existing) {
        UUID instanceId = instance.getId();
        if (existing.stream().anyMatch(StaffShift::isPlanned)) {
            return LoomResult.ok("Program uses manual staffing; automatic assignment skipped",
                    new StaffAssignmentResponse(instanceId, true, participantCount, 0, 0, List.of()));
        }
        List<StaffShift> placeholders = placeholderShiftService.createPlaceholders(instance, (int) participantCount);
        List<StaffShiftResponse> created = new ArrayList<>();
        for (StaffShift placeholder : placeholders) {
            auditLogService.record(AuditLogCommand.of(instanceId, AuditAction.STAFF_ASSIGNED, placeholder.toAuditState()));
            created.add(StaffShiftResponse.from(placeholder));
        }
        return LoomResult.ok("Program uses manual staffing; laid out %d placeholder shift(s)".formatted(created.size()),
                new StaffAssignmentResponse(instanceId, true, participantCount, created.size(), 0, created));
    }

    private int releaseUnusedPlaceholders(UUID instanceId, Map<StaffRole, Deque<StaffShift>> open) {
        int released = 0;
        for (Deque<StaffShift> placeholders : open.values()) {
            for (StaffShift placeholder : placeholders) {
                Map<String, Object> before = placeholder.toAuditState();
                placeholder.release("Placeholder not needed under automatic staffing");
                auditLogService.record(new AuditLogCommand(instanceId, AuditAction.STAFF_RELEASED, before, placeholder.toAuditState()));
                released++;
            }
        }
        return released;
    }

    private static Map<StaffRole, Deque<StaffShift>> openPlaceholders(List<StaffShift> existing) {
        Map<StaffRole, Deque<StaffShift>> open = new EnumMap<>(StaffRole.class);
        for (StaffRole role : StaffRole.values()) {
            open.put(role, new ArrayDeque<>());
        }
        for (StaffShift shift : existing) {
            if (shift.isPlanned() && shift.isPlaceholder()) {
                open.get(shift.getRole()).add(shift);
            }
        }
        return open;
    }

    /**
     * Positions still open per role after counting staffed planned shifts. An
     * unstaffed placeholder does not fill a position.
     */
    static Map<StaffRole, Integer> missingPositions(StaffingRequirement requirement, List<StaffShift> existing) {
        Map<StaffRole, Integer> planned = new EnumMap<>(StaffRole.class);
        for (StaffShift shift : existing) {
            if (shift.isPlanned() && !shift.isPlaceholder()) {
                planned.merge(shift.getRole(), 1, Integer::sum);
            }
        }
        Map<StaffRole, Integer> missing = new EnumMap<>(StaffRole.class);
        for (StaffRole role : StaffRole.values()) {
            int required = switch (role) {
                case LEAD -> requirement.lead();
                case SUPPORT -> requirement.support();
                case DRIVER -> requirement.driver();
            };
            missing.put(role, Math.max(0, required - planned.getOrDefault(role, 0)));
        }
        return missing;
    }
}
