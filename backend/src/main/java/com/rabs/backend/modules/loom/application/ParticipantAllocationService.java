package com.rabs.backend.modules.loom.application;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.presentation.dto.ParticipantAllocationResponse;
import com.rabs.backend.modules.program.domain.Enrollment;
import com.rabs.backend.modules.program.infrastructure.EnrollmentRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ParticipantAllocationService {

    private final LoomInstanceRepository loomInstanceRepository;
    private final ParticipantAllocationRepository participantAllocationRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final AuditLogService auditLogService;

    public ParticipantAllocationService(
            LoomInstanceRepository loomInstanceRepository,
            ParticipantAllocationRepository participantAllocationRepository,
            EnrollmentRepository enrollmentRepository,
            AuditLogService auditLogService
    ) {
        this.loomInstanceRepository = loomInstanceRepository;
        this.participantAllocationRepository = participantAllocationRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.auditLogService = auditLogService;
    }

    /**
     * Allocates every eligible enrolled participant who is not yet on the instance.
     */
    public LoomResult<ParticipantAllocationResponse> allocateParticipants(UUID instanceId) {
        LoomInstance instance = loomInstanceRepository.findWithProgramById(instanceId)
                .orElseThrow(() -> ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "Instance " + instanceId + " does not exist"));

        Set<UUID> alreadyAllocated = new HashSet<>(participantAllocationRepository.findParticipantIdsByInstance(instanceId));
        List<Enrollment> enrollments = enrollmentRepository.findEligibleForDate(
                instance.getProgram().getId(), instance.getInstanceDate());

        List<UUID> created = new ArrayList<>();
        for (Enrollment enrollment : enrollments) {
            UUID participantId = enrollment.getParticipant().getId();
            if (!alreadyAllocated.add(participantId)) {
                continue;
            }
            ParticipantAllocation allocation = new ParticipantAllocation(instance, enrollment.getParticipant());
            enrollment.findDefaultBillingCode().ifPresentOrElse(code -> {
                allocation.setBillingCode(code.getCode());
                allocation.setPlannedRate(code.getHourlyRate());
            }, () -> {
                allocation.setBillingCode(ParticipantAllocation.FALLBACK_BILLING_CODE);
                allocation.setPlannedRate(BigDecimal.ZERO);
            });
            ParticipantAllocation saved = participantAllocationRepository.save(allocation);
            created.add(saved.getId());

            Map<String, Object> after = new LinkedHashMap<>();
            after.put("allocationId", String.valueOf(saved.getId()));
            after.put("participantId", participantId.toString());
            after.put("billingCode", saved.getBillingCode());
            after.put("plannedRate", saved.getPlannedRate().toPlainString());
            auditLogService.record(AuditLogCommand.of(instanceId, AuditAction.PARTICIPANT_ALLOCATED, after));
        }

        instance.markGenerated();
        long planned = participantAllocationRepository.countByLoomInstance_IdAndStatus(instanceId, AllocationStatus.PLANNED);
        String message = created.isEmpty()
                ? "No new participants to allocate"
                : "Allocated %d participant(s)".formatted(created.size());
        return LoomResult.ok(message, new ParticipantAllocationResponse(instanceId, created, planned));
    }
}
