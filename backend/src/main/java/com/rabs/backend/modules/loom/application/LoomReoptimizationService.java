package com.rabs.backend.modules.loom.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.loom.infrastructure.VehicleRunRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Clears staff and transport planning of an instance ahead of a fresh allocation pass.
 */
@Service
@Transactional
public class LoomReoptimizationService {

    private final LoomInstanceRepository loomInstanceRepository;
    private final StaffShiftRepository staffShiftRepository;
    private final VehicleRunRepository vehicleRunRepository;
    private final AuditLogService auditLogService;

    public LoomReoptimizationService(
            LoomInstanceRepository loomInstanceRepository,
            StaffShiftRepository staffShiftRepository,
            VehicleRunRepository vehicleRunRepository,
            AuditLogService auditLogService
    ) {
        this.loomInstanceRepository = loomInstanceRepository;
        this.staffShiftRepository = staffShiftRepository;
        this.vehicleRunRepository = vehicleRunRepository;
        this.auditLogService = auditLogService;
    }

    public void prepare(UUID instanceId) {
        LoomInstance instance = loomInstanceRepository.findWithProgramById(instanceId)
                .orElseThrow(() -> ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "Instance " + instanceId + " does not exist"));

        Map<String, Object> before = instance.toAuditState();
        int shifts = staffShiftRepository.deleteByInstance(instanceId);
        int runs = vehicleRunRepository.deleteByInstance(instanceId);
        instance.resetForReoptimization();

        Map<String, Object> after = new LinkedHashMap<>(instance.toAuditState());
        after.put("removedShifts", shifts);
        after.put("removedRuns", runs);
        auditLogService.record(new AuditLogCommand(instanceId, AuditAction.REOPTIMIZATION_STARTED, before, after));
    }
}
