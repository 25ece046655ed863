package com.rabs.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.rabs.backend.global.web.RequestContextFilter;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.audit.domain.AuditLog;
import com.rabs.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes audit entries inside the caller's transaction so an entry exists
 * exactly when the state change it describes was committed.
 */
@Service
public class AuditLogService {

    public static final String SYSTEM_ACTOR = "loom_engine";

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional
    public AuditLog record(AuditLogCommand command) {
        Objects.requireNonNull(command.loomInstanceId(), "loomInstanceId is required");
        Objects.requireNonNull(command.action(), "action is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setLoomInstanceId(command.loomInstanceId());
        auditLog.setAction(command.action());
        auditLog.setActor(resolveActor());
        auditLog.setRequestId(MDC.get(RequestContextFilter.REQUEST_ID_MDC_KEY));

        if (command.beforeState() != null && !command.beforeState().isEmpty()) {
            auditLog.setBeforeState(new LinkedHashMap<>(command.beforeState()));
        }
        if (command.afterState() != null && !command.afterState().isEmpty()) {
            auditLog.setAfterState(new LinkedHashMap<>(command.afterState()));
        }

        return auditLogRepository.save(auditLog);
    }

    private String resolveActor() {
        String actor = MDC.get(RequestContextFilter.ACTOR_MDC_KEY);
        return actor != null && !actor.isBlank() ? actor : SYSTEM_ACTOR;
    }

    public record AuditLogCommand(
            UUID loomInstanceId,
            AuditAction action,
            Map<String, Object> beforeState,
            Map<String, Object> afterState
    ) {

        public static AuditLogCommand of(UUID loomInstanceId, AuditAction action, Map<String, Object> afterState) {
            return new AuditLogCommand(loomInstanceId, action, null, afterState);
        }
    }
}
