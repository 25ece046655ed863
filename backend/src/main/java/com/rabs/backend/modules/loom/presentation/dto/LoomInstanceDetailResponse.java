package com.rabs.backend.modules.loom.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record LoomInstanceDetailResponse(
        LoomInstanceSummaryResponse instance,
        List<TimeSlotItem> timeSlots,
        List<ParticipantItem> participants,
        List<StaffShiftResponse> staff,
        List<VehicleRunResponse> vehicles,
        List<AuditItem> auditLog
) {

    public record TimeSlotItem(int seq, String label, String slotType, LocalTime startTime, LocalTime endTime) {
    }

    public record ParticipantItem(
            UUID allocationId,
            UUID participantId,
            String participantName,
            String billingCode,
            BigDecimal plannedRate,
            String status,
            String cancellationType,
            OffsetDateTime cancelledAt
    ) {
    }

    public record AuditItem(
            UUID id,
            String action,
            Map<String, Object> beforeState,
            Map<String, Object> afterState,
            String actor,
            OffsetDateTime createdAt
    ) {
    }
}
