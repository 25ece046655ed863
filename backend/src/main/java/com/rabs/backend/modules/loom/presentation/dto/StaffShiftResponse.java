package com.rabs.backend.modules.loom.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.rabs.backend.modules.loom.domain.StaffShift;

public record StaffShiftResponse(
        UUID shiftId,
        UUID staffId,
        String staffName,
        String role,
        String status,
        OffsetDateTime startAt,
        OffsetDateTime endAt,
        int assignmentOrder,
        String notes
) {

    public static StaffShiftResponse from(StaffShift shift) {
        return new StaffShiftResponse(
                shift.getId(),
                shift.getStaff() != null ? shift.getStaff().getId() : null,
                shift.getStaff() != null ? shift.getStaff().getFullName() : null,
                shift.getRole().name(),
                shift.getStatus().name(),
                shift.getStartAt(),
                shift.getEndAt(),
                shift.getAssignmentOrder(),
                shift.getNotes()
        );
    }
}
