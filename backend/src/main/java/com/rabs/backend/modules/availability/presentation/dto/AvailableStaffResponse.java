package com.rabs.backend.modules.availability.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.rabs.backend.modules.staff.domain.Staff;

public record AvailableStaffResponse(UUID id, String name, BigDecimal contractedHours) {

    public static AvailableStaffResponse from(Staff staff) {
        return new AvailableStaffResponse(staff.getId(), staff.getFullName(), staff.getContractedHours());
    }
}
