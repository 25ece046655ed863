package com.rabs.backend.modules.loom.domain;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

@Embeddable
public class OptimisationState {

    @Enumerated(EnumType.STRING)
    @Column(name = "staffing_status", length = 24)
    private StepStatus staffingStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_status", length = 24)
    private StepStatus vehicleStatus;

    @Column(name = "reoptimized", nullable = false)
    private boolean reoptimized;

    public static OptimisationState initial() {
        return new OptimisationState();
    }

    public static OptimisationState reoptimized() {
        OptimisationState state = new OptimisationState();
        state.reoptimized = true;
        return state;
    }

    public boolean requiresAttention() {
        return (staffingStatus != null && staffingStatus.requiresAttention())
                || (vehicleStatus != null && vehicleStatus.requiresAttention());
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("staffingStatus", staffingStatus != null ? staffingStatus.name() : null);
        state.put("vehicleStatus", vehicleStatus != null ? vehicleStatus.name() : null);
        state.put("reoptimized", reoptimized);
        return state;
    }

    public StepStatus getStaffingStatus() {
        return staffingStatus;
    }

    public void setStaffingStatus(StepStatus staffingStatus) {
        this.staffingStatus = staffingStatus;
    }

    public StepStatus getVehicleStatus() {
        return vehicleStatus;
    }

    public void setVehicleStatus(StepStatus vehicleStatus) {
        this.vehicleStatus = vehicleStatus;
    }

    public boolean isReoptimized() {
        return reoptimized;
    }
}
