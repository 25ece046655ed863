package com.rabs.backend.modules.audit.domain;

public enum AuditAction {
    INSTANCE_CREATED,
    PARTICIPANT_ALLOCATED,
    PARTICIPANT_CANCELLED,
    STAFF_ASSIGNED,
    STAFF_INSUFFICIENT,
    STAFF_RELEASED,
    STAFF_REPLACED,
    STAFF_FLAGGED,
    VEHICLES_ASSIGNED,
    VEHICLES_INSUFFICIENT,
    REOPTIMIZATION_STARTED,
    STAFF_UNAVAILABILITY_CONFLICT,
    VEHICLE_BLACKOUT_CONFLICT
}
