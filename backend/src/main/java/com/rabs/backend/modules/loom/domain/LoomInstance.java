package com.rabs.backend.modules.loom.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;
import com.rabs.backend.modules.availability.domain.TimeInterval;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.program.domain.Venue;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One dated occurrence of a program inside the loom window.
 */
@Entity
@Table(name = "loom_instance")
public class LoomInstance extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "program_id", nullable = false, updatable = false)
    private Program program;

    @Column(name = "instance_date", nullable = false, updatable = false)
    private LocalDate instanceDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "venue_id")
    private Venue venue;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 24)
    private LoomInstanceStatus status = LoomInstanceStatus.PENDING;

    @Column(name = "capacity", nullable = false)
    private int capacity;

    @Embedded
    private OptimisationState optimisationState = OptimisationState.initial();

    public LoomInstance() {
    }

    public LoomInstance(Program program, LocalDate instanceDate) {
        this.program = program;
        this.instanceDate = instanceDate;
        this.startTime = program.getStartTime();
        this.endTime = program.getEndTime();
        this.venue = program.getVenue();
    }

    public TimeInterval interval(ZoneId zone) {
        return TimeInterval.of(instanceDate, startTime, endTime, zone);
    }

    /**
     * First allocation run moves a pending instance into the generated state.
     */
    public void markGenerated() {
        if (status == LoomInstanceStatus.PENDING) {
            status = LoomInstanceStatus.GENERATED;
        }
        refreshStatus();
    }

    public void recordStaffing(StepStatus staffingStatus) {
        optimisationState.setStaffingStatus(staffingStatus);
        refreshStatus();
    }

    public void recordTransport(StepStatus vehicleStatus) {
        optimisationState.setVehicleStatus(vehicleStatus);
        refreshStatus();
    }

    public void resetForReoptimization() {
        optimisationState = OptimisationState.reoptimized();
        refreshStatus();
    }

    private void refreshStatus() {
        if (optimisationState.requiresAttention()) {
            status = LoomInstanceStatus.NEEDS_ATTENTION;
        } else if (status == LoomInstanceStatus.NEEDS_ATTENTION) {
            status = LoomInstanceStatus.GENERATED;
        }
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("status", status.name());
        state.putAll(optimisationState.toAuditState());
        return state;
    }

    public UUID getId() {
        return id;
    }

    public Program getProgram() {
        return program;
    }

    public LocalDate getInstanceDate() {
        return instanceDate;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public Venue getVenue() {
        return venue;
    }

    public LoomInstanceStatus getStatus() {
        return status;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public OptimisationState getOptimisationState() {
        return optimisationState;
    }
}
