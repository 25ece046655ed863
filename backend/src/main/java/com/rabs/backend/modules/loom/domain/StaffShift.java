package com.rabs.backend.modules.loom.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;
import com.rabs.backend.modules.staff.domain.Staff;

import jakarta.persistence.Column;
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
 * Staff placement on an instance. A null staff reference is a placeholder
 * awaiting manual assignment.
 */
@Entity
@Table(name = "staff_shift")
public class StaffShift extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "loom_instance_id", nullable = false, updatable = false)
    private LoomInstance loomInstance;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "staff_id")
    private Staff staff;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private StaffRole role;

    @Column(name = "start_at", nullable = false)
    private OffsetDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private OffsetDateTime endAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private StaffShiftStatus status = StaffShiftStatus.PLANNED;

    @Column(name = "notes")
    private String notes;

    // Monotonic per instance; the highest value is the most recent placement.
    @Column(name = "assignment_order", nullable = false)
    private int assignmentOrder;

    public StaffShift() {
    }

    public StaffShift(LoomInstance loomInstance, Staff staff, StaffRole role,
                      OffsetDateTime startAt, OffsetDateTime endAt, int assignmentOrder) {
        this.loomInstance = loomInstance;
        this.staff = staff;
        this.role = role;
        this.startAt = startAt;
        this.endAt = endAt;
        this.assignmentOrder = assignmentOrder;
    }

    public void annotate(String note) {
        this.notes = note;
    }

    public boolean isPlanned() {
        return status == StaffShiftStatus.PLANNED;
    }

    public boolean isPlaceholder() {
        return staff == null;
    }

    /**
     * Puts a staff member on an open placeholder. The placement counts as the
     * most recent one, so it takes the given order.
     */
    public void fill(Staff staff, int assignmentOrder) {
        if (!isPlanned() || !isPlaceholder()) {
            throw new IllegalStateException("Shift " + id + " is not an open placeholder");
        }
        this.staff = staff;
        this.assignmentOrder = assignmentOrder;
    }

    public Duration duration() {
        return Duration.between(startAt, endAt);
    }

    public void markReplaced(String note) {
        transition(StaffShiftStatus.REPLACED, note);
    }

    public void flag(String note) {
        transition(StaffShiftStatus.FLAGGED, note);
    }

    public void release(String note) {
        transition(StaffShiftStatus.RELEASED, note);
    }

    private void transition(StaffShiftStatus next, String note) {
        if (status != StaffShiftStatus.PLANNED) {
            throw new IllegalStateException("Shift " + id + " is " + status + ", cannot move to " + next);
        }
        this.status = next;
        this.notes = note;
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("shiftId", id != null ? id.toString() : null);
        state.put("staffId", staff != null ? staff.getId().toString() : null);
        state.put("staffName", staff != null ? staff.getFullName() : null);
        state.put("role", role.name());
        state.put("status", status.name());
        return state;
    }

    public UUID getId() {
        return id;
    }

    public LoomInstance getLoomInstance() {
        return loomInstance;
    }

    public Staff getStaff() {
        return staff;
    }

    public StaffRole getRole() {
        return role;
    }

    public OffsetDateTime getStartAt() {
        return startAt;
    }

    public OffsetDateTime getEndAt() {
        return endAt;
    }

    public StaffShiftStatus getStatus() {
        return status;
    }

    public String getNotes() {
        return notes;
    }

    public int getAssignmentOrder() {
        return assignmentOrder;
    }
}
