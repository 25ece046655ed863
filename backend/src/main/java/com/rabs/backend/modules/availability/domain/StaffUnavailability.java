package com.rabs.backend.modules.availability.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;
import com.rabs.backend.modules.staff.domain.Staff;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "staff_unavailability")
public class StaffUnavailability extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "staff_id", nullable = false, updatable = false)
    private Staff staff;

    @Column(name = "start_at", nullable = false)
    private OffsetDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private OffsetDateTime endAt;

    @Column(name = "reason", length = 200)
    private String reason;

    public StaffUnavailability() {
    }

    public StaffUnavailability(Staff staff, TimeInterval interval, String reason) {
        this.staff = staff;
        this.startAt = interval.start();
        this.endAt = interval.end();
        this.reason = reason;
    }

    public TimeInterval interval() {
        return new TimeInterval(startAt, endAt);
    }

    public UUID getId() {
        return id;
    }

    public Staff getStaff() {
        return staff;
    }

    public OffsetDateTime getStartAt() {
        return startAt;
    }

    public OffsetDateTime getEndAt() {
        return endAt;
    }

    public String getReason() {
        return reason;
    }
}
