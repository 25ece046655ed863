package com.rabs.backend.modules.availability.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;
import com.rabs.backend.modules.vehicle.domain.Vehicle;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "vehicle_blackout")
public class VehicleBlackout extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "vehicle_id", nullable = false, updatable = false)
    private Vehicle vehicle;

    @Column(name = "start_at", nullable = false)
    private OffsetDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private OffsetDateTime endAt;

    @Column(name = "reason", length = 200)
    private String reason;

    public VehicleBlackout() {
    }

    public VehicleBlackout(Vehicle vehicle, TimeInterval interval, String reason) {
        this.vehicle = vehicle;
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

    public Vehicle getVehicle() {
        return vehicle;
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
