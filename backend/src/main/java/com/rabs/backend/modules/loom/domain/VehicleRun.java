package com.rabs.backend.modules.loom.domain;

import java.util.LinkedHashMap;
import java.util.Map;
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

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "vehicle_run")
public class VehicleRun extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "loom_instance_id", nullable = false, updatable = false)
    private LoomInstance loomInstance;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "vehicle_id")
    private Vehicle vehicle;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "route_data", columnDefinition = "jsonb")
    private Map<String, Object> routeData = new LinkedHashMap<>();

    @Column(name = "seats_used", nullable = false)
    private int seatsUsed;

    @Column(name = "estimated_duration_minutes", nullable = false)
    private int estimatedDurationMinutes;

    @Column(name = "estimated_distance_km", nullable = false)
    private int estimatedDistanceKm;

    public VehicleRun() {
    }

    public VehicleRun(LoomInstance loomInstance, Vehicle vehicle) {
        this.loomInstance = loomInstance;
        this.vehicle = vehicle;
    }

    public boolean isPlaceholder() {
        return vehicle == null;
    }

    public UUID getId() {
        return id;
    }

    public LoomInstance getLoomInstance() {
        return loomInstance;
    }

    public Vehicle getVehicle() {
        return vehicle;
    }

    public Map<String, Object> getRouteData() {
        return routeData;
    }

    public void setRouteData(Map<String, Object> routeData) {
        this.routeData = routeData;
    }

    public int getSeatsUsed() {
        return seatsUsed;
    }

    public void setSeatsUsed(int seatsUsed) {
        this.seatsUsed = seatsUsed;
    }

    public int getEstimatedDurationMinutes() {
        return estimatedDurationMinutes;
    }

    public void setEstimatedDurationMinutes(int estimatedDurationMinutes) {
        this.estimatedDurationMinutes = estimatedDurationMinutes;
    }

    public int getEstimatedDistanceKm() {
        return estimatedDistanceKm;
    }

    public void setEstimatedDistanceKm(int estimatedDistanceKm) {
        this.estimatedDistanceKm = estimatedDistanceKm;
    }
}
