package com.rabs.backend.modules.vehicle.domain;

import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "vehicle")
public class Vehicle extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "registration", nullable = false, length = 16)
    private String registration;

    @Column(name = "description", length = 120)
    private String description;

    @Column(name = "seats", nullable = false)
    private int seats;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    /**
     * Seats available to participants; one seat is always the driver's.
     */
    public int getPassengerSeats() {
        return Math.max(0, seats - 1);
    }

    public UUID getId() {
        return id;
    }

    public String getRegistration() {
        return registration;
    }

    public void setRegistration(String registration) {
        this.registration = registration;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getSeats() {
        return seats;
    }

    public void setSeats(int seats) {
        this.seats = seats;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
