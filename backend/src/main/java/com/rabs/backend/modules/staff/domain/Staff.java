package com.rabs.backend.modules.staff.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "staff")
public class Staff extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "first_name", nullable = false, length = 80)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 80)
    private String lastName;

    /**
     * Contracted hours per ISO week.
     */
    @Column(name = "contracted_hours", nullable = false, precision = 5, scale = 2)
    private BigDecimal contractedHours = BigDecimal.ZERO;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "staff", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<StaffAvailability> availabilities = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public BigDecimal getContractedHours() {
        return contractedHours;
    }

    public void setContractedHours(BigDecimal contractedHours) {
        this.contractedHours = contractedHours;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public List<StaffAvailability> getAvailabilities() {
        return availabilities;
    }

    public void addAvailability(StaffAvailability availability) {
        availability.setStaff(this);
        availabilities.add(availability);
    }
}
