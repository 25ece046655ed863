package com.rabs.backend.modules.program.domain;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "enrollment_billing_code")
public class EnrollmentBillingCode {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "enrollment_id", nullable = false)
    private Enrollment enrollment;

    @Column(name = "code", nullable = false, length = 40)
    private String code;

    @Column(name = "hourly_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal hourlyRate = BigDecimal.ZERO;

    @Column(name = "hours", nullable = false, precision = 5, scale = 2)
    private BigDecimal hours = BigDecimal.ZERO;

    @Column(name = "is_default", nullable = false)
    private boolean defaultCode;

    public EnrollmentBillingCode() {
    }

    public EnrollmentBillingCode(String code, BigDecimal hourlyRate, BigDecimal hours, boolean defaultCode) {
        this.code = code;
        this.hourlyRate = hourlyRate;
        this.hours = hours;
        this.defaultCode = defaultCode;
    }

    public UUID getId() {
        return id;
    }

    public Enrollment getEnrollment() {
        return enrollment;
    }

    void setEnrollment(Enrollment enrollment) {
        this.enrollment = enrollment;
    }

    public String getCode() {
        return code;
    }

    public BigDecimal getHourlyRate() {
        return hourlyRate;
    }

    public BigDecimal getHours() {
        return hours;
    }

    public boolean isDefaultCode() {
        return defaultCode;
    }
}
