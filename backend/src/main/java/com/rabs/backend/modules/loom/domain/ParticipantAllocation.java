package com.rabs.backend.modules.loom.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;
import com.rabs.backend.modules.participant.domain.Participant;

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

@Entity
@Table(name = "participant_allocation")
public class ParticipantAllocation extends AbstractTimestampedEntity {

    public static final String FALLBACK_BILLING_CODE = "DEFAULT";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "loom_instance_id", nullable = false, updatable = false)
    private LoomInstance loomInstance;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "participant_id", nullable = false, updatable = false)
    private Participant participant;

    @Column(name = "billing_code", nullable = false, length = 40)
    private String billingCode = FALLBACK_BILLING_CODE;

    @Column(name = "planned_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal plannedRate = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AllocationStatus status = AllocationStatus.PLANNED;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_type", length = 16)
    private CancellationType cancellationType;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    public ParticipantAllocation() {
    }

    public ParticipantAllocation(LoomInstance loomInstance, Participant participant) {
        this.loomInstance = loomInstance;
        this.participant = participant;
    }

    public boolean isPlanned() {
        return status == AllocationStatus.PLANNED;
    }

    /**
     * Planned allocations can be cancelled exactly once.
     */
    public void cancel(CancellationType type, OffsetDateTime at) {
        if (status != AllocationStatus.PLANNED) {
            throw new IllegalStateException("Allocation " + id + " is already " + status);
        }
        this.status = AllocationStatus.CANCELLED;
        this.cancellationType = type;
        this.cancelledAt = at;
    }

    public UUID getId() {
        return id;
    }

    public LoomInstance getLoomInstance() {
        return loomInstance;
    }

    public Participant getParticipant() {
        return participant;
    }

    public String getBillingCode() {
        return billingCode;
    }

    public void setBillingCode(String billingCode) {
        this.billingCode = billingCode;
    }

    public BigDecimal getPlannedRate() {
        return plannedRate;
    }

    public void setPlannedRate(BigDecimal plannedRate) {
        this.plannedRate = plannedRate;
    }

    public AllocationStatus getStatus() {
        return status;
    }

    public CancellationType getCancellationType() {
        return cancellationType;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }
}
