package com.rabs.backend.modules.loom.domain;

import java.time.LocalTime;
import java.util.UUID;

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
@Table(name = "instance_time_slot")
public class InstanceTimeSlot {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "loom_instance_id", nullable = false, updatable = false)
    private LoomInstance loomInstance;

    @Column(name = "seq", nullable = false)
    private int seq;

    @Column(name = "label", nullable = false, length = 80)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(name = "slot_type", nullable = false, length = 16)
    private SlotType slotType;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    public InstanceTimeSlot() {
    }

    public InstanceTimeSlot(LoomInstance loomInstance, int seq, String label, LocalTime startTime, LocalTime endTime) {
        this.loomInstance = loomInstance;
        this.seq = seq;
        this.label = label;
        this.slotType = SlotType.classify(label);
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public UUID getId() {
        return id;
    }

    public LoomInstance getLoomInstance() {
        return loomInstance;
    }

    public int getSeq() {
        return seq;
    }

    public String getLabel() {
        return label;
    }

    public SlotType getSlotType() {
        return slotType;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }
}
