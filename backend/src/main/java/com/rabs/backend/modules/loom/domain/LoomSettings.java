package com.rabs.backend.modules.loom.domain;

import java.util.UUID;

import com.rabs.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Single settings row for the loom. Always stored under {@link #SETTINGS_ID}.
 */
@Entity
@Table(name = "loom_settings")
public class LoomSettings extends AbstractTimestampedEntity {

    public static final UUID SETTINGS_ID = UUID.fromString("00000000-0000-0000-0000-00000000100a");

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "window_weeks", nullable = false)
    private int windowWeeks;

    @Column(name = "participants_per_support_worker", nullable = false)
    private int participantsPerSupportWorker;

    public LoomSettings() {
    }

    public LoomSettings(int windowWeeks, int participantsPerSupportWorker) {
        this.id = SETTINGS_ID;
        this.windowWeeks = windowWeeks;
        this.participantsPerSupportWorker = participantsPerSupportWorker;
    }

    public UUID getId() {
        return id;
    }

    public int getWindowWeeks() {
        return windowWeeks;
    }

    public void setWindowWeeks(int windowWeeks) {
        this.windowWeeks = windowWeeks;
    }

    public int getParticipantsPerSupportWorker() {
        return participantsPerSupportWorker;
    }

    public void setParticipantsPerSupportWorker(int participantsPerSupportWorker) {
        this.participantsPerSupportWorker = participantsPerSupportWorker;
    }
}
