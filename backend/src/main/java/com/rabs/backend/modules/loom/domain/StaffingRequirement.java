package com.rabs.backend.modules.loom.domain;

/**
 * Staff needed for an instance: one lead, support workers by ratio plus any
 * program extras, and a driver when the program has a transport leg.
 */
public record StaffingRequirement(int lead, int support, int driver) {

    public static StaffingRequirement of(int participantCount,
                                         int participantsPerSupportWorker,
                                         int additionalStaff,
                                         boolean needsDriver) {
        if (participantCount < 0) {
            throw new IllegalArgumentException("participantCount must not be negative");
        }
        if (participantsPerSupportWorker < 1) {
            throw new IllegalArgumentException("participantsPerSupportWorker must be positive");
        }
        int ratioSupport = (participantCount + participantsPerSupportWorker - 1) / participantsPerSupportWorker;
        return new StaffingRequirement(1, ratioSupport + Math.max(0, additionalStaff), needsDriver ? 1 : 0);
    }

    /**
     * Lead plus support; the figure compared against planned staff after a cancellation.
     */
    public int nonDriverCount() {
        return lead + support;
    }

    public int total() {
        return lead + support + driver;
    }
}
