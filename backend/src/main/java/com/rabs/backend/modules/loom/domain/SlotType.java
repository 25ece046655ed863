package com.rabs.backend.modules.loom.domain;

import java.util.Locale;

public enum SlotType {
    PICKUP,
    DROPOFF,
    ACTIVITY;

    public static SlotType classify(String label) {
        if (label == null) {
            return ACTIVITY;
        }
        String normalized = label.toLowerCase(Locale.ROOT);
        if (normalized.contains("pick")) {
            return PICKUP;
        }
        if (normalized.contains("drop")) {
            return DROPOFF;
        }
        return ACTIVITY;
    }

    public boolean isTransport() {
        return this != ACTIVITY;
    }
}
