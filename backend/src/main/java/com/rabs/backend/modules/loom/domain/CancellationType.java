package com.rabs.backend.modules.loom.domain;

import java.util.Locale;
import java.util.Optional;

public enum CancellationType {
    NORMAL,
    SHORT_NOTICE;

    /**
     * Accepts {@code normal} and {@code short_notice} in any case.
     */
    public static Optional<CancellationType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (CancellationType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
