package com.rabs.backend.modules.loom.application;

import com.rabs.backend.global.config.LoomProperties;
import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.loom.domain.LoomSettings;
import com.rabs.backend.modules.loom.infrastructure.LoomSettingsRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Typed access to the single loom settings row. Falls back to configured
 * defaults until the row is first written.
 */
@Service
@Transactional
public class LoomSettingsService {

    private final LoomSettingsRepository loomSettingsRepository;
    private final LoomProperties loomProperties;

    public LoomSettingsService(LoomSettingsRepository loomSettingsRepository, LoomProperties loomProperties) {
        this.loomSettingsRepository = loomSettingsRepository;
        this.loomProperties = loomProperties;
    }

    @Transactional(readOnly = true)
    public LoomSettings current() {
        return loomSettingsRepository.findById(LoomSettings.SETTINGS_ID)
                .orElseGet(this::defaults);
    }

    @Transactional(readOnly = true)
    public int windowWeeks() {
        return current().getWindowWeeks();
    }

    @Transactional(readOnly = true)
    public int participantsPerSupportWorker() {
        return current().getParticipantsPerSupportWorker();
    }

    public void validateWindowWeeks(int weeks) {
        int min = loomProperties.getMinWindowWeeks();
        int max = loomProperties.getMaxWindowWeeks();
        if (weeks < min || weeks > max) {
            throw ProblemException.badRequest(
                    "INVALID_WINDOW_SIZE",
                    "Window size must be between %d and %d weeks, got %d".formatted(min, max, weeks)
            );
        }
    }

    public LoomSettings updateWindowWeeks(int weeks) {
        validateWindowWeeks(weeks);
        LoomSettings settings = current();
        settings.setWindowWeeks(weeks);
        return loomSettingsRepository.save(settings);
    }

    public LoomSettings updateParticipantsPerSupportWorker(int participantsPerSupportWorker) {
        if (participantsPerSupportWorker < 1) {
            throw ProblemException.badRequest("INVALID_STAFF_RATIO", "Participants per support worker must be positive");
        }
        LoomSettings settings = current();
        settings.setParticipantsPerSupportWorker(participantsPerSupportWorker);
        return loomSettingsRepository.save(settings);
    }

    private LoomSettings defaults() {
        return new LoomSettings(
                loomProperties.getDefaultWindowWeeks(),
                loomProperties.getDefaultParticipantsPerSupportWorker()
        );
    }
}
