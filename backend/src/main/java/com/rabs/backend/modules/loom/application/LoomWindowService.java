package com.rabs.backend.modules.loom.application;

import java.time.Clock;
import java.time.LocalDate;

import com.rabs.backend.modules.loom.domain.LoomSettings;
import com.rabs.backend.modules.loom.domain.LoomWindow;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.presentation.dto.LoomWindowResponse;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.program.infrastructure.ProgramRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the rolling window: persisting its size and materialising every active
 * program inside it.
 */
@Service
@Transactional
public class LoomWindowService {

    private static final Logger log = LoggerFactory.getLogger(LoomWindowService.class);

    private final LoomSettingsService loomSettingsService;
    private final ProgramRepository programRepository;
    private final LoomInstanceRepository loomInstanceRepository;
    private final InstanceGenerator instanceGenerator;
    private final Clock clock;

    public LoomWindowService(
            LoomSettingsService loomSettingsService,
            ProgramRepository programRepository,
            LoomInstanceRepository loomInstanceRepository,
            InstanceGenerator instanceGenerator,
            Clock clock
    ) {
        this.loomSettingsService = loomSettingsService;
        this.programRepository = programRepository;
        this.loomInstanceRepository = loomInstanceRepository;
        this.instanceGenerator = instanceGenerator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public LoomWindow currentWindow() {
        return LoomWindow.of(LocalDate.now(clock), loomSettingsService.windowWeeks());
    }

    @Transactional(readOnly = true)
    public LoomWindowResponse describeWindow() {
        return toResponse(loomSettingsService.current(), currentWindow(), 0, 0);
    }

    public LoomWindowResponse generateWindow(int weeks) {
        LoomSettings settings = loomSettingsService.updateWindowWeeks(weeks);
        LoomWindow window = LoomWindow.of(LocalDate.now(clock), weeks);
        int created = generateAll(window.startDate(), window.endDate());
        return toResponse(settings, window, created, 0);
    }

    /**
     * Growing materialises only the added weeks; shrinking drops instances on or
     * after the new end date. Instances inside both windows are never touched.
     */
    public LoomWindowResponse resizeWindow(int weeks) {
        loomSettingsService.validateWindowWeeks(weeks);
        LoomWindow previous = currentWindow();
        LoomSettings settings = loomSettingsService.updateWindowWeeks(weeks);
        LoomWindow resized = LoomWindow.of(previous.startDate(), weeks);

        int created = 0;
        int removed = 0;
        if (resized.endDate().isAfter(previous.endDate())) {
            created = generateAll(previous.endDate(), resized.endDate());
        } else if (resized.endDate().isBefore(previous.endDate())) {
            removed = loomInstanceRepository.deleteOnOrAfter(resized.endDate());
        }
        log.info("Resized loom window from {} to {} weeks (created={}, removed={})",
                previous.weekCount(), weeks, created, removed);
        return toResponse(settings, resized, created, removed);
    }

    /**
     * Re-runs generation for the persisted window size; used by the nightly roll.
     */
    public int rollWindow() {
        LoomWindow window = currentWindow();
        return generateAll(window.startDate(), window.endDate());
    }

    /**
     * Generates a single program inside the current window, from {@code fromDate} onwards.
     */
    public int generateForProgram(Program program, LocalDate fromDate) {
        LoomWindow window = currentWindow();
        LocalDate start = fromDate.isAfter(window.startDate()) ? fromDate : window.startDate();
        if (!start.isBefore(window.endDate())) {
            return 0;
        }
        return instanceGenerator.generateInstances(program, start, window.endDate());
    }

    private int generateAll(LocalDate rangeStart, LocalDate rangeEnd) {
        int created = 0;
        for (Program program : programRepository.findByActiveTrueOrderByNameAsc()) {
            created += instanceGenerator.generateInstances(program, rangeStart, rangeEnd);
        }
        return created;
    }

    private static LoomWindowResponse toResponse(LoomSettings settings, LoomWindow window, int created, int removed) {
        return new LoomWindowResponse(
                settings.getWindowWeeks(),
                settings.getParticipantsPerSupportWorker(),
                window.startDate(),
                window.endDate(),
                created,
                removed
        );
    }
}
