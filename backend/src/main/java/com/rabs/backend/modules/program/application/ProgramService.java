package com.rabs.backend.modules.program.application;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.loom.application.LoomWindowService;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.program.domain.ProgramTimeSlot;
import com.rabs.backend.modules.program.domain.RepeatPattern;
import com.rabs.backend.modules.program.domain.StaffAssignmentMode;
import com.rabs.backend.modules.program.domain.Venue;
import com.rabs.backend.modules.program.infrastructure.ProgramRepository;
import com.rabs.backend.modules.program.infrastructure.VenueRepository;
import com.rabs.backend.modules.program.presentation.dto.CreateProgramRequest;
import com.rabs.backend.modules.program.presentation.dto.ProgramResponse;
import com.rabs.backend.modules.program.presentation.dto.TimeSlotRequest;
import com.rabs.backend.modules.program.presentation.dto.UpdateProgramRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Program lifecycle. Creating an active program materialises it inside the
 * current window; schedule edits rebuild its future instances; deactivation
 * removes them. Instances dated today or earlier are never touched.
 */
@Service
@Transactional
public class ProgramService {

    private static final Logger log = LoggerFactory.getLogger(ProgramService.class);

    private final ProgramRepository programRepository;
    private final VenueRepository venueRepository;
    private final LoomInstanceRepository loomInstanceRepository;
    private final LoomWindowService loomWindowService;
    private final Clock clock;

    public ProgramService(
            ProgramRepository programRepository,
            VenueRepository venueRepository,
            LoomInstanceRepository loomInstanceRepository,
            LoomWindowService loomWindowService,
            Clock clock
    ) {
        this.programRepository = programRepository;
        this.venueRepository = venueRepository;
        this.loomInstanceRepository = loomInstanceRepository;
        this.loomWindowService = loomWindowService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ProgramResponse> listActivePrograms() {
        return programRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(program -> toResponse(program, 0, 0))
                .toList();
    }

    public ProgramResponse createProgram(CreateProgramRequest request) {
        Program program = new Program();
        program.setName(request.name().trim());
        program.setProgramType(trimToNull(request.programType()));
        program.setStartDate(request.startDate());
        program.setEndDate(request.endDate());
        program.setRepeatPattern(parseRepeatPattern(request.repeatPattern(), RepeatPattern.WEEKLY));
        program.setDaysOfWeek(parseDays(request.daysOfWeek()));
        program.setStartTime(request.startTime());
        program.setEndTime(request.endTime());
        program.setVenue(loadVenue(request.venueId()));
        program.setCentreBased(Boolean.TRUE.equals(request.centreBased()));
        program.setStaffAssignmentMode(parseStaffAssignmentMode(request.staffAssignmentMode(), StaffAssignmentMode.AUTO));
        program.setAdditionalStaffCount(request.additionalStaffCount() != null ? request.additionalStaffCount() : 0);
        program.replaceTimeSlots(toTimeSlots(request.timeSlots()));
        validate(program);

        Program saved = programRepository.saveAndFlush(program);
        int created = loomWindowService.generateForProgram(saved, LocalDate.now(clock));
        log.info("Created program {} with {} instance(s) in the current window", saved.getId(), created);
        return toResponse(saved, created, 0);
    }

    public ProgramResponse updateProgram(UUID programId, UpdateProgramRequest request) {
        Program program = loadProgram(programId);
        ScheduleSnapshot before = ScheduleSnapshot.of(program);

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw ProblemException.badRequest("NAME_REQUIRED", "Program name must not be blank");
            }
            program.setName(request.name().trim());
        }
        if (request.programType() != null) {
            program.setProgramType(trimToNull(request.programType()));
        }
        if (request.startDate() != null) {
            program.setStartDate(request.startDate());
        }
        if (request.clearEndDate()) {
            program.setEndDate(null);
        } else if (request.endDate() != null) {
            program.setEndDate(request.endDate());
        }
        if (request.repeatPattern() != null) {
            program.setRepeatPattern(parseRepeatPattern(request.repeatPattern(), program.getRepeatPattern()));
        }
        if (request.daysOfWeek() != null) {
            program.setDaysOfWeek(parseDays(request.daysOfWeek()));
        }
        if (request.startTime() != null) {
            program.setStartTime(request.startTime());
        }
        if (request.endTime() != null) {
            program.setEndTime(request.endTime());
        }
        if (request.venueId() != null) {
            program.setVenue(loadVenue(request.venueId()));
        }
        if (request.centreBased() != null) {
            program.setCentreBased(request.centreBased());
        }
        if (request.staffAssignmentMode() != null) {
            program.setStaffAssignmentMode(parseStaffAssignmentMode(request.staffAssignmentMode(), program.getStaffAssignmentMode()));
        }
        if (request.additionalStaffCount() != null) {
            program.setAdditionalStaffCount(request.additionalStaffCount());
        }
        if (request.timeSlots() != null) {
            program.replaceTimeSlots(toTimeSlots(request.timeSlots()));
        }
        validate(program);

        Program saved = programRepository.saveAndFlush(program);
        int removed = 0;
        int created = 0;
        if (saved.isActive() && !before.equals(ScheduleSnapshot.of(saved))) {
            LocalDate today = LocalDate.now(clock);
            removed = loomInstanceRepository.deleteByProgramAfter(programId, today);
            created = loomWindowService.generateForProgram(saved, today.plusDays(1));
            log.info("Regenerated program {}: removed={}, created={}", programId, removed, created);
        }
        return toResponse(saved, created, removed);
    }

    public ProgramResponse deactivateProgram(UUID programId) {
        Program program = loadProgram(programId);
        if (!program.isActive()) {
            throw ProblemException.conflict("PROGRAM_ALREADY_INACTIVE", "Program " + programId + " is already inactive");
        }
        program.setActive(false);
        Program saved = programRepository.saveAndFlush(program);
        int removed = loomInstanceRepository.deleteByProgramAfter(programId, LocalDate.now(clock));
        log.info("Deactivated program {} and removed {} future instance(s)", programId, removed);
        return toResponse(saved, 0, removed);
    }

    private Program loadProgram(UUID programId) {
        return programRepository.findById(programId)
                .orElseThrow(() -> ProblemException.notFound("PROGRAM_NOT_FOUND", "Program " + programId + " does not exist"));
    }

    private Venue loadVenue(UUID venueId) {
        if (venueId == null) {
            return null;
        }
        return venueRepository.findById(venueId)
                .orElseThrow(() -> ProblemException.notFound("VENUE_NOT_FOUND", "Venue " + venueId + " does not exist"));
    }

    private void validate(Program program) {
        if (!program.getEndTime().isAfter(program.getStartTime())) {
            throw ProblemException.badRequest("INVALID_TIME_RANGE", "Program end time must be after its start time");
        }
        if (program.getEndDate() != null && program.getEndDate().isBefore(program.getStartDate())) {
            throw ProblemException.badRequest("INVALID_DATE_RANGE", "Program end date must not precede its start date");
        }
        if (program.getRepeatPattern() != RepeatPattern.NONE && program.getDaysOfWeek().isEmpty()) {
            throw ProblemException.badRequest("DAYS_OF_WEEK_REQUIRED", "Repeating programs need at least one weekday");
        }
        for (ProgramTimeSlot slot : program.getTimeSlots()) {
            if (!slot.getEndTime().isAfter(slot.getStartTime())) {
                throw ProblemException.badRequest("INVALID_TIME_RANGE", "Time slot '" + slot.getLabel() + "' ends before it starts");
            }
        }
    }

    private static RepeatPattern parseRepeatPattern(String raw, RepeatPattern fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return RepeatPattern.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_REPEAT_PATTERN", "Unknown repeat pattern " + raw);
        }
    }

    private static StaffAssignmentMode parseStaffAssignmentMode(String raw, StaffAssignmentMode fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return StaffAssignmentMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_STAFF_ASSIGNMENT_MODE", "Unknown staff assignment mode " + raw);
        }
    }

    // ISO numbering, 1 = Monday.
    private static Set<DayOfWeek> parseDays(List<Integer> raw) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (raw == null) {
            return days;
        }
        for (Integer value : raw) {
            if (value == null || value < 1 || value > 7) {
                throw ProblemException.badRequest("INVALID_DAY_OF_WEEK", "Weekdays are numbered 1 (Monday) to 7 (Sunday), got " + value);
            }
            days.add(DayOfWeek.of(value));
        }
        return days;
    }

    private static List<ProgramTimeSlot> toTimeSlots(List<TimeSlotRequest> requests) {
        List<ProgramTimeSlot> slots = new ArrayList<>();
        if (requests == null) {
            return slots;
        }
        int seq = 1;
        for (TimeSlotRequest request : requests) {
            slots.add(new ProgramTimeSlot(seq++, request.label().trim(), request.startTime(), request.endTime()));
        }
        return slots;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static ProgramResponse toResponse(Program program, int created, int removed) {
        Venue venue = program.getVenue();
        return new ProgramResponse(
                program.getId(),
                program.getName(),
                program.getProgramType(),
                program.getStartDate(),
                program.getEndDate(),
                program.getRepeatPattern().name(),
                program.getDaysOfWeek().stream().map(DayOfWeek::getValue).sorted().toList(),
                program.getStartTime(),
                program.getEndTime(),
                venue != null ? venue.getId() : null,
                venue != null ? venue.getName() : null,
                program.isCentreBased(),
                program.getStaffAssignmentMode().name(),
                program.getAdditionalStaffCount(),
                program.isActive(),
                program.getTimeSlots().stream()
                        .map(slot -> new ProgramResponse.TimeSlot(slot.getSeq(), slot.getLabel(), slot.getStartTime(), slot.getEndTime()))
                        .toList(),
                created,
                removed,
                program.getCreatedAt(),
                program.getUpdatedAt()
        );
    }

    /**
     * The fields whose change invalidates materialised instances. Venue and
     * staffing shape are copied or derived at generation time, so they count too.
     */
    private record ScheduleSnapshot(
            LocalDate startDate,
            LocalDate endDate,
            RepeatPattern pattern,
            Set<DayOfWeek> days,
            LocalTime startTime,
            LocalTime endTime,
            List<String> timeSlots,
            UUID venueId,
            boolean centreBased,
            StaffAssignmentMode staffAssignmentMode,
            int additionalStaffCount
    ) {

        static ScheduleSnapshot of(Program program) {
            return new ScheduleSnapshot(
                    program.getStartDate(),
                    program.getEndDate(),
                    program.getRepeatPattern(),
                    Set.copyOf(program.getDaysOfWeek()),
                    program.getStartTime(),
                    program.getEndTime(),
                    program.getTimeSlots().stream()
                            .map(slot -> slot.getLabel() + "|" + slot.getStartTime() + "|" + slot.getEndTime())
                            .toList(),
                    program.getVenue() != null ? program.getVenue().getId() : null,
                    program.isCentreBased(),
                    program.getStaffAssignmentMode(),
                    program.getAdditionalStaffCount()
            );
        }
    }
}
