package com.rabs.backend.modules.loom.application;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.loom.domain.InstanceTimeSlot;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.RecurrenceExpander;
import com.rabs.backend.modules.loom.domain.VehicleRun;
import com.rabs.backend.modules.loom.infrastructure.InstanceTimeSlotRepository;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.VehicleRunRepository;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.program.domain.ProgramTimeSlot;
import com.rabs.backend.modules.program.infrastructure.EnrollmentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Materialises program occurrences into loom instances. Re-running over an
 * overlapping range creates nothing new.
 */
@Service
@Transactional
public class InstanceGenerator {

    private static final Logger log = LoggerFactory.getLogger(InstanceGenerator.class);
    private static final String UNIQUE_PROGRAM_DATE = "uq_loom_instance_program_date";
    private static final String DEFAULT_SLOT_LABEL = "Activity";

    private final LoomInstanceRepository loomInstanceRepository;
    private final InstanceTimeSlotRepository instanceTimeSlotRepository;
    private final VehicleRunRepository vehicleRunRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final PlaceholderShiftService placeholderShiftService;
    private final AuditLogService auditLogService;

    public InstanceGenerator(
            LoomInstanceRepository loomInstanceRepository,
            InstanceTimeSlotRepository instanceTimeSlotRepository,
            VehicleRunRepository vehicleRunRepository,
            EnrollmentRepository enrollmentRepository,
            PlaceholderShiftService placeholderShiftService,
            AuditLogService auditLogService
    ) {
        this.loomInstanceRepository = loomInstanceRepository;
        this.instanceTimeSlotRepository = instanceTimeSlotRepository;
        this.vehicleRunRepository = vehicleRunRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.placeholderShiftService = placeholderShiftService;
        this.auditLogService = auditLogService;
    }

    /**
     * Creates instances for every occurrence of the program in {@code [rangeStart, rangeEnd)}.
     *
     * @return number of instances created
     */
    public int generateInstances(Program program, LocalDate rangeStart, LocalDate rangeEnd) {
        if (!program.isActive()) {
            return 0;
        }
        List<LocalDate> dates = RecurrenceExpander.expand(program.toSchedule(), rangeStart, rangeEnd).toList();
        int created = 0;
        for (LocalDate date : dates) {
            if (loomInstanceRepository.existsByProgram_IdAndInstanceDate(program.getId(), date)) {
                continue;
            }
            createInstance(program, date);
            created++;
        }
        if (created > 0) {
            log.info("Generated {} instance(s) for program {} in [{}, {})", created, program.getId(), rangeStart, rangeEnd);
        }
        return created;
    }

    private void createInstance(Program program, LocalDate date) {
        LoomInstance instance = new LoomInstance(program, date);
        instance.setCapacity((int) enrollmentRepository.countEligibleForDate(program.getId(), date));
        LoomInstance saved = saveInstance(instance);

        List<InstanceTimeSlot> slots = buildTimeSlots(saved, program);
        instanceTimeSlotRepository.saveAll(slots);

        int placeholderShifts = program.isManualStaffing()
                ? placeholderShiftService.createPlaceholders(saved, saved.getCapacity()).size()
                : 0;
        boolean transport = slots.stream().anyMatch(slot -> slot.getSlotType().isTransport());
        if (transport) {
            VehicleRun placeholder = new VehicleRun(saved, null);
            placeholder.setRouteData(new LinkedHashMap<>(Map.of("placeholder", true)));
            vehicleRunRepository.save(placeholder);
        }

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("programId", program.getId().toString());
        after.put("instanceDate", date.toString());
        after.put("startTime", saved.getStartTime().toString());
        after.put("endTime", saved.getEndTime().toString());
        after.put("capacity", saved.getCapacity());
        after.put("timeSlots", slots.size());
        after.put("placeholderShifts", placeholderShifts);
        after.put("transportPlaceholder", transport);
        after.put("status", saved.getStatus().name());
        auditLogService.record(AuditLogCommand.of(saved.getId(), AuditAction.INSTANCE_CREATED, after));
    }

    private LoomInstance saveInstance(LoomInstance instance) {
        try {
            return loomInstanceRepository.saveAndFlush(instance);
        } catch (DataIntegrityViolationException ex) {
            Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
            String message = root.getMessage();
            if (message != null && message.contains(UNIQUE_PROGRAM_DATE)) {
                throw ProblemException.conflict("LOOM_INSTANCE_DUPLICATE",
                        "Instance for program " + instance.getProgram().getId() + " on "
                                + instance.getInstanceDate() + " was created concurrently; retry generation");
            }
            throw ex;
        }
    }

    private List<InstanceTimeSlot> buildTimeSlots(LoomInstance instance, Program program) {
        List<InstanceTimeSlot> slots = new ArrayList<>();
        List<ProgramTimeSlot> configured = program.getTimeSlots();
        if (configured.isEmpty()) {
            slots.add(new InstanceTimeSlot(instance, 1, DEFAULT_SLOT_LABEL, program.getStartTime(), program.getEndTime()));
            return slots;
        }
        int seq = 1;
        for (ProgramTimeSlot slot : configured) {
            slots.add(new InstanceTimeSlot(instance, seq++, slot.getLabel(), slot.getStartTime(), slot.getEndTime()));
        }
        return slots;
    }
}
