package com.rabs.backend.modules.loom.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import com.rabs.backend.modules.availability.domain.TimeInterval;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.StaffRole;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.StaffingRequirement;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.program.domain.Program;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Unstaffed shifts sized to the staffing requirement, left for a coordinator
 * to fill on manually staffed programs.
 */
@Service
@Transactional
public class PlaceholderShiftService {

    private final StaffShiftRepository staffShiftRepository;
    private final LoomSettingsService loomSettingsService;
    private final Clock clock;

    public PlaceholderShiftService(
            StaffShiftRepository staffShiftRepository,
            LoomSettingsService loomSettingsService,
            Clock clock
    ) {
        this.staffShiftRepository = staffShiftRepository;
        this.loomSettingsService = loomSettingsService;
        this.clock = clock;
    }

    public List<StaffShift> createPlaceholders(LoomInstance instance, int headcount) {
        Program program = instance.getProgram();
        StaffingRequirement requirement = StaffingRequirement.of(
                headcount,
                loomSettingsService.participantsPerSupportWorker(),
                program.getAdditionalStaffCount(),
                !program.isCentreBased()
        );
        TimeInterval interval = instance.interval(clock.getZone());
        int order = instance.getId() != null ? staffShiftRepository.findMaxAssignmentOrder(instance.getId()) : 0;

        List<StaffShift> placeholders = new ArrayList<>();
        placeholders.add(new StaffShift(instance, null, StaffRole.LEAD, interval.start(), interval.end(), ++order));
        for (int i = 0; i < requirement.support(); i++) {
            placeholders.add(new StaffShift(instance, null, StaffRole.SUPPORT, interval.start(), interval.end(), ++order));
        }
        if (requirement.driver() > 0) {
            placeholders.add(new StaffShift(instance, null, StaffRole.DRIVER, interval.start(), interval.end(), ++order));
        }
        return staffShiftRepository.saveAll(placeholders);
    }
}
