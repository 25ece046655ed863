package com.rabs.backend.modules.loom.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.modules.availability.application.AvailabilityService;
import com.rabs.backend.modules.availability.domain.TimeInterval;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.staff.domain.Staff;
import com.rabs.backend.modules.staff.domain.StaffAvailability;
import com.rabs.backend.modules.staff.infrastructure.StaffAvailabilityRepository;

import org.springframework.stereotype.Component;

/**
 * Ranks staff who can cover an instance: weekly availability must contain the
 * whole instance, no unavailability may overlap it, and staff with the most
 * contracted hours left in that ISO week come first.
 */
@Component
public class StaffCandidateFinder {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    private static final Comparator<StaffCandidate> RANKING = Comparator
            .comparingLong(StaffCandidate::remainingMinutes).reversed()
            .thenComparing(candidate -> candidate.staff().getLastName())
            .thenComparing(candidate -> candidate.staff().getFirstName())
            .thenComparing(candidate -> candidate.staff().getId());

    private final StaffAvailabilityRepository staffAvailabilityRepository;
    private final StaffShiftRepository staffShiftRepository;
    private final AvailabilityService availabilityService;
    private final Clock clock;

    public StaffCandidateFinder(
            StaffAvailabilityRepository staffAvailabilityRepository,
            StaffShiftRepository staffShiftRepository,
            AvailabilityService availabilityService,
            Clock clock
    ) {
        this.staffAvailabilityRepository = staffAvailabilityRepository;
        this.staffShiftRepository = staffShiftRepository;
        this.availabilityService = availabilityService;
        this.clock = clock;
    }

    public List<StaffCandidate> findCandidates(LoomInstance instance, Set<UUID> excludedStaffIds) {
        ZoneId zone = clock.getZone();
        TimeInterval interval = instance.interval(zone);
        Set<UUID> unavailable = availabilityService.unavailableStaffIds(interval);

        Map<UUID, Staff> eligible = new LinkedHashMap<>();
        int isoDay = instance.getInstanceDate().getDayOfWeek().getValue();
        for (StaffAvailability availability : staffAvailabilityRepository.findActiveByIsoDay(isoDay)) {
            Staff staff = availability.getStaff();
            if (excludedStaffIds.contains(staff.getId()) || unavailable.contains(staff.getId())) {
                continue;
            }
            if (availability.covers(instance.getStartTime(), instance.getEndTime())) {
                eligible.putIfAbsent(staff.getId(), staff);
            }
        }
        if (eligible.isEmpty()) {
            return List.of();
        }

        Map<UUID, Long> plannedMinutes = plannedMinutesInWeek(eligible.keySet(), instance.getInstanceDate(), zone);
        return eligible.values().stream()
                .map(staff -> new StaffCandidate(staff, remainingMinutes(staff, plannedMinutes.getOrDefault(staff.getId(), 0L))))
                .sorted(RANKING)
                .toList();
    }

    private Map<UUID, Long> plannedMinutesInWeek(Set<UUID> staffIds, LocalDate date, ZoneId zone) {
        LocalDate weekStart = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        OffsetDateTime from = weekStart.atStartOfDay(zone).toOffsetDateTime();
        OffsetDateTime to = weekStart.plusWeeks(1).atStartOfDay(zone).toOffsetDateTime();
        Map<UUID, Long> minutes = new HashMap<>();
        for (StaffShift shift : staffShiftRepository.findPlannedForStaffStartingBetween(staffIds, from, to)) {
            minutes.merge(shift.getStaff().getId(), shift.duration().toMinutes(), Long::sum);
        }
        return minutes;
    }

    private long remainingMinutes(Staff staff, long plannedMinutes) {
        long contractedMinutes = staff.getContractedHours().multiply(MINUTES_PER_HOUR).longValue();
        return contractedMinutes - plannedMinutes;
    }

    public record StaffCandidate(Staff staff, long remainingMinutes) {
    }
}
