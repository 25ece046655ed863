package com.rabs.backend.modules.availability.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.availability.domain.StaffUnavailability;
import com.rabs.backend.modules.availability.domain.TimeInterval;
import com.rabs.backend.modules.availability.domain.VehicleBlackout;
import com.rabs.backend.modules.availability.infrastructure.StaffUnavailabilityRepository;
import com.rabs.backend.modules.availability.infrastructure.VehicleBlackoutRepository;
import com.rabs.backend.modules.availability.presentation.dto.AvailabilityConflictResponse;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.StepStatus;
import com.rabs.backend.modules.loom.domain.VehicleRun;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.loom.infrastructure.VehicleRunRepository;
import com.rabs.backend.modules.staff.domain.Staff;
import com.rabs.backend.modules.staff.infrastructure.StaffRepository;
import com.rabs.backend.modules.vehicle.domain.Vehicle;
import com.rabs.backend.modules.vehicle.infrastructure.VehicleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers whether staff and vehicles are free for an interval and records
 * unavailability. Every overlap test uses the half-open rule of {@link TimeInterval}.
 */
@Service
@Transactional
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final StaffRepository staffRepository;
    private final VehicleRepository vehicleRepository;
    private final StaffUnavailabilityRepository staffUnavailabilityRepository;
    private final VehicleBlackoutRepository vehicleBlackoutRepository;
    private final StaffShiftRepository staffShiftRepository;
    private final VehicleRunRepository vehicleRunRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AvailabilityService(
            StaffRepository staffRepository,
            VehicleRepository vehicleRepository,
            StaffUnavailabilityRepository staffUnavailabilityRepository,
            VehicleBlackoutRepository vehicleBlackoutRepository,
            StaffShiftRepository staffShiftRepository,
            VehicleRunRepository vehicleRunRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.staffRepository = staffRepository;
        this.vehicleRepository = vehicleRepository;
        this.staffUnavailabilityRepository = staffUnavailabilityRepository;
        this.vehicleBlackoutRepository = vehicleBlackoutRepository;
        this.staffShiftRepository = staffShiftRepository;
        this.vehicleRunRepository = vehicleRunRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public boolean isStaffAvailable(UUID staffId, LocalDate date, LocalTime startTime, LocalTime endTime) {
        TimeInterval interval = toInterval(date, startTime, endTime);
        if (!staffRepository.existsById(staffId)) {
            throw ProblemException.notFound("STAFF_NOT_FOUND", "Staff " + staffId + " does not exist");
        }
        return !staffUnavailabilityRepository.existsOverlapping(staffId, interval.start(), interval.end());
    }

    @Transactional(readOnly = true)
    public boolean isVehicleAvailable(UUID vehicleId, LocalDate date, LocalTime startTime, LocalTime endTime) {
        TimeInterval interval = toInterval(date, startTime, endTime);
        if (!vehicleRepository.existsById(vehicleId)) {
            throw ProblemException.notFound("VEHICLE_NOT_FOUND", "Vehicle " + vehicleId + " does not exist");
        }
        return !vehicleBlackoutRepository.existsOverlapping(vehicleId, interval.start(), interval.end());
    }

    @Transactional(readOnly = true)
    public List<Staff> getAvailableStaff(LocalDate date, LocalTime startTime, LocalTime endTime) {
        Set<UUID> unavailable = unavailableStaffIds(toInterval(date, startTime, endTime));
        return staffRepository.findByActiveTrueOrderByLastNameAscFirstNameAsc().stream()
                .filter(staff -> !unavailable.contains(staff.getId()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Vehicle> getAvailableVehicles(LocalDate date, LocalTime startTime, LocalTime endTime) {
        Set<UUID> blackedOut = blackedOutVehicleIds(toInterval(date, startTime, endTime));
        return vehicleRepository.findByActiveTrueOrderByRegistrationAsc().stream()
                .filter(vehicle -> !blackedOut.contains(vehicle.getId()))
                .toList();
    }

    @Transactional(readOnly = true)
    public Set<UUID> unavailableStaffIds(TimeInterval interval) {
        return new HashSet<>(staffUnavailabilityRepository.findStaffIdsUnavailableBetween(interval.start(), interval.end()));
    }

    @Transactional(readOnly = true)
    public Set<UUID> blackedOutVehicleIds(TimeInterval interval) {
        return new HashSet<>(vehicleBlackoutRepository.findVehicleIdsBlackedOutBetween(interval.start(), interval.end()));
    }

    public AvailabilityConflictResponse createStaffUnavailability(UUID staffId,
                                                                  OffsetDateTime startAt,
                                                                  OffsetDateTime endAt,
                                                                  String reason) {
        TimeInterval interval = requireInterval(startAt, endAt);
        Staff staff = staffRepository.findById(staffId)
                .orElseThrow(() -> ProblemException.notFound("STAFF_NOT_FOUND", "Staff " + staffId + " does not exist"));
        if (staffUnavailabilityRepository.existsOverlapping(staffId, interval.start(), interval.end())) {
            throw ProblemException.conflict("STAFF_UNAVAILABILITY_OVERLAP",
                    "Staff " + staffId + " already has unavailability overlapping this period");
        }
        StaffUnavailability saved = staffUnavailabilityRepository.save(new StaffUnavailability(staff, interval, reason));

        Set<UUID> affected = new LinkedHashSet<>();
        List<StaffShift> shifts = staffShiftRepository.findPlannedForStaffOverlapping(staffId, interval.start(), interval.end());
        for (StaffShift shift : shifts) {
            LoomInstance instance = shift.getLoomInstance();
            Map<String, Object> before = instance.toAuditState();
            instance.recordStaffing(StepStatus.NEEDS_ATTENTION);
            Map<String, Object> after = conflictState(saved.getId(), interval, reason);
            after.put("shiftId", shift.getId().toString());
            after.put("staffId", staffId.toString());
            after.putAll(instance.toAuditState());
            auditLogService.record(new AuditLogCommand(
                    instance.getId(), AuditAction.STAFF_UNAVAILABILITY_CONFLICT, before, after));
            affected.add(instance.getId());
        }
        if (!affected.isEmpty()) {
            log.warn("Staff unavailability {} for staff {} conflicts with {} instance(s)", saved.getId(), staffId, affected.size());
        }
        return new AvailabilityConflictResponse(saved.getId(), List.copyOf(affected));
    }

    public AvailabilityConflictResponse createVehicleBlackout(UUID vehicleId,
                                                              OffsetDateTime startAt,
                                                              OffsetDateTime endAt,
                                                              String reason) {
        TimeInterval interval = requireInterval(startAt, endAt);
        Vehicle vehicle = vehicleRepository.findById(vehicleId)
                .orElseThrow(() -> ProblemException.notFound("VEHICLE_NOT_FOUND", "Vehicle " + vehicleId + " does not exist"));
        if (vehicleBlackoutRepository.existsOverlapping(vehicleId, interval.start(), interval.end())) {
            throw ProblemException.conflict("VEHICLE_BLACKOUT_OVERLAP",
                    "Vehicle " + vehicleId + " already has a blackout overlapping this period");
        }
        VehicleBlackout saved = vehicleBlackoutRepository.save(new VehicleBlackout(vehicle, interval, reason));

        ZoneId zone = clock.getZone();
        LocalDate fromDate = interval.start().atZoneSameInstant(zone).toLocalDate();
        LocalDate toDate = interval.end().atZoneSameInstant(zone).toLocalDate();
        Set<UUID> affected = new LinkedHashSet<>();
        for (VehicleRun run : vehicleRunRepository.findForVehicleBetween(vehicleId, fromDate, toDate)) {
            LoomInstance instance = run.getLoomInstance();
            if (!instance.interval(zone).overlaps(interval) || affected.contains(instance.getId())) {
                continue;
            }
            Map<String, Object> before = instance.toAuditState();
            instance.recordTransport(StepStatus.NEEDS_ATTENTION);
            Map<String, Object> after = conflictState(saved.getId(), interval, reason);
            after.put("runId", run.getId().toString());
            after.put("vehicleId", vehicleId.toString());
            after.putAll(instance.toAuditState());
            auditLogService.record(new AuditLogCommand(
                    instance.getId(), AuditAction.VEHICLE_BLACKOUT_CONFLICT, before, after));
            affected.add(instance.getId());
        }
        if (!affected.isEmpty()) {
            log.warn("Vehicle blackout {} for vehicle {} conflicts with {} instance(s)", saved.getId(), vehicleId, affected.size());
        }
        return new AvailabilityConflictResponse(saved.getId(), List.copyOf(affected));
    }

    public TimeInterval toInterval(LocalDate date, LocalTime startTime, LocalTime endTime) {
        if (date == null || startTime == null || endTime == null) {
            throw ProblemException.badRequest("TIME_RANGE_REQUIRED", "date, start and end are required");
        }
        if (!endTime.isAfter(startTime)) {
            throw ProblemException.badRequest("INVALID_TIME_RANGE", "end must be after start");
        }
        return TimeInterval.of(date, startTime, endTime, clock.getZone());
    }

    private TimeInterval requireInterval(OffsetDateTime startAt, OffsetDateTime endAt) {
        if (startAt == null || endAt == null) {
            throw ProblemException.badRequest("TIME_RANGE_REQUIRED", "startAt and endAt are required");
        }
        if (!endAt.isAfter(startAt)) {
            throw ProblemException.badRequest("INVALID_TIME_RANGE", "endAt must be after startAt");
        }
        return new TimeInterval(startAt, endAt);
    }

    private Map<String, Object> conflictState(UUID recordId, TimeInterval interval, String reason) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("recordId", recordId.toString());
        state.put("startAt", interval.start().toString());
        state.put("endAt", interval.end().toString());
        state.put("reason", reason);
        return state;
    }
}
