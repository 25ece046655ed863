package com.rabs.backend.modules.loom;

import static com.rabs.backend.support.LoomFixtures.allocation;
import static com.rabs.backend.support.LoomFixtures.instance;
import static com.rabs.backend.support.LoomFixtures.participant;
import static com.rabs.backend.support.LoomFixtures.program;
import static com.rabs.backend.support.LoomFixtures.uuid;
import static com.rabs.backend.support.LoomFixtures.vehicle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.availability.application.AvailabilityService;
import com.rabs.backend.modules.loom.application.LoomFailureKind;
import com.rabs.backend.modules.loom.application.LoomResult;
import com.rabs.backend.modules.loom.application.VehicleAssignmentService;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.LoomInstanceStatus;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.domain.VehicleRun;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.infrastructure.VehicleRunRepository;
import com.rabs.backend.modules.loom.presentation.dto.VehicleAssignmentResponse;
import com.rabs.backend.modules.loom.presentation.dto.VehicleRunResponse;
import com.rabs.backend.modules.vehicle.domain.Vehicle;
import com.rabs.backend.modules.vehicle.infrastructure.VehicleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VehicleAssignmentServiceTest {

    private static final UUID INSTANCE_ID = uuid(100);

    @Mock
    private LoomInstanceRepository loomInstanceRepository;

    @Mock
    private ParticipantAllocationRepository participantAllocationRepository;

    @Mock
    private VehicleRunRepository vehicleRunRepository;

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private AvailabilityService availabilityService;

    @Mock
    private AuditLogService auditLogService;

    private VehicleAssignmentService vehicleAssignmentService;
    private LoomInstance instance;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-05T13:00:00Z"), ZoneId.of("Australia/Sydney"));
        vehicleAssignmentService = new VehicleAssignmentService(
                loomInstanceRepository,
                participantAllocationRepository,
                vehicleRunRepository,
                vehicleRepository,
                availabilityService,
                auditLogService,
                clock
        );
        instance = instance(program(false), INSTANCE_ID);
        lenient().when(loomInstanceRepository.findWithProgramById(INSTANCE_ID)).thenReturn(Optional.of(instance));
        lenient().when(vehicleRunRepository.findVehicleIdsUsedOn(instance.getInstanceDate(), INSTANCE_ID)).thenReturn(Set.of());
        lenient().when(availabilityService.blackedOutVehicleIds(any())).thenReturn(Set.of());
        lenient().when(vehicleRunRepository.save(any(VehicleRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("centre-based programs need no transport and keep their runs")
    void centreBasedSkipped() {
        LoomInstance centre = instance(program(true), INSTANCE_ID);
        when(loomInstanceRepository.findWithProgramById(INSTANCE_ID)).thenReturn(Optional.of(centre));

        LoomResult<VehicleAssignmentResponse> result = vehicleAssignmentService.assignVehicles(INSTANCE_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.data().transportRequired()).isFalse();
        verify(vehicleRunRepository, never()).deleteByInstance(any());
        verifyNoInteractions(vehicleRepository, auditLogService);
    }

    @Test
    @DisplayName("passengers fill vehicles in order, keeping the driver seat free")
    void packsPassengersLeavingDriverSeat() {
        givenPassengers(5);
        Vehicle van = vehicle(501, "VAN-001", 4);
        Vehicle bus = vehicle(502, "BUS-001", 8);
        when(vehicleRepository.findByActiveTrueOrderByRegistrationAsc()).thenReturn(List.of(bus, van));

        LoomResult<VehicleAssignmentResponse> result = vehicleAssignmentService.assignVehicles(INSTANCE_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.data().runs()).extracting(VehicleRunResponse::registration, VehicleRunResponse::seatsUsed)
                .containsExactly(tuple("BUS-001", 5));
        assertThat(result.data().seatBudget()).isEqualTo(7);
        verify(vehicleRunRepository).deleteByInstance(INSTANCE_ID);

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(AuditAction.VEHICLES_ASSIGNED);
    }

    @Test
    @DisplayName("vehicles in use elsewhere that day or blacked out are not offered")
    void excludesUsedAndBlackedOutVehicles() {
        givenPassengers(3);
        Vehicle used = vehicle(501, "AAA-001", 12);
        Vehicle blackedOut = vehicle(502, "BBB-001", 12);
        Vehicle free = vehicle(503, "CCC-001", 4);
        when(vehicleRepository.findByActiveTrueOrderByRegistrationAsc()).thenReturn(List.of(used, blackedOut, free));
        when(vehicleRunRepository.findVehicleIdsUsedOn(instance.getInstanceDate(), INSTANCE_ID)).thenReturn(Set.of(used.getId()));
        when(availabilityService.blackedOutVehicleIds(any())).thenReturn(Set.of(blackedOut.getId()));

        LoomResult<VehicleAssignmentResponse> result = vehicleAssignmentService.assignVehicles(INSTANCE_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.data().runs()).singleElement().satisfies(run -> {
            assertThat(run.vehicleId()).isEqualTo(free.getId());
            assertThat(run.seatsUsed()).isEqualTo(3);
            assertThat(run.routeData()).containsKey("stops");
        });
    }

    @Test
    @DisplayName("too few seats flags the instance without creating runs")
    void insufficientSeats() {
        givenPassengers(6);
        when(vehicleRepository.findByActiveTrueOrderByRegistrationAsc()).thenReturn(List.of(vehicle(501, "VAN-001", 4)));

        LoomResult<VehicleAssignmentResponse> result = vehicleAssignmentService.assignVehicles(INSTANCE_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.INSUFFICIENT_RESOURCES);
        assertThat(result.error().code()).isEqualTo("INSUFFICIENT_VEHICLES");
        assertThat(result.data().passengerCount()).isEqualTo(6);
        assertThat(result.data().seatBudget()).isEqualTo(3);
        assertThat(instance.getStatus()).isEqualTo(LoomInstanceStatus.NEEDS_ATTENTION);
        verify(vehicleRunRepository, never()).save(any());

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(AuditAction.VEHICLES_INSUFFICIENT);
        assertThat(audit.getValue().afterState()).containsEntry("passengerCount", 6);
    }

    @Test
    @DisplayName("no planned passengers completes transport with no runs")
    void noPassengers() {
        when(participantAllocationRepository.findByInstanceAndStatusForRouting(INSTANCE_ID, AllocationStatus.PLANNED))
                .thenReturn(List.of());

        LoomResult<VehicleAssignmentResponse> result = vehicleAssignmentService.assignVehicles(INSTANCE_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.data().runs()).isEmpty();
        verifyNoInteractions(vehicleRepository);
    }

    private void givenPassengers(int count) {
        List<ParticipantAllocation> allocations = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            allocations.add(allocation(instance, participant(200 + i, "P" + i, "Rider", "Parramatta"), uuid(300 + i)));
        }
        when(participantAllocationRepository.findByInstanceAndStatusForRouting(INSTANCE_ID, AllocationStatus.PLANNED))
                .thenReturn(allocations);
    }
}
