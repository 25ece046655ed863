package com.rabs.backend.modules.loom;

import static com.rabs.backend.support.LoomFixtures.allocation;
import static com.rabs.backend.support.LoomFixtures.instance;
import static com.rabs.backend.support.LoomFixtures.participant;
import static com.rabs.backend.support.LoomFixtures.program;
import static com.rabs.backend.support.LoomFixtures.shift;
import static com.rabs.backend.support.LoomFixtures.staff;
import static com.rabs.backend.support.LoomFixtures.uuid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.loom.application.LoomFailureKind;
import com.rabs.backend.modules.loom.application.LoomRebalanceService;
import com.rabs.backend.modules.loom.application.LoomResult;
import com.rabs.backend.modules.loom.application.LoomSettingsService;
import com.rabs.backend.modules.loom.application.StaffCandidateFinder;
import com.rabs.backend.modules.loom.application.StaffCandidateFinder.StaffCandidate;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.CancellationType;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.LoomInstanceStatus;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.domain.StaffRole;
import com.rabs.backend.modules.loom.domain.StaffShift;
import com.rabs.backend.modules.loom.domain.StaffShiftStatus;
import com.rabs.backend.modules.loom.domain.StepStatus;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.infrastructure.StaffShiftRepository;
import com.rabs.backend.modules.loom.presentation.dto.CancellationResponse;
import com.rabs.backend.modules.loom.presentation.dto.SicknessResponse;
import com.rabs.backend.modules.staff.domain.Staff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class LoomRebalanceServiceTest {

    private static final UUID INSTANCE_ID = uuid(1);
    private static final UUID ALLOCATION_ID = uuid(2);
    private static final UUID SHIFT_ID = uuid(3);

    @Mock
    private ParticipantAllocationRepository participantAllocationRepository;

    @Mock
    private StaffShiftRepository staffShiftRepository;

    @Mock
    private StaffCandidateFinder staffCandidateFinder;

    @Mock
    private LoomSettingsService loomSettingsService;

    @Mock
    private AuditLogService auditLogService;

    private LoomRebalanceService loomRebalanceService;
    private LoomInstance instance;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2025-01-05T22:00:00Z"), ZoneId.of("Australia/Sydney"));
        loomRebalanceService = new LoomRebalanceService(
                participantAllocationRepository,
                staffShiftRepository,
                staffCandidateFinder,
                loomSettingsService,
                auditLogService,
                clock
        );
        instance = instance(program(true), INSTANCE_ID);
        lenient().when(loomSettingsService.participantsPerSupportWorker()).thenReturn(5);
        lenient().when(staffShiftRepository.save(any(StaffShift.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("cancellation releases surplus support workers, newest placement first")
    void cancellationReleasesNewestSupport() {
        ParticipantAllocation allocation = allocation(instance, participant(50, "Pat", "Quinn", "Newtown"), ALLOCATION_ID);
        StaffShift oldest = shift(instance, staff(11, "Ada", "Brown", 38), StaffRole.SUPPORT, 2, uuid(21));
        StaffShift middle = shift(instance, staff(12, "Ben", "Chan", 38), StaffRole.SUPPORT, 3, uuid(22));
        StaffShift newest = shift(instance, staff(13, "Cy", "Dunn", 38), StaffRole.SUPPORT, 4, uuid(23));

        when(participantAllocationRepository.findWithInstanceById(ALLOCATION_ID)).thenReturn(Optional.of(allocation));
        when(participantAllocationRepository.countByLoomInstance_IdAndStatus(INSTANCE_ID, AllocationStatus.PLANNED)).thenReturn(4L);
        when(staffShiftRepository.countByInstanceAndStatusAndRoles(eq(INSTANCE_ID), eq(StaffShiftStatus.PLANNED), eq(EnumSet.of(StaffRole.LEAD, StaffRole.SUPPORT))))
                .thenReturn(4L);
        when(staffShiftRepository.findByInstanceAndStatusAndRoleNewestFirst(INSTANCE_ID, StaffShiftStatus.PLANNED, StaffRole.SUPPORT))
                .thenReturn(List.of(newest, middle, oldest));

        LoomResult<CancellationResponse> result = loomRebalanceService.cancelParticipant(ALLOCATION_ID, CancellationType.SHORT_NOTICE);

        assertThat(result.success()).isTrue();
        assertThat(allocation.getStatus()).isEqualTo(AllocationStatus.CANCELLED);
        assertThat(allocation.getCancellationType()).isEqualTo(CancellationType.SHORT_NOTICE);
        assertThat(allocation.getCancelledAt()).isNotNull();
        assertThat(result.data().requiredNonDriverStaff()).isEqualTo(2);
        assertThat(result.data().releasedShiftIds()).containsExactly(uuid(23), uuid(22));
        assertThat(newest.getStatus()).isEqualTo(StaffShiftStatus.RELEASED);
        assertThat(middle.getStatus()).isEqualTo(StaffShiftStatus.RELEASED);
        assertThat(oldest.getStatus()).isEqualTo(StaffShiftStatus.PLANNED);
        assertThat(newest.getNotes()).contains("4 participants planned");
        // drivers are never counted against the participant ratio
        verify(staffShiftRepository).countByInstanceAndStatusAndRoles(
                INSTANCE_ID, StaffShiftStatus.PLANNED, EnumSet.of(StaffRole.LEAD, StaffRole.SUPPORT));
    }

    @Test
    @DisplayName("cancellation keeps staffing when the requirement has not dropped")
    void cancellationWithoutSurplus() {
        ParticipantAllocation allocation = allocation(instance, participant(50, "Pat", "Quinn", "Newtown"), ALLOCATION_ID);
        when(participantAllocationRepository.findWithInstanceById(ALLOCATION_ID)).thenReturn(Optional.of(allocation));
        when(participantAllocationRepository.countByLoomInstance_IdAndStatus(INSTANCE_ID, AllocationStatus.PLANNED)).thenReturn(6L);
        when(staffShiftRepository.countByInstanceAndStatusAndRoles(eq(INSTANCE_ID), eq(StaffShiftStatus.PLANNED), eq(EnumSet.of(StaffRole.LEAD, StaffRole.SUPPORT))))
                .thenReturn(3L);

        LoomResult<CancellationResponse> result = loomRebalanceService.cancelParticipant(ALLOCATION_ID, CancellationType.NORMAL);

        assertThat(result.data().releasedShiftIds()).isEmpty();
        verify(staffShiftRepository, never()).findByInstanceAndStatusAndRoleNewestFirst(any(), any(), any());
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().action()).isEqualTo(AuditAction.PARTICIPANT_CANCELLED);
    }

    @Test
    @DisplayName("cancelling an already cancelled allocation is a conflict with no state change")
    void alreadyCancelled() {
        ParticipantAllocation allocation = allocation(instance, participant(50, "Pat", "Quinn", "Newtown"), ALLOCATION_ID);
        allocation.cancel(CancellationType.NORMAL, OffsetDateTime.now(clock));
        when(participantAllocationRepository.findWithInstanceById(ALLOCATION_ID)).thenReturn(Optional.of(allocation));

        assertThatThrownBy(() -> loomRebalanceService.cancelParticipant(ALLOCATION_ID, CancellationType.SHORT_NOTICE))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(problem.getCode()).isEqualTo("ALLOCATION_ALREADY_CANCELLED");
                });
        assertThat(allocation.getCancellationType()).isEqualTo(CancellationType.NORMAL);
        verify(auditLogService, never()).record(any());
    }

    @Test
    @DisplayName("sick staff are replaced by the best ranked free candidate")
    void sicknessReplaced() {
        Staff sick = staff(11, "Ada", "Brown", 38);
        Staff cover = staff(14, "Dee", "Evans", 30);
        StaffShift shift = shift(instance, sick, StaffRole.SUPPORT, 2, SHIFT_ID);
        when(staffShiftRepository.findWithInstanceById(SHIFT_ID)).thenReturn(Optional.of(shift));
        when(staffShiftRepository.findStaffIdsOnInstance(INSTANCE_ID)).thenReturn(Set.of(sick.getId(), uuid(12)));
        when(staffShiftRepository.findMaxAssignmentOrder(INSTANCE_ID)).thenReturn(3);
        when(staffCandidateFinder.findCandidates(eq(instance), any())).thenReturn(List.of(new StaffCandidate(cover, 1800)));

        LoomResult<SicknessResponse> result = loomRebalanceService.handleStaffSickness(SHIFT_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.data().outcome()).isEqualTo(SicknessResponse.REPLACED);
        assertThat(result.data().replacementStaffId()).isEqualTo(cover.getId());
        assertThat(shift.getStatus()).isEqualTo(StaffShiftStatus.REPLACED);

        ArgumentCaptor<StaffShift> saved = ArgumentCaptor.forClass(StaffShift.class);
        verify(staffShiftRepository).save(saved.capture());
        assertThat(saved.getValue().getRole()).isEqualTo(StaffRole.SUPPORT);
        assertThat(saved.getValue().getStartAt()).isEqualTo(shift.getStartAt());
        assertThat(saved.getValue().getAssignmentOrder()).isEqualTo(4);
        assertThat(saved.getValue().getNotes()).isEqualTo("Replacement for Ada Brown (sick)");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Set<UUID>> excluded = ArgumentCaptor.forClass(Set.class);
        verify(staffCandidateFinder).findCandidates(eq(instance), excluded.capture());
        assertThat(excluded.getValue()).contains(sick.getId(), uuid(12));
    }

    @Test
    @DisplayName("sick staff without a replacement flag the shift and the instance")
    void sicknessFlagged() {
        StaffShift shift = shift(instance, staff(11, "Ada", "Brown", 38), StaffRole.LEAD, 1, SHIFT_ID);
        when(staffShiftRepository.findWithInstanceById(SHIFT_ID)).thenReturn(Optional.of(shift));
        when(staffShiftRepository.findStaffIdsOnInstance(INSTANCE_ID)).thenReturn(Set.of(uuid(11)));
        when(staffCandidateFinder.findCandidates(eq(instance), any())).thenReturn(List.of());

        LoomResult<SicknessResponse> result = loomRebalanceService.handleStaffSickness(SHIFT_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.INSUFFICIENT_RESOURCES);
        assertThat(result.data().outcome()).isEqualTo(SicknessResponse.FLAGGED);
        assertThat(shift.getStatus()).isEqualTo(StaffShiftStatus.FLAGGED);
        assertThat(instance.getOptimisationState().getStaffingStatus()).isEqualTo(StepStatus.NEEDS_ATTENTION);
        assertThat(instance.getStatus()).isEqualTo(LoomInstanceStatus.NEEDS_ATTENTION);
        verify(staffShiftRepository, never()).save(any());
    }

    @Test
    @DisplayName("sickness on a shift that is no longer planned is a conflict")
    void sicknessOnReleasedShift() {
        StaffShift shift = shift(instance, staff(11, "Ada", "Brown", 38), StaffRole.SUPPORT, 2, SHIFT_ID);
        shift.release("Released after cancellation: 3 participants planned");
        when(staffShiftRepository.findWithInstanceById(SHIFT_ID)).thenReturn(Optional.of(shift));

        assertThatThrownBy(() -> loomRebalanceService.handleStaffSickness(SHIFT_ID))
                .isInstanceOf(ProblemException.class)
                .hasMessageContaining("SHIFT_NOT_ELIGIBLE_FOR_SICKNESS");
    }
}
