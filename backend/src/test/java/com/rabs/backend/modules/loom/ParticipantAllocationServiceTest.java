package com.rabs.backend.modules.loom;

import static com.rabs.backend.support.LoomFixtures.instance;
import static com.rabs.backend.support.LoomFixtures.participant;
import static com.rabs.backend.support.LoomFixtures.program;
import static com.rabs.backend.support.LoomFixtures.uuid;
import static com.rabs.backend.support.LoomFixtures.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.audit.application.AuditLogService;
import com.rabs.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rabs.backend.modules.audit.domain.AuditAction;
import com.rabs.backend.modules.loom.application.LoomResult;
import com.rabs.backend.modules.loom.application.ParticipantAllocationService;
import com.rabs.backend.modules.loom.domain.AllocationStatus;
import com.rabs.backend.modules.loom.domain.LoomInstance;
import com.rabs.backend.modules.loom.domain.LoomInstanceStatus;
import com.rabs.backend.modules.loom.domain.ParticipantAllocation;
import com.rabs.backend.modules.loom.infrastructure.LoomInstanceRepository;
import com.rabs.backend.modules.loom.infrastructure.ParticipantAllocationRepository;
import com.rabs.backend.modules.loom.presentation.dto.ParticipantAllocationResponse;
import com.rabs.backend.modules.participant.domain.Participant;
import com.rabs.backend.modules.program.domain.Enrollment;
import com.rabs.backend.modules.program.domain.EnrollmentBillingCode;
import com.rabs.backend.modules.program.domain.Program;
import com.rabs.backend.modules.program.infrastructure.EnrollmentRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ParticipantAllocationServiceTest {

    private static final UUID INSTANCE_ID = uuid(100);

    @Mock
    private LoomInstanceRepository loomInstanceRepository;

    @Mock
    private ParticipantAllocationRepository participantAllocationRepository;

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private AuditLogService auditLogService;

    private ParticipantAllocationService participantAllocationService;
    private Program program;

    @BeforeEach
    void setUp() {
        participantAllocationService = new ParticipantAllocationService(
                loomInstanceRepository,
                participantAllocationRepository,
                enrollmentRepository,
                auditLogService
        );
        program = program(true);
    }

    @Test
    @DisplayName("new enrolments are allocated with their default billing code and existing ones are skipped")
    void allocatesOnlyNewParticipants() {
        LoomInstance instance = withId(new LoomInstance(program, LocalDate.of(2025, 1, 7)), INSTANCE_ID);
        Participant existing = participant(201, "Jamie", "Existing", "Penrith");
        Participant billed = participant(202, "Kai", "Billed", "Penrith");
        Participant unbilled = participant(203, "Lee", "Unbilled", "Blacktown");
        Enrollment billedEnrollment = enrollment(billed);
        billedEnrollment.addBillingCode(new EnrollmentBillingCode("04_104_0125_6_1", new BigDecimal("67.56"), new BigDecimal("6"), true));

        when(loomInstanceRepository.findWithProgramById(INSTANCE_ID)).thenReturn(Optional.of(instance));
        when(participantAllocationRepository.findParticipantIdsByInstance(INSTANCE_ID)).thenReturn(Set.of(existing.getId()));
        when(enrollmentRepository.findEligibleForDate(program.getId(), instance.getInstanceDate()))
                .thenReturn(List.of(enrollment(existing), billedEnrollment, enrollment(unbilled)));
        when(participantAllocationRepository.save(any(ParticipantAllocation.class)))
                .thenAnswer(invocation -> withId(invocation.<ParticipantAllocation>getArgument(0), UUID.randomUUID()));
        when(participantAllocationRepository.countByLoomInstance_IdAndStatus(INSTANCE_ID, AllocationStatus.PLANNED)).thenReturn(3L);

        LoomResult<ParticipantAllocationResponse> result = participantAllocationService.allocateParticipants(INSTANCE_ID);

        assertThat(result.success()).isTrue();
        assertThat(result.data().createdAllocationIds()).hasSize(2);
        assertThat(result.data().plannedParticipants()).isEqualTo(3);
        assertThat(instance.getStatus()).isEqualTo(LoomInstanceStatus.GENERATED);

        ArgumentCaptor<ParticipantAllocation> saved = ArgumentCaptor.forClass(ParticipantAllocation.class);
        verify(participantAllocationRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(ParticipantAllocation::getBillingCode)
                .containsExactly("04_104_0125_6_1", ParticipantAllocation.FALLBACK_BILLING_CODE);

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService, times(2)).record(audit.capture());
        assertThat(audit.getAllValues()).extracting(AuditLogCommand::action)
                .containsOnly(AuditAction.PARTICIPANT_ALLOCATED);
    }

    @Test
    @DisplayName("allocating an unknown instance is not found")
    void unknownInstance() {
        when(loomInstanceRepository.findWithProgramById(INSTANCE_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> participantAllocationService.allocateParticipants(INSTANCE_ID))
                .isInstanceOf(ProblemException.class)
                .hasMessageContaining("LOOM_INSTANCE_NOT_FOUND");
        verifyNoInteractions(enrollmentRepository, auditLogService);
    }

    private Enrollment enrollment(Participant participant) {
        Enrollment enrollment = new Enrollment();
        enrollment.setParticipant(participant);
        enrollment.setProgram(program);
        enrollment.setStartDate(LocalDate.of(2024, 12, 1));
        return enrollment;
    }
}
