package com.rabs.backend.modules.loom;

import static com.rabs.backend.support.LoomFixtures.uuid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.rabs.backend.global.error.ProblemException;
import com.rabs.backend.modules.loom.application.LoomEngine;
import com.rabs.backend.modules.loom.application.LoomFailureKind;
import com.rabs.backend.modules.loom.application.LoomQueryService;
import com.rabs.backend.modules.loom.application.LoomRebalanceService;
import com.rabs.backend.modules.loom.application.LoomReoptimizationService;
import com.rabs.backend.modules.loom.application.LoomResult;
import com.rabs.backend.modules.loom.application.LoomSettingsService;
import com.rabs.backend.modules.loom.application.LoomWindowService;
import com.rabs.backend.modules.loom.application.ParticipantAllocationService;
import com.rabs.backend.modules.loom.application.StaffAssignmentService;
import com.rabs.backend.modules.loom.application.VehicleAssignmentService;
import com.rabs.backend.modules.loom.domain.CancellationType;
import com.rabs.backend.modules.loom.presentation.dto.CancellationResponse;
import com.rabs.backend.modules.loom.presentation.dto.LoomWindowResponse;
import com.rabs.backend.modules.loom.presentation.dto.ReoptimizationResponse;
import com.rabs.backend.modules.loom.presentation.dto.StaffAssignmentResponse;
import com.rabs.backend.modules.loom.presentation.dto.VehicleAssignmentResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class LoomEngineTest {

    private static final UUID INSTANCE_ID = uuid(100);

    @Mock
    private LoomWindowService loomWindowService;

    @Mock
    private LoomSettingsService loomSettingsService;

    @Mock
    private ParticipantAllocationService participantAllocationService;

    @Mock
    private StaffAssignmentService staffAssignmentService;

    @Mock
    private VehicleAssignmentService vehicleAssignmentService;

    @Mock
    private LoomReoptimizationService loomReoptimizationService;

    @Mock
    private LoomRebalanceService loomRebalanceService;

    @Mock
    private LoomQueryService loomQueryService;

    private LoomEngine loomEngine;

    @BeforeEach
    void setUp() {
        loomEngine = new LoomEngine(
                loomWindowService,
                loomSettingsService,
                participantAllocationService,
                staffAssignmentService,
                vehicleAssignmentService,
                loomReoptimizationService,
                loomRebalanceService,
                loomQueryService
        );
    }

    @Test
    @DisplayName("an out-of-range window size is a validation failure and generates nothing")
    void invalidWindowSize() {
        doThrow(ProblemException.badRequest("INVALID_WINDOW_SIZE", "Window size must be between 1 and 16 weeks, got 0"))
                .when(loomSettingsService).validateWindowWeeks(0);

        LoomResult<LoomWindowResponse> result = loomEngine.generateLoomWindow(0);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.VALIDATION);
        assertThat(result.error().code()).isEqualTo("INVALID_WINDOW_SIZE");
        verifyNoInteractions(loomWindowService);
    }

    @Test
    @DisplayName("unknown cancellation types are rejected before touching the allocation")
    void invalidCancellationType() {
        LoomResult<CancellationResponse> result = loomEngine.handleParticipantCancellation(uuid(300), "whenever");

        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.VALIDATION);
        assertThat(result.error().code()).isEqualTo("INVALID_CANCELLATION_TYPE");
        verifyNoInteractions(loomRebalanceService);
    }

    @Test
    @DisplayName("short_notice is passed through as a short-notice cancellation")
    void shortNoticeCancellation() {
        CancellationResponse response = new CancellationResponse(uuid(300), INSTANCE_ID, "SHORT_NOTICE", 3L, 2, List.of());
        when(loomRebalanceService.cancelParticipant(uuid(300), CancellationType.SHORT_NOTICE))
                .thenReturn(LoomResult.ok("Cancelled", response));

        LoomResult<CancellationResponse> result = loomEngine.handleParticipantCancellation(uuid(300), "short_notice");

        assertThat(result.success()).isTrue();
        assertThat(result.data()).isEqualTo(response);
    }

    @Test
    @DisplayName("missing instances map to NOT_FOUND and conflicts to CONFLICT")
    void problemKinds() {
        when(staffAssignmentService.assignStaff(INSTANCE_ID))
                .thenThrow(ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "missing"));
        when(vehicleAssignmentService.assignVehicles(INSTANCE_ID))
                .thenThrow(ProblemException.conflict("LOOM_INSTANCE_DUPLICATE", "raced"));

        assertThat(loomEngine.assignStaff(INSTANCE_ID).error().kind()).isEqualTo(LoomFailureKind.NOT_FOUND);
        assertThat(loomEngine.assignVehicles(INSTANCE_ID).error().kind()).isEqualTo(LoomFailureKind.CONFLICT);
    }

    @Test
    @DisplayName("unexpected persistence failures become STORAGE errors")
    void storageFailure() {
        when(staffAssignmentService.assignStaff(INSTANCE_ID))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        LoomResult<StaffAssignmentResponse> result = loomEngine.assignStaff(INSTANCE_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.STORAGE);
        assertThat(result.error().code()).isEqualTo("STORAGE_ERROR");
    }

    @Test
    @DisplayName("reoptimisation stops when participant allocation fails")
    void reoptimizeStopsOnAllocationFailure() {
        when(participantAllocationService.allocateParticipants(INSTANCE_ID))
                .thenThrow(ProblemException.notFound("LOOM_INSTANCE_NOT_FOUND", "missing"));

        LoomResult<ReoptimizationResponse> result = loomEngine.reoptimizeInstance(INSTANCE_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.NOT_FOUND);
        verify(loomReoptimizationService).prepare(INSTANCE_ID);
        verifyNoInteractions(staffAssignmentService, vehicleAssignmentService);
    }

    @Test
    @DisplayName("reoptimisation runs every step and surfaces a staffing shortfall")
    void reoptimizeSurfacesShortfall() {
        when(participantAllocationService.allocateParticipants(INSTANCE_ID))
                .thenReturn(LoomResult.ok("Allocated", null));
        when(staffAssignmentService.assignStaff(INSTANCE_ID))
                .thenReturn(LoomResult.insufficient("INSUFFICIENT_STAFF", "Need 3 staff but only 1 available", null));
        when(vehicleAssignmentService.assignVehicles(INSTANCE_ID))
                .thenReturn(LoomResult.<VehicleAssignmentResponse>ok("Assigned", null));

        LoomResult<ReoptimizationResponse> result = loomEngine.reoptimizeInstance(INSTANCE_ID);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(LoomFailureKind.INSUFFICIENT_RESOURCES);
        assertThat(result.data().vehicles().success()).isTrue();

        InOrder order = inOrder(loomReoptimizationService, participantAllocationService, staffAssignmentService, vehicleAssignmentService);
        order.verify(loomReoptimizationService).prepare(INSTANCE_ID);
        order.verify(participantAllocationService).allocateParticipants(INSTANCE_ID);
        order.verify(staffAssignmentService).assignStaff(INSTANCE_ID);
        order.verify(vehicleAssignmentService).assignVehicles(INSTANCE_ID);
    }

    @Test
    @DisplayName("resizing validates the size before reading the current window")
    void resizeValidatesFirst() {
        doThrow(ProblemException.badRequest("INVALID_WINDOW_SIZE", "too big"))
                .when(loomSettingsService).validateWindowWeeks(anyInt());

        assertThat(loomEngine.resizeLoomWindow(40).error().code()).isEqualTo("INVALID_WINDOW_SIZE");
        verify(loomSettingsService).validateWindowWeeks(40);
        verify(loomSettingsService, never()).updateWindowWeeks(anyInt());
        verifyNoInteractions(loomWindowService);
    }
}
