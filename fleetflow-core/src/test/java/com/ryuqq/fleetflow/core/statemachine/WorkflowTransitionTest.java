package com.ryuqq.fleetflow.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.fleetflow.core.statemachine.WorkflowState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowTransition 테스트.
 *
 * <ul>
 *   <li>표에 있는 전이는 모두 허용</li>
 *   <li>COMPLETED에서는 어떤 트리거도 거부</li>
 *   <li>ERROR에서는 RETRY, RETRIES_EXHAUSTED만 허용</li>
 *   <li>INGESTING으로 들어가는 트리거 없음</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
class WorkflowTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void next_HappyPathThroughAllStages_EndsCompleted() {
        // Given
        WorkflowState state = IDLE;

        // When
        state = WorkflowTransition.next(state, WorkflowTrigger.NEW_INPUT);
        state = WorkflowTransition.next(state, WorkflowTrigger.ANALYSIS_RESULT);
        state = WorkflowTransition.next(state, WorkflowTrigger.ENGAGEMENT_REQUIRED);
        state = WorkflowTransition.next(state, WorkflowTrigger.ENGAGEMENT_ACCEPTED);
        state = WorkflowTransition.next(state, WorkflowTrigger.BOOKING_CONFIRMED);
        state = WorkflowTransition.next(state, WorkflowTrigger.EXTERNAL_COMPLETION);
        state = WorkflowTransition.next(state, WorkflowTrigger.OUTCOME_RECORDED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void next_NoActionAfterAssessment_Completes() {
        // When
        WorkflowState state = WorkflowTransition.next(ASSESSING, WorkflowTrigger.NO_ACTION_REQUIRED);

        // Then
        assertEquals(COMPLETED, state);
    }

    @Test
    void next_Declined_Completes() {
        // Then
        assertEquals(COMPLETED, WorkflowTransition.next(ENGAGING, WorkflowTrigger.ENGAGEMENT_DECLINED));
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowState.class, names = {"COMPLETED", "ERROR"}, mode = EnumSource.Mode.EXCLUDE)
    void isAllowed_FailureFromAnyLiveState_Allowed(WorkflowState from) {
        // Then
        assertTrue(WorkflowTransition.isAllowed(from, WorkflowTrigger.FAILURE));
        assertEquals(ERROR, WorkflowTransition.next(from, WorkflowTrigger.FAILURE));
    }

    @Test
    void next_ErrorRetry_ReturnsIdle() {
        // Then
        assertEquals(IDLE, WorkflowTransition.next(ERROR, WorkflowTrigger.RETRY));
        assertEquals(COMPLETED, WorkflowTransition.next(ERROR, WorkflowTrigger.RETRIES_EXHAUSTED));
    }

    // ========== 불법 전이 ==========

    @ParameterizedTest
    @EnumSource(WorkflowTrigger.class)
    void validate_AnyTriggerFromCompleted_ThrowsException(WorkflowTrigger trigger) {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> WorkflowTransition.validate(COMPLETED, trigger)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowTrigger.class, names = {"RETRY", "RETRIES_EXHAUSTED"}, mode = EnumSource.Mode.EXCLUDE)
    void isAllowed_FromErrorOnlyRetryTriggers(WorkflowTrigger trigger) {
        // Then
        assertFalse(WorkflowTransition.isAllowed(ERROR, trigger));
    }

    @Test
    void validate_SkippingStage_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> WorkflowTransition.validate(ANALYZING, WorkflowTrigger.BOOKING_CONFIRMED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_RetryFromLiveState_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> WorkflowTransition.validate(SCHEDULING, WorkflowTrigger.RETRY));
    }

    @Test
    void noTriggerTargetsIngesting() {
        // Then
        for (WorkflowTrigger trigger : WorkflowTrigger.values()) {
            assertNotEquals(INGESTING, trigger.target());
        }
    }

    @Test
    void isAllowed_NullArguments_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> WorkflowTransition.isAllowed(null, WorkflowTrigger.NEW_INPUT)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void isActive_OnlyWaitingStates() {
        // Then
        assertFalse(IDLE.isActive());
        assertFalse(ERROR.isActive());
        assertFalse(COMPLETED.isActive());
        assertTrue(ANALYZING.isActive());
        assertTrue(AWAITING_EXTERNAL.isActive());
    }
}
