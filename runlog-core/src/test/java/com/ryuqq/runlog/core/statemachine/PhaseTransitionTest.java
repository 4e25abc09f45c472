package com.ryuqq.runlog.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.runlog.core.statemachine.RunPhase.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PhaseTransition 테스트.
 *
 * <ul>
 *   <li>PENDING → RUNNING_NO_OUTPUT → RUNNING_STREAMING → ENDED 정상 전이</li>
 *   <li>RUNNING_NO_OUTPUT → ENDED (스트리밍 없이 종료) 정상 전이</li>
 *   <li>ENDED에서의 모든 전이는 IllegalStateException</li>
 *   <li>단계 건너뛰기/역행은 IllegalStateException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PhaseTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_StreamingFlow_Succeeds() {
        // Given
        RunPhase phase = PENDING;

        // When
        phase = PhaseTransition.transition(phase, RUNNING_NO_OUTPUT);
        phase = PhaseTransition.transition(phase, RUNNING_STREAMING);
        phase = PhaseTransition.transition(phase, RUNNING_STREAMING);
        phase = PhaseTransition.transition(phase, ENDED);

        // Then
        assertEquals(ENDED, phase);
        assertTrue(phase.isTerminal());
    }

    @Test
    void validate_RunningNoOutputToEnded_Succeeds() {
        assertDoesNotThrow(() -> PhaseTransition.validate(RUNNING_NO_OUTPUT, ENDED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_EndedToStreaming_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PhaseTransition.validate(ENDED, RUNNING_STREAMING)
        );
        assertTrue(exception.getMessage().contains("Cannot transition from terminal phase"));
    }

    @Test
    void validate_PendingToEnded_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> PhaseTransition.validate(PENDING, ENDED)
        );
        assertTrue(exception.getMessage().contains("Invalid phase transition"));
    }

    @Test
    void validate_StreamingToNoOutput_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.validate(RUNNING_STREAMING, RUNNING_NO_OUTPUT));
    }

    @Test
    void validate_NullPhase_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> PhaseTransition.validate(null, ENDED));
        assertThrows(IllegalArgumentException.class, () -> PhaseTransition.validate(PENDING, null));
    }

    @Test
    void isStarted_OnlyPendingIsNotStarted() {
        assertFalse(PENDING.isStarted());
        assertTrue(RUNNING_NO_OUTPUT.isStarted());
        assertTrue(RUNNING_STREAMING.isStarted());
        assertTrue(ENDED.isStarted());
    }
}
