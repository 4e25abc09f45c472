/**
 * Sub-run phase state machine package.
 *
 * <p>This package implements the phase rules the event translator applies per
 * sub-run, ensuring that every sub-run emits exactly one start and at most one end.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlog.core.statemachine.RunPhase} - Sub-run lifecycle phases (enum)</li>
 *   <li>{@link com.ryuqq.runlog.core.statemachine.PhaseTransition} - Phase transition validation and execution</li>
 * </ul>
 *
 * <h2>Phase Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING_NO_OUTPUT (start)
 * RUNNING_NO_OUTPUT → RUNNING_STREAMING (stream)
 * RUNNING_NO_OUTPUT → ENDED (end)
 * RUNNING_STREAMING → RUNNING_STREAMING (stream)
 * RUNNING_STREAMING → ENDED (end)
 *
 * Forbidden:
 * - ENDED → * (terminal phase)
 * - Backward transitions (e.g., RUNNING_STREAMING → RUNNING_NO_OUTPUT)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RunPhase phase = RunPhase.PENDING;
 * phase = PhaseTransition.transition(phase, RunPhase.RUNNING_NO_OUTPUT);
 * phase = PhaseTransition.transition(phase, RunPhase.ENDED);
 *
 * // This will throw IllegalStateException
 * PhaseTransition.validate(phase, RunPhase.RUNNING_STREAMING);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.core.statemachine;
