package com.ryuqq.runlog.core.statemachine;

/**
 * 하위 run 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING_NO_OUTPUT</li>
 *   <li>RUNNING_NO_OUTPUT → RUNNING_STREAMING</li>
 *   <li>RUNNING_NO_OUTPUT → ENDED</li>
 *   <li>RUNNING_STREAMING → RUNNING_STREAMING</li>
 *   <li>RUNNING_STREAMING → ENDED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> ENDED에서는 어떤 상태로도 전이 불가 (end는 정확히 1회)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunPhase from, RunPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == RunPhase.RUNNING_NO_OUTPUT;
            case RUNNING_NO_OUTPUT, RUNNING_STREAMING -> to == RunPhase.RUNNING_STREAMING || to == RunPhase.ENDED;
            case ENDED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunPhase transition(RunPhase current, RunPhase next) {
        validate(current, next);
        return next;
    }
}
