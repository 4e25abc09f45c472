package com.ryuqq.runlog.core.statemachine;

/**
 * 번역기가 추적하는 하위 run의 생명주기 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING (id 없음)
 *    │
 *    ▼ (start 방출)
 * RUNNING_NO_OUTPUT
 *    │
 *    ├─► RUNNING_STREAMING (stream 방출, 자기 전이 가능)
 *    │        │
 *    │        └─► ENDED
 *    │
 *    └─► ENDED (end 방출)
 *
 * 금지된 전이:
 * - ENDED → * ❌
 * - RUNNING_STREAMING → RUNNING_NO_OUTPUT ❌
 * - * → PENDING ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunPhase {

    /**
     * 아직 id가 없음 (번역기가 인지하지 못한 상태).
     */
    PENDING,

    /**
     * 시작됨, 아직 청크 없음.
     */
    RUNNING_NO_OUTPUT,

    /**
     * 청크를 한 번 이상 방출함.
     */
    RUNNING_STREAMING,

    /**
     * 종료 (end_time 설정됨).
     */
    ENDED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ENDED인 경우 true
     */
    public boolean isTerminal() {
        return this == ENDED;
    }

    /**
     * start 이벤트가 이미 방출되었는지 확인.
     *
     * @return PENDING이 아니면 true
     */
    public boolean isStarted() {
        return this != PENDING;
    }
}
