package com.ryuqq.runlog.core.protection;

/**
 * 동시 실행 수 제한 게이트(admission gate) SPI.
 *
 * <p>bounded gather가 동시에 실행할 작업 수를 제한할 때 사용하는 카운팅 게이트입니다.
 * 진입하지 못한 작업은 대기열에 남고 실행 자원을 점유하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (bulkhead.tryAcquire()) {
 *     try {
 *         runTask();
 *     } finally {
 *         bulkhead.release();
 *     }
 * } else {
 *     pending.add(task);
 * }
 * }</pre>
 *
 * <p><strong>동시성:</strong> 구현체는 카운터를 원자적으로 갱신해야 합니다 (thread-safe).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * Bulkhead 진입 시도 (비블로킹).
     *
     * @return true: 진입 허용, false: 동시 실행 제한 초과
     */
    boolean tryAcquire();

    /**
     * Bulkhead 진입 해제.
     *
     * <p>진입에 성공한 작업이 끝나면 반드시 호출해야 합니다.</p>
     */
    void release();

    /**
     * 현재 동시 실행 수 조회.
     *
     * @return 현재 진입 중인 작업 수
     */
    int getCurrentConcurrency();

    /**
     * Bulkhead 설정 정보 조회.
     *
     * @return Bulkhead 설정
     */
    BulkheadConfig getConfig();
}
