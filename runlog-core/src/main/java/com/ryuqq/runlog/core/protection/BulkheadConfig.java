package com.ryuqq.runlog.core.protection;

/**
 * Bulkhead 설정.
 *
 * @param maxConcurrentCalls 최대 동시 실행 수 (예: 10)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrentCalls) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrentCalls is not positive
     */
    public BulkheadConfig {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive (current: " + maxConcurrentCalls + ")");
        }
    }

    /**
     * 무제한 설정.
     *
     * @return maxConcurrentCalls = Integer.MAX_VALUE
     */
    public static BulkheadConfig unlimited() {
        return new BulkheadConfig(Integer.MAX_VALUE);
    }
}
