package com.ryuqq.runlog.adapter.runner;

import com.ryuqq.runlog.core.protection.Bulkhead;
import com.ryuqq.runlog.core.protection.BulkheadConfig;

import java.util.concurrent.Semaphore;

/**
 * Semaphore 기반 카운팅 admission gate.
 *
 * <p>허가(permit) 수는 {@link BulkheadConfig#maxConcurrentCalls()}로 고정되며,
 * 카운터 갱신은 Semaphore가 원자적으로 처리합니다.</p>
 *
 * <p>대기 기능은 없습니다. 진입하지 못한 작업은 호출 측 대기열에서 다음 release를 기다립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SemaphoreBulkhead implements Bulkhead {

    private final BulkheadConfig config;
    private final Semaphore semaphore;

    /**
     * 생성자.
     *
     * @param config Bulkhead 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SemaphoreBulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.semaphore = new Semaphore(config.maxConcurrentCalls());
    }

    @Override
    public boolean tryAcquire() {
        return semaphore.tryAcquire();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException 진입한 작업이 없는데 release를 호출한 경우
     */
    @Override
    public void release() {
        if (semaphore.availablePermits() >= config.maxConcurrentCalls()) {
            throw new IllegalStateException("release() called without a matching tryAcquire()");
        }
        semaphore.release();
    }

    @Override
    public int getCurrentConcurrency() {
        return config.maxConcurrentCalls() - semaphore.availablePermits();
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }
}
