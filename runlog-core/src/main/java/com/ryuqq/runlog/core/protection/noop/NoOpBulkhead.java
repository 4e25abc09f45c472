package com.ryuqq.runlog.core.protection.noop;

import com.ryuqq.runlog.core.protection.Bulkhead;
import com.ryuqq.runlog.core.protection.BulkheadConfig;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수 제한을 적용하지 않습니다.
 * 제한값 없이 gather를 호출할 때 모든 작업을 즉시 진입시키는 데 사용합니다.
 * 상태가 없으므로 {@link #INSTANCE} 하나를 공유합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>release(): 아무 동작 안 함</li>
 *   <li>getCurrentConcurrency(): 항상 0 반환</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    /**
     * 공유 인스턴스.
     */
    public static final NoOpBulkhead INSTANCE = new NoOpBulkhead();

    private static final BulkheadConfig UNLIMITED_CONFIG = BulkheadConfig.unlimited();

    private NoOpBulkhead() {
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void release() {
        // 추적하는 permit 없음
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
