package com.ryuqq.runlog.adapter.runner;

/**
 * RunEventFanOut 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentSubscribers: 동시에 이벤트를 소비하는 구독자 수 상한 (기본 null = 제한 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrentSubscribers 최대 동시 구독자 수 (null 허용, 지정 시 1 이상)
 */
public record FanOutConfig(Integer maxConcurrentSubscribers) {

    /**
     * 기본 설정 생성자 (제한 없음).
     */
    public FanOutConfig() {
        this((Integer) null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException maxConcurrentSubscribers가 양수가 아닌 경우
     */
    public FanOutConfig {
        if (maxConcurrentSubscribers != null && maxConcurrentSubscribers <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentSubscribers must be positive (current: " + maxConcurrentSubscribers + ")"
            );
        }
    }

    /**
     * 제한이 있는지 확인.
     *
     * @return maxConcurrentSubscribers가 지정되었으면 true
     */
    public boolean isBounded() {
        return maxConcurrentSubscribers != null;
    }

    /**
     * maxConcurrentSubscribers만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withMaxConcurrentSubscribers(Integer maxConcurrentSubscribers) {
        return new FanOutConfig(maxConcurrentSubscribers);
    }
}
