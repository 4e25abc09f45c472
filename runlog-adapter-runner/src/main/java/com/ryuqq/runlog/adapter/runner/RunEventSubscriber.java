package com.ryuqq.runlog.adapter.runner;

import com.ryuqq.runlog.core.event.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * 이벤트 스트림 구독자.
 *
 * <p>{@link RunEventFanOut}이 구독자마다 작업 하나로 호출합니다.
 * 작업 스레드에서 실행되므로 스트림을 블로킹으로 소비해도 됩니다.</p>
 *
 * @param <R> 구독 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunEventSubscriber<R> {

    /**
     * 이벤트 스트림 전체 소비.
     *
     * @param events 처음부터 재생되는 이벤트 스트림
     * @return 구독 결과
     * @throws Exception 소비 실패 시 (dispatch 전체를 실패시킴)
     */
    R consume(Flux<StreamEvent> events) throws Exception;
}
