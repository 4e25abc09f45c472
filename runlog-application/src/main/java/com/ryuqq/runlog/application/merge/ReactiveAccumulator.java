package com.ryuqq.runlog.application.merge;

import com.ryuqq.runlog.core.merge.Accumulator;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 비동기 시퀀스에 대한 {@link Accumulator} fold.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReactiveAccumulator {

    // Utility class - prevent instantiation
    private ReactiveAccumulator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 스트림으로 도착하는 값을 왼쪽부터 결합.
     *
     * @param addables 값 스트림
     * @param <T> 값 타입
     * @return 누적 결과, 입력이 비어 있으면 값 없이 완료되는 Mono
     * @throws IllegalArgumentException addables가 null인 경우
     */
    public static <T> Mono<T> add(Publisher<? extends T> addables) {
        if (addables == null) {
            throw new IllegalArgumentException("addables cannot be null");
        }
        return Flux.<T>from(addables).reduce(Accumulator::combine);
    }
}
