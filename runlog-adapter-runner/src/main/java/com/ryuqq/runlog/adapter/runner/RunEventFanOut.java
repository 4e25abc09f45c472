package com.ryuqq.runlog.adapter.runner;

import com.ryuqq.runlog.application.translator.RunLogEventTranslator;
import com.ryuqq.runlog.core.event.StreamEvent;
import com.ryuqq.runlog.core.patch.RunLogPatch;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 번역된 이벤트 스트림 하나를 여러 구독자에게 동시성 상한을 두고 전달.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * dispatch(patches, subscribers)
 *   ↓
 * translator.translate(patches).cache()   → 번역은 1회, 모든 구독자가 전체 이벤트를 재생
 *   ↓
 * 구독자마다 작업 1개 → BoundedGather(maxConcurrentSubscribers)
 *   ↓
 * 구독자 순서의 결과 목록 (첫 실패 시 전체 실패)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunEventFanOut {

    private static final Logger log = LoggerFactory.getLogger(RunEventFanOut.class);

    private final RunLogEventTranslator translator;
    private final BoundedGather gather;
    private final FanOutConfig config;

    /**
     * 생성자.
     *
     * @param translator 이벤트 번역기
     * @param gather 작업 실행기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RunEventFanOut(RunLogEventTranslator translator, BoundedGather gather, FanOutConfig config) {
        if (translator == null) {
            throw new IllegalArgumentException("translator cannot be null");
        }
        if (gather == null) {
            throw new IllegalArgumentException("gather cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.translator = translator;
        this.gather = gather;
        this.config = config;
    }

    /**
     * 패치 스트림을 번역해 모든 구독자에게 전달하고 결과를 기다림 (블로킹).
     *
     * @param patches 패치 스트림
     * @param subscribers 구독자 목록
     * @param <R> 구독 결과 타입
     * @return 구독자 순서의 결과 목록
     * @throws ExecutionException 구독자 하나가 실패한 경우 (cause = 원래 예외)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public <R> List<R> dispatch(Publisher<RunLogPatch> patches, List<? extends RunEventSubscriber<R>> subscribers)
            throws ExecutionException, InterruptedException {
        return dispatchAsync(patches, subscribers).get();
    }

    /**
     * 패치 스트림을 번역해 모든 구독자에게 전달 (비블로킹).
     *
     * @param patches 패치 스트림
     * @param subscribers 구독자 목록
     * @param <R> 구독 결과 타입
     * @return 구독자 순서의 결과 목록으로 완료되는 future (취소 시 남은 구독자는 시작하지 않음)
     * @throws IllegalArgumentException patches 또는 subscribers가 null인 경우
     */
    public <R> CompletableFuture<List<R>> dispatchAsync(
            Publisher<RunLogPatch> patches,
            List<? extends RunEventSubscriber<R>> subscribers) {
        if (subscribers == null) {
            throw new IllegalArgumentException("subscribers cannot be null");
        }
        Flux<StreamEvent> shared = translator.translate(patches).cache();

        List<Callable<R>> tasks = new ArrayList<>(subscribers.size());
        for (RunEventSubscriber<R> subscriber : subscribers) {
            if (subscriber == null) {
                throw new IllegalArgumentException("subscribers cannot contain null");
            }
            tasks.add(() -> subscriber.consume(shared));
        }

        log.info("Dispatching run events to {} subscribers (limit: {})",
            tasks.size(), config.isBounded() ? config.maxConcurrentSubscribers() : "unbounded");

        CompletableFuture<List<R>> results = gather.gatherAsync(config.maxConcurrentSubscribers(), tasks);
        results.thenAccept(values -> log.info("Run event dispatch completed: {} subscribers", values.size()));
        return results;
    }

    public FanOutConfig getConfig() {
        return config;
    }
}
