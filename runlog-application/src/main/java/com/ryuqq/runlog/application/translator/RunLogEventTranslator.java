package com.ryuqq.runlog.application.translator;

import com.ryuqq.runlog.core.event.StreamEvent;
import com.ryuqq.runlog.core.patch.RunLogPatch;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 패치 스트림을 생명주기 이벤트 스트림으로 변환하는 리액티브 번역기.
 *
 * <p>구독마다 새 {@link RunLogEventSession}을 만들며 세션 간 상태 공유는 없습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>패치를 한 번에 하나씩 요청 (소비자 속도에 맞춘 backpressure)</li>
 *   <li>소비자 취소 시 upstream 패치 구독도 취소</li>
 *   <li>upstream 완료 시 루트 end 이벤트를 정확히 1회 추가</li>
 *   <li>불변식 위반 등 오류는 onError로 스트림을 종료 (잘린 종료 이벤트 없음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RunLogEventTranslator translator = new RunLogEventTranslator();
 * translator.translate(tracer.patches())
 *     .filter(event -> event.event().endsWith("_stream"))
 *     .subscribe(event -> render(event.data().get("chunk")));
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLogEventTranslator {

    private final TranslatorConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public RunLogEventTranslator() {
        this(new TranslatorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 번역기 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RunLogEventTranslator(TranslatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 패치 스트림 번역.
     *
     * @param patches 방출 순서대로 도착하는 패치 스트림
     * @return 이벤트 스트림 (cold, 구독마다 독립 세션)
     * @throws IllegalArgumentException patches가 null인 경우
     */
    public Flux<StreamEvent> translate(Publisher<RunLogPatch> patches) {
        if (patches == null) {
            throw new IllegalArgumentException("patches cannot be null");
        }
        return Flux.defer(() -> {
            RunLogEventSession session = new RunLogEventSession(config);
            return Flux.from(patches)
                .concatMapIterable(session::onPatch, 1)
                .concatWith(Mono.fromCallable(session::finish));
        });
    }

    public TranslatorConfig getConfig() {
        return config;
    }
}
