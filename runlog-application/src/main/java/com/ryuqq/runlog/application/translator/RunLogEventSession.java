package com.ryuqq.runlog.application.translator;

import com.ryuqq.runlog.core.category.ChainRun;
import com.ryuqq.runlog.core.category.RunCategory;
import com.ryuqq.runlog.core.event.EventKind;
import com.ryuqq.runlog.core.event.StreamEvent;
import com.ryuqq.runlog.core.merge.Accumulator;
import com.ryuqq.runlog.core.patch.RunLogPatch;
import com.ryuqq.runlog.core.state.RunLog;
import com.ryuqq.runlog.core.state.RunNode;
import com.ryuqq.runlog.core.state.StreamedOutputInvariantException;
import com.ryuqq.runlog.core.statemachine.PhaseTransition;
import com.ryuqq.runlog.core.statemachine.RunPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 패치 스트림 하나를 이벤트로 번역하는 단일 세션.
 *
 * <p>세션은 run-state 트리({@link RunLog})와 하위 run별 단계({@link RunPhase})를 단독 소유합니다.
 * 패치는 한 번에 하나씩 순서대로 처리되어야 하며, 세션은 thread-safe하지 않습니다.</p>
 *
 * <p><strong>패치 처리 흐름 ({@link #onPatch(RunLogPatch)}):</strong></p>
 * <pre>
 * 1. runLog = combine(runLog, patch)
 * 2. 루트에 id가 처음 생기면 루트 start 1회 방출 (data 비어 있음)
 * 3. 패치가 건드린 /logs/&lt;segment&gt; 집합 계산
 * 4. 각 하위 run 분류:
 *    - end_time != null           → end
 *    - streamed_output 비어있지 않음 → stream
 *    - 그 외                       → start
 * 5. id 없는 run(PENDING)과 이미 종료된 run(ENDED)은 건너뜀
 * 6. 아직 start를 내지 않은 run이 stream/end로 분류되면 start를 먼저 방출
 * 7. 루트 streamed_output이 있으면 루트 stream 방출
 * </pre>
 *
 * <p><strong>종료 ({@link #finish()}):</strong> 루트 end 이벤트를 정확히 1회 반환합니다.
 * tags/metadata는 항상 비어 있습니다.</p>
 *
 * <p><strong>주의:</strong> 같은 패치에서 건드린 하위 run 사이의 방출 순서는 보장하지 않습니다.
 * 패치 사이의 순서만 보존됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLogEventSession {

    private static final Logger log = LoggerFactory.getLogger(RunLogEventSession.class);

    private final TranslatorConfig config;
    private final Map<String, SubRunTracker> trackers;
    private RunLog runLog;
    private boolean rootStarted;
    private boolean finished;

    /**
     * 기본 설정 세션 생성.
     */
    public RunLogEventSession() {
        this(new TranslatorConfig());
    }

    /**
     * 생성자.
     *
     * @param config 번역기 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RunLogEventSession(TranslatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.trackers = new HashMap<>();
        this.runLog = RunLog.empty();
    }

    /**
     * 패치 하나를 적용하고 그로부터 파생된 이벤트를 반환.
     *
     * @param patch 패치
     * @return 이번 패치로 발생한 이벤트 (없으면 빈 목록)
     * @throws IllegalArgumentException patch가 null이거나 경로가 잘못된 경우
     * @throws IllegalStateException 세션이 이미 종료된 경우
     * @throws StreamedOutputInvariantException 버퍼된 청크가 1개가 아닌 경우
     */
    public List<StreamEvent> onPatch(RunLogPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        if (finished) {
            throw new IllegalStateException("Session already finished");
        }

        Object merged = Accumulator.<Object>combine(runLog, patch);
        if (!(merged instanceof RunLog folded)) {
            throw new IllegalStateException("Patch could not be folded into run log: " + patch);
        }
        runLog = folded;

        List<StreamEvent> events = new ArrayList<>();
        try {
            emitRootStart(events);
            for (String segment : patch.touchedSubRuns()) {
                emitSubRun(segment, events);
            }
            emitRootStream(events);
        } catch (StreamedOutputInvariantException e) {
            log.error("Run log translation aborted: {}", e.getMessage());
            throw e;
        }
        return events;
    }

    /**
     * 패치 스트림 종료 처리: 루트 end 이벤트 생성.
     *
     * <p>패치를 하나도 받지 않았어도 항상 1회 반환합니다.</p>
     *
     * @return 루트 end 이벤트
     * @throws IllegalStateException 이미 종료된 경우
     */
    public StreamEvent finish() {
        if (finished) {
            throw new IllegalStateException("Session already finished");
        }
        finished = true;

        RunNode root = runLog.root();
        RunCategory category = categoryOf(root);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("output", category.rootOutput(root));

        StreamEvent end = new StreamEvent(
            category.eventName(EventKind.END), root.name(), root.id(), List.of(), Map.of(), data);
        log.debug("Emitting {} for root run {}", end.event(), end.runId());
        return end;
    }

    /**
     * 하위 run의 현재 단계 조회.
     *
     * @param segment {@code logs} 아래 경로 세그먼트
     * @return 단계 (처음 보는 run은 PENDING)
     */
    public RunPhase phaseOf(String segment) {
        SubRunTracker tracker = trackers.get(segment);
        return tracker == null ? RunPhase.PENDING : tracker.phase;
    }

    /**
     * 누적 상태 스냅샷.
     *
     * @return 깊은 복사된 불변 Map
     */
    public Map<String, Object> snapshot() {
        return runLog.snapshot();
    }

    public boolean isFinished() {
        return finished;
    }

    private void emitRootStart(List<StreamEvent> events) {
        if (rootStarted) {
            return;
        }
        RunNode root = runLog.root();
        if (root.id() == null) {
            return;
        }
        // 이 시점에는 입력을 신뢰할 수 없으므로 data는 비워 둔다
        StreamEvent start = new StreamEvent(
            categoryOf(root).eventName(EventKind.START), root.name(), root.id(), List.of(), Map.of(), Map.of());
        add(events, start);
        rootStarted = true;
    }

    private void emitSubRun(String segment, List<StreamEvent> events) {
        RunNode node = runLog.subRun(segment);
        if (node == null || node.id() == null) {
            log.debug("Sub-run {} has no id yet, skipping", segment);
            return;
        }

        SubRunTracker tracker = trackers.computeIfAbsent(segment, key -> new SubRunTracker(node.id()));
        if (!tracker.runId.equals(node.id())) {
            throw new IllegalStateException(String.format(
                "Sub-run id changed at /logs/%s: %s → %s", segment, tracker.runId, node.id()));
        }
        if (tracker.phase.isTerminal()) {
            log.debug("Sub-run {} already ended, ignoring patch", segment);
            return;
        }

        RunCategory category = categoryOf(node);
        EventKind kind = classify(node);
        RunPhase phase = tracker.phase;

        if (!phase.isStarted()) {
            add(events, eventOf(category, EventKind.START, node, category.startData(node)));
            phase = PhaseTransition.transition(phase, RunPhase.RUNNING_NO_OUTPUT);
        }

        switch (kind) {
            case START -> {
                // start는 위에서 한 번만 방출된다
            }
            case STREAM -> {
                Object chunk = node.consumeSingleChunk();
                add(events, eventOf(category, EventKind.STREAM, node, chunkData(chunk)));
                phase = PhaseTransition.transition(phase, RunPhase.RUNNING_STREAMING);
            }
            case END -> {
                Map<String, Object> data = category.endData(node);
                if (category instanceof ChainRun && !data.containsKey("output")) {
                    log.debug("Ignoring unrecognized final_output shape for sub-run {}", node.id());
                }
                add(events, eventOf(category, EventKind.END, node, data));
                phase = PhaseTransition.transition(phase, RunPhase.ENDED);
            }
        }
        tracker.phase = phase;
    }

    private void emitRootStream(List<StreamEvent> events) {
        RunNode root = runLog.root();
        if (!root.hasStreamedOutput()) {
            return;
        }
        Object chunk = root.consumeSingleChunk();
        add(events, eventOf(categoryOf(root), EventKind.STREAM, root, chunkData(chunk)));
    }

    private static EventKind classify(RunNode node) {
        if (node.isEnded()) {
            return EventKind.END;
        }
        return node.hasStreamedOutput() ? EventKind.STREAM : EventKind.START;
    }

    private RunCategory categoryOf(RunNode node) {
        return RunCategory.of(node.type(), config.defaultRunType());
    }

    private static StreamEvent eventOf(RunCategory category, EventKind kind, RunNode node, Map<String, Object> data) {
        return new StreamEvent(category.eventName(kind), node.name(), node.id(), node.tags(), node.metadata(), data);
    }

    private static Map<String, Object> chunkData(Object chunk) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("chunk", chunk);
        return data;
    }

    private static void add(List<StreamEvent> events, StreamEvent event) {
        log.debug("Emitting {} for run {}", event.event(), event.runId());
        events.add(event);
    }

    /**
     * 하위 run별 추적 상태.
     */
    private static final class SubRunTracker {

        private final String runId;
        private RunPhase phase;

        private SubRunTracker(String runId) {
            this.runId = runId;
            this.phase = RunPhase.PENDING;
        }
    }
}
