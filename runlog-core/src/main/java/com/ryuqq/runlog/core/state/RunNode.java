package com.ryuqq.runlog.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * run-state 트리의 run 하나(루트 또는 {@code logs/<segment>})에 대한 타입 뷰.
 *
 * <p>RunNode는 세션이 소유한 가변 Map을 직접 감싸므로,
 * consume 계열 메서드는 트리 자체를 변경합니다.</p>
 *
 * <p><strong>Consume 연산:</strong></p>
 * <ul>
 *   <li>{@link #consumeInputs()}: inputs를 반환하고 슬롯 제거</li>
 *   <li>{@link #consumeFinalOutput()}: final_output을 반환하고 슬롯 제거</li>
 *   <li>{@link #consumeSingleChunk()}: 청크 1개를 반환하고 streamed_output을 비움</li>
 * </ul>
 *
 * <p>각 값은 consume 이후 다시 방출되지 않습니다 (at-most-once).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunNode {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String TAGS = "tags";
    public static final String METADATA = "metadata";
    public static final String INPUTS = "inputs";
    public static final String FINAL_OUTPUT = "final_output";
    public static final String STREAMED_OUTPUT = "streamed_output";
    public static final String END_TIME = "end_time";
    public static final String LOGS = "logs";

    private final Map<String, Object> fields;

    private RunNode(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * 트리의 run Map을 감싸는 뷰 생성.
     *
     * @param fields run Map (가변, 세션 소유)
     * @return RunNode 인스턴스
     * @throws IllegalArgumentException fields가 null인 경우
     */
    static RunNode wrap(Map<String, Object> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return new RunNode(fields);
    }

    public String id() {
        return asString(fields.get(ID));
    }

    public String name() {
        return asString(fields.get(NAME));
    }

    /**
     * 카테고리 태그 (chain, tool, llm, retriever ...).
     *
     * @return 타입 (없으면 null)
     */
    public String type() {
        return asString(fields.get(TYPE));
    }

    /**
     * 태그 조회.
     *
     * @return 태그 목록 (없으면 빈 목록)
     */
    public List<String> tags() {
        Object value = fields.get(TAGS);
        if (!(value instanceof List<?> list)) {
            return Collections.emptyList();
        }
        List<String> tags = new ArrayList<>(list.size());
        for (Object tag : list) {
            tags.add(asString(tag));
        }
        return tags;
    }

    /**
     * 메타데이터 조회.
     *
     * @return 메타데이터 (없으면 빈 Map)
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> metadata() {
        Object value = fields.get(METADATA);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Collections.emptyMap();
    }

    public Object inputs() {
        return fields.get(INPUTS);
    }

    public boolean hasInputs() {
        return Trees.isPresent(inputs());
    }

    public Object finalOutput() {
        return fields.get(FINAL_OUTPUT);
    }

    public Object endTime() {
        return fields.get(END_TIME);
    }

    /**
     * 종료 여부 (end_time이 설정되었는지).
     *
     * @return end_time이 null이 아니면 true
     */
    public boolean isEnded() {
        return endTime() != null;
    }

    /**
     * 아직 방출되지 않은 청크 목록.
     *
     * @return 청크 목록 (없으면 빈 목록)
     */
    public List<Object> streamedOutput() {
        Object value = fields.get(STREAMED_OUTPUT);
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(list);
        }
        return Collections.emptyList();
    }

    public boolean hasStreamedOutput() {
        return !streamedOutput().isEmpty();
    }

    /**
     * inputs를 꺼내고 슬롯을 제거.
     *
     * @return 이전 inputs (없으면 null)
     */
    public Object consumeInputs() {
        return fields.remove(INPUTS);
    }

    /**
     * final_output을 꺼내고 슬롯을 제거.
     *
     * @return 이전 final_output (없으면 null)
     */
    public Object consumeFinalOutput() {
        return fields.remove(FINAL_OUTPUT);
    }

    /**
     * 버퍼된 청크를 모두 꺼내고 streamed_output을 빈 목록으로 재설정.
     *
     * @return 꺼낸 청크 목록
     */
    public List<Object> drainStreamedOutput() {
        List<Object> drained = new ArrayList<>(streamedOutput());
        fields.put(STREAMED_OUTPUT, new ArrayList<>());
        return drained;
    }

    /**
     * 버퍼된 청크가 정확히 1개임을 검증한 뒤 꺼냄.
     *
     * <p>검증 실패 시 버퍼는 변경되지 않습니다.</p>
     *
     * @return 청크
     * @throws StreamedOutputInvariantException 버퍼된 청크가 1개가 아닌 경우
     */
    public Object consumeSingleChunk() {
        int count = streamedOutput().size();
        if (count != 1) {
            throw new StreamedOutputInvariantException(name(), count);
        }
        return drainStreamedOutput().get(0);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return "RunNode{id=" + id() + ", name=" + name() + ", type=" + type() + ", ended=" + isEnded() + '}';
    }
}
