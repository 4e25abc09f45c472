package com.ryuqq.runlog.core.event;

import com.ryuqq.runlog.core.state.Trees;

import java.util.List;
import java.util.Map;

/**
 * 소비자에게 전달되는 생명주기 이벤트.
 *
 * <p>모든 필드는 생성 시 깊은 불변 복사되므로, 이후 run-state 트리가 변경되어도
 * 이미 방출된 이벤트에는 영향이 없습니다.</p>
 *
 * <p><strong>data 내용 (종류별):</strong></p>
 * <ul>
 *   <li>start: {@code input} (알 수 있는 경우)</li>
 *   <li>stream: {@code chunk}</li>
 *   <li>end: {@code output}, {@code input} (알 수 있는 경우)</li>
 * </ul>
 *
 * @param event 이벤트 이름 ({@code on_<category>_<kind>})
 * @param name run 이름 (null 가능)
 * @param runId run 식별자 (null 가능: id 없는 루트의 종료 이벤트)
 * @param tags 태그
 * @param metadata 메타데이터
 * @param data 이벤트 데이터 (null 값 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamEvent(
    String event,
    String name,
    String runId,
    List<String> tags,
    Map<String, Object> metadata,
    Map<String, Object> data
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException event가 null이거나 빈 문자열인 경우
     */
    @SuppressWarnings("unchecked")
    public StreamEvent {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
        tags = tags == null ? List.of() : (List<String>) Trees.immutableCopy(tags);
        metadata = metadata == null ? Map.of() : (Map<String, Object>) Trees.immutableCopy(metadata);
        data = data == null ? Map.of() : (Map<String, Object>) Trees.immutableCopy(data);
    }

    /**
     * 이벤트 종류 조회.
     *
     * @return 이벤트 이름의 마지막 토큰에 해당하는 EventKind
     * @throws IllegalStateException 이름이 알려진 종류로 끝나지 않는 경우
     */
    public EventKind kind() {
        for (EventKind kind : EventKind.values()) {
            if (event.endsWith("_" + kind.wireName())) {
                return kind;
            }
        }
        throw new IllegalStateException("Unknown event kind: " + event);
    }
}
