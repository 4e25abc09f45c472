package com.ryuqq.runlog.core.category;

import com.ryuqq.runlog.core.event.EventKind;
import com.ryuqq.runlog.core.state.RunNode;

import java.util.Map;
import java.util.Set;

/**
 * run 카테고리 (tagged union).
 *
 * <p>run 타입 태그에 따라 입력/출력 추출 규칙이 다른 두 변형으로 나뉩니다:</p>
 * <ul>
 *   <li>{@link LegacyRun}: retriever, tool, llm (inputs/final_output 전체를 그대로 전달)</li>
 *   <li>{@link ChainRun}: 그 외 모든 타입 ({@code input}/{@code output} 키 하나로 감싼 형식)</li>
 * </ul>
 *
 * <p>분기는 {@link #of(String, String)}의 단일 매칭에서만 일어납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface RunCategory permits LegacyRun, ChainRun {

    /**
     * 구형(legacy) 규칙을 따르는 타입 태그.
     */
    Set<String> LEGACY_TYPES = Set.of("retriever", "tool", "llm");

    /**
     * 타입 태그로 카테고리 결정.
     *
     * @param type run 타입 태그 (null 허용)
     * @param defaultType type이 null일 때 사용할 태그
     * @return LegacyRun 또는 ChainRun
     * @throws IllegalArgumentException type과 defaultType이 모두 null인 경우
     */
    static RunCategory of(String type, String defaultType) {
        String resolved = type != null ? type : defaultType;
        if (resolved == null) {
            throw new IllegalArgumentException("type and defaultType cannot both be null");
        }
        return LEGACY_TYPES.contains(resolved) ? new LegacyRun(resolved) : new ChainRun(resolved);
    }

    /**
     * 타입 태그.
     *
     * @return 타입 태그
     */
    String type();

    /**
     * start 이벤트 data 구성. inputs는 consume하지 않습니다.
     *
     * @param node 하위 run
     * @return data Map
     */
    Map<String, Object> startData(RunNode node);

    /**
     * end 이벤트 data 구성. 사용한 final_output과 inputs는 consume합니다.
     *
     * @param node 하위 run
     * @return data Map
     */
    Map<String, Object> endData(RunNode node);

    /**
     * 스트림 종료 시 루트 end 이벤트의 output 값.
     *
     * @param root 루트 run
     * @return output 값 (null 가능)
     */
    Object rootOutput(RunNode root);

    /**
     * 이벤트 이름 생성.
     *
     * @param kind 이벤트 종류
     * @return {@code on_<type>_<kind>}
     */
    default String eventName(EventKind kind) {
        return kind.eventName(type());
    }
}
