package com.ryuqq.runlog.core.event;

/**
 * 생명주기 이벤트 종류.
 *
 * <p>이벤트 이름은 {@code on_<category>_<kind>} 형식입니다 (예: {@code on_tool_stream}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventKind {

    /**
     * run 시작.
     */
    START("start"),

    /**
     * 증분 청크 1개.
     */
    STREAM("stream"),

    /**
     * run 종료.
     */
    END("end");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 카테고리 태그와 결합한 이벤트 이름 생성.
     *
     * @param category run 타입 태그 (예: chain, tool)
     * @return {@code on_<category>_<kind>}
     */
    public String eventName(String category) {
        return "on_" + category + "_" + wireName;
    }
}
