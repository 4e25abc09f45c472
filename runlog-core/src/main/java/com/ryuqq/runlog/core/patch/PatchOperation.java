package com.ryuqq.runlog.core.patch;

/**
 * 패치 연산 종류.
 *
 * <p>JSON Patch(RFC 6902) 중 run-state 트리 구성에 쓰이는 두 연산만 지원합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PatchOperation {

    /**
     * 경로에 값 추가 (리스트는 삽입, {@code -}는 끝에 추가).
     */
    ADD("add"),

    /**
     * 경로의 기존 값을 교체.
     */
    REPLACE("replace");

    private final String wireName;

    PatchOperation(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 직렬화 이름 조회.
     *
     * @return "add" 또는 "replace"
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 직렬화 이름으로 연산 조회.
     *
     * @param wireName "add" 또는 "replace"
     * @return PatchOperation
     * @throws IllegalArgumentException 지원하지 않는 연산인 경우
     */
    public static PatchOperation fromWireName(String wireName) {
        for (PatchOperation operation : values()) {
            if (operation.wireName.equals(wireName)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unsupported patch operation: " + wireName);
    }
}
