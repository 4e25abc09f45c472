package com.ryuqq.runlog.core.patch;

/**
 * 단일 구조 패치 연산.
 *
 * <p>경로는 JSON Pointer 형식입니다. 예: {@code /logs/retriever/streamed_output/-}</p>
 *
 * @param op 연산 종류
 * @param path JSON Pointer 경로 ("" = 루트 전체)
 * @param value 값 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PatchOp(
    PatchOperation op,
    String path,
    Object value
) {

    private static final String LOGS_PREFIX = "/logs/";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException op 또는 path가 null이거나,
     *         path가 비어있지 않은데 '/'로 시작하지 않는 경우
     */
    public PatchOp {
        if (op == null) {
            throw new IllegalArgumentException("op cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!path.isEmpty() && !path.startsWith("/")) {
            throw new IllegalArgumentException("path must be empty or start with '/' (current: " + path + ")");
        }
    }

    /**
     * add 연산 생성.
     *
     * @param path 경로
     * @param value 값
     * @return PatchOp 인스턴스
     */
    public static PatchOp add(String path, Object value) {
        return new PatchOp(PatchOperation.ADD, path, value);
    }

    /**
     * replace 연산 생성.
     *
     * @param path 경로
     * @param value 값
     * @return PatchOp 인스턴스
     */
    public static PatchOp replace(String path, Object value) {
        return new PatchOp(PatchOperation.REPLACE, path, value);
    }

    /**
     * 하위 run 경로를 가리키는지 확인.
     *
     * @return path가 "/logs/"로 시작하면 true
     */
    public boolean targetsSubRun() {
        return path.startsWith(LOGS_PREFIX);
    }

    /**
     * 하위 run의 경로 세그먼트 조회.
     *
     * <p>{@code /logs/<segment>/...}의 {@code <segment>} 부분을 디코딩하여 반환합니다.</p>
     *
     * @return 세그먼트
     * @throws IllegalStateException 하위 run 경로가 아닌 경우
     */
    public String subRunSegment() {
        if (!targetsSubRun()) {
            throw new IllegalStateException("Not a sub-run path: " + path);
        }
        return JsonPointer.parse(path).get(1);
    }
}
