package com.ryuqq.runlog.core.state;

/**
 * 방출 시점에 버퍼된 스트림 청크가 정확히 1개가 아닐 때 발생.
 *
 * <p>패치 생산자는 청크를 항상 하나씩 flush해야 합니다.
 * 이 예외는 생산자 버그를 뜻하므로 재시도하지 않고 번역을 중단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamedOutputInvariantException extends IllegalStateException {

    private final String runName;
    private final int chunkCount;

    /**
     * 생성자.
     *
     * @param runName 청크를 가진 run 이름 (null 허용)
     * @param chunkCount 실제 버퍼된 청크 수
     */
    public StreamedOutputInvariantException(String runName, int chunkCount) {
        super(String.format(
            "Expected exactly one chunk of streamed output, got %d instead. Encountered in: %s",
            chunkCount, runName));
        this.runName = runName;
        this.chunkCount = chunkCount;
    }

    /**
     * run 이름 조회.
     *
     * @return run 이름 (null 가능)
     */
    public String getRunName() {
        return runName;
    }

    /**
     * 버퍼된 청크 수 조회.
     *
     * @return 청크 수
     */
    public int getChunkCount() {
        return chunkCount;
    }
}
