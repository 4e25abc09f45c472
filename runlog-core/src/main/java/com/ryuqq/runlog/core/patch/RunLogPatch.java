package com.ryuqq.runlog.core.patch;

import com.ryuqq.runlog.core.merge.Addable;
import com.ryuqq.runlog.core.merge.UnsupportedAddendException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 외부 tracer가 한 번에 내보내는 패치 묶음.
 *
 * <p>연산 순서는 방출 순서 그대로 유지되며 재정렬되지 않습니다.</p>
 *
 * <p><strong>결합:</strong> RunLogPatch + RunLogPatch는 연산을 이어붙인 새 패치입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 연산 목록 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLogPatch implements Addable<RunLogPatch> {

    private final List<PatchOp> ops;

    private RunLogPatch(List<PatchOp> ops) {
        this.ops = List.copyOf(ops);
    }

    /**
     * RunLogPatch 생성.
     *
     * @param ops 연산 목록
     * @return RunLogPatch 인스턴스
     * @throws IllegalArgumentException ops가 null이거나 null 요소를 포함하는 경우
     */
    public static RunLogPatch of(List<PatchOp> ops) {
        if (ops == null) {
            throw new IllegalArgumentException("ops cannot be null");
        }
        if (ops.contains(null)) {
            throw new IllegalArgumentException("ops cannot contain null");
        }
        return new RunLogPatch(ops);
    }

    /**
     * RunLogPatch 생성 (가변 인자).
     *
     * @param ops 연산들
     * @return RunLogPatch 인스턴스
     */
    public static RunLogPatch of(PatchOp... ops) {
        if (ops == null) {
            throw new IllegalArgumentException("ops cannot be null");
        }
        return of(Arrays.asList(ops));
    }

    /**
     * 연산 목록 조회.
     *
     * @return 불변 연산 목록
     */
    public List<PatchOp> ops() {
        return ops;
    }

    /**
     * 이 패치가 건드린 하위 run 세그먼트 집합.
     *
     * <p>반환 순서는 계약이 아닙니다. 같은 패치에서 건드린 하위 run 사이의
     * 이벤트 순서에 의존하면 안 됩니다.</p>
     *
     * @return 세그먼트 집합
     */
    public Set<String> touchedSubRuns() {
        Set<String> segments = new LinkedHashSet<>();
        for (PatchOp op : ops) {
            if (op.targetsSubRun()) {
                segments.add(op.subRunSegment());
            }
        }
        return segments;
    }

    @Override
    public RunLogPatch add(Object other) {
        if (!(other instanceof RunLogPatch patch)) {
            throw new UnsupportedAddendException(this, other);
        }
        List<PatchOp> joined = new ArrayList<>(ops.size() + patch.ops.size());
        joined.addAll(ops);
        joined.addAll(patch.ops);
        return new RunLogPatch(joined);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ops.equals(((RunLogPatch) o).ops);
    }

    @Override
    public int hashCode() {
        return ops.hashCode();
    }

    @Override
    public String toString() {
        return "RunLogPatch{" + ops.size() + " ops}";
    }
}
