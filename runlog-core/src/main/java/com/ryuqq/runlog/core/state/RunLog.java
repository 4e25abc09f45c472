package com.ryuqq.runlog.core.state;

import com.ryuqq.runlog.core.merge.Addable;
import com.ryuqq.runlog.core.merge.UnsupportedAddendException;
import com.ryuqq.runlog.core.patch.JsonPointer;
import com.ryuqq.runlog.core.patch.PatchOp;
import com.ryuqq.runlog.core.patch.PatchOperation;
import com.ryuqq.runlog.core.patch.RunLogPatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 지금까지 받은 모든 패치를 접은 누적 run-state 트리.
 *
 * <p>RunLog는 번역 세션 하나가 단독 소유하는 명시적 상태 객체입니다.
 * 세션 간 공유되지 않으므로 동기화가 필요 없습니다 (thread-safe하지 않음).</p>
 *
 * <p><strong>결합:</strong> {@code runLog.add(patch)}는 패치를 제자리(in place)에 적용하고
 * 같은 인스턴스를 반환합니다. RunLogPatch 외의 피연산자는
 * {@link UnsupportedAddendException}으로 거부합니다.</p>
 *
 * <p><strong>경로 적용 규칙:</strong></p>
 * <ul>
 *   <li>"" 경로: 루트 전체 교체 (값은 Map이어야 함)</li>
 *   <li>중간 컨테이너가 없으면 Map으로 생성 (다음 세그먼트가 {@code -}이면 List)</li>
 *   <li>List의 {@code -}: 끝에 추가</li>
 *   <li>List 인덱스: add는 삽입, replace는 교체</li>
 *   <li>스칼라를 통과하는 경로, 범위를 벗어난 인덱스: IllegalArgumentException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLog implements Addable<RunLog> {

    private Map<String, Object> state;
    private long appliedOps;

    private RunLog() {
        this.state = new LinkedHashMap<>();
    }

    /**
     * 빈 RunLog 생성.
     *
     * @return 빈 상태의 RunLog
     */
    public static RunLog empty() {
        return new RunLog();
    }

    @Override
    public RunLog add(Object other) {
        if (!(other instanceof RunLogPatch patch)) {
            throw new UnsupportedAddendException(this, other);
        }
        for (PatchOp op : patch.ops()) {
            apply(op);
            appliedOps++;
        }
        return this;
    }

    /**
     * 루트 run 뷰 조회.
     *
     * @return 루트 RunNode
     */
    public RunNode root() {
        return RunNode.wrap(state);
    }

    /**
     * 하위 run 뷰 조회.
     *
     * @param segment {@code logs} 아래 경로 세그먼트
     * @return RunNode (없으면 null)
     * @throws IllegalStateException 해당 경로의 값이 Map이 아닌 경우
     */
    @SuppressWarnings("unchecked")
    public RunNode subRun(String segment) {
        Object logs = state.get(RunNode.LOGS);
        if (!(logs instanceof Map<?, ?> logMap)) {
            return null;
        }
        Object node = logMap.get(segment);
        if (node == null) {
            return null;
        }
        if (!(node instanceof Map<?, ?>)) {
            throw new IllegalStateException("Sub-run state at /logs/" + segment + " is not a mapping");
        }
        return RunNode.wrap((Map<String, Object>) node);
    }

    /**
     * 현재 상태의 불변 스냅샷.
     *
     * @return 깊은 복사된 불변 Map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> snapshot() {
        return (Map<String, Object>) Trees.immutableCopy(state);
    }

    /**
     * 지금까지 적용된 연산 수.
     *
     * <p>적용된 연산 자체는 보관하지 않습니다. 소비된 청크는 트리에서 제거되는 즉시 해제됩니다.</p>
     *
     * @return 적용된 연산 수
     */
    public long appliedOps() {
        return appliedOps;
    }

    @SuppressWarnings("unchecked")
    private void apply(PatchOp op) {
        List<String> segments = JsonPointer.parse(op.path());
        Object value = Trees.mutableCopy(op.value());

        if (segments.isEmpty()) {
            if (!(value instanceof Map<?, ?>)) {
                throw new IllegalArgumentException("Root replacement requires a mapping value");
            }
            state = (Map<String, Object>) value;
            return;
        }

        Object container = state;
        for (int i = 0; i < segments.size() - 1; i++) {
            container = descend(container, segments.get(i), segments.get(i + 1), op.path());
        }
        write(container, segments.get(segments.size() - 1), value, op);
    }

    @SuppressWarnings("unchecked")
    private static Object descend(Object container, String segment, String nextSegment, String path) {
        if (container instanceof Map<?, ?> raw) {
            Map<String, Object> map = (Map<String, Object>) raw;
            Object child = map.get(segment);
            if (child == null) {
                child = JsonPointer.APPEND.equals(nextSegment) ? new ArrayList<>() : new LinkedHashMap<String, Object>();
                map.put(segment, child);
            }
            return child;
        }
        if (container instanceof List<?> list) {
            return list.get(index(segment, list.size() - 1, path));
        }
        throw new IllegalArgumentException("Cannot traverse through scalar at '" + segment + "' in path " + path);
    }

    @SuppressWarnings("unchecked")
    private static void write(Object container, String segment, Object value, PatchOp op) {
        if (container instanceof Map<?, ?> raw) {
            ((Map<String, Object>) raw).put(segment, value);
            return;
        }
        if (container instanceof List<?> raw) {
            List<Object> list = (List<Object>) raw;
            if (JsonPointer.APPEND.equals(segment)) {
                if (op.op() == PatchOperation.REPLACE) {
                    throw new IllegalArgumentException("Cannot replace list end '-' in path " + op.path());
                }
                list.add(value);
            } else if (op.op() == PatchOperation.ADD) {
                list.add(index(segment, list.size(), op.path()), value);
            } else {
                list.set(index(segment, list.size() - 1, op.path()), value);
            }
            return;
        }
        throw new IllegalArgumentException("Cannot write into scalar in path " + op.path());
    }

    private static int index(String segment, int maxInclusive, String path) {
        int index;
        try {
            index = Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid list index '" + segment + "' in path " + path, e);
        }
        if (index < 0 || index > maxInclusive) {
            throw new IllegalArgumentException("List index " + index + " out of range in path " + path);
        }
        return index;
    }

    @Override
    public String toString() {
        return "RunLog{" + appliedOps + " ops applied}";
    }
}
