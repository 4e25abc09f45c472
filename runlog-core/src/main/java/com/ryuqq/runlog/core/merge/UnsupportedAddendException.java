package com.ryuqq.runlog.core.merge;

/**
 * 두 값의 타입이 결합 불가능할 때 발생.
 *
 * <p>{@link Accumulator}가 내부적으로 잡아 오른쪽 값으로 대체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnsupportedAddendException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param left 왼쪽 피연산자
     * @param right 오른쪽 피연산자
     */
    public UnsupportedAddendException(Object left, Object right) {
        super(String.format("Cannot add %s and %s", typeName(left), typeName(right)));
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
