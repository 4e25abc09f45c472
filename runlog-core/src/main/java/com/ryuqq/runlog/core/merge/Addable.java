package com.ryuqq.runlog.core.merge;

/**
 * 자체 결합 규칙을 가진 누적 가능한 값.
 *
 * <p>{@link Accumulator#combine(Object, Object)}는 왼쪽 피연산자가 Addable이면
 * 이 인터페이스에 결합을 위임합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>지원하지 않는 피연산자 타입은 {@link UnsupportedAddendException}으로 거부</li>
 *   <li>거부된 결합은 Accumulator가 오른쪽 값으로 대체 (오류로 전파되지 않음)</li>
 *   <li>그 밖의 예외는 그대로 전파</li>
 * </ul>
 *
 * @param <S> 결합 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Addable<S> {

    /**
     * 이 값과 다른 값을 결합.
     *
     * @param other 오른쪽 피연산자 (null 아님)
     * @return 결합 결과
     * @throws UnsupportedAddendException other 타입을 결합할 수 없는 경우
     */
    S add(Object other);
}
