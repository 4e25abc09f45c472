package com.ryuqq.runlog.core.merge;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 누적 가능한 값(addable)의 이항 결합 및 좌측 fold.
 *
 * <p>증분 청크를 누적 값 하나로 접는 데 사용되는 순수 함수 모음입니다.
 * 내부 상태가 없으며 thread-safe합니다.</p>
 *
 * <p><strong>결합 규칙 ({@link #combine(Object, Object)}):</strong></p>
 * <ul>
 *   <li>null은 빈 값: {@code combine(null, x) == combine(x, null) == x}</li>
 *   <li>Map + Map: 키 합집합, 공유 키는 재귀 결합</li>
 *   <li>List + List: 이어붙이기</li>
 *   <li>CharSequence + CharSequence: 문자열 연결</li>
 *   <li>Number + Number: 자연 덧셈 (아래 숫자 규칙)</li>
 *   <li>Addable + any: {@link Addable#add(Object)} 위임</li>
 *   <li>그 외 또는 타입 불일치: 오른쪽 값이 왼쪽을 대체</li>
 * </ul>
 *
 * <p>타입 불일치 시 오른쪽 값 대체는 의도된 불변식이며 오류 경로가 아닙니다.</p>
 *
 * <p><strong>숫자 규칙:</strong></p>
 * <ul>
 *   <li>같은 클래스의 두 숫자는 같은 클래스로 더함 (Float + Float = Float, BigInteger + BigInteger = BigInteger)</li>
 *   <li>서로 다른 클래스는 넓은 쪽으로 승격: 정수끼리 Long, 실수 포함 시 Double,
 *       BigDecimal 또는 BigInteger와 실수 조합은 BigDecimal</li>
 *   <li>고정 폭 정수의 overflow는 값을 잃지 않고 다음 폭으로 승격
 *       (Byte/Short → Integer, Integer → Long, Long → BigInteger)</li>
 * </ul>
 *
 * <p>overflow 승격은 피연산자와 다른 클래스를 반환하므로,
 * 한계값 근처의 고정 폭 정수를 접는 호출자는 {@code T}를 {@link Number}로 받아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Accumulator {

    // Utility class - prevent instantiation
    private Accumulator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 값을 결합.
     *
     * @param left 왼쪽 값 (null 허용)
     * @param right 오른쪽 값 (null 허용)
     * @param <T> 값 타입
     * @return 결합 결과, 결합 불가 시 right
     */
    @SuppressWarnings("unchecked")
    public static <T> T combine(T left, T right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        try {
            return (T) combineNonNull(left, right);
        } catch (UnsupportedAddendException e) {
            return right;
        }
    }

    /**
     * 순서가 있는 값 시퀀스를 왼쪽부터 결합.
     *
     * @param addables 결합할 값들
     * @param <T> 값 타입
     * @return 누적 결과, 입력이 비어 있으면 {@link Optional#empty()}
     * @throws IllegalArgumentException addables가 null인 경우
     */
    public static <T> Optional<T> add(Iterable<? extends T> addables) {
        if (addables == null) {
            throw new IllegalArgumentException("addables cannot be null");
        }
        T total = null;
        for (T chunk : addables) {
            total = combine(total, chunk);
        }
        return Optional.ofNullable(total);
    }

    private static Object combineNonNull(Object left, Object right) {
        if (left instanceof Addable<?> addable) {
            return addable.add(right);
        }
        if (left instanceof Map<?, ?> leftMap && right instanceof Map<?, ?> rightMap) {
            return combineMaps(leftMap, rightMap);
        }
        if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
            List<Object> joined = new ArrayList<>(leftList.size() + rightList.size());
            joined.addAll(leftList);
            joined.addAll(rightList);
            return joined;
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString() + right;
        }
        if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
            return addNumbers(leftNumber, rightNumber);
        }
        throw new UnsupportedAddendException(left, right);
    }

    private static Map<Object, Object> combineMaps(Map<?, ?> left, Map<?, ?> right) {
        Map<Object, Object> merged = new LinkedHashMap<>(left);
        for (Map.Entry<?, ?> entry : right.entrySet()) {
            Object key = entry.getKey();
            Object current = merged.get(key);
            Object incoming = entry.getValue();
            if (current == null) {
                merged.put(key, incoming);
            } else if (incoming != null) {
                merged.put(key, combine(current, incoming));
            }
        }
        return merged;
    }

    private static Number addNumbers(Number left, Number right) {
        if (left instanceof BigDecimal || right instanceof BigDecimal) {
            return toBigDecimal(left).add(toBigDecimal(right));
        }
        if (left instanceof BigInteger || right instanceof BigInteger) {
            if (isFloating(left) || isFloating(right)) {
                return toBigDecimal(left).add(toBigDecimal(right));
            }
            return toBigInteger(left).add(toBigInteger(right));
        }
        if (isFloating(left) || isFloating(right)) {
            if (left instanceof Float && right instanceof Float) {
                return left.floatValue() + right.floatValue();
            }
            return left.doubleValue() + right.doubleValue();
        }
        if (!isIntegral(left) || !isIntegral(right)) {
            throw new UnsupportedAddendException(left, right);
        }
        if (left instanceof Integer && right instanceof Integer) {
            try {
                return Math.addExact(left.intValue(), right.intValue());
            } catch (ArithmeticException overflow) {
                return left.longValue() + right.longValue();
            }
        }
        if (left instanceof Short && right instanceof Short) {
            int sum = left.intValue() + right.intValue();
            if (sum >= Short.MIN_VALUE && sum <= Short.MAX_VALUE) {
                return Short.valueOf((short) sum);
            }
            return Integer.valueOf(sum);
        }
        if (left instanceof Byte && right instanceof Byte) {
            int sum = left.intValue() + right.intValue();
            if (sum >= Byte.MIN_VALUE && sum <= Byte.MAX_VALUE) {
                return Byte.valueOf((byte) sum);
            }
            return Integer.valueOf(sum);
        }
        try {
            return Math.addExact(left.longValue(), right.longValue());
        } catch (ArithmeticException overflow) {
            return BigInteger.valueOf(left.longValue()).add(BigInteger.valueOf(right.longValue()));
        }
    }

    private static boolean isFloating(Number number) {
        return number instanceof Double || number instanceof Float;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isFloating(number)) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        throw new UnsupportedAddendException(number, null);
    }

    private static BigInteger toBigInteger(Number number) {
        if (number instanceof BigInteger integer) {
            return integer;
        }
        return BigInteger.valueOf(number.longValue());
    }
}
