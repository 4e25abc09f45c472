package com.ryuqq.runlog.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * run-state 트리 값의 깊은 복사 유틸리티.
 *
 * <p>트리에 들어가는 값은 가변 복사본으로, 트리에서 나가는 값은 불변 복사본으로 만듭니다.
 * 두 경우 모두 null 값과 삽입 순서를 보존합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Trees {

    // Utility class - prevent instantiation
    private Trees() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 가변 깊은 복사 (Map → LinkedHashMap, List → ArrayList).
     *
     * @param value 원본 값 (null 허용)
     * @return 복사본, 스칼라는 그대로
     */
    public static Object mutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), mutableCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(mutableCopy(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * 불변 깊은 복사 (null 값 허용).
     *
     * @param value 원본 값 (null 허용)
     * @return 수정 불가능한 복사본, 스칼라는 그대로
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), immutableCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(immutableCopy(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * 값이 "존재"하는지 확인.
     *
     * <p>null, 빈 Map, 빈 List, 빈 문자열은 존재하지 않는 것으로 봅니다.</p>
     *
     * @param value 값
     * @return 존재하면 true
     */
    public static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        return true;
    }
}
