package com.ryuqq.runlog.core.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON Pointer(RFC 6901) 경로 파서.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonPointer {

    /**
     * 리스트 끝을 가리키는 세그먼트.
     */
    public static final String APPEND = "-";

    // Utility class - prevent instantiation
    private JsonPointer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 경로를 디코딩된 세그먼트 목록으로 분해.
     *
     * @param path JSON Pointer ("" = 루트)
     * @return 세그먼트 목록 (루트는 빈 목록)
     * @throws IllegalArgumentException path가 null이거나 형식이 잘못된 경우
     */
    public static List<String> parse(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (path.isEmpty()) {
            return Collections.emptyList();
        }
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("JSON Pointer must start with '/' (current: " + path + ")");
        }
        String[] raw = path.substring(1).split("/", -1);
        List<String> segments = new ArrayList<>(raw.length);
        for (String segment : raw) {
            segments.add(unescape(segment));
        }
        return Collections.unmodifiableList(segments);
    }

    // ~1 먼저 풀어야 "~01"이 "~1"로 남는다
    private static String unescape(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }
}
