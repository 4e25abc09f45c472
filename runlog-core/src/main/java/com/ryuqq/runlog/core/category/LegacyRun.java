package com.ryuqq.runlog.core.category;

import com.ryuqq.runlog.core.state.RunNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 구형 run (retriever, tool, llm).
 *
 * <p>inputs와 final_output을 감싸지 않고 그대로 {@code input}/{@code output}으로 전달합니다.</p>
 *
 * @param type 타입 태그
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LegacyRun(String type) implements RunCategory {

    public LegacyRun {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
    }

    @Override
    public Map<String, Object> startData(RunNode node) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (node.hasInputs()) {
            data.put("input", node.inputs());
        }
        return data;
    }

    @Override
    public Map<String, Object> endData(RunNode node) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("output", node.consumeFinalOutput());
        // 스트리밍 run은 종료 시점에야 입력이 확정된다
        if (node.hasInputs()) {
            data.put("input", node.consumeInputs());
        }
        return data;
    }

    @Override
    public Object rootOutput(RunNode root) {
        return root.finalOutput();
    }
}
