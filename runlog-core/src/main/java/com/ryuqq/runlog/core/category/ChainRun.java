package com.ryuqq.runlog.core.category;

import com.ryuqq.runlog.core.state.RunNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 신형 chain run.
 *
 * <p>inputs는 {@code {"input": ...}}, final_output은 {@code {"output": ...}} 형태로
 * 감싸져 있으며, 이벤트에는 감싼 값을 풀어 전달합니다.</p>
 *
 * <p>final_output이 Map도 null도 아니면 end 이벤트에 {@code output} 키를 넣지 않습니다.</p>
 *
 * @param type 타입 태그
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChainRun(String type) implements RunCategory {

    private static final String INPUT_KEY = "input";
    private static final String OUTPUT_KEY = "output";

    public ChainRun {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
    }

    @Override
    public Map<String, Object> startData(RunNode node) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (node.inputs() instanceof Map<?, ?> inputs) {
            data.put(INPUT_KEY, inputs.get(INPUT_KEY));
        }
        return data;
    }

    @Override
    public Map<String, Object> endData(RunNode node) {
        Map<String, Object> data = new LinkedHashMap<>();
        Object finalOutput = node.finalOutput();
        if (finalOutput == null) {
            data.put(OUTPUT_KEY, null);
        } else if (finalOutput instanceof Map<?, ?> wrapped) {
            data.put(OUTPUT_KEY, wrapped.get(OUTPUT_KEY));
            node.consumeFinalOutput();
        }
        if (node.inputs() instanceof Map<?, ?> inputs && inputs.containsKey(INPUT_KEY)) {
            data.put(INPUT_KEY, inputs.get(INPUT_KEY));
            node.consumeInputs();
        }
        return data;
    }

    @Override
    public Object rootOutput(RunNode root) {
        Object finalOutput = root.finalOutput();
        if (finalOutput instanceof Map<?, ?> wrapped && wrapped.containsKey(OUTPUT_KEY)) {
            return wrapped.get(OUTPUT_KEY);
        }
        return finalOutput;
    }
}
