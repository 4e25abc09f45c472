package com.ryuqq.runlog.core.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StreamEvent 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StreamEventTest {

    @Test
    void 생성자_null_컬렉션_빈값으로() {
        // when
        StreamEvent event = new StreamEvent("on_chain_start", "pipeline", "r1", null, null, null);

        // then
        assertThat(event.tags()).isEmpty();
        assertThat(event.metadata()).isEmpty();
        assertThat(event.data()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void 생성자_방어적_복사() {
        // given
        List<String> tags = new ArrayList<>(List.of("prod"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("chunk", new ArrayList<>(List.of("a")));

        // when
        StreamEvent event = new StreamEvent("on_llm_stream", "model", "s1", tags, Map.of(), data);
        tags.add("late");
        data.put("extra", 1);

        // then
        assertThat(event.tags()).containsExactly("prod");
        assertThat(event.data()).containsOnlyKeys("chunk");
        assertThatThrownBy(() -> ((List<Object>) event.data().get("chunk")).add("b"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 생성자_null_값_허용() {
        // given
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("output", null);

        // when
        StreamEvent event = new StreamEvent("on_chain_end", null, null, List.of(), Map.of(), data);

        // then
        assertThat(event.data()).containsKey("output");
        assertThat(event.data().get("output")).isNull();
    }

    @Test
    void 생성자_빈_이벤트명_예외() {
        assertThatThrownBy(() -> new StreamEvent(" ", "n", "r1", null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void kind_이벤트명_접미사로_판별() {
        assertThat(new StreamEvent("on_chat_model_stream", null, null, null, null, null).kind())
            .isEqualTo(EventKind.STREAM);
        assertThat(new StreamEvent(EventKind.END.eventName("tool"), null, null, null, null, null).kind())
            .isEqualTo(EventKind.END);
    }
}
