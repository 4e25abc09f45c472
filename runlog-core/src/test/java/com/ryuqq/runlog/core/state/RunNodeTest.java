package com.ryuqq.runlog.core.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunNode consume 연산 테스트.
 *
 * <p>consume 연산은 값을 반환하고 슬롯을 비워, 같은 값이 두 번 방출되지 않게 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunNodeTest {

    private static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Test
    void consumeFinalOutput_ReturnsValueAndClearsSlot() {
        // Given
        Map<String, Object> state = fields(RunNode.FINAL_OUTPUT, "done");
        RunNode node = RunNode.wrap(state);

        // When
        Object first = node.consumeFinalOutput();
        Object second = node.consumeFinalOutput();

        // Then
        assertEquals("done", first);
        assertNull(second);
        assertFalse(state.containsKey(RunNode.FINAL_OUTPUT));
    }

    @Test
    void consumeInputs_ReturnsValueAndClearsSlot() {
        // Given
        RunNode node = RunNode.wrap(fields(RunNode.INPUTS, Map.of("query", "q")));

        // When
        Object inputs = node.consumeInputs();

        // Then
        assertEquals(Map.of("query", "q"), inputs);
        assertFalse(node.hasInputs());
    }

    @Test
    void consumeSingleChunk_OneChunk_DrainsBuffer() {
        // Given
        RunNode node = RunNode.wrap(fields(RunNode.STREAMED_OUTPUT, new ArrayList<>(List.of("chunk"))));

        // When
        Object chunk = node.consumeSingleChunk();

        // Then
        assertEquals("chunk", chunk);
        assertFalse(node.hasStreamedOutput());
    }

    @Test
    void consumeSingleChunk_TwoChunks_ThrowsInvariantException() {
        // Given
        RunNode node = RunNode.wrap(fields(
            RunNode.NAME, "model",
            RunNode.STREAMED_OUTPUT, new ArrayList<>(List.of("a", "b"))));

        // When
        StreamedOutputInvariantException exception = assertThrows(
            StreamedOutputInvariantException.class,
            node::consumeSingleChunk
        );

        // Then: buffer is left untouched
        assertEquals(2, exception.getChunkCount());
        assertEquals("model", exception.getRunName());
        assertEquals(
            "Expected exactly one chunk of streamed output, got 2 instead. Encountered in: model",
            exception.getMessage());
        assertEquals(2, node.streamedOutput().size());
    }

    @Test
    void consumeSingleChunk_EmptyBuffer_ThrowsInvariantException() {
        RunNode node = RunNode.wrap(fields());
        assertThrows(StreamedOutputInvariantException.class, node::consumeSingleChunk);
    }

    @Test
    void accessors_MissingFields_ReturnDefaults() {
        // Given
        RunNode node = RunNode.wrap(fields(RunNode.TAGS, "not-a-list", RunNode.END_TIME, null));

        // Then
        assertNull(node.id());
        assertNull(node.type());
        assertTrue(node.tags().isEmpty());
        assertTrue(node.metadata().isEmpty());
        assertFalse(node.isEnded());
        assertFalse(node.hasInputs());
    }

    @Test
    void hasInputs_EmptyMapping_ReturnsFalse() {
        assertFalse(RunNode.wrap(fields(RunNode.INPUTS, Map.of())).hasInputs());
        assertTrue(RunNode.wrap(fields(RunNode.INPUTS, "text")).hasInputs());
    }
}
