package com.ryuqq.runlog.testkit.contract;

import com.ryuqq.runlog.core.patch.PatchOp;
import com.ryuqq.runlog.core.patch.RunLogPatch;
import com.ryuqq.runlog.core.state.RunNode;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for patch sequences shaped like the ones a run tracer emits.
 *
 * <p>Each builder call appends exactly one {@link RunLogPatch}. Use {@link #patch(PatchOp...)}
 * to put several operations into the same patch.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * List<RunLogPatch> patches = RunLogScenario.create()
 *     .rootStart("r1", "pipeline", "chain")
 *     .subRunStart("llm", "s1", "model", "llm")
 *     .subRunChunk("llm", "Hel")
 *     .subRunEnd("llm", "Hello")
 *     .rootOutput(Map.of("output", "Hello"))
 *     .build();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLogScenario {

    /**
     * Timestamp written into {@code end_time} by {@link #subRunEnd(String, Object)}.
     */
    public static final String END_TIME = "2024-01-01T00:00:00Z";

    private final List<RunLogPatch> patches = new ArrayList<>();

    private RunLogScenario() {
    }

    /**
     * Creates an empty scenario.
     *
     * @return a new scenario
     */
    public static RunLogScenario create() {
        return new RunLogScenario();
    }

    /**
     * Replaces the whole state with a fresh root run.
     *
     * @param id the root run id
     * @param name the root run name
     * @param type the root run type, or null to leave the type tag out
     * @return this scenario
     */
    public RunLogScenario rootStart(String id, String name, String type) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(RunNode.ID, id);
        root.put(RunNode.NAME, name);
        if (type != null) {
            root.put(RunNode.TYPE, type);
        }
        root.put(RunNode.STREAMED_OUTPUT, new ArrayList<>());
        root.put(RunNode.FINAL_OUTPUT, null);
        root.put(RunNode.LOGS, new LinkedHashMap<>());
        return patch(PatchOp.replace("", root));
    }

    /**
     * Appends one chunk to the root's streamed output.
     *
     * @param chunk the chunk
     * @return this scenario
     */
    public RunLogScenario rootChunk(Object chunk) {
        return patch(PatchOp.add("/streamed_output/-", chunk));
    }

    /**
     * Sets the root's final output.
     *
     * @param output the final output
     * @return this scenario
     */
    public RunLogScenario rootOutput(Object output) {
        return patch(PatchOp.replace("/final_output", output));
    }

    /**
     * Creates a sub-run with no tags and no inputs.
     *
     * @param segment the key under {@code /logs}
     * @param id the sub-run id
     * @param name the sub-run name
     * @param type the sub-run type, or null to leave the type tag out
     * @return this scenario
     */
    public RunLogScenario subRunStart(String segment, String id, String name, String type) {
        return subRunStart(segment, id, name, type, List.of(), null);
    }

    /**
     * Creates a sub-run.
     *
     * @param segment the key under {@code /logs}
     * @param id the sub-run id
     * @param name the sub-run name
     * @param type the sub-run type, or null to leave the type tag out
     * @param tags the sub-run tags
     * @param inputs the sub-run inputs, or null when they are not known yet
     * @return this scenario
     */
    public RunLogScenario subRunStart(String segment, String id, String name, String type,
                                      List<String> tags, Object inputs) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put(RunNode.ID, id);
        node.put(RunNode.NAME, name);
        if (type != null) {
            node.put(RunNode.TYPE, type);
        }
        node.put(RunNode.TAGS, new ArrayList<>(tags));
        node.put(RunNode.METADATA, new LinkedHashMap<>());
        if (inputs != null) {
            node.put(RunNode.INPUTS, inputs);
        }
        node.put(RunNode.STREAMED_OUTPUT, new ArrayList<>());
        node.put(RunNode.FINAL_OUTPUT, null);
        node.put(RunNode.END_TIME, null);
        return patch(PatchOp.add(subRunPath(segment), node));
    }

    /**
     * Sets a sub-run's inputs after it was created.
     *
     * @param segment the key under {@code /logs}
     * @param inputs the inputs
     * @return this scenario
     */
    public RunLogScenario subRunInputs(String segment, Object inputs) {
        return patch(PatchOp.add(subRunPath(segment) + "/" + RunNode.INPUTS, inputs));
    }

    /**
     * Appends one chunk to a sub-run's streamed output.
     *
     * @param segment the key under {@code /logs}
     * @param chunk the chunk
     * @return this scenario
     */
    public RunLogScenario subRunChunk(String segment, Object chunk) {
        return patch(PatchOp.add(subRunPath(segment) + "/" + RunNode.STREAMED_OUTPUT + "/-", chunk));
    }

    /**
     * Ends a sub-run: one patch carrying both the final output and the end time.
     *
     * @param segment the key under {@code /logs}
     * @param finalOutput the final output
     * @return this scenario
     */
    public RunLogScenario subRunEnd(String segment, Object finalOutput) {
        return patch(
            PatchOp.add(subRunPath(segment) + "/" + RunNode.FINAL_OUTPUT, finalOutput),
            PatchOp.add(subRunPath(segment) + "/" + RunNode.END_TIME, END_TIME)
        );
    }

    /**
     * Appends a raw patch.
     *
     * @param ops the operations of the patch
     * @return this scenario
     */
    public RunLogScenario patch(PatchOp... ops) {
        patches.add(RunLogPatch.of(ops));
        return this;
    }

    /**
     * Returns the patches built so far.
     *
     * @return an immutable copy of the patch list
     */
    public List<RunLogPatch> build() {
        return List.copyOf(patches);
    }

    /**
     * Returns the patches built so far as a cold publisher.
     *
     * @return a Flux replaying the patch list to each subscriber
     */
    public Flux<RunLogPatch> toFlux() {
        return Flux.fromIterable(build());
    }

    private static String subRunPath(String segment) {
        return "/" + RunNode.LOGS + "/" + segment.replace("~", "~0").replace("/", "~1");
    }
}
