/**
 * Addable merge package.
 *
 * <p>A total, stateless binary combine over numbers, text, lists, maps and
 * {@link com.ryuqq.runlog.core.merge.Addable} values, plus a left fold.
 * A combine whose operand types do not match yields the right operand.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Accumulator.combine(Map.of("a", "x"), Map.of("a", "y", "b", 1)); // {a=xy, b=1}
 * Accumulator.combine(1, "a");                                     // "a"
 * Accumulator.add(List.of(List.of(1), List.of(2)));                // Optional[[1, 2]]
 * }</pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.core.merge;
