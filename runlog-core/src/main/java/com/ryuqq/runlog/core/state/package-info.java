/**
 * Run-state tree package.
 *
 * <p>{@link com.ryuqq.runlog.core.state.RunLog} folds patches into one mutable
 * tree owned by a single translation session. {@link com.ryuqq.runlog.core.state.RunNode}
 * is a typed view over the root or a {@code logs/<segment>} entry and exposes the
 * consume operations that free {@code inputs}, {@code final_output} and
 * {@code streamed_output} after their single use.</p>
 *
 * <h2>Tree Shape</h2>
 * <pre>
 * {
 *   id, name, type, tags, metadata, streamed_output, final_output,
 *   logs: {
 *     &lt;segment&gt;: { id, name, type, tags, metadata, inputs,
 *                   streamed_output, final_output, end_time }
 *   }
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.core.state;
