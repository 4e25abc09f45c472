/**
 * Lifecycle event model.
 *
 * <p>{@link com.ryuqq.runlog.core.event.StreamEvent} is the flat, immutable event
 * delivered to consumers. The event name follows the fixed vocabulary
 * {@code on_<category>_<start|stream|end>}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.core.event;
