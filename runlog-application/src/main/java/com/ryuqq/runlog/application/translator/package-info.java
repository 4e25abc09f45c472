/**
 * Run-state event translator package.
 *
 * <p>Turns an ordered stream of {@link com.ryuqq.runlog.core.patch.RunLogPatch}es into a flat
 * stream of {@link com.ryuqq.runlog.core.event.StreamEvent}s, one per observed state transition,
 * for the root run and every nested sub-run.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlog.application.translator.RunLogEventSession} - synchronous, single-owner state machine</li>
 *   <li>{@link com.ryuqq.runlog.application.translator.RunLogEventTranslator} - Reactor wrapper, one session per subscription</li>
 *   <li>{@link com.ryuqq.runlog.application.translator.TranslatorConfig} - immutable settings</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>Events derived from different patches keep patch order. Events for sub-runs touched by the
 * same patch are emitted in an unspecified relative order.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.application.translator;
