/**
 * Runner adapters.
 *
 * <p>Bounded-concurrency execution and event fan-out built on top of the translator.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlog.adapter.runner.BoundedGather} - runs a fixed task list under a concurrency ceiling, fail-fast</li>
 *   <li>{@link com.ryuqq.runlog.adapter.runner.SemaphoreBulkhead} - counting admission gate</li>
 *   <li>{@link com.ryuqq.runlog.adapter.runner.RunEventFanOut} - serves one translated event stream to many subscribers</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedGather gather = new BoundedGather();
 * List<String> pages = gather.gather(4, urls.stream()
 *     .map(url -> (Callable<String>) () -> http.get(url))
 *     .toList());
 * gather.shutdown();
 * }</pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.adapter.runner;
