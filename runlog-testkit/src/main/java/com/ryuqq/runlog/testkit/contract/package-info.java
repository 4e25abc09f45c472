/**
 * Translation contract test support.
 *
 * <p>{@link com.ryuqq.runlog.testkit.contract.RunLogScenario} builds tracer-shaped patch sequences;
 * {@link com.ryuqq.runlog.testkit.contract.AbstractTranslationContractTest} translates them and
 * asserts on the resulting events.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.testkit.contract;
