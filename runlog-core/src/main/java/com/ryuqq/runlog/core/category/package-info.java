/**
 * Run category package.
 *
 * <p>Resolves a run's type tag into one of two variants with their own
 * input and output extraction rules.</p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runlog.core.category.LegacyRun} - retriever, tool, llm</li>
 *   <li>{@link com.ryuqq.runlog.core.category.ChainRun} - everything else</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.core.category;
