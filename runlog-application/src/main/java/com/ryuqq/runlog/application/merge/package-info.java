/**
 * Asynchronous fold over addable values.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.runlog.application.merge;
