/**
 * Admission gate SPI 패키지.
 *
 * <p>bounded gather가 동시 실행 수를 제한하는 데 쓰는 {@link com.ryuqq.runlog.core.protection.Bulkhead}
 * 확장점을 정의합니다.</p>
 *
 * <h2>구현</h2>
 * <ul>
 *   <li>{@code noop.NoOpBulkhead}: 제한 없음 (limit 미지정 시)</li>
 *   <li>{@code adapter.runner.SemaphoreBulkhead}: Semaphore 기반 카운팅 게이트</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.runlog.core.protection.Bulkhead
 * @see com.ryuqq.runlog.core.protection.noop
 */
package com.ryuqq.runlog.core.protection;
