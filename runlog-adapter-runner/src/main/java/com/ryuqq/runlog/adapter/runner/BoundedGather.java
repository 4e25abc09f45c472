package com.ryuqq.runlog.adapter.runner;

import com.ryuqq.runlog.core.protection.Bulkhead;
import com.ryuqq.runlog.core.protection.BulkheadConfig;
import com.ryuqq.runlog.core.protection.noop.NoOpBulkhead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 동시 실행 수 상한을 둔 작업 일괄 실행기.
 *
 * <p>고정된 독립 작업 목록을 실행하고, 입력 순서대로 결과를 반환합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>limit == null: 모든 작업을 즉시 제출 ({@link NoOpBulkhead})</li>
 *   <li>limit &gt; 0: {@link SemaphoreBulkhead}로 최대 limit개만 진입</li>
 *   <li>진입하지 못한 작업은 대기열에만 존재 (스레드를 점유하지 않음)</li>
 *   <li>작업 완료 시 permit 해제 후 다음 대기 작업 진입 (FIFO 보장 안 함)</li>
 *   <li>모든 작업 성공 시 입력 순서의 결과 목록으로 완료</li>
 * </ol>
 *
 * <p><strong>실패 정책 (fail-fast):</strong></p>
 * <ul>
 *   <li>첫 번째 실패가 원래 예외로 전체 호출을 실패시킴</li>
 *   <li>이후 대기 작업은 진입시키지 않음</li>
 *   <li>이미 실행 중인 작업은 강제 취소하지 않지만 결과는 버림</li>
 * </ul>
 *
 * <p>타임아웃은 없습니다. 호출 측이 반환된 future를 취소하거나 시간 제한을 걸어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BoundedGather {

    private static final Logger log = LoggerFactory.getLogger(BoundedGather.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * 생성자 (자체 cached thread pool 사용).
     *
     * <p>사용 후 {@link #shutdown()}을 호출해야 합니다.</p>
     */
    public BoundedGather() {
        this(Executors.newCachedThreadPool(), true);
    }

    /**
     * 생성자 (외부 ExecutorService 주입, 종료는 호출 측 책임).
     *
     * @param executor 작업을 실행할 ExecutorService
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public BoundedGather(ExecutorService executor) {
        this(executor, false);
    }

    private BoundedGather(ExecutorService executor, boolean ownsExecutor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * 작업들을 실행하고 모든 결과를 기다림 (블로킹).
     *
     * @param limit 최대 동시 실행 수 (null이면 제한 없음)
     * @param tasks 실행할 작업 목록
     * @param <T> 결과 타입
     * @return 입력 순서의 결과 목록
     * @throws ExecutionException 작업 하나가 실패한 경우 (cause = 원래 예외)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException limit이 양수가 아니거나 tasks가 null/null 요소를 포함하는 경우
     */
    public <T> List<T> gather(Integer limit, List<? extends Callable<T>> tasks)
            throws ExecutionException, InterruptedException {
        return gatherAsync(limit, tasks).get();
    }

    /**
     * 작업들을 실행 (비블로킹).
     *
     * @param limit 최대 동시 실행 수 (null이면 제한 없음)
     * @param tasks 실행할 작업 목록 (호출 시점에 복사되며 이후 변경은 반영되지 않음)
     * @param <T> 결과 타입
     * @return 입력 순서의 결과 목록으로 완료되는 future, 첫 실패 시 그 예외로 완료
     * @throws IllegalArgumentException limit이 양수가 아니거나 tasks가 null/null 요소를 포함하는 경우
     */
    public <T> CompletableFuture<List<T>> gatherAsync(Integer limit, List<? extends Callable<T>> tasks) {
        validateInput(limit, tasks);
        Bulkhead gate = limit == null
            ? NoOpBulkhead.INSTANCE
            : new SemaphoreBulkhead(new BulkheadConfig(limit));
        return new GatherCall<T>(List.copyOf(tasks), gate).start();
    }

    /**
     * 자체 생성한 스레드 풀 종료.
     *
     * <p>외부에서 주입한 ExecutorService는 종료하지 않습니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    private static void validateInput(Integer limit, List<?> tasks) {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (Object task : tasks) {
            if (task == null) {
                throw new IllegalArgumentException("tasks cannot contain null");
            }
        }
    }

    /**
     * gather 호출 1회의 상태 (호출 간 공유 없음).
     */
    private final class GatherCall<T> {

        private final List<? extends Callable<T>> tasks;
        private final Bulkhead gate;
        private final List<CompletableFuture<T>> slots;
        private final Queue<Integer> pending;
        private final CompletableFuture<List<T>> aggregate;

        private GatherCall(List<? extends Callable<T>> tasks, Bulkhead gate) {
            this.tasks = tasks;
            this.gate = gate;
            this.slots = new ArrayList<>(tasks.size());
            this.pending = new ConcurrentLinkedQueue<>();
            this.aggregate = new CompletableFuture<>();
        }

        private CompletableFuture<List<T>> start() {
            if (tasks.isEmpty()) {
                aggregate.complete(Collections.emptyList());
                return aggregate;
            }
            for (int i = 0; i < tasks.size(); i++) {
                slots.add(new CompletableFuture<>());
                pending.add(i);
            }
            CompletableFuture.allOf(slots.toArray(new CompletableFuture<?>[0]))
                .thenRun(() -> aggregate.complete(collectResults()));
            admit();
            return aggregate;
        }

        private void admit() {
            while (!aggregate.isDone() && !pending.isEmpty() && gate.tryAcquire()) {
                Integer index = pending.poll();
                if (index == null) {
                    // 다른 스레드가 마지막 대기 작업을 가져감
                    gate.release();
                    return;
                }
                log.debug("Admitted gather task {} (active: {})", index, gate.getCurrentConcurrency());
                launch(index);
            }
        }

        private void launch(int index) {
            Callable<T> task = tasks.get(index);
            try {
                executor.execute(() -> run(index, task));
            } catch (RejectedExecutionException e) {
                gate.release();
                fail(index, e);
            }
        }

        private void run(int index, Callable<T> task) {
            try {
                slots.get(index).complete(task.call());
            } catch (Throwable t) {
                fail(index, t);
            } finally {
                gate.release();
                admit();
            }
        }

        private void fail(int index, Throwable failure) {
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
            slots.get(index).completeExceptionally(cause);
            if (aggregate.completeExceptionally(cause)) {
                log.warn("Gather task {} failed, aborting with {} tasks never admitted", index, pending.size(), cause);
            }
        }

        private List<T> collectResults() {
            List<T> results = new ArrayList<>(slots.size());
            for (CompletableFuture<T> slot : slots) {
                results.add(slot.join());
            }
            return Collections.unmodifiableList(results);
        }
    }
}
