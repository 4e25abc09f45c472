package com.ryuqq.runlog.adapter.runner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * BoundedGather 테스트.
 *
 * <ul>
 *   <li>결과는 완료 순서와 무관하게 입력 순서</li>
 *   <li>동시 실행 수는 limit을 넘지 않음</li>
 *   <li>첫 실패가 전체 호출을 원래 예외로 실패시킴</li>
 *   <li>limit == null이면 모든 작업이 동시에 실행됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("BoundedGather 테스트")
class BoundedGatherTest {

    private BoundedGather gather;

    @BeforeEach
    void setUp() {
        gather = new BoundedGather();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        gather.shutdown();
    }

    private static Callable<Integer> sleepThenReturn(int value, long sleepMs) {
        return () -> {
            Thread.sleep(sleepMs);
            return value;
        };
    }

    @Nested
    @DisplayName("결과")
    class Results {

        @Test
        @DisplayName("결과는 입력 순서를 유지한다")
        void gather_입력_순서_유지() throws Exception {
            // given: 뒤 작업일수록 먼저 끝남
            List<Callable<Integer>> tasks = List.of(
                sleepThenReturn(0, 150),
                sleepThenReturn(1, 100),
                sleepThenReturn(2, 50),
                sleepThenReturn(3, 0));

            // when
            List<Integer> results = gather.gather(2, tasks);

            // then
            assertThat(results).containsExactly(0, 1, 2, 3);
        }

        @Test
        @DisplayName("빈 작업 목록은 빈 결과를 반환한다")
        void gather_빈_목록() throws Exception {
            assertThat(gather.gather(3, List.<Callable<String>>of())).isEmpty();
            assertThat(gather.gather(null, List.<Callable<String>>of())).isEmpty();
        }

        @Test
        @DisplayName("null 결과도 그대로 전달한다")
        void gather_null_결과() throws Exception {
            // given
            List<Callable<String>> tasks = List.of(() -> null, () -> "b");

            // when
            List<String> results = gather.gather(1, tasks);

            // then
            assertThat(results).containsExactly(null, "b");
        }

        @Test
        @DisplayName("호출 이후 작업 목록을 변경해도 결과에 영향이 없다")
        void gatherAsync_호출_후_목록_변경_무시() throws Exception {
            // given
            CountDownLatch firstRunning = new CountDownLatch(1);
            CountDownLatch releaseFirst = new CountDownLatch(1);
            List<Callable<Integer>> tasks = new ArrayList<>();
            tasks.add(() -> {
                firstRunning.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
                return 0;
            });
            tasks.add(() -> 1);
            tasks.add(() -> 2);

            // when
            CompletableFuture<List<Integer>> future = gather.gatherAsync(1, tasks);
            assertThat(firstRunning.await(5, TimeUnit.SECONDS)).isTrue();
            tasks.set(1, () -> -1);
            tasks.remove(2);
            releaseFirst.countDown();

            // then
            assertThat(future.get(5, TimeUnit.SECONDS)).containsExactly(0, 1, 2);
        }
    }

    @Nested
    @DisplayName("동시성 상한")
    class Ceiling {

        @Test
        @DisplayName("동시 실행 수는 limit을 넘지 않는다")
        void gather_limit_초과_없음() throws Exception {
            // given
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int value = i;
                tasks.add(() -> {
                    int now = active.incrementAndGet();
                    maxActive.accumulateAndGet(now, Math::max);
                    try {
                        Thread.sleep(20);
                        return value;
                    } finally {
                        active.decrementAndGet();
                    }
                });
            }

            // when
            List<Integer> results = gather.gather(3, tasks);

            // then
            assertThat(results).hasSize(20);
            assertThat(maxActive.get()).isBetween(1, 3);
        }

        @Test
        @DisplayName("limit이 null이면 모든 작업이 동시에 실행된다")
        void gather_limit_null_전체_동시() throws Exception {
            // given: 모든 작업이 동시에 실행되어야만 통과하는 barrier
            int taskCount = 5;
            CountDownLatch allRunning = new CountDownLatch(taskCount);
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < taskCount; i++) {
                tasks.add(() -> {
                    allRunning.countDown();
                    return allRunning.await(5, TimeUnit.SECONDS);
                });
            }

            // when
            List<Boolean> results = gather.gather(null, tasks);

            // then
            assertThat(results).containsOnly(true);
        }

        @Test
        @DisplayName("limit이 양수가 아니면 IllegalArgumentException")
        void gather_잘못된_limit_예외() {
            List<Callable<Integer>> tasks = List.of(() -> 1);

            assertThatThrownBy(() -> gather.gather(0, tasks))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit must be positive");
        }

        @Test
        @DisplayName("null 작업은 IllegalArgumentException")
        void gather_null_작업_예외() {
            List<Callable<Integer>> tasks = new ArrayList<>();
            tasks.add(null);

            assertThatThrownBy(() -> gather.gather(1, tasks))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> gather.gather(1, null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("fail-fast")
    class FailFast {

        @Test
        @DisplayName("5개 중 3번째 작업이 실패하면 전체 호출이 그 예외로 실패한다")
        void gather_세번째_실패_전체_실패() {
            // given
            IllegalStateException failure = new IllegalStateException("task 3 failed");
            List<Callable<Integer>> tasks = List.of(
                sleepThenReturn(0, 0),
                sleepThenReturn(1, 0),
                () -> {
                    throw failure;
                },
                sleepThenReturn(3, 300),
                sleepThenReturn(4, 300));

            // when & then
            assertThatThrownBy(() -> gather.gather(null, tasks))
                .isInstanceOf(ExecutionException.class)
                .hasCause(failure);
        }

        @Test
        @DisplayName("실패 이후의 대기 작업은 진입시키지 않는다")
        void gather_실패_후_진입_중단() {
            // given
            Set<Integer> started = ConcurrentHashMap.newKeySet();
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                int index = i;
                tasks.add(() -> {
                    started.add(index);
                    if (index == 2) {
                        throw new IllegalStateException("task 3 failed");
                    }
                    return index;
                });
            }

            // when
            CompletableFuture<List<Integer>> future = gather.gatherAsync(1, tasks);

            // then
            assertThatThrownBy(future::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(started).doesNotContain(3, 4);
        }

        @Test
        @DisplayName("checked 예외도 원래 예외로 전달한다")
        void gather_checked_예외_전달() {
            // given
            Exception failure = new IOException("io failed");
            List<Callable<Integer>> tasks = List.of(() -> {
                throw failure;
            });

            // when & then
            assertThatThrownBy(() -> gather.gather(2, tasks))
                .isInstanceOf(ExecutionException.class)
                .hasCause(failure);
        }

        @Test
        @DisplayName("외부에서 취소하면 남은 작업을 진입시키지 않는다")
        void gatherAsync_취소_후_진입_중단() throws Exception {
            // given
            CountDownLatch firstRunning = new CountDownLatch(1);
            CountDownLatch releaseFirst = new CountDownLatch(1);
            AtomicInteger started = new AtomicInteger();
            List<Callable<Integer>> tasks = new ArrayList<>();
            tasks.add(() -> {
                started.incrementAndGet();
                firstRunning.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
                return 0;
            });
            for (int i = 1; i < 4; i++) {
                int value = i;
                tasks.add(() -> {
                    started.incrementAndGet();
                    return value;
                });
            }

            // when
            CompletableFuture<List<Integer>> future = gather.gatherAsync(1, tasks);
            assertThat(firstRunning.await(5, TimeUnit.SECONDS)).isTrue();
            future.cancel(false);
            releaseFirst.countDown();
            Thread.sleep(200);

            // then
            assertThat(future.isCancelled()).isTrue();
            assertThat(started.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("외부 ExecutorService")
    @ExtendWith(MockitoExtension.class)
    class InjectedExecutor {

        @Mock
        private ExecutorService executor;

        @Test
        @DisplayName("executor가 작업을 거부하면 전체 호출이 실패한다")
        void gather_거부_실패() {
            // given
            doThrow(new RejectedExecutionException("saturated")).when(executor).execute(any(Runnable.class));
            BoundedGather injected = new BoundedGather(executor);
            List<Callable<Integer>> tasks = List.of(() -> 1, () -> 2);

            // when & then
            assertThatThrownBy(() -> injected.gather(1, tasks))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
        }

        @Test
        @DisplayName("shutdown()은 주입된 executor를 종료하지 않는다")
        void shutdown_주입된_executor_유지() throws InterruptedException {
            // given
            BoundedGather injected = new BoundedGather(executor);

            // when
            injected.shutdown();

            // then
            verify(executor, never()).shutdown();
        }

        @Test
        @DisplayName("executor가 null이면 IllegalArgumentException")
        void 생성자_null_예외() {
            assertThatThrownBy(() -> new BoundedGather(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("executor cannot be null");
        }
    }
}
