package io.gradeflow.core.grading;

import static org.assertj.core.api.Assertions.assertThat;

import io.gradeflow.core.TestFixtures;
import io.gradeflow.core.document.Page;
import io.gradeflow.core.rubric.RubricTree;
import io.gradeflow.core.segment.StudentSegment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GradingDispatcherTest {

    private static final RubricTree RUBRIC = TestFixtures.rubric(10, 10);

    private ExecutorService executor;
    private List<Page> pages;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        pages = TestFixtures.pages("answers", 30);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private GradingDispatcher dispatcher(GradingCapability capability, int workers, int retries) {
        return new GradingDispatcher(capability, executor, workers, retries, Duration.ofSeconds(5), 10);
    }

    private static StudentSegment segment(String key, int from, int to) {
        List<Integer> indices = new ArrayList<>();
        for (int p = from; p <= to; p++) {
            indices.add(p);
        }
        return new StudentSegment(key, indices, 1.0, false, List.of());
    }

    private static GradingOutcome ok() {
        return TestFixtures.outcome(TestFixtures.score("1", 8, 10, 0.9));
    }

    @Nested
    class Planning {

        @Test
        void shouldSplitLongSegmentIntoOrderedSubBatches() {
            var plan = dispatcher(request -> ok(), 2, 2).plan(List.of(segment("Ann", 0, 24)));

            assertThat(plan).extracting(GradingTask::taskId).containsExactly("task-001", "task-002", "task-003");
            assertThat(plan).extracting(GradingTask::subBatch).containsExactly(0, 1, 2);
            assertThat(plan.get(2).pages()).containsExactly(20, 21, 22, 23, 24);
            assertThat(plan).allMatch(t -> t.status() == TaskStatus.QUEUED);
        }

        @Test
        void shouldPlanRawBatchesWhenSegmentationIsSkipped() {
            var plan = dispatcher(request -> ok(), 2, 2).planBatches(23);

            assertThat(plan)
                    .extracting(GradingTask::studentKey)
                    .containsExactly("Batch 01", "Batch 02", "Batch 03");
            assertThat(plan.get(2).pages()).hasSize(3);
        }
    }

    @Nested
    class Retries {

        @Test
        void shouldRecoverTaskThatSucceedsOnLastAllowedAttempt() {
            Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
            GradingCapability capability =
                    request -> {
                        int attempt =
                                attempts.computeIfAbsent(request.taskId(), id -> new AtomicInteger())
                                        .incrementAndGet();
                        if (request.taskId().equals("task-002") && attempt <= 2) {
                            throw GradingException.transientFailure("rate limited", null);
                        }
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 2, 2);
            var plan =
                    dispatcher.plan(
                            List.of(segment("Ann", 0, 1), segment("Ben", 2, 3), segment("Cat", 4, 5)));

            var result = dispatcher.dispatch("run-1", plan, pages, RUBRIC, TaskListener.NONE, () -> false);

            assertThat(result.allTerminal()).isTrue();
            assertThat(result.failedTasks()).isEmpty();
            GradingTask second = result.tasks().get(1);
            assertThat(second.status()).isEqualTo(TaskStatus.DONE);
            assertThat(second.retryCount()).isEqualTo(2);
            assertThat(second.result()).isNotNull();
            assertThat(attempts.get("task-002")).hasValue(3);
        }

        @Test
        void shouldFailTaskAfterExhaustingRetries() {
            AtomicInteger calls = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        calls.incrementAndGet();
                        throw GradingException.transientFailure("upstream 503", null);
                    };
            var dispatcher = dispatcher(capability, 2, 2);

            var result =
                    dispatcher.dispatch(
                            "run-1",
                            dispatcher.plan(List.of(segment("Ann", 0, 1))),
                            pages,
                            RUBRIC,
                            TaskListener.NONE,
                            () -> false);

            GradingTask task = result.tasks().get(0);
            assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(task.retryCount()).isEqualTo(2);
            assertThat(task.errorDetail()).contains("upstream 503");
            assertThat(calls).hasValue(3);
        }

        @Test
        void shouldNotRetryPermanentFailure() {
            AtomicInteger calls = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        calls.incrementAndGet();
                        throw GradingException.permanentFailure("page unreadable");
                    };
            var dispatcher = dispatcher(capability, 2, 2);

            var result =
                    dispatcher.dispatch(
                            "run-1",
                            dispatcher.plan(List.of(segment("Ann", 0, 1))),
                            pages,
                            RUBRIC,
                            TaskListener.NONE,
                            () -> false);

            assertThat(result.tasks().get(0).status()).isEqualTo(TaskStatus.FAILED);
            assertThat(calls).hasValue(1);
        }

        @Test
        void shouldRetryAttemptThatTimesOut() {
            AtomicInteger calls = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        if (calls.incrementAndGet() == 1) {
                            try {
                                Thread.sleep(5_000);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        }
                        return ok();
                    };
            var dispatcher =
                    new GradingDispatcher(capability, executor, 1, 2, Duration.ofMillis(100), 10);

            var result =
                    dispatcher.dispatch(
                            "run-1",
                            dispatcher.plan(List.of(segment("Ann", 0, 1))),
                            pages,
                            RUBRIC,
                            TaskListener.NONE,
                            () -> false);

            assertThat(result.tasks().get(0).status()).isEqualTo(TaskStatus.DONE);
            assertThat(result.tasks().get(0).retryCount()).isEqualTo(1);
        }
    }

    @Nested
    class LocalFailures {

        @Test
        void shouldFailOnlyTheTaskWhoseCapabilityReturnsNothing() {
            AtomicInteger annCalls = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        if (request.studentKey().equals("Ann")) {
                            annCalls.incrementAndGet();
                            return null;
                        }
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 2, 2);

            var result =
                    dispatcher.dispatch(
                            "run-1",
                            dispatcher.plan(List.of(segment("Ann", 0, 1), segment("Ben", 2, 3))),
                            pages,
                            RUBRIC,
                            TaskListener.NONE,
                            () -> false);

            assertThat(result.allTerminal()).isTrue();
            assertThat(result.failedTasks()).extracting(GradingTask::studentKey).containsExactly("Ann");
            assertThat(result.tasks().get(0).errorDetail()).contains("no outcome");
            assertThat(result.tasks().get(1).status()).isEqualTo(TaskStatus.DONE);
            assertThat(annCalls).hasValue(3);
        }

        @Test
        void shouldFailTaskWhenGradingCallCannotBeSubmitted() {
            ExecutorService rejectingCalls =
                    new ThreadPoolExecutor(
                            2, 2, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>()) {
                        @Override
                        public <T> Future<T> submit(Callable<T> task) {
                            throw new RejectedExecutionException("pool saturated");
                        }
                    };
            try {
                var dispatcher =
                        new GradingDispatcher(
                                request -> ok(), rejectingCalls, 2, 2, Duration.ofSeconds(5), 10);

                var result =
                        dispatcher.dispatch(
                                "run-1",
                                dispatcher.plan(List.of(segment("Ann", 0, 1))),
                                pages,
                                RUBRIC,
                                TaskListener.NONE,
                                () -> false);

                GradingTask task = result.tasks().get(0);
                assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
                assertThat(task.errorDetail()).contains("pool saturated");
            } finally {
                rejectingCalls.shutdownNow();
            }
        }
    }

    @Nested
    class Concurrency {

        @Test
        void shouldNeverRunMoreTasksThanWorkers() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        int now = running.incrementAndGet();
                        peak.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(30);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        running.decrementAndGet();
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 2, 0);
            List<StudentSegment> segments = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                segments.add(segment("S" + i, i * 2, i * 2 + 1));
            }

            var result =
                    dispatcher.dispatch(
                            "run-1", dispatcher.plan(segments), pages, RUBRIC, TaskListener.NONE, () -> false);

            assertThat(result.tasks()).allMatch(t -> t.status() == TaskStatus.DONE);
            assertThat(peak.get()).isBetween(1, 2);
        }

        @Test
        void shouldStartQueuedTasksInSubmissionOrder() {
            List<String> started = Collections.synchronizedList(new ArrayList<>());
            GradingCapability capability =
                    request -> {
                        started.add(request.taskId());
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 1, 0);
            var plan =
                    dispatcher.plan(
                            List.of(segment("A", 0, 0), segment("B", 1, 1), segment("C", 2, 2), segment("D", 3, 3)));

            dispatcher.dispatch("run-1", plan, pages, RUBRIC, TaskListener.NONE, () -> false);

            assertThat(started).containsExactly("task-001", "task-002", "task-003", "task-004");
        }

        @Test
        void shouldPassOnlyTaskPagesToCapability() {
            Map<String, List<Integer>> seen = new ConcurrentHashMap<>();
            GradingCapability capability =
                    request -> {
                        seen.put(request.studentKey(), request.pages().stream().map(Page::index).toList());
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 2, 0);

            dispatcher.dispatch(
                    "run-1",
                    dispatcher.plan(List.of(segment("Ann", 0, 2), segment("Ben", 3, 4))),
                    pages,
                    RUBRIC,
                    TaskListener.NONE,
                    () -> false);

            assertThat(seen).containsEntry("Ann", List.of(0, 1, 2)).containsEntry("Ben", List.of(3, 4));
        }
    }

    @Nested
    class Events {

        @Test
        void shouldReportEveryStatusChange() {
            List<GradingTask> updates = new CopyOnWriteArrayList<>();
            AtomicInteger calls = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        if (calls.incrementAndGet() == 1) {
                            throw GradingException.transientFailure("blip", null);
                        }
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 1, 2);

            dispatcher.dispatch(
                    "run-1",
                    dispatcher.plan(List.of(segment("Ann", 0, 1))),
                    pages,
                    RUBRIC,
                    updates::add,
                    () -> false);

            assertThat(updates)
                    .extracting(GradingTask::status)
                    .containsExactly(TaskStatus.RUNNING, TaskStatus.RUNNING, TaskStatus.DONE);
            assertThat(updates).extracting(GradingTask::retryCount).containsExactly(0, 1, 1);
        }

        @Test
        void shouldKeepGradingWhenListenerThrows() {
            var dispatcher = dispatcher(request -> ok(), 1, 0);

            var result =
                    dispatcher.dispatch(
                            "run-1",
                            dispatcher.plan(List.of(segment("Ann", 0, 1))),
                            pages,
                            RUBRIC,
                            task -> {
                                throw new IllegalStateException("listener broke");
                            },
                            () -> false);

            assertThat(result.tasks().get(0).status()).isEqualTo(TaskStatus.DONE);
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldStopSubmittingAfterCancellation() {
            AtomicInteger calls = new AtomicInteger();
            GradingCapability capability =
                    request -> {
                        calls.incrementAndGet();
                        return ok();
                    };
            var dispatcher = dispatcher(capability, 1, 0);
            var plan =
                    dispatcher.plan(List.of(segment("A", 0, 0), segment("B", 1, 1), segment("C", 2, 2)));
            AtomicInteger checks = new AtomicInteger();

            var result =
                    dispatcher.dispatch(
                            "run-1", plan, pages, RUBRIC, TaskListener.NONE, () -> checks.incrementAndGet() > 1);

            assertThat(result.cancelled()).isTrue();
            assertThat(result.tasks().get(0).status()).isEqualTo(TaskStatus.DONE);
            assertThat(result.tasks().subList(1, 3)).allMatch(t -> t.status() == TaskStatus.QUEUED);
            assertThat(calls).hasValue(1);
        }
    }
}
