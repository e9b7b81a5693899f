package io.gradeflow.core.grading;

import io.gradeflow.core.document.Page;
import io.gradeflow.core.exception.GradeflowException;
import io.gradeflow.core.rubric.RubricTree;
import io.gradeflow.core.segment.StudentSegment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/// Fans grading work out to the external {@link GradingCapability} and collects the results.
///
/// ### Fan-out
/// One task per student segment; a segment longer than `maxPagesPerTask` is split into
/// ordered sub-batches that the aggregator later reconciles by question id. At most
/// `maxWorkers` tasks run at once and the rest wait in submission order (FIFO).
///
/// ### Retries
/// Each attempt is bounded by `taskTimeout`. Timeouts and retryable failures are
/// re-submitted immediately, up to `maxRetries` times; a task then fails with its pages
/// reported as a gap. A missing outcome counts as a failed attempt. {@link GradingException}s
/// marked permanent and `IllegalArgumentException`s are not retried, and a call that cannot
/// be submitted fails its task at once.
///
/// ### Fan-in
/// {@link #dispatch} returns only after every submitted task is `DONE` or `FAILED`. Each
/// status change is reported to the {@link TaskListener} immediately.
///
/// ### Cancellation
/// The cancellation flag is checked before each submission. Tasks already running finish
/// normally; tasks never submitted stay `QUEUED`.
///
/// @implNote Results live in one map slot per task id and each slot has a single writer,
/// so concurrent workers cannot lose each other's updates. The executor is not shut down
/// here; it must be able to run `2 * maxWorkers` threads because every worker waits on a
/// separate call future.
public class GradingDispatcher {

    private static final Logger logger = Logger.getLogger(GradingDispatcher.class.getName());

    public static final int DEFAULT_MAX_WORKERS = 5;
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofMinutes(2);

    private final GradingCapability capability;
    private final ExecutorService executor;
    private final int maxWorkers;
    private final int maxRetries;
    private final Duration taskTimeout;
    private final int maxPagesPerTask;

    public GradingDispatcher(
            GradingCapability capability,
            ExecutorService executor,
            int maxWorkers,
            int maxRetries,
            Duration taskTimeout,
            int maxPagesPerTask) {
        this.capability = Objects.requireNonNull(capability, "capability must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.taskTimeout = Objects.requireNonNull(taskTimeout, "taskTimeout must not be null");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, was " + maxWorkers);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (maxPagesPerTask < 1) {
            throw new IllegalArgumentException(
                    "maxPagesPerTask must be >= 1, was " + maxPagesPerTask);
        }
        this.maxWorkers = maxWorkers;
        this.maxRetries = maxRetries;
        this.maxPagesPerTask = maxPagesPerTask;
    }

    /// Plans one task per segment, splitting long segments into sub-batches.
    ///
    /// @param segments student segments in page order, not null
    /// @return queued tasks in submission order, never null
    public List<GradingTask> plan(List<StudentSegment> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        List<GradingTask> tasks = new ArrayList<>();
        for (StudentSegment segment : segments) {
            List<Integer> pages = segment.pages();
            int subBatch = 0;
            for (int start = 0; start < pages.size(); start += maxPagesPerTask) {
                List<Integer> slice = pages.subList(start, Math.min(pages.size(), start + maxPagesPerTask));
                tasks.add(GradingTask.queued(taskId(tasks.size()), segment.studentKey(), subBatch++, slice));
            }
        }
        return tasks;
    }

    /// Plans fixed-size page batches for runs that skip boundary detection.
    ///
    /// Each batch is treated as its own submission, keyed `Batch 01`, `Batch 02`, ...
    ///
    /// @param pageCount number of answer pages
    /// @return queued tasks in page order, never null
    public List<GradingTask> planBatches(int pageCount) {
        List<GradingTask> tasks = new ArrayList<>();
        for (int start = 0; start < pageCount; start += maxPagesPerTask) {
            List<Integer> slice = new ArrayList<>();
            for (int p = start; p < Math.min(pageCount, start + maxPagesPerTask); p++) {
                slice.add(p);
            }
            String key = String.format("Batch %02d", tasks.size() + 1);
            tasks.add(GradingTask.queued(taskId(tasks.size()), key, 0, slice));
        }
        return tasks;
    }

    /// Runs the planned tasks and waits for all of them to settle.
    ///
    /// @param runId owning run, not null
    /// @param plan queued tasks from {@link #plan} or {@link #planBatches}, not null
    /// @param pages all answer pages, indexed by `Page.index()`, not null
    /// @param rubric rubric passed to every grading call, not null
    /// @param listener receives each status change, not null
    /// @param cancelled checked before each submission, not null
    /// @return the final state of every task in plan order, never null
    /// @throws GradeflowException if the dispatching thread is interrupted
    public DispatchResult dispatch(
            String runId,
            List<GradingTask> plan,
            List<Page> pages,
            RubricTree rubric,
            TaskListener listener,
            BooleanSupplier cancelled) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(pages, "pages must not be null");
        Objects.requireNonNull(rubric, "rubric must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        Objects.requireNonNull(cancelled, "cancelled must not be null");

        logger.info(
                "Dispatching " + plan.size() + " grading tasks for run " + runId
                        + " with " + maxWorkers + " workers");

        Map<Integer, Page> pagesByIndex = new HashMap<>();
        for (Page page : pages) {
            pagesByIndex.put(page.index(), page);
        }
        Map<String, GradingTask> slots = new ConcurrentHashMap<>();
        for (GradingTask task : plan) {
            slots.put(task.taskId(), task);
        }

        Semaphore permits = new Semaphore(maxWorkers, true);
        List<Future<?>> inFlight = new ArrayList<>();
        boolean stopped = false;
        try {
            for (GradingTask task : plan) {
                if (cancelled.getAsBoolean()) {
                    logger.info("Run " + runId + " cancelled, not submitting remaining tasks");
                    stopped = true;
                    break;
                }
                permits.acquire();
                try {
                    inFlight.add(
                            executor.submit(
                                    () -> {
                                        try {
                                            runTask(runId, task, pagesByIndex, rubric, listener, slots);
                                        } finally {
                                            permits.release();
                                        }
                                    }));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    throw e;
                }
            }
            for (Future<?> future : inFlight) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GradeflowException("Grading dispatch interrupted for run " + runId, e);
        } catch (ExecutionException e) {
            throw new GradeflowException("Grading worker crashed for run " + runId, e.getCause());
        }

        List<GradingTask> settled = plan.stream().map(t -> slots.get(t.taskId())).toList();
        DispatchResult result = new DispatchResult(settled, stopped);
        logger.info(
                "Grading finished for run " + runId + ": "
                        + (settled.size() - result.failedTasks().size()) + " done, "
                        + result.failedTasks().size() + " failed");
        return result;
    }

    private void runTask(
            String runId,
            GradingTask task,
            Map<Integer, Page> pagesByIndex,
            RubricTree rubric,
            TaskListener listener,
            Map<String, GradingTask> slots) {
        List<Page> taskPages =
                task.pages().stream().map(pagesByIndex::get).filter(Objects::nonNull).toList();
        GradingTask current = task;

        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            current = update(slots, listener, current.running(attempt - 1));
            GradingRequest request =
                    new GradingRequest(
                            runId, task.taskId(), task.studentKey(), taskPages, rubric, attempt);
            Future<GradingOutcome> call = null;
            try {
                call = executor.submit(() -> capability.grade(request));
                GradingOutcome outcome = call.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (outcome != null) {
                    update(slots, listener, current.done(outcome));
                    return;
                }
                current = current.withError("Grading capability returned no outcome");
            } catch (TimeoutException e) {
                call.cancel(true);
                current = current.withError("Timed out after " + taskTimeout);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                current = current.withError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
                if (!isRetryable(cause)) {
                    logger.warning(
                            "Task " + task.taskId() + " failed permanently: " + current.errorDetail());
                    update(slots, listener, current.failed(current.errorDetail()));
                    return;
                }
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                update(slots, listener, current.failed("Interrupted"));
                return;
            } catch (RuntimeException e) {
                if (call != null) {
                    call.cancel(true);
                }
                current = current.withError(e.getClass().getSimpleName() + ": " + e.getMessage());
                logger.warning(
                        "Task " + task.taskId() + " could not be graded: " + current.errorDetail());
                update(slots, listener, current.failed(current.errorDetail()));
                return;
            }
            if (attempt <= maxRetries) {
                logger.warning(
                        "Task " + task.taskId() + " attempt " + attempt + " failed ("
                                + current.errorDetail() + "), retrying");
            }
        }

        logger.warning(
                "Task " + task.taskId() + " failed after " + (maxRetries + 1) + " attempts, pages "
                        + task.pages() + " reported as a gap");
        update(slots, listener, current.failed(current.errorDetail()));
    }

    private static GradingTask update(
            Map<String, GradingTask> slots, TaskListener listener, GradingTask task) {
        slots.put(task.taskId(), task);
        try {
            listener.onTaskUpdate(task);
        } catch (RuntimeException e) {
            logger.warning("Task listener failed for " + task.taskId() + ": " + e.getMessage());
        }
        return task;
    }

    private static boolean isRetryable(Throwable cause) {
        if (cause instanceof GradingException grading) {
            return grading.isRetryable();
        }
        return !(cause instanceof IllegalArgumentException);
    }

    private static String taskId(int index) {
        return String.format("task-%03d", index + 1);
    }
}
