package io.gradeflow.core.workflow;

import io.gradeflow.core.checkpoint.CheckpointStore;
import io.gradeflow.core.exception.GradeflowException;
import io.gradeflow.core.exception.InputValidationException;
import io.gradeflow.core.exception.InvalidDecisionException;
import io.gradeflow.core.exception.RunNotFoundException;
import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.grading.TaskListener;
import io.gradeflow.core.progress.ProgressBroadcaster;
import io.gradeflow.core.progress.ProgressEventKind;
import io.gradeflow.core.progress.ProgressStream;
import io.gradeflow.core.progress.ProgressSubscription;
import io.gradeflow.core.review.ReviewDecision;
import io.gradeflow.core.review.ReviewGate;
import io.gradeflow.core.review.ReviewRequest;
import io.gradeflow.core.rubric.RubricScoreMismatchException;
import io.gradeflow.core.run.NodeExecution;
import io.gradeflow.core.run.RunState;
import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.run.StatePatch;
import io.gradeflow.core.run.WorkflowRun;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Checkpointed state machine that drives grading runs through the {@link WorkflowDefinition}.
///
/// Each run is driven by one task on the executor. The driver repeatedly selects the next
/// node, executes it, merges its output into the run state and saves a checkpoint before
/// moving on. Nodes of one run never overlap; different runs proceed independently.
///
/// ### Contracts
/// - **Postcondition**: every transition is checkpointed before its progress event is published
/// - **Invariant**: checkpoint writes of one run are linearized by the run's lock
/// - **Invariant**: a failed or cancelled run executes no further node
///
/// ### Review gates
/// A gate whose reasons apply records an `INTERRUPTED` attempt, suspends the run and
/// publishes `review_required`. {@link #resume} applies the decision, completes the gate
/// and hands the run back to a driver. A decision for a gate that is already decided is
/// ignored, so delivering the same decision twice has no effect.
///
/// ### Failures
/// - {@link RubricScoreMismatchException}: the run returns to `PENDING` with the reason
///   recorded and waits for a new submission
/// - any other exception: the run becomes `FAILED` with the node name and detail
///
/// ### Usage
/// {@snippet :
/// String runId = engine.submit(request);
/// try (ProgressStream stream = engine.stream(runId)) {
///     stream.events().forEachRemaining(event -> send(event));
/// }
/// engine.resume(runId, new ReviewDecision.Approve("result_review"));
/// }
///
/// @implNote Thread-safe. The engine does not own the executor or the checkpoint store.
/// @see GradingWorkflow for the node table
public class WorkflowEngine {

    private static final Logger logger = Logger.getLogger(WorkflowEngine.class.getName());

    private final WorkflowDefinition definition;
    private final CheckpointStore store;
    private final ProgressBroadcaster broadcaster;
    private final ExecutorService executor;
    private final WorkflowListener listener;
    private final Map<String, RunControl> controls = new ConcurrentHashMap<>();

    public WorkflowEngine(
            WorkflowDefinition definition,
            CheckpointStore store,
            ProgressBroadcaster broadcaster,
            ExecutorService executor,
            WorkflowListener listener) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.listener = listener != null ? listener : WorkflowListener.NOOP;
    }

    /// Validates a submission and starts a run for it.
    ///
    /// @param request run inputs, not null
    /// @return the new run id, never null
    /// @throws InputValidationException if the request is incomplete; no run is created
    public String submit(SubmissionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<String> violations = request.validate();
        if (!violations.isEmpty()) {
            throw new InputValidationException(violations);
        }
        String runId = UUID.randomUUID().toString();
        WorkflowRun run =
                WorkflowRun.submitted(
                        runId,
                        definition.first().name(),
                        RunState.empty().merge(StatePatch.of(GradingKeys.SUBMISSION, request)));
        store.save(runId, run);
        broadcaster.open(runId, 0);
        listener.onRunSubmitted(run);
        startDriver(runId);
        return runId;
    }

    /// Applies a review decision to a suspended run.
    ///
    /// Approve and edit complete the gate and continue the run asynchronously; reject
    /// cancels it. Repeating a decision for a gate that is already decided, or deciding on a
    /// run that has ended, returns the current run unchanged.
    ///
    /// @param runId the run, not null
    /// @param decision the reviewer's decision, not null
    /// @return the run after the decision was applied, never null
    /// @throws RunNotFoundException if the run does not exist
    /// @throws InvalidDecisionException if the run is not waiting at the decision's gate or
    ///     the decision does not fit the gate
    public WorkflowRun resume(String runId, ReviewDecision decision) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        NodeDescriptor node =
                definition
                        .node(decision.gate())
                        .filter(NodeDescriptor::isGate)
                        .orElseThrow(
                                () -> new InvalidDecisionException(
                                        "Unknown review gate: " + decision.gate()));
        ReviewGate<?> gate = node.gate();

        // a driver may hold the lock for a whole grading pass; settled decisions skip it
        WorkflowRun known = load(runId);
        if (isSettled(known, gate)) {
            return ignoreDecision(known, gate);
        }

        RunControl control = control(runId);
        WorkflowRun run;
        control.lock.lock();
        try {
            run = load(runId);
            if (isSettled(run, gate)) {
                return ignoreDecision(run, gate);
            }
            if (run.status() != RunStatus.SUSPENDED || !gate.name().equals(run.currentNode())) {
                throw new InvalidDecisionException(
                        "Run " + runId + " is " + run.status() + " at " + run.currentNode()
                                + ", not waiting at " + gate.name());
            }

            StatePatch patch = gate.apply(decision);
            Instant startedAt = Instant.now();
            int attempt = run.nextAttempt(gate.name());
            run = run.running(gate.name())
                    .withState(run.state().merge(patch))
                    .withExecution(NodeExecution.ok(runId, gate.name(), attempt, startedAt));
            broadcaster.open(runId, run.lastSequence());

            if (decision instanceof ReviewDecision.Reject reject) {
                run = cancel(run, "Rejected at " + gate.name() + ": " + reject.reason());
                controls.remove(runId, control);
                return run;
            }

            run = checkpoint(run.running(nextNodeName(run.state(), gate.name())));
            publish(
                    runId,
                    ProgressEventKind.NODE_COMPLETED,
                    payload("node", gate.name(), "attempt", attempt, "decision", actionOf(decision)));
            listener.onNodeCompleted(runId, gate.name(), Duration.between(startedAt, Instant.now()));
        } finally {
            control.lock.unlock();
        }
        startDriver(runId);
        return run;
    }

    private static boolean isSettled(WorkflowRun run, ReviewGate<?> gate) {
        return run.isTerminal() || gate.isDecided(run.state());
    }

    private static WorkflowRun ignoreDecision(WorkflowRun run, ReviewGate<?> gate) {
        logger.info(
                "Ignoring decision for " + gate.name() + " on run " + run.runId()
                        + " (status " + run.status() + ")");
        return run;
    }

    /// Returns the latest checkpoint of a run.
    ///
    /// @throws RunNotFoundException if the run does not exist
    public WorkflowRun getStatus(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return load(runId);
    }

    /// Opens a live view of a run: its current snapshot plus every later event.
    ///
    /// The subscription is registered before the snapshot is read. For a run that has
    /// ended, or that is blocked waiting for a new submission, the event sequence is
    /// already closed and only the snapshot is of interest.
    ///
    /// @param runId the run, not null
    /// @return snapshot and events, never null; close it to unsubscribe
    /// @throws RunNotFoundException if the run does not exist
    public ProgressStream stream(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        WorkflowRun known = load(runId);
        if (known.isTerminal() || known.isBlocked()) {
            ProgressSubscription closed = broadcaster.subscribe(runId);
            closed.close();
            discardIdleChannel(runId);
            return new ProgressStream(known, closed);
        }
        broadcaster.open(runId, known.lastSequence());
        ProgressSubscription events = broadcaster.subscribe(runId);
        WorkflowRun snapshot = load(runId);
        if (snapshot.isTerminal() || snapshot.isBlocked()) {
            broadcaster.complete(runId);
        }
        return new ProgressStream(snapshot, events);
    }

    /// Requests cancellation of a run.
    ///
    /// A run waiting at a gate or not yet started is cancelled at once. A running run
    /// stops before its next node or grading task; tasks already running finish and
    /// their results are discarded.
    ///
    /// @param runId the run, not null
    /// @return the run as known after the request, never null
    /// @throws RunNotFoundException if the run does not exist
    public WorkflowRun cancel(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        WorkflowRun run = load(runId);
        if (run.isTerminal()) {
            return run;
        }
        RunControl control = control(runId);
        control.cancelled.set(true);
        if (!control.lock.tryLock()) {
            logger.info("Cancellation of run " + runId + " requested, waiting for current node");
            return run;
        }
        try {
            WorkflowRun latest = load(runId);
            if (latest.isTerminal()) {
                return latest;
            }
            return cancel(latest, "Cancelled by request");
        } finally {
            control.lock.unlock();
            controls.remove(runId, control);
        }
    }

    /// Restarts drivers for runs a previous process left unfinished.
    ///
    /// Runs in `RUNNING` status and runs in `PENDING` status that are not blocked are
    /// re-entered at the first node whose outputs are missing. Suspended runs keep waiting
    /// for {@link #resume}.
    ///
    /// @return ids of the re-entered runs, never null
    public List<String> recover() {
        List<WorkflowRun> candidates = new ArrayList<>(store.findByStatus(RunStatus.RUNNING));
        for (WorkflowRun pending : store.findByStatus(RunStatus.PENDING)) {
            if (!pending.isBlocked()) {
                candidates.add(pending);
            }
        }
        List<String> recovered = new ArrayList<>();
        for (WorkflowRun run : candidates) {
            if (controls.containsKey(run.runId())) {
                continue;
            }
            logger.info("Recovering run " + run.runId() + " at " + run.currentNode());
            broadcaster.open(run.runId(), run.lastSequence());
            startDriver(run.runId());
            recovered.add(run.runId());
        }
        return recovered;
    }

    /// Waits until the run's driver stops, either because the run ended or because it is
    /// waiting at a gate.
    ///
    /// @param runId the run, not null
    /// @param timeout maximum wait, not null
    /// @return the run after the driver stopped, never null
    /// @throws TimeoutException if the driver is still running after `timeout`
    /// @throws InterruptedException if the calling thread is interrupted
    public WorkflowRun awaitSettled(String runId, Duration timeout)
            throws InterruptedException, TimeoutException {
        RunControl control = controls.get(runId);
        Future<?> driver = control != null ? control.driver : null;
        if (driver != null) {
            try {
                driver.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new GradeflowException("Driver of run " + runId + " crashed", e.getCause());
            }
        }
        return getStatus(runId);
    }

    // -- driver --

    private void startDriver(String runId) {
        RunControl control = control(runId);
        control.driver = executor.submit(() -> drive(runId, control));
    }

    private void drive(String runId, RunControl control) {
        control.lock.lock();
        WorkflowRun run = null;
        try {
            run = store.load(runId).orElse(null);
            if (run == null) {
                logger.warning("Run " + runId + " disappeared from the checkpoint store");
                return;
            }
            while (isDrivable(run)) {
                if (control.cancelled.get()) {
                    run = cancel(run, "Cancelled before " + run.currentNode());
                    break;
                }
                Optional<NodeDescriptor> next = definition.next(run.state());
                if (next.isEmpty()) {
                    run = complete(run);
                    break;
                }
                run = step(run, next.get(), control);
            }
            if (!run.isTerminal() && control.cancelled.get()) {
                run = cancel(run, "Cancelled by request");
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Driver of run " + runId + " stopped unexpectedly", e);
            run = failUnexpectedly(runId, run, e);
        } finally {
            control.lock.unlock();
            if (run == null || run.isTerminal()) {
                controls.remove(runId, control);
            }
        }
    }

    private static boolean isDrivable(WorkflowRun run) {
        return !run.isTerminal() && run.status() != RunStatus.SUSPENDED && !run.isBlocked();
    }

    private WorkflowRun step(WorkflowRun run, NodeDescriptor node, RunControl control) {
        String runId = run.runId();
        String nodeName = node.name();
        int attempt = run.nextAttempt(nodeName);
        Instant startedAt = Instant.now();

        run = checkpoint(run.running(nodeName));
        publish(runId, ProgressEventKind.NODE_STARTED, payload("node", nodeName, "attempt", attempt));
        listener.onNodeStarted(runId, nodeName, attempt);

        StatePatch patch;
        if (node.isGate()) {
            Optional<ReviewRequest> review = node.gate().evaluate(run.state());
            if (review.isPresent()) {
                return suspend(run, review.get(), attempt, startedAt);
            }
            patch = node.gate().autoApprove();
        } else {
            RunContext context =
                    new RunContext(
                            runId, run.state(), attempt, control.cancelled::get, taskListener(runId));
            try {
                patch = node.handler().execute(context);
            } catch (RubricScoreMismatchException e) {
                return block(run, nodeName, attempt, startedAt, e);
            } catch (RuntimeException e) {
                return fail(run, nodeName, attempt, startedAt, e);
            }
        }

        if (control.cancelled.get()) {
            logger.info("Run " + runId + " cancelled during " + nodeName + ", output discarded");
            return cancel(
                    run.withExecution(NodeExecution.interrupted(runId, nodeName, attempt, startedAt)),
                    "Cancelled during " + nodeName);
        }

        RunState merged = run.state().merge(patch);
        run = run.withState(merged)
                .withExecution(NodeExecution.ok(runId, nodeName, attempt, startedAt))
                .running(nextNodeName(merged, nodeName));
        run = checkpoint(run);
        Duration elapsed = Duration.between(startedAt, Instant.now());
        publish(
                runId,
                ProgressEventKind.NODE_COMPLETED,
                payload("node", nodeName, "attempt", attempt, "elapsedMs", elapsed.toMillis()));
        listener.onNodeCompleted(runId, nodeName, elapsed);
        return run;
    }

    private WorkflowRun suspend(
            WorkflowRun run, ReviewRequest review, int attempt, Instant startedAt) {
        run = run.withExecution(
                        NodeExecution.interrupted(run.runId(), review.gate(), attempt, startedAt))
                .suspended(review);
        run = checkpoint(run);
        publish(
                run.runId(),
                ProgressEventKind.REVIEW_REQUIRED,
                payload(
                        "node", review.gate(),
                        "field", review.reviewedField(),
                        "reasons", review.reasons()));
        listener.onSuspended(run.runId(), review);
        return run;
    }

    private WorkflowRun block(
            WorkflowRun run,
            String nodeName,
            int attempt,
            Instant startedAt,
            RubricScoreMismatchException e) {
        String detail = e.getMessage();
        run = run.withExecution(
                        NodeExecution.error(run.runId(), nodeName, attempt, startedAt, detail))
                .blocked(nodeName, detail);
        run = checkpoint(run);
        publish(
                run.runId(),
                ProgressEventKind.FAILED,
                payload(
                        "node", nodeName,
                        "error", detail,
                        "status", RunStatus.PENDING.name().toLowerCase(Locale.ROOT),
                        "expectedTotal", e.getExpectedTotal(),
                        "parsedTotal", e.getParsedTotal()));
        broadcaster.complete(run.runId());
        listener.onRunBlocked(run.runId(), nodeName, detail);
        return run;
    }

    private WorkflowRun fail(
            WorkflowRun run, String nodeName, int attempt, Instant startedAt, RuntimeException e) {
        String detail = describe(e);
        logger.log(Level.WARNING, "Node " + nodeName + " of run " + run.runId() + " failed", e);
        run = run.withExecution(
                        NodeExecution.error(run.runId(), nodeName, attempt, startedAt, detail))
                .failed(nodeName + ": " + detail);
        run = checkpoint(run);
        publish(run.runId(), ProgressEventKind.FAILED, payload("node", nodeName, "error", detail));
        broadcaster.complete(run.runId());
        listener.onRunFailed(run.runId(), nodeName, detail);
        return run;
    }

    /// Records a failure that escaped node execution, for example from a listener or the
    /// checkpoint store. The latest checkpoint wins over the driver's copy of the run; a run
    /// that already reached a terminal, suspended or blocked checkpoint keeps it.
    private WorkflowRun failUnexpectedly(String runId, WorkflowRun known, RuntimeException e) {
        String detail = describe(e);
        WorkflowRun run = known;
        String node;
        try {
            run = store.load(runId).orElse(known);
            if (run == null || !isDrivable(run)) {
                return run;
            }
            node = run.currentNode();
            run = checkpoint(run.failed(node + ": " + detail));
            publish(runId, ProgressEventKind.FAILED, payload("node", node, "error", detail));
            broadcaster.complete(runId);
        } catch (RuntimeException secondary) {
            logger.log(Level.SEVERE, "Could not record failure of run " + runId, secondary);
            publish(runId, ProgressEventKind.FAILED, payload("error", detail));
            broadcaster.complete(runId);
            return run;
        }
        try {
            listener.onRunFailed(runId, node, detail);
        } catch (RuntimeException listenerError) {
            logger.log(Level.WARNING, "Workflow listener failed for run " + runId, listenerError);
        }
        return run;
    }

    private WorkflowRun cancel(WorkflowRun run, String detail) {
        run = checkpoint(run.cancelled(detail));
        publish(run.runId(), ProgressEventKind.CANCELLED, payload("detail", detail));
        broadcaster.complete(run.runId());
        listener.onRunCancelled(run.runId(), detail);
        return run;
    }

    private WorkflowRun complete(WorkflowRun run) {
        run = checkpoint(run.completed());
        publish(run.runId(), ProgressEventKind.COMPLETED, completionPayload(run.state()));
        broadcaster.complete(run.runId());
        listener.onRunCompleted(run);
        return run;
    }

    private WorkflowRun checkpoint(WorkflowRun run) {
        WorkflowRun stamped = run.withLastSequence(broadcaster.lastSequence(run.runId()));
        store.save(stamped.runId(), stamped);
        return stamped;
    }

    private String nextNodeName(RunState state, String fallback) {
        return definition.next(state).map(NodeDescriptor::name).orElse(fallback);
    }

    private TaskListener taskListener(String runId) {
        return task -> {
            publish(runId, ProgressEventKind.TASK_UPDATE, taskPayload(task));
            listener.onTaskUpdate(runId, task);
        };
    }

    private void publish(String runId, ProgressEventKind kind, Map<String, Object> payload) {
        broadcaster.publish(runId, kind, payload);
    }

    private void discardIdleChannel(String runId) {
        if (!broadcaster.hasSubscribers(runId)) {
            broadcaster.complete(runId);
        }
    }

    private WorkflowRun load(String runId) {
        return store.load(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private RunControl control(String runId) {
        return controls.computeIfAbsent(runId, id -> new RunControl());
    }

    private static Map<String, Object> taskPayload(GradingTask task) {
        return payload(
                "taskId", task.taskId(),
                "studentKey", task.studentKey(),
                "status", task.status().name().toLowerCase(Locale.ROOT),
                "retryCount", task.retryCount(),
                "pages", task.pages());
    }

    private static Map<String, Object> completionPayload(RunState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        state.get(GradingKeys.REPORT_EDITED)
                .or(() -> state.get(GradingKeys.REPORT))
                .ifPresent(
                        report -> {
                            payload.put("students", report.students().size());
                            payload.put("average", report.summary().average());
                            payload.put("flagged", report.flagged().size());
                        });
        state.get(GradingKeys.EXPORT).ifPresent(receipt -> payload.put("export", receipt.location()));
        return payload;
    }

    private static String actionOf(ReviewDecision decision) {
        if (decision instanceof ReviewDecision.Edit) {
            return "edit";
        }
        return decision instanceof ReviewDecision.Reject ? "reject" : "approve";
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }

    /// Per-run coordination: the lock linearizing node execution and checkpoints, the
    /// cancellation flag and the current driver.
    private static final class RunControl {
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile Future<?> driver;
    }
}
