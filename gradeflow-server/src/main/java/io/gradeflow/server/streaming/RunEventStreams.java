package io.gradeflow.server.streaming;

import io.gradeflow.core.progress.ProgressEvent;
import io.gradeflow.core.progress.ProgressStream;
import io.gradeflow.core.progress.ProgressSubscription;
import io.gradeflow.core.run.WorkflowRun;
import io.gradeflow.core.workflow.WorkflowEngine;
import io.gradeflow.serialization.CheckpointSerializer;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.BackPressureStrategy;
import io.smallrye.mutiny.subscription.MultiEmitter;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/// Exposes run progress as Mutiny streams for server-push endpoints (SSE, WebSocket).
///
/// Every subscription opens its own {@link ProgressStream} on the engine, so each client
/// gets the full ordered event sequence from its join point on. A blocking pump on the
/// supplied executor moves events from the engine's bounded buffer into the emitter; the
/// buffer's drop-oldest policy still applies to a client that falls behind.
///
/// ### Stream Lifecycle
/// - Completes after the run's terminal event (or immediately for a finished run)
/// - Fails with {@link io.gradeflow.core.exception.RunNotFoundException} for an unknown run
/// - Cancelling the subscription detaches from the engine
///
/// ### Usage
/// {@snippet :
/// Multi<String> sse = streams.streamJson(runId);
/// }
///
/// @implNote Thread-safe. One pump task per active subscription.
public class RunEventStreams {

    private static final Logger LOG = Logger.getLogger(RunEventStreams.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final WorkflowEngine engine;
    private final Executor executor;

    /// @param engine source of progress streams, not null
    /// @param executor runs one blocking pump per subscription, not null
    public RunEventStreams(WorkflowEngine engine, Executor executor) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /// Streams live progress events of a run.
    ///
    /// @param runId the run, not null
    /// @return cold stream; each subscriber opens its own engine subscription
    public Multi<ProgressEvent> stream(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Multi.createFrom()
                .emitter(emitter -> open(runId, emitter), BackPressureStrategy.BUFFER);
    }

    /// Streams a run's events as JSON, preceded by the checkpoint a late joiner starts from.
    ///
    /// The first item is the run snapshot, every following item one event.
    ///
    /// @param runId the run, not null
    /// @return cold stream of JSON documents
    public Multi<String> streamJson(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Multi.createFrom()
                .<Object>emitter(
                        emitter -> openWithSnapshot(runId, emitter), BackPressureStrategy.BUFFER)
                .map(
                        item ->
                                item instanceof WorkflowRun run
                                        ? CheckpointSerializer.toJson(run)
                                        : CheckpointSerializer.eventToJson((ProgressEvent) item));
    }

    private void open(String runId, MultiEmitter<? super ProgressEvent> emitter) {
        ProgressStream stream;
        try {
            stream = engine.stream(runId);
        } catch (RuntimeException e) {
            emitter.fail(e);
            return;
        }
        LOG.debugv("Client subscribed to run {0}", runId);
        emitter.onTermination(stream::close);
        executor.execute(() -> pump(stream.events(), emitter));
    }

    private void openWithSnapshot(String runId, MultiEmitter<? super Object> emitter) {
        ProgressStream stream;
        try {
            stream = engine.stream(runId);
        } catch (RuntimeException e) {
            emitter.fail(e);
            return;
        }
        emitter.onTermination(stream::close);
        emitter.emit(stream.snapshot());
        executor.execute(() -> pump(stream.events(), emitter));
    }

    private static void pump(
            ProgressSubscription events, MultiEmitter<? super ProgressEvent> emitter) {
        try {
            while (!emitter.isCancelled()) {
                Optional<ProgressEvent> next = events.poll(POLL_INTERVAL);
                if (next.isPresent()) {
                    emitter.emit(next.get());
                } else if (events.isEnded()) {
                    if (events.droppedCount() > 0) {
                        LOG.warnv(
                                "Client of run {0} missed {1} events",
                                events.runId(), events.droppedCount());
                    }
                    emitter.complete();
                    return;
                }
            }
            LOG.debugv("Client disconnected from run {0}", events.runId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.fail(e);
        }
    }
}
