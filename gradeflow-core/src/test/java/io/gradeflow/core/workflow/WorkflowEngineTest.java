package io.gradeflow.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.gradeflow.core.GradeflowConfig;
import io.gradeflow.core.GradeflowEnvironment;
import io.gradeflow.core.TestFixtures;
import io.gradeflow.core.aggregate.AggregatedResult;
import io.gradeflow.core.aggregate.GradingReport;
import io.gradeflow.core.checkpoint.InMemoryCheckpointStore;
import io.gradeflow.core.exception.InputValidationException;
import io.gradeflow.core.exception.InvalidDecisionException;
import io.gradeflow.core.exception.RunNotFoundException;
import io.gradeflow.core.progress.ProgressEvent;
import io.gradeflow.core.progress.ProgressEventKind;
import io.gradeflow.core.progress.ProgressStream;
import io.gradeflow.core.review.ReviewDecision;
import io.gradeflow.core.run.NodeExecution;
import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.run.WorkflowRun;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowEngineTest {

    private static final Duration SETTLE = Duration.ofSeconds(10);

    private GradingRig rig;
    private InMemoryCheckpointStore store;
    private RecordingListener listener;
    private final List<GradeflowEnvironment> environments = new ArrayList<>();

    @BeforeEach
    void setUp() {
        rig = new GradingRig();
        store = new InMemoryCheckpointStore();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        environments.forEach(GradeflowEnvironment::close);
    }

    private WorkflowEngine engine(GradeflowConfig config) {
        GradeflowEnvironment env = rig.build(config, store, listener);
        environments.add(env);
        return env.getEngine();
    }

    private WorkflowEngine engine() {
        return engine(GradeflowConfig.defaults());
    }

    private static List<String> nodesOf(WorkflowRun run, NodeExecution.Outcome outcome) {
        return run.executions().stream()
                .filter(e -> e.outcome() == outcome)
                .map(NodeExecution::nodeName)
                .toList();
    }

    @Nested
    class Submit {

        @Test
        void shouldRunEveryNodeAndExport() throws Exception {
            WorkflowEngine engine = engine();

            String runId = engine.submit(GradingRig.submission());
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(run.currentNode()).isNull();
            assertThat(nodesOf(run, NodeExecution.Outcome.OK))
                    .containsExactly(
                            "intake", "preprocess", "rubric_parse", "rubric_review",
                            "boundary_detect", "grade_dispatch", "aggregate", "result_review",
                            "export");
            assertThat(run.state().require(GradingKeys.EXPORT).location()).isEqualTo("memory:" + runId);

            GradingReport report = run.state().require(GradingKeys.REPORT);
            assertThat(report.students())
                    .extracting(AggregatedResult::studentKey)
                    .containsExactly("Ann", "Ben");
            assertThat(report.students()).allMatch(s -> s.score() == 24.0 && s.maxScore() == 30.0);
            assertThat(rig.gradingCalls).hasValue(2);
            assertThat(listener.completed).containsExactly(runId);
        }

        @Test
        void shouldRejectIncompleteSubmissionWithoutCreatingRun() {
            WorkflowEngine engine = engine();
            SubmissionRequest request =
                    new SubmissionRequest(null, null, GradingRig.ANSWERS_DOC, -5.0, null, List.of());

            assertThatThrownBy(() -> engine.submit(request))
                    .isInstanceOfSatisfying(
                            InputValidationException.class,
                            e ->
                                    assertThat(e.getViolations())
                                            .anyMatch(v -> v.contains("Rubric document"))
                                            .anyMatch(v -> v.contains("positive")));
            assertThat(store.size()).isZero();
        }

        @Test
        void shouldGradeRawBatchesWhenBoundaryDetectionIsDisabled() throws Exception {
            WorkflowEngine engine = engine(GradeflowConfig.builder().boundaryDetectionEnabled(false).build());

            WorkflowRun run = engine.awaitSettled(engine.submit(GradingRig.submission()), SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(run.state().require(GradingKeys.SEGMENTS).skipped()).isTrue();
            GradingReport report = run.state().require(GradingKeys.REPORT);
            assertThat(report.students())
                    .extracting(AggregatedResult::studentKey)
                    .containsExactly("Batch 01");
        }

        @Test
        void shouldFailRunWhenAnswerPageCountDiffers() throws Exception {
            WorkflowEngine engine = engine();
            SubmissionRequest request =
                    new SubmissionRequest(
                            "Midterm", GradingRig.RUBRIC_DOC, GradingRig.ANSWERS_DOC, 30.0, 7, List.of());

            WorkflowRun run = engine.awaitSettled(engine.submit(request), SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.errorDetail()).startsWith("preprocess: ").contains("Expected 7 answer pages");
            assertThat(nodesOf(run, NodeExecution.Outcome.ERROR)).containsExactly("preprocess");
            assertThat(listener.failed).containsExactly("preprocess");
        }
    }

    @Nested
    class RubricMismatch {

        @Test
        void shouldBlockRunInPendingWithReason() throws Exception {
            WorkflowEngine engine = engine();
            SubmissionRequest request =
                    new SubmissionRequest(
                            "Midterm", GradingRig.RUBRIC_DOC, GradingRig.ANSWERS_DOC, 50.0, null, List.of());

            String runId = engine.submit(request);
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.PENDING);
            assertThat(run.isBlocked()).isTrue();
            assertThat(run.currentNode()).isEqualTo("rubric_parse");
            assertThat(run.errorDetail()).contains("30.0").contains("50.0");
            assertThat(run.state().has(GradingKeys.RUBRIC.name())).isFalse();
            assertThat(listener.blocked).containsExactly("rubric_parse");
            assertThat(rig.gradingCalls).hasValue(0);
        }

        @Test
        void shouldNotRecoverBlockedRun() throws Exception {
            WorkflowEngine engine = engine();
            SubmissionRequest request =
                    new SubmissionRequest(
                            "Midterm", GradingRig.RUBRIC_DOC, GradingRig.ANSWERS_DOC, 50.0, null, List.of());
            engine.awaitSettled(engine.submit(request), SETTLE);

            assertThat(engine(GradeflowConfig.defaults()).recover()).isEmpty();
        }
    }

    @Nested
    class ReviewGates {

        private WorkflowEngine engine;
        private String runId;

        @BeforeEach
        void suspendAtRubricReview() throws Exception {
            engine = engine(GradeflowConfig.builder().rubricReviewRequired(true).build());
            runId = engine.submit(GradingRig.submission());
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);
            assertThat(run.status()).isEqualTo(RunStatus.SUSPENDED);
        }

        @Test
        void shouldExposePendingReview() {
            WorkflowRun run = engine.getStatus(runId);

            assertThat(run.currentNode()).isEqualTo("rubric_review");
            assertThat(run.pendingReview().reviewedField()).isEqualTo("rubric");
            assertThat(run.pendingReview().reasons()).contains("Rubric sign-off is required");
            assertThat(nodesOf(run, NodeExecution.Outcome.INTERRUPTED)).containsExactly("rubric_review");
            assertThat(rig.gradingCalls).hasValue(0);
        }

        @Test
        void shouldContinueAfterApproval() throws Exception {
            engine.resume(runId, new ReviewDecision.Approve("rubric_review", "looks right"));
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            List<NodeExecution> gate =
                    run.executions().stream().filter(e -> e.nodeName().equals("rubric_review")).toList();
            assertThat(gate)
                    .extracting(NodeExecution::attempt, NodeExecution::outcome)
                    .containsExactly(
                            tuple(1, NodeExecution.Outcome.INTERRUPTED),
                            tuple(2, NodeExecution.Outcome.OK));
        }

        @Test
        void shouldGradeAgainstEditedRubric() throws Exception {
            engine.resume(runId, new ReviewDecision.Edit("rubric_review", TestFixtures.rubric(20, 20, 20), null));
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(run.state().require(GradingKeys.RUBRIC).totalScore()).isEqualTo(30.0);
            GradingReport report = run.state().require(GradingKeys.REPORT);
            assertThat(report.students()).allMatch(s -> s.maxScore() == 60.0);
        }

        @Test
        void shouldCancelRunOnRejection() {
            WorkflowRun run = engine.resume(runId, new ReviewDecision.Reject("rubric_review", "wrong exam"));

            assertThat(run.status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(run.errorDetail()).isEqualTo("Rejected at rubric_review: wrong exam");
            assertThat(engine.getStatus(runId).status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(listener.cancelled).containsExactly(runId);
        }

        @Test
        void shouldIgnoreRepeatedDecision() throws Exception {
            engine.resume(runId, new ReviewDecision.Approve("rubric_review"));
            WorkflowRun settled = engine.awaitSettled(runId, SETTLE);

            WorkflowRun again = engine.resume(runId, new ReviewDecision.Approve("rubric_review"));

            assertThat(again.status()).isEqualTo(settled.status());
            assertThat(again.executions()).hasSameSizeAs(settled.executions());
        }

        @Test
        void shouldAnswerRepeatedDecisionWhileGradingIsInProgress() throws Exception {
            CountDownLatch grading = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            rig.grader =
                    request -> {
                        grading.countDown();
                        try {
                            release.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return GradingRig.fullMarks();
                    };
            engine.resume(runId, new ReviewDecision.Approve("rubric_review"));
            assertThat(grading.await(5, TimeUnit.SECONDS)).isTrue();

            try {
                assertThat(
                                CompletableFuture.supplyAsync(
                                        () ->
                                                engine.resume(
                                                        runId,
                                                        new ReviewDecision.Approve("rubric_review"))))
                        .succeedsWithin(Duration.ofSeconds(2))
                        .extracting(WorkflowRun::status)
                        .isEqualTo(RunStatus.RUNNING);
            } finally {
                release.countDown();
            }
            assertThat(engine.awaitSettled(runId, SETTLE).status()).isEqualTo(RunStatus.COMPLETED);
        }

        @Test
        void shouldRejectDecisionForGateNotWaiting() {
            assertThatThrownBy(() -> engine.resume(runId, new ReviewDecision.Approve("result_review")))
                    .isInstanceOf(InvalidDecisionException.class)
                    .hasMessageContaining("not waiting at result_review");
        }

        @Test
        void shouldRejectDecisionForUnknownGate() {
            assertThatThrownBy(() -> engine.resume(runId, new ReviewDecision.Approve("export")))
                    .isInstanceOf(InvalidDecisionException.class)
                    .hasMessageContaining("export");
        }

        @Test
        void shouldRejectEditOfWrongType() {
            assertThatThrownBy(
                            () -> engine.resume(runId, new ReviewDecision.Edit("rubric_review", "text", null)))
                    .isInstanceOf(InvalidDecisionException.class);
            assertThat(engine.getStatus(runId).status()).isEqualTo(RunStatus.SUSPENDED);
        }

        @Test
        void shouldCancelSuspendedRunAtOnce() {
            WorkflowRun run = engine.cancel(runId);

            assertThat(run.status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(run.errorDetail()).isEqualTo("Cancelled by request");
        }
    }

    @Nested
    class ResultReview {

        @Test
        void shouldSuspendWhenStudentHasLowConfidence() throws Exception {
            rig.grader =
                    request ->
                            request.studentKey().equals("Ben")
                                    ? TestFixtures.outcome(
                                            TestFixtures.score("1", 2, 10, 0.3),
                                            TestFixtures.score("2", 8, 10, 0.9),
                                            TestFixtures.score("3", 8, 10, 0.9))
                                    : GradingRig.fullMarks();
            WorkflowEngine engine = engine();

            String runId = engine.submit(GradingRig.submission());
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.SUSPENDED);
            assertThat(run.currentNode()).isEqualTo("result_review");
            assertThat(run.pendingReview().reasons()).anyMatch(r -> r.startsWith("Ben has low-confidence"));
        }

        @Test
        void shouldExportEditedReport() throws Exception {
            WorkflowEngine engine = engine(GradeflowConfig.builder().resultReviewRequired(true).build());
            String runId = engine.submit(GradingRig.submission());
            WorkflowRun suspended = engine.awaitSettled(runId, SETTLE);
            GradingReport original = suspended.state().require(GradingKeys.REPORT);
            GradingReport edited = new GradingReport(original.students().subList(0, 1), original.summary());

            engine.resume(runId, new ReviewDecision.Edit("result_review", edited, "Ben withdrew"));
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(run.state().require(GradingKeys.REPORT_EDITED).students()).hasSize(1);
            assertThat(run.state().require(GradingKeys.REPORT).students()).hasSize(2);
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldStopRunDuringGrading() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            rig.grader =
                    request -> {
                        entered.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return GradingRig.fullMarks();
                    };
            WorkflowEngine engine = engine();
            String runId = engine.submit(GradingRig.submission());
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            engine.cancel(runId);
            release.countDown();
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(run.errorDetail()).contains("grade_dispatch");
            assertThat(run.state().has(GradingKeys.GRADING.name())).isFalse();
            assertThat(run.state().has(GradingKeys.EXPORT.name())).isFalse();
            assertThat(nodesOf(run, NodeExecution.Outcome.INTERRUPTED)).containsExactly("grade_dispatch");
        }

        @Test
        void shouldLeaveTerminalRunUnchanged() throws Exception {
            WorkflowEngine engine = engine();
            String runId = engine.submit(GradingRig.submission());
            engine.awaitSettled(runId, SETTLE);

            assertThat(engine.cancel(runId).status()).isEqualTo(RunStatus.COMPLETED);
        }
    }

    @Nested
    class UnexpectedFailures {

        private final WorkflowListener brokenListener =
                new WorkflowListener() {
                    @Override
                    public void onNodeStarted(String runId, String node, int attempt) {
                        throw new IllegalStateException("listener broke");
                    }
                };

        @Test
        void shouldCheckpointFailedRunWhenDriverStopsUnexpectedly() throws Exception {
            GradeflowEnvironment env = rig.build(GradeflowConfig.defaults(), store, null);
            environments.add(env);
            WorkflowEngine engine =
                    new WorkflowEngine(
                            env.getWorkflow().definition(),
                            store,
                            env.getBroadcaster(),
                            env.getExecutorService(),
                            brokenListener);

            String runId = engine.submit(GradingRig.submission());
            WorkflowRun run = engine.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.errorDetail()).startsWith("intake: ").contains("listener broke");
            assertThat(store.load(runId)).get().extracting(WorkflowRun::status).isEqualTo(RunStatus.FAILED);
            try (ProgressStream stream = engine.stream(runId)) {
                assertThat(stream.snapshot().status()).isEqualTo(RunStatus.FAILED);
                assertThat(stream.events().hasNext()).isFalse();
            }
            assertThat(rig.gradingCalls).hasValue(0);
        }

        @Test
        void shouldCompleteRunWhenOnlyRegisteredListenerThrows() throws Exception {
            GradeflowEnvironment env = rig.build(GradeflowConfig.defaults(), store, brokenListener);
            environments.add(env);
            WorkflowEngine engine = env.getEngine();

            WorkflowRun run = engine.awaitSettled(engine.submit(GradingRig.submission()), SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        }
    }

    @Nested
    class Recovery {

        @Test
        void shouldResumeOnNewEngineWithoutRegrading() throws Exception {
            WorkflowEngine first = engine(GradeflowConfig.builder().resultReviewRequired(true).build());
            String runId = first.submit(GradingRig.submission());
            first.awaitSettled(runId, SETTLE);
            assertThat(rig.gradingCalls).hasValue(2);

            WorkflowEngine second = engine(GradeflowConfig.builder().resultReviewRequired(true).build());
            second.resume(runId, new ReviewDecision.Approve("result_review"));
            WorkflowRun run = second.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(rig.gradingCalls).hasValue(2);
            assertThat(nodesOf(run, NodeExecution.Outcome.OK)).containsOnlyOnce("grade_dispatch");
        }

        @Test
        void shouldReenterInterruptedRunAtFirstMissingNode() throws Exception {
            WorkflowEngine first = engine(GradeflowConfig.builder().resultReviewRequired(true).build());
            String runId = first.submit(GradingRig.submission());
            WorkflowRun suspended = first.awaitSettled(runId, SETTLE);
            // a crash while the gate was being evaluated leaves the run RUNNING
            store.save(runId, suspended.running("result_review"));

            WorkflowEngine second = engine();
            assertThat(second.recover()).containsExactly(runId);
            WorkflowRun run = second.awaitSettled(runId, SETTLE);

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(rig.gradingCalls).hasValue(2);
            assertThat(run.lastSequence()).isGreaterThan(suspended.lastSequence());
        }
    }

    @Nested
    class Streaming {

        @Test
        void shouldDeliverLiveEventsInOrderUntilCompletion() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            rig.grader =
                    request -> {
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return GradingRig.fullMarks();
                    };
            WorkflowEngine engine = engine();
            String runId = engine.submit(GradingRig.submission());

            List<ProgressEvent> events = new ArrayList<>();
            try (ProgressStream stream = engine.stream(runId)) {
                release.countDown();
                stream.events().forEachRemaining(events::add);
            }

            assertThat(events).isNotEmpty();
            assertThat(events).extracting(ProgressEvent::sequence).isSorted().doesNotHaveDuplicates();
            assertThat(events.get(events.size() - 1).kind()).isEqualTo(ProgressEventKind.COMPLETED);
            assertThat(events)
                    .filteredOn(e -> e.kind() == ProgressEventKind.TASK_UPDATE)
                    .anyMatch(e -> "done".equals(e.payload().get("status")));
            assertThat(events.get(events.size() - 1).payload()).containsEntry("students", 2);
        }

        @Test
        void shouldReturnOnlySnapshotForFinishedRun() throws Exception {
            WorkflowEngine engine = engine();
            String runId = engine.submit(GradingRig.submission());
            engine.awaitSettled(runId, SETTLE);

            try (ProgressStream stream = engine.stream(runId)) {
                assertThat(stream.snapshot().status()).isEqualTo(RunStatus.COMPLETED);
                assertThat(stream.events().hasNext()).isFalse();
            }
        }

        @Test
        void shouldFailForUnknownRun() {
            WorkflowEngine engine = engine();

            assertThatThrownBy(() -> engine.stream("missing")).isInstanceOf(RunNotFoundException.class);
            assertThatThrownBy(() -> engine.getStatus("missing")).isInstanceOf(RunNotFoundException.class);
        }
    }

    private static final class RecordingListener implements WorkflowListener {
        final List<String> completed = new CopyOnWriteArrayList<>();
        final List<String> failed = new CopyOnWriteArrayList<>();
        final List<String> blocked = new CopyOnWriteArrayList<>();
        final List<String> cancelled = new CopyOnWriteArrayList<>();

        @Override
        public void onRunCompleted(WorkflowRun run) {
            completed.add(run.runId());
        }

        @Override
        public void onRunFailed(String runId, String node, String detail) {
            failed.add(node);
        }

        @Override
        public void onRunBlocked(String runId, String node, String detail) {
            blocked.add(node);
        }

        @Override
        public void onRunCancelled(String runId, String detail) {
            cancelled.add(runId);
        }
    }
}
