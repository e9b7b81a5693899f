package io.gradeflow.core.workflow;

import static io.gradeflow.core.workflow.GradingKeys.EXPORT;
import static io.gradeflow.core.workflow.GradingKeys.GRADING;
import static io.gradeflow.core.workflow.GradingKeys.INTAKE;
import static io.gradeflow.core.workflow.GradingKeys.PAGES;
import static io.gradeflow.core.workflow.GradingKeys.REPORT;
import static io.gradeflow.core.workflow.GradingKeys.REPORT_EDITED;
import static io.gradeflow.core.workflow.GradingKeys.RESULT_REVIEW;
import static io.gradeflow.core.workflow.GradingKeys.RUBRIC;
import static io.gradeflow.core.workflow.GradingKeys.RUBRIC_EDITED;
import static io.gradeflow.core.workflow.GradingKeys.RUBRIC_REVIEW;
import static io.gradeflow.core.workflow.GradingKeys.SEGMENTS;
import static io.gradeflow.core.workflow.GradingKeys.SUBMISSION;

import io.gradeflow.core.GradeflowConfig;
import io.gradeflow.core.aggregate.AggregatedResult;
import io.gradeflow.core.aggregate.GradingReport;
import io.gradeflow.core.aggregate.ResultAggregator;
import io.gradeflow.core.document.Page;
import io.gradeflow.core.document.PageRasterizer;
import io.gradeflow.core.exception.InputValidationException;
import io.gradeflow.core.export.ExportReceipt;
import io.gradeflow.core.export.ResultExporter;
import io.gradeflow.core.grading.DispatchResult;
import io.gradeflow.core.grading.GradingDispatcher;
import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.review.ReviewGate;
import io.gradeflow.core.rubric.ParseReport;
import io.gradeflow.core.rubric.QualityCheck;
import io.gradeflow.core.rubric.RubricParser;
import io.gradeflow.core.rubric.RubricTree;
import io.gradeflow.core.run.RunState;
import io.gradeflow.core.run.StatePatch;
import io.gradeflow.core.segment.BoundaryDetector;
import io.gradeflow.core.segment.PageIndexer;
import io.gradeflow.core.segment.PageSignal;
import io.gradeflow.core.segment.StudentSegment;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// The grading workflow's node table and node bodies.
///
/// ```
/// intake → preprocess → rubric_parse → [rubric_review] → boundary_detect
///        → grade_dispatch → aggregate → [result_review] → export
/// ```
///
/// Gates in brackets suspend the run only when the reviewed value needs a human; otherwise
/// they approve automatically and the run continues.
///
/// @see WorkflowEngine for the driver that walks this table
public final class GradingWorkflow {

    private static final Logger logger = Logger.getLogger(GradingWorkflow.class.getName());

    public static final String INTAKE_NODE = "intake";
    public static final String PREPROCESS_NODE = "preprocess";
    public static final String RUBRIC_PARSE_NODE = "rubric_parse";
    public static final String RUBRIC_REVIEW_GATE = "rubric_review";
    public static final String BOUNDARY_DETECT_NODE = "boundary_detect";
    public static final String GRADE_DISPATCH_NODE = "grade_dispatch";
    public static final String AGGREGATE_NODE = "aggregate";
    public static final String RESULT_REVIEW_GATE = "result_review";
    public static final String EXPORT_NODE = "export";

    private final GradeflowConfig config;
    private final PageRasterizer rasterizer;
    private final RubricParser rubricParser;
    private final PageIndexer pageIndexer;
    private final BoundaryDetector boundaryDetector;
    private final GradingDispatcher dispatcher;
    private final ResultAggregator aggregator;
    private final ResultExporter exporter;

    private final ReviewGate<RubricTree> rubricGate;
    private final ReviewGate<GradingReport> resultGate;

    public GradingWorkflow(
            GradeflowConfig config,
            PageRasterizer rasterizer,
            RubricParser rubricParser,
            PageIndexer pageIndexer,
            BoundaryDetector boundaryDetector,
            GradingDispatcher dispatcher,
            ResultAggregator aggregator,
            ResultExporter exporter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.rasterizer = Objects.requireNonNull(rasterizer, "rasterizer must not be null");
        this.rubricParser = Objects.requireNonNull(rubricParser, "rubricParser must not be null");
        this.pageIndexer = Objects.requireNonNull(pageIndexer, "pageIndexer must not be null");
        this.boundaryDetector =
                Objects.requireNonNull(boundaryDetector, "boundaryDetector must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        this.rubricGate =
                new ReviewGate<>(
                        RUBRIC_REVIEW_GATE, RUBRIC, RUBRIC_EDITED, RUBRIC_REVIEW, this::rubricReviewReasons);
        this.resultGate =
                new ReviewGate<>(
                        RESULT_REVIEW_GATE, REPORT, REPORT_EDITED, RESULT_REVIEW, this::resultReviewReasons);
    }

    /// Builds the node table.
    public WorkflowDefinition definition() {
        return new WorkflowDefinition(
                List.of(
                        NodeDescriptor.node(
                                INTAKE_NODE, names(SUBMISSION.name()), names(INTAKE.name()), this::intake),
                        NodeDescriptor.node(
                                PREPROCESS_NODE,
                                names(SUBMISSION.name(), INTAKE.name()),
                                names(PAGES.name()),
                                this::preprocess),
                        NodeDescriptor.node(
                                RUBRIC_PARSE_NODE,
                                names(PAGES.name(), INTAKE.name()),
                                names(RUBRIC.name()),
                                this::parseRubric),
                        NodeDescriptor.gate(rubricGate, Set.of()),
                        NodeDescriptor.node(
                                BOUNDARY_DETECT_NODE,
                                names(PAGES.name(), INTAKE.name(), RUBRIC_REVIEW.name()),
                                names(SEGMENTS.name()),
                                this::detectBoundaries),
                        NodeDescriptor.node(
                                GRADE_DISPATCH_NODE,
                                names(SEGMENTS.name(), PAGES.name(), RUBRIC_REVIEW.name()),
                                names(GRADING.name()),
                                this::dispatch),
                        NodeDescriptor.node(
                                AGGREGATE_NODE,
                                names(GRADING.name(), RUBRIC_REVIEW.name()),
                                names(REPORT.name()),
                                this::aggregate),
                        NodeDescriptor.gate(resultGate, names(SEGMENTS.name())),
                        NodeDescriptor.node(
                                EXPORT_NODE,
                                names(REPORT.name(), RESULT_REVIEW.name()),
                                names(EXPORT.name()),
                                this::export)));
    }

    public ReviewGate<RubricTree> rubricGate() {
        return rubricGate;
    }

    public ReviewGate<GradingReport> resultGate() {
        return resultGate;
    }

    // -- nodes --

    private StatePatch intake(RunContext context) {
        SubmissionRequest submission = context.state().require(SUBMISSION);
        String title =
                submission.title() != null && !submission.title().isBlank()
                        ? submission.title().trim()
                        : submission.answers().name();
        List<String> roster = submission.roster().stream().map(String::trim).toList();
        return StatePatch.of(
                INTAKE,
                new IntakeSummary(
                        title,
                        submission.expectedTotal(),
                        submission.expectedAnswerPages(),
                        roster,
                        Instant.now()));
    }

    private StatePatch preprocess(RunContext context) {
        SubmissionRequest submission = context.state().require(SUBMISSION);
        IntakeSummary intake = context.state().require(INTAKE);
        List<Page> rubricPages = rasterizer.rasterize(submission.rubric());
        List<Page> answerPages = rasterizer.rasterize(submission.answers());

        List<String> violations = new ArrayList<>();
        if (rubricPages.isEmpty()) {
            violations.add("Rubric document " + submission.rubric().name() + " has no pages");
        }
        if (answerPages.isEmpty()) {
            violations.add("Answer document " + submission.answers().name() + " has no pages");
        }
        if (intake.expectedAnswerPages() != null
                && !answerPages.isEmpty()
                && answerPages.size() != intake.expectedAnswerPages()) {
            violations.add(
                    "Expected " + intake.expectedAnswerPages() + " answer pages, found "
                            + answerPages.size());
        }
        if (!violations.isEmpty()) {
            throw new InputValidationException(violations);
        }
        logger.info(
                "Run " + context.runId() + ": " + rubricPages.size() + " rubric pages, "
                        + answerPages.size() + " answer pages");
        return StatePatch.of(PAGES, new PageSet(rubricPages, answerPages));
    }

    private StatePatch parseRubric(RunContext context) {
        PageSet pages = context.state().require(PAGES);
        IntakeSummary intake = context.state().require(INTAKE);
        return StatePatch.of(RUBRIC, rubricParser.parse(pages.rubricPages(), intake.expectedTotal()));
    }

    private StatePatch detectBoundaries(RunContext context) {
        if (!config.isBoundaryDetectionEnabled()) {
            logger.info("Run " + context.runId() + ": boundary detection disabled, grading raw batches");
            return StatePatch.of(SEGMENTS, SegmentPlan.skippedPlan());
        }
        PageSet pages = context.state().require(PAGES);
        IntakeSummary intake = context.state().require(INTAKE);
        RubricTree rubric = rubricGate.effectiveValue(context.state());
        List<PageSignal> signals = pageIndexer.index(pages.answerPages());
        List<StudentSegment> segments =
                boundaryDetector.detect(
                        pages.answerPages().size(),
                        signals != null ? signals : List.of(),
                        rubric.questionCount(),
                        intake.roster());
        return StatePatch.of(SEGMENTS, new SegmentPlan(signals, segments, false));
    }

    private StatePatch dispatch(RunContext context) {
        SegmentPlan plan = context.state().require(SEGMENTS);
        PageSet pages = context.state().require(PAGES);
        RubricTree rubric = rubricGate.effectiveValue(context.state());
        List<GradingTask> tasks =
                plan.skipped()
                        ? dispatcher.planBatches(pages.answerPages().size())
                        : dispatcher.plan(plan.segments());
        DispatchResult result =
                dispatcher.dispatch(
                        context.runId(),
                        tasks,
                        pages.answerPages(),
                        rubric,
                        context.taskListener(),
                        context::isCancelled);
        return StatePatch.of(GRADING, result);
    }

    private StatePatch aggregate(RunContext context) {
        DispatchResult grading = context.state().require(GRADING);
        RubricTree rubric = rubricGate.effectiveValue(context.state());
        return StatePatch.of(REPORT, aggregator.aggregate(rubric, grading.tasks()));
    }

    private StatePatch export(RunContext context) {
        GradingReport report = resultGate.effectiveValue(context.state());
        ExportReceipt receipt = exporter.export(context.runId(), report);
        logger.info("Run " + context.runId() + ": exported report to " + receipt.location());
        return StatePatch.of(EXPORT, receipt);
    }

    // -- review reasons --

    private List<String> rubricReviewReasons(RunState state) {
        RubricTree rubric = state.require(RUBRIC);
        ParseReport report = rubric.report();
        List<String> reasons = new ArrayList<>();
        if (config.isRubricReviewRequired()) {
            reasons.add("Rubric sign-off is required");
        }
        if (report.confidence() < config.getRubricReviewThreshold()) {
            reasons.add(
                    String.format(
                            Locale.ROOT,
                            "Rubric confidence %.2f is below %.2f",
                            report.confidence(),
                            config.getRubricReviewThreshold()));
        }
        if (report.status() == ParseReport.Status.ERROR) {
            reasons.add(
                    "Rubric quality checks failed: "
                            + report.failedChecks().stream()
                                    .filter(c -> c.severity() == QualityCheck.Severity.ERROR)
                                    .map(QualityCheck::name)
                                    .toList());
        }
        return reasons;
    }

    private List<String> resultReviewReasons(RunState state) {
        GradingReport report = state.require(REPORT);
        SegmentPlan plan = state.require(SEGMENTS);
        List<String> reasons = new ArrayList<>();
        if (config.isResultReviewRequired()) {
            reasons.add("Result sign-off is required");
        }
        for (StudentSegment segment : plan.unconfirmed()) {
            reasons.add(
                    String.format(
                            Locale.ROOT,
                            "Pages %d-%d of %s need boundary confirmation (confidence %.2f)",
                            segment.firstPage(),
                            segment.lastPage(),
                            segment.studentKey(),
                            segment.confidence()));
        }
        for (AggregatedResult student : report.flagged()) {
            if (student.isPartial()) {
                reasons.add(student.studentKey() + " is missing pages " + student.gapPages());
            }
            if (!student.lowConfidenceQuestionIds().isEmpty()) {
                reasons.add(
                        student.studentKey() + " has low-confidence questions "
                                + student.lowConfidenceQuestionIds());
            }
        }
        return reasons;
    }

    private static Set<String> names(String... names) {
        return Set.of(names);
    }
}
