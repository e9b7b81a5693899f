package io.gradeflow.core.workflow;

import io.gradeflow.core.aggregate.GradingReport;
import io.gradeflow.core.export.ExportReceipt;
import io.gradeflow.core.grading.DispatchResult;
import io.gradeflow.core.review.ReviewRecord;
import io.gradeflow.core.rubric.RubricTree;
import io.gradeflow.core.run.StateKey;
import java.util.List;
import java.util.Optional;

/// Fields of the grading run state.
///
/// Each node reads some of these and adds others; no field is ever written twice.
public final class GradingKeys {

    public static final StateKey<SubmissionRequest> SUBMISSION =
            StateKey.of("submission", SubmissionRequest.class);
    public static final StateKey<IntakeSummary> INTAKE = StateKey.of("intake", IntakeSummary.class);
    public static final StateKey<PageSet> PAGES = StateKey.of("pages", PageSet.class);
    public static final StateKey<RubricTree> RUBRIC = StateKey.of("rubric", RubricTree.class);
    public static final StateKey<RubricTree> RUBRIC_EDITED =
            StateKey.of("rubric_edited", RubricTree.class);
    public static final StateKey<ReviewRecord> RUBRIC_REVIEW =
            StateKey.of("rubric_review", ReviewRecord.class);
    public static final StateKey<SegmentPlan> SEGMENTS = StateKey.of("segments", SegmentPlan.class);
    public static final StateKey<DispatchResult> GRADING =
            StateKey.of("grading", DispatchResult.class);
    public static final StateKey<GradingReport> REPORT = StateKey.of("report", GradingReport.class);
    public static final StateKey<GradingReport> REPORT_EDITED =
            StateKey.of("report_edited", GradingReport.class);
    public static final StateKey<ReviewRecord> RESULT_REVIEW =
            StateKey.of("result_review", ReviewRecord.class);
    public static final StateKey<ExportReceipt> EXPORT = StateKey.of("export", ExportReceipt.class);

    /// Every key, in the order the workflow produces them.
    public static final List<StateKey<?>> ALL =
            List.of(
                    SUBMISSION, INTAKE, PAGES, RUBRIC, RUBRIC_EDITED, RUBRIC_REVIEW, SEGMENTS,
                    GRADING, REPORT, REPORT_EDITED, RESULT_REVIEW, EXPORT);

    private GradingKeys() {}

    /// Looks up a key by field name, e.g. when reading a checkpoint back.
    public static Optional<StateKey<?>> byName(String name) {
        return ALL.stream().filter(key -> key.name().equals(name)).findFirst();
    }
}
