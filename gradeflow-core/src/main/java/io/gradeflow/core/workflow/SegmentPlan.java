package io.gradeflow.core.workflow;

import io.gradeflow.core.segment.PageSignal;
import io.gradeflow.core.segment.StudentSegment;
import java.util.List;

/// Output of the `boundary_detect` node.
///
/// @param signals first-pass page signals, not null
/// @param segments detected students in page order, not null
/// @param skipped true when detection is disabled and raw page batches are graded instead
public record SegmentPlan(List<PageSignal> signals, List<StudentSegment> segments, boolean skipped) {

    public SegmentPlan {
        signals = signals != null ? List.copyOf(signals) : List.of();
        segments = segments != null ? List.copyOf(segments) : List.of();
    }

    public static SegmentPlan skippedPlan() {
        return new SegmentPlan(List.of(), List.of(), true);
    }

    public List<StudentSegment> unconfirmed() {
        return segments.stream().filter(StudentSegment::needsConfirmation).toList();
    }
}
