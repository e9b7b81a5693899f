package io.gradeflow.core.aggregate;

import io.gradeflow.core.grading.QuestionScore;
import java.util.Objects;

/// A question graded in two sub-batches of the same student, kept for audit.
///
/// @param discarded the lower-confidence grade that was dropped, not null
/// @param discardedTaskId task that produced it, not null
/// @param keptTaskId task whose grade was kept, not null
public record DiscardedDuplicate(QuestionScore discarded, String discardedTaskId, String keptTaskId) {

    public DiscardedDuplicate {
        Objects.requireNonNull(discarded, "discarded must not be null");
        Objects.requireNonNull(discardedTaskId, "discardedTaskId must not be null");
        Objects.requireNonNull(keptTaskId, "keptTaskId must not be null");
    }
}
