package io.gradeflow.core.workflow;

import io.gradeflow.core.document.Page;
import java.util.List;

/// Rasterized pages of both submitted documents.
///
/// @param rubricPages rubric pages in order, not null
/// @param answerPages answer pages in order, indexed from 0, not null
public record PageSet(List<Page> rubricPages, List<Page> answerPages) {

    public PageSet {
        rubricPages = rubricPages != null ? List.copyOf(rubricPages) : List.of();
        answerPages = answerPages != null ? List.copyOf(answerPages) : List.of();
    }
}
