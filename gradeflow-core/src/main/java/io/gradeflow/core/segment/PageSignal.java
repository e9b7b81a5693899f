package io.gradeflow.core.segment;

import java.util.List;

/// Low-cost first-pass observation of one answer page.
///
/// @param pageIndex zero-based page index
/// @param questionLabels question labels seen on the page, in reading order, not null
/// @param studentName name or id written on the page, null if none was found
public record PageSignal(int pageIndex, List<String> questionLabels, String studentName) {

    public PageSignal {
        questionLabels = questionLabels != null ? List.copyOf(questionLabels) : List.of();
        if (pageIndex < 0) {
            throw new IllegalArgumentException("pageIndex must be >= 0, was " + pageIndex);
        }
    }
}
