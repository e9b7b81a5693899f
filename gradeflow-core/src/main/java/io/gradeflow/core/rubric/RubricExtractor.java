package io.gradeflow.core.rubric;

import io.gradeflow.core.document.Page;
import java.util.List;

/// External capability that reads scoring items from a batch of rubric pages.
@FunctionalInterface
public interface RubricExtractor {

    /// Extracts rubric items from one batch.
    ///
    /// @param pages the batch, in document order, never empty
    /// @param batchIndex zero-based batch number
    /// @return items found in the batch, never null
    RubricExtraction extract(List<Page> pages, int batchIndex);
}
