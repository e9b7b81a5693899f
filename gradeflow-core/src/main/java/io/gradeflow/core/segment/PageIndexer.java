package io.gradeflow.core.segment;

import io.gradeflow.core.document.Page;
import java.util.List;

/// External first-pass capability that lists the question labels visible on each page.
@FunctionalInterface
public interface PageIndexer {

    /// Indexes answer pages.
    ///
    /// @param pages answer pages in order, never empty
    /// @return one signal per page it could read; pages missing from the result are treated
    ///     as having no visible question numbers
    List<PageSignal> index(List<Page> pages);
}
