package io.gradeflow.core.document;

import java.util.List;

/// External page rasterization service.
///
/// Only the ordered page list is consumed; rendering parameters belong to the implementation.
@FunctionalInterface
public interface PageRasterizer {

    /// Renders a document into pages.
    ///
    /// @param document the document to render, not null
    /// @return pages in document order with indices `0..n-1`, never null
    List<Page> rasterize(DocumentRef document);
}
