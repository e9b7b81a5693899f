package io.gradeflow.core.document;

import java.util.Objects;

/// Reference to an uploaded document. The core never reads the bytes itself; it hands the
/// reference to a {@link PageRasterizer}.
///
/// @param name display name, e.g. the uploaded file name, not null
/// @param location where the rasterizer can fetch the document, not null
public record DocumentRef(String name, String location) {

    public DocumentRef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }
}
