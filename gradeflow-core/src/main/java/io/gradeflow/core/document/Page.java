package io.gradeflow.core.document;

import java.util.Objects;

/// One rasterized page.
///
/// @param index zero-based position in its document
/// @param imageRef where the page image is stored, not null
/// @param text text layer if the rasterizer extracted one, may be null
public record Page(int index, String imageRef, String text) {

    public Page {
        Objects.requireNonNull(imageRef, "imageRef must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, was " + index);
        }
    }
}
