package io.gradeflow.core.segment;

import java.util.List;
import java.util.Objects;

/// Contiguous page range attributed to one student.
///
/// @param studentKey resolved name or placeholder, not null
/// @param pages page indices in order, not empty
/// @param confidence confidence in the boundaries, `[0, 1]`
/// @param needsConfirmation whether a human should confirm the split
/// @param notes why confidence was lowered, not null
public record StudentSegment(
        String studentKey,
        List<Integer> pages,
        double confidence,
        boolean needsConfirmation,
        List<String> notes) {

    public StudentSegment {
        Objects.requireNonNull(studentKey, "studentKey must not be null");
        pages = pages != null ? List.copyOf(pages) : List.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("Segment " + studentKey + " has no pages");
        }
    }

    public int firstPage() {
        return pages.get(0);
    }

    public int lastPage() {
        return pages.get(pages.size() - 1);
    }

    public int pageCount() {
        return pages.size();
    }
}
