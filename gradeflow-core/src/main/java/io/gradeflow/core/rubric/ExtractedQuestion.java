package io.gradeflow.core.rubric;

import java.util.List;

/// Raw rubric item as returned by a {@link RubricExtractor}, before merging.
///
/// @param label question label as printed, e.g. `"7(a)"`
/// @param description item text, may be null
/// @param maxScore points the item declares
/// @param points scoring points the item lists, may be empty
/// @param standardAnswer reference answer, may be null
/// @param confidence extractor confidence in `[0, 1]`
public record ExtractedQuestion(
        String label,
        String description,
        double maxScore,
        List<Point> points,
        String standardAnswer,
        double confidence) {

    public ExtractedQuestion {
        points = points != null ? List.copyOf(points) : List.of();
    }

    /// Raw scoring point.
    public record Point(String description, double score, List<String> keywords) {

        public Point {
            keywords = keywords != null ? List.copyOf(keywords) : List.of();
        }
    }
}
