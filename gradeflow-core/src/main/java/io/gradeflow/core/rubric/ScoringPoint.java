package io.gradeflow.core.rubric;

import java.util.List;
import java.util.Objects;

/// One scoring point of a rubric question.
///
/// @param pointId id of the form `<questionId>.<n>`, not null
/// @param description what earns the point, not null
/// @param maxScore points available
/// @param keywords hints a grader should look for, not null
public record ScoringPoint(
        String pointId, String description, double maxScore, List<String> keywords) {

    public ScoringPoint {
        Objects.requireNonNull(pointId, "pointId must not be null");
        description = description != null ? description : "";
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }
}
