package io.gradeflow.core.aggregate;

import java.util.List;
import java.util.Map;

/// Class-level statistics over all students of a run.
///
/// @param studentCount students graded
/// @param completeCount students without gaps
/// @param average mean score
/// @param highest best score
/// @param lowest worst score
/// @param passRate share of students at or above the pass ratio, `[0, 1]`
/// @param distribution students per grade band `A`..`E`, not null
/// @param weakPoints most frequently missed scoring points, not null
/// @param strongPoints most frequently earned scoring points, not null
/// @param flaggedCount students whose result needs review
public record ClassSummary(
        int studentCount,
        int completeCount,
        double average,
        double highest,
        double lowest,
        double passRate,
        Map<String, Integer> distribution,
        List<PointFrequency> weakPoints,
        List<PointFrequency> strongPoints,
        int flaggedCount) {

    public ClassSummary {
        distribution = distribution != null ? Map.copyOf(distribution) : Map.of();
        weakPoints = weakPoints != null ? List.copyOf(weakPoints) : List.of();
        strongPoints = strongPoints != null ? List.copyOf(strongPoints) : List.of();
    }

    /// How many students earned or missed a scoring point.
    public record PointFrequency(String pointId, int count) {}
}
