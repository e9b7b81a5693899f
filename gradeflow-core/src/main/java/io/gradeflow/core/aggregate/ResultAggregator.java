package io.gradeflow.core.aggregate;

import io.gradeflow.core.aggregate.ClassSummary.PointFrequency;
import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.grading.QuestionScore;
import io.gradeflow.core.grading.TaskStatus;
import io.gradeflow.core.rubric.QuestionIds;
import io.gradeflow.core.rubric.RubricQuestion;
import io.gradeflow.core.rubric.RubricTree;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Merges terminal grading tasks into per-student results and a class summary.
///
/// Tasks are grouped by student and read in sub-batch order. When a question is graded by
/// more than one sub-batch of the same student (an answer spanning a page split), the
/// grades are not summed: the one with the higher confidence is kept and the other is
/// recorded as a {@link DiscardedDuplicate}. Every question score is capped at the
/// rubric maximum for that question.
///
/// A result needs review when a question falls below `lowConfidenceThreshold` or when a
/// task of that student failed, leaving a gap.
public class ResultAggregator {

    private static final Logger logger = Logger.getLogger(ResultAggregator.class.getName());

    public static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.7;
    public static final double DEFAULT_PASS_RATIO = 0.6;

    private static final int TOP_POINTS = 5;

    private final double lowConfidenceThreshold;
    private final double passRatio;

    public ResultAggregator() {
        this(DEFAULT_LOW_CONFIDENCE_THRESHOLD, DEFAULT_PASS_RATIO);
    }

    public ResultAggregator(double lowConfidenceThreshold, double passRatio) {
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.passRatio = passRatio;
    }

    /// Aggregates the tasks of one run.
    ///
    /// @param rubric rubric the tasks were graded against, not null
    /// @param tasks terminal tasks, not null
    /// @return the report, never null
    public GradingReport aggregate(RubricTree rubric, List<GradingTask> tasks) {
        Objects.requireNonNull(rubric, "rubric must not be null");
        Objects.requireNonNull(tasks, "tasks must not be null");

        Map<String, List<GradingTask>> byStudent = new LinkedHashMap<>();
        for (GradingTask task : tasks) {
            byStudent.computeIfAbsent(task.studentKey(), k -> new ArrayList<>()).add(task);
        }

        List<AggregatedResult> students = new ArrayList<>();
        byStudent.forEach((student, studentTasks) -> students.add(merge(rubric, student, studentTasks)));

        ClassSummary summary = summarize(students);
        logger.info(
                "Aggregated " + students.size() + " students, average "
                        + String.format("%.1f", summary.average()) + ", "
                        + summary.flaggedCount() + " flagged for review");
        return new GradingReport(students, summary);
    }

    private AggregatedResult merge(RubricTree rubric, String student, List<GradingTask> tasks) {
        List<GradingTask> ordered = new ArrayList<>(tasks);
        ordered.sort(Comparator.comparingInt(GradingTask::subBatch));

        Map<String, QuestionScore> kept = new LinkedHashMap<>();
        Map<String, String> keptBy = new HashMap<>();
        List<DiscardedDuplicate> discarded = new ArrayList<>();
        List<Integer> gapPages = new ArrayList<>();

        for (GradingTask task : ordered) {
            if (task.status() != TaskStatus.DONE) {
                gapPages.addAll(task.pages());
                continue;
            }
            for (QuestionScore raw : task.result().questions()) {
                QuestionScore score = normalize(rubric, raw);
                String questionId = score.questionId();
                QuestionScore existing = kept.get(questionId);
                if (existing == null) {
                    kept.put(questionId, score);
                    keptBy.put(questionId, task.taskId());
                } else if (score.confidence() > existing.confidence()) {
                    discarded.add(new DiscardedDuplicate(existing, keptBy.get(questionId), task.taskId()));
                    kept.put(questionId, score);
                    keptBy.put(questionId, task.taskId());
                } else {
                    discarded.add(new DiscardedDuplicate(score, task.taskId(), keptBy.get(questionId)));
                }
            }
        }

        List<QuestionScore> questions = new ArrayList<>(kept.values());
        double score = questions.stream().mapToDouble(QuestionScore::score).sum();
        double maxScore = rubric.totalScore();
        for (QuestionScore question : questions) {
            if (rubric.question(question.questionId()).isEmpty()) {
                maxScore += question.maxScore();
            }
        }
        double confidence =
                questions.stream().mapToDouble(QuestionScore::confidence).average().orElse(0.0);
        List<String> lowConfidence =
                questions.stream()
                        .filter(q -> q.confidence() < lowConfidenceThreshold)
                        .map(QuestionScore::questionId)
                        .toList();
        boolean needsReview = !lowConfidence.isEmpty() || !gapPages.isEmpty();

        return new AggregatedResult(
                student, score, maxScore, questions, confidence, lowConfidence, gapPages,
                discarded, needsReview);
    }

    private static QuestionScore normalize(RubricTree rubric, QuestionScore raw) {
        String questionId = QuestionIds.canonical(raw.questionId());
        double cap =
                rubric.question(questionId).map(RubricQuestion::maxScore).orElse(raw.maxScore());
        QuestionScore score =
                new QuestionScore(
                        questionId,
                        Math.max(0, raw.score()),
                        cap,
                        raw.confidence(),
                        raw.feedback(),
                        raw.earnedPoints(),
                        raw.missedPoints());
        return score.cappedAt(cap);
    }

    private ClassSummary summarize(List<AggregatedResult> students) {
        if (students.isEmpty()) {
            return new ClassSummary(0, 0, 0, 0, 0, 0, bands(List.of()), List.of(), List.of(), 0);
        }
        double total = 0;
        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        int passed = 0;
        int complete = 0;
        int flagged = 0;
        Map<String, Integer> missed = new HashMap<>();
        Map<String, Integer> earned = new HashMap<>();

        for (AggregatedResult student : students) {
            total += student.score();
            highest = Math.max(highest, student.score());
            lowest = Math.min(lowest, student.score());
            if (student.percentage() >= passRatio * 100) {
                passed++;
            }
            if (!student.isPartial()) {
                complete++;
            }
            if (student.needsReview()) {
                flagged++;
            }
            for (QuestionScore question : student.questions()) {
                question.missedPoints().forEach(id -> missed.merge(id, 1, Integer::sum));
                question.earnedPoints().forEach(id -> earned.merge(id, 1, Integer::sum));
            }
        }

        return new ClassSummary(
                students.size(),
                complete,
                total / students.size(),
                highest,
                lowest,
                passed / (double) students.size(),
                bands(students),
                top(missed),
                top(earned),
                flagged);
    }

    private static Map<String, Integer> bands(List<AggregatedResult> students) {
        Map<String, Integer> bands = new LinkedHashMap<>();
        for (String band : List.of("A", "B", "C", "D", "E")) {
            bands.put(band, 0);
        }
        for (AggregatedResult student : students) {
            bands.merge(band(student.percentage()), 1, Integer::sum);
        }
        return bands;
    }

    static String band(double percentage) {
        if (percentage >= 85) {
            return "A";
        } else if (percentage >= 70) {
            return "B";
        } else if (percentage >= 60) {
            return "C";
        } else if (percentage >= 50) {
            return "D";
        }
        return "E";
    }

    private static List<PointFrequency> top(Map<String, Integer> counts) {
        return counts.entrySet().stream()
                .sorted(
                        Map.Entry.<String, Integer>comparingByValue()
                                .reversed()
                                .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_POINTS)
                .map(e -> new PointFrequency(e.getKey(), e.getValue()))
                .toList();
    }
}
