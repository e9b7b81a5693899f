package io.gradeflow.core.rubric;

import io.gradeflow.core.document.Page;
import io.gradeflow.core.rubric.QualityCheck.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns rubric pages into a validated {@link RubricTree}.
///
/// Pages are sent to the {@link RubricExtractor} in fixed-size batches. Items from all
/// batches are merged by canonical question id, so `7(a)` and `7(b)` become scoring points
/// of question `7` instead of two top-level questions. The merged tree carries a
/// self-report with quality checks, a confidence score and uncertainty notes.
///
/// ### Contracts
/// - **Precondition**: `pages` is not empty
/// - **Postcondition**: the returned tree's total equals the sum of its question maxima
/// - **Postcondition**: if an expected total is given, the returned tree matches it within
///   the configured tolerance; otherwise {@link RubricScoreMismatchException} is thrown
///
/// ### Fallback
/// When a fallback rubric is configured and extraction fails, the fallback is used, the
/// degradation is logged and the report marks `fallbackUsed`. Without a fallback the
/// extraction failure propagates.
///
/// @implNote Stateless apart from configuration; safe to share across runs.
public class RubricParser {

    private static final Logger logger = Logger.getLogger(RubricParser.class.getName());

    /// Default number of rubric pages per extraction call.
    public static final int DEFAULT_PAGES_PER_BATCH = 14;

    static final double LOW_CONFIDENCE = 0.7;

    private static final Comparator<RubricQuestion> QUESTION_ORDER =
            Comparator.comparingInt((RubricQuestion q) -> sortKey(q.questionId()))
                    .thenComparing(RubricQuestion::questionId);

    private final RubricExtractor extractor;
    private final int pagesPerBatch;
    private final double scoreTolerance;
    private final RubricTree fallback;

    /// Creates a parser.
    ///
    /// @param extractor extraction capability, not null
    /// @param pagesPerBatch pages per extraction call, positive
    /// @param scoreTolerance allowed difference between totals
    /// @param fallback rubric used when extraction fails, may be null to disable fallback
    public RubricParser(
            RubricExtractor extractor, int pagesPerBatch, double scoreTolerance, RubricTree fallback) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        if (pagesPerBatch < 1) {
            throw new IllegalArgumentException("pagesPerBatch must be >= 1, was " + pagesPerBatch);
        }
        this.pagesPerBatch = pagesPerBatch;
        this.scoreTolerance = scoreTolerance;
        this.fallback = fallback;
    }

    /// Parses the rubric.
    ///
    /// @param pages rubric pages in order, not empty
    /// @param expectedTotal total declared at submission, may be null
    /// @return the parsed tree, never null
    /// @throws RubricScoreMismatchException if the parsed total differs from `expectedTotal`
    /// @throws IllegalArgumentException if `pages` is empty
    public RubricTree parse(List<Page> pages, Double expectedTotal) {
        Objects.requireNonNull(pages, "pages must not be null");
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("Rubric has no pages");
        }

        RubricTree tree;
        try {
            tree = extractAndMerge(pages, expectedTotal);
        } catch (RuntimeException e) {
            if (fallback == null) {
                throw e;
            }
            logger.warning(
                    "Rubric extraction failed, using configured fallback rubric: " + e.getMessage());
            tree = withFallbackReport(fallback, e, expectedTotal);
        }

        if (expectedTotal != null && Math.abs(tree.totalScore() - expectedTotal) > scoreTolerance) {
            throw new RubricScoreMismatchException(expectedTotal, tree.totalScore(), tree);
        }
        logger.info(
                "Parsed rubric: "
                        + tree.questionCount()
                        + " questions, total "
                        + tree.totalScore()
                        + ", confidence "
                        + String.format("%.2f", tree.report().confidence()));
        return tree;
    }

    /// Splits pages into batches of at most `pagesPerBatch`.
    List<List<Page>> batches(List<Page> pages) {
        List<List<Page>> batches = new ArrayList<>();
        for (int start = 0; start < pages.size(); start += pagesPerBatch) {
            batches.add(List.copyOf(pages.subList(start, Math.min(pages.size(), start + pagesPerBatch))));
        }
        return batches;
    }

    private RubricTree extractAndMerge(List<Page> pages, Double expectedTotal) {
        Map<String, QuestionBuilder> merged = new LinkedHashMap<>();
        Double declaredTotal = null;

        List<List<Page>> batches = batches(pages);
        for (int i = 0; i < batches.size(); i++) {
            RubricExtraction extraction = extractor.extract(batches.get(i), i);
            logger.fine(
                    "Rubric batch " + (i + 1) + "/" + batches.size() + ": "
                            + extraction.questions().size() + " items");
            if (declaredTotal == null) {
                declaredTotal = extraction.declaredTotal();
            }
            for (ExtractedQuestion item : extraction.questions()) {
                String id = QuestionIds.canonical(item.label());
                if (id.isEmpty()) {
                    logger.warning("Skipping rubric item without a label in batch " + (i + 1));
                    continue;
                }
                merged.computeIfAbsent(id, QuestionBuilder::new).add(item);
            }
        }

        List<RubricQuestion> questions =
                merged.values().stream()
                        .map(QuestionBuilder::build)
                        .sorted(QUESTION_ORDER)
                        .toList();
        double total = questions.stream().mapToDouble(RubricQuestion::maxScore).sum();
        return RubricTree.of(questions, report(questions, total, declaredTotal, expectedTotal));
    }

    private ParseReport report(
            List<RubricQuestion> questions, double total, Double declaredTotal, Double expectedTotal) {
        List<QualityCheck> checks = new ArrayList<>();
        List<String> notes = new ArrayList<>();

        double countFactor;
        if (questions.isEmpty()) {
            checks.add(QualityCheck.fail("question_count", Severity.ERROR, "No questions extracted"));
            countFactor = 0.0;
        } else if (questions.size() < 3) {
            checks.add(
                    QualityCheck.fail(
                            "question_count",
                            Severity.CAUTION,
                            "Only " + questions.size() + " questions extracted"));
            countFactor = 0.6;
        } else {
            checks.add(QualityCheck.pass("question_count", questions.size() + " questions"));
            countFactor = 0.9;
        }

        boolean consistent = true;
        if (declaredTotal != null && Math.abs(declaredTotal - total) > scoreTolerance) {
            checks.add(
                    QualityCheck.fail(
                            "total_consistency",
                            Severity.CAUTION,
                            "Printed total " + declaredTotal + " differs from question sum " + total));
            consistent = false;
        } else {
            checks.add(QualityCheck.pass("total_consistency", "Question sum " + total));
        }

        double expectedFactor = 0.95;
        if (expectedTotal != null) {
            if (Math.abs(expectedTotal - total) > scoreTolerance) {
                checks.add(
                        QualityCheck.fail(
                                "expected_total",
                                Severity.ERROR,
                                "Parsed total " + total + " differs from declared " + expectedTotal));
                expectedFactor = 0.5;
            } else {
                checks.add(QualityCheck.pass("expected_total", "Matches declared " + expectedTotal));
            }
        }

        double confidenceSum = 0;
        for (RubricQuestion question : questions) {
            confidenceSum += question.confidence();
            String id = question.questionId();
            if (question.points().isEmpty()) {
                checks.add(
                        QualityCheck.fail(
                                "missing_points:" + id,
                                Severity.CAUTION,
                                "Question " + id + " has no scoring points"));
            } else if (Math.abs(question.pointsTotal() - question.maxScore()) > scoreTolerance) {
                checks.add(
                        QualityCheck.fail(
                                "points_sum:" + id,
                                Severity.CAUTION,
                                "Question " + id + " points sum to " + question.pointsTotal()
                                        + " but the question is worth " + question.maxScore()));
                consistent = false;
            }
            if (question.confidence() < LOW_CONFIDENCE) {
                checks.add(
                        QualityCheck.fail(
                                "low_confidence:" + id,
                                Severity.CAUTION,
                                "Question " + id + " extracted with confidence "
                                        + String.format("%.2f", question.confidence())));
            }
        }
        double meanQuestionConfidence = questions.isEmpty() ? 0 : confidenceSum / questions.size();
        double consistencyFactor = consistent ? 1.0 : 0.7;

        double confidence =
                (countFactor + consistencyFactor + expectedFactor + meanQuestionConfidence) / 4;

        for (QualityCheck check : checks) {
            if (!check.passed()) {
                notes.add(check.message());
            }
        }
        return new ParseReport(clamp(confidence), statusOf(checks), checks, notes, false);
    }

    private RubricTree withFallbackReport(RubricTree rubric, RuntimeException cause, Double expectedTotal) {
        List<QualityCheck> checks = new ArrayList<>(rubric.report().checks());
        checks.add(
                QualityCheck.fail(
                        "extraction_fallback",
                        Severity.ERROR,
                        "Extraction failed (" + cause.getMessage() + "), fallback rubric used"));
        if (expectedTotal != null && Math.abs(expectedTotal - rubric.totalScore()) > scoreTolerance) {
            checks.add(
                    QualityCheck.fail(
                            "expected_total",
                            Severity.ERROR,
                            "Fallback total " + rubric.totalScore() + " differs from declared "
                                    + expectedTotal));
        }
        List<String> notes = new ArrayList<>(rubric.report().notes());
        notes.add("Fallback rubric used after extraction failure");
        return new RubricTree(
                rubric.questions(),
                rubric.totalScore(),
                new ParseReport(0.0, ParseReport.Status.ERROR, checks, notes, true));
    }

    private static ParseReport.Status statusOf(List<QualityCheck> checks) {
        ParseReport.Status status = ParseReport.Status.OK;
        for (QualityCheck check : checks) {
            if (check.passed()) {
                continue;
            }
            if (check.severity() == Severity.ERROR) {
                return ParseReport.Status.ERROR;
            }
            if (check.severity() == Severity.CAUTION) {
                status = ParseReport.Status.CAUTION;
            }
        }
        return status;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static int sortKey(String questionId) {
        int number = QuestionIds.number(questionId);
        return number > 0 ? number : Integer.MAX_VALUE;
    }

    /// Accumulates every extracted item that shares one canonical id.
    private static final class QuestionBuilder {

        private final String questionId;
        private final List<ScoringPoint> points = new ArrayList<>();
        private final List<String> answers = new ArrayList<>();
        private String description;
        private double maxScore;
        private double confidence = 1.0;

        QuestionBuilder(String questionId) {
            this.questionId = questionId;
        }

        void add(ExtractedQuestion item) {
            maxScore += item.maxScore();
            confidence = Math.min(confidence, item.confidence());
            if ((description == null || description.isBlank()) && item.description() != null) {
                description = item.description();
            }
            if (item.standardAnswer() != null && !item.standardAnswer().isBlank()) {
                answers.add(item.standardAnswer());
            }
            if (item.points().isEmpty()) {
                // a labelled sub-item without its own points counts as one point
                if (QuestionIds.isSubLabel(item.label())) {
                    addPoint(labelled(item), item.maxScore(), List.of());
                }
                return;
            }
            for (ExtractedQuestion.Point point : item.points()) {
                addPoint(point.description(), point.score(), point.keywords());
            }
        }

        private void addPoint(String text, double score, List<String> keywords) {
            points.add(
                    new ScoringPoint(questionId + "." + (points.size() + 1), text, score, keywords));
        }

        private static String labelled(ExtractedQuestion item) {
            String text = item.description() != null ? item.description() : "";
            return (item.label().trim() + " " + text).trim();
        }

        RubricQuestion build() {
            return new RubricQuestion(
                    questionId,
                    description,
                    maxScore,
                    points,
                    answers.isEmpty() ? null : String.join("\n", answers),
                    confidence);
        }
    }
}
