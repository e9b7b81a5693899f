package io.gradeflow.core.segment;

import io.gradeflow.core.rubric.QuestionIds;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Splits a multi-student answer document into per-student page ranges.
///
/// Pages are scanned in order while tracking the question numbers seen in the open segment.
/// A new segment starts when:
/// - a page names a different student than the open segment,
/// - a page's lowest question number was already reached in the open segment (a restart,
///   e.g. question 1 after question 8), or
/// - the open segment reaches `maxPagesPerSegment` pages without a restart (a forced split,
///   which always needs confirmation).
///
/// A page whose lowest number equals the highest number of the previous marked page
/// continues that answer rather than restarting, unless the open segment already covers
/// every rubric question.
///
/// ### Ambiguous splits
/// When pages without question numbers sit right before a restart, each of them is an
/// equally plausible first page of the next student. The detector picks the candidate that
/// makes segment lengths most even (lowest variance), preferring the restart page itself on
/// a tie, then caps the affected segments' confidence and marks them for confirmation.
///
/// ### Confidence
/// Each segment scores a weighted mix of question-number monotonicity, question-count match
/// against the rubric and boundary clarity (see {@link BoundaryWeights}), minus a penalty
/// per page without question numbers. Segments below `confirmationThreshold` need
/// confirmation.
///
/// ### Contracts
/// - **Postcondition**: segments are pairwise disjoint, ordered and together cover pages
///   `0..pageCount-1`
/// - **Postcondition**: a one-page document yields one segment with confidence 1.0
///
/// @implNote Stateless apart from configuration; safe to share across runs.
public class BoundaryDetector {

    private static final Logger logger = Logger.getLogger(BoundaryDetector.class.getName());

    public static final int DEFAULT_MAX_PAGES_PER_SEGMENT = 8;
    public static final double DEFAULT_CONFIRMATION_THRESHOLD = 0.8;

    private static final double AMBIGUOUS_CLARITY = 0.5;
    private static final double FORCED_CLARITY = 0.3;

    private final int maxPagesPerSegment;
    private final double confirmationThreshold;
    private final BoundaryWeights weights;

    public BoundaryDetector() {
        this(DEFAULT_MAX_PAGES_PER_SEGMENT, DEFAULT_CONFIRMATION_THRESHOLD, BoundaryWeights.DEFAULT);
    }

    public BoundaryDetector(
            int maxPagesPerSegment, double confirmationThreshold, BoundaryWeights weights) {
        if (maxPagesPerSegment < 1) {
            throw new IllegalArgumentException(
                    "maxPagesPerSegment must be >= 1, was " + maxPagesPerSegment);
        }
        this.maxPagesPerSegment = maxPagesPerSegment;
        this.confirmationThreshold = confirmationThreshold;
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    /// Detects student segments.
    ///
    /// @param pageCount number of answer pages, >= 0
    /// @param signals first-pass signals; pages without a signal count as unmarked, not null
    /// @param expectedQuestionCount top-level questions in the rubric, 0 if unknown
    /// @param roster student names in submission order, may be empty
    /// @return ordered segments covering every page, empty only when `pageCount` is 0
    public List<StudentSegment> detect(
            int pageCount, List<PageSignal> signals, int expectedQuestionCount, List<String> roster) {
        Objects.requireNonNull(signals, "signals must not be null");
        if (pageCount < 0) {
            throw new IllegalArgumentException("pageCount must be >= 0, was " + pageCount);
        }
        if (pageCount == 0) {
            return List.of();
        }

        PageView[] pages = pageViews(pageCount, signals);
        if (pageCount == 1) {
            String key = resolveKeys(List.of(pages[0].name), roster).get(0);
            return List.of(new StudentSegment(key, List.of(0), 1.0, false, List.of()));
        }

        List<Cut> cuts = scan(pages, expectedQuestionCount);
        resolveAmbiguity(cuts, pageCount);
        List<StudentSegment> segments = build(pages, cuts, expectedQuestionCount, roster);

        long flagged = segments.stream().filter(StudentSegment::needsConfirmation).count();
        logger.info(
                "Detected " + segments.size() + " student segments over " + pageCount
                        + " pages, " + flagged + " need confirmation");
        return segments;
    }

    private List<Cut> scan(PageView[] pages, int expectedQuestionCount) {
        List<Cut> cuts = new ArrayList<>();
        int segmentStart = 0;
        Set<Integer> seen = new HashSet<>();
        int maxSeen = 0;
        int lastMarkedMax = 0;
        String segmentName = null;
        int trailingUnmarked = 0;

        for (int p = 0; p < pages.length; p++) {
            PageView page = pages[p];
            if (p > segmentStart) {
                CutKind kind = null;
                if (page.name != null && segmentName != null && !sameName(page.name, segmentName)) {
                    kind = CutKind.NAME;
                } else if (isRestart(page, seen, maxSeen, lastMarkedMax, expectedQuestionCount)) {
                    kind = CutKind.RESTART;
                } else if (p - segmentStart >= maxPagesPerSegment) {
                    kind = CutKind.FORCED;
                }

                if (kind != null) {
                    int firstCandidate =
                            kind == CutKind.RESTART
                                    ? Math.max(segmentStart + 1, p - trailingUnmarked)
                                    : p;
                    cuts.add(new Cut(kind, firstCandidate, p));
                    segmentStart = p;
                    seen.clear();
                    maxSeen = 0;
                    lastMarkedMax = 0;
                    segmentName = null;
                    trailingUnmarked = 0;
                }
            }

            if (page.numbers.isEmpty()) {
                trailingUnmarked++;
            } else {
                seen.addAll(page.numbers);
                lastMarkedMax = page.max();
                maxSeen = Math.max(maxSeen, lastMarkedMax);
                trailingUnmarked = 0;
            }
            if (segmentName == null && page.name != null) {
                segmentName = page.name;
            }
        }
        return cuts;
    }

    private static boolean isRestart(
            PageView page, Set<Integer> seen, int maxSeen, int lastMarkedMax, int expected) {
        if (page.numbers.isEmpty() || seen.isEmpty()) {
            return false;
        }
        int min = page.min();
        if (min > maxSeen) {
            return false;
        }
        boolean allQuestionsSeen = expected > 0 && seen.size() >= expected;
        // the last question repeating on the next page is one answer spanning two pages
        boolean continuesPreviousAnswer = min == maxSeen && min == lastMarkedMax;
        return allQuestionsSeen || !continuesPreviousAnswer;
    }

    /// Chooses the start page of every ambiguous cut by minimizing length variance.
    private static void resolveAmbiguity(List<Cut> cuts, int pageCount) {
        for (Cut cut : cuts) {
            if (!cut.isAmbiguous()) {
                continue;
            }
            int best = cut.restartPage;
            double bestVariance = Double.MAX_VALUE;
            for (int candidate = cut.restartPage; candidate >= cut.firstCandidate; candidate--) {
                cut.chosen = candidate;
                double variance = lengthVariance(cuts, pageCount);
                if (variance < bestVariance - 1e-9) {
                    bestVariance = variance;
                    best = candidate;
                }
            }
            cut.chosen = best;
        }
    }

    private static double lengthVariance(List<Cut> cuts, int pageCount) {
        List<Integer> lengths = new ArrayList<>();
        int start = 0;
        for (Cut cut : cuts) {
            lengths.add(cut.chosen - start);
            start = cut.chosen;
        }
        lengths.add(pageCount - start);
        double mean = pageCount / (double) lengths.size();
        double sum = 0;
        for (int length : lengths) {
            sum += (length - mean) * (length - mean);
        }
        return sum / lengths.size();
    }

    private List<StudentSegment> build(
            PageView[] pages, List<Cut> cuts, int expectedQuestionCount, List<String> roster) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (Cut cut : cuts) {
            starts.add(cut.chosen);
        }

        List<String> names = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : pages.length;
            String name = null;
            for (int p = starts.get(i); p < end && name == null; p++) {
                name = pages[p].name;
            }
            names.add(name);
        }
        List<String> keys = resolveKeys(names, roster);

        List<StudentSegment> segments = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = i + 1 < starts.size() ? starts.get(i + 1) : pages.length;
            Cut opening = i == 0 ? null : cuts.get(i - 1);
            Cut closing = i < cuts.size() ? cuts.get(i) : null;
            segments.add(score(keys.get(i), pages, start, end, opening, closing, expectedQuestionCount));
        }
        return segments;
    }

    private StudentSegment score(
            String key,
            PageView[] pages,
            int start,
            int end,
            Cut opening,
            Cut closing,
            int expectedQuestionCount) {
        List<String> notes = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        Set<Integer> ordered = new LinkedHashSet<>();
        int unmarked = 0;
        for (int p = start; p < end; p++) {
            indices.add(p);
            if (pages[p].numbers.isEmpty()) {
                unmarked++;
            }
            ordered.addAll(pages[p].numbers);
        }

        double monotonicity = monotonicity(new ArrayList<>(ordered));
        double countMatch;
        if (expectedQuestionCount <= 0) {
            countMatch = 0.5;
        } else if (ordered.isEmpty()) {
            countMatch = 0.0;
        } else {
            int observed = ordered.size();
            countMatch =
                    Math.min(observed, expectedQuestionCount)
                            / (double) Math.max(observed, expectedQuestionCount);
            if (observed != expectedQuestionCount) {
                notes.add(observed + " of " + expectedQuestionCount + " questions observed");
            }
        }

        boolean forced = isKind(opening, CutKind.FORCED) || isKind(closing, CutKind.FORCED);
        boolean ambiguous =
                (opening != null && opening.isAmbiguous())
                        || (closing != null && closing.isAmbiguous());
        double clarity = 1.0;
        if (ambiguous) {
            clarity = AMBIGUOUS_CLARITY;
            notes.add("Boundary has several plausible split pages");
        }
        if (forced) {
            clarity = Math.min(clarity, FORCED_CLARITY);
            notes.add("Split forced after " + maxPagesPerSegment + " pages without a restart");
        }
        if (unmarked > 0) {
            notes.add(unmarked + " page(s) without question numbers");
        }

        double confidence =
                (weights.monotonicity() * monotonicity
                                + weights.questionCount() * countMatch
                                + weights.restartClarity() * clarity)
                        / weights.weightSum();
        confidence -= weights.unmarkedPagePenalty() * unmarked;
        if (ambiguous) {
            confidence = Math.min(confidence, weights.ambiguityCap());
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        boolean needsConfirmation = ambiguous || forced || confidence < confirmationThreshold;
        return new StudentSegment(key, indices, confidence, needsConfirmation, notes);
    }

    // Share of consecutive distinct question numbers that step by exactly one.
    private static double monotonicity(List<Integer> ordered) {
        if (ordered.size() < 2) {
            return 0.5;
        }
        int steps = 0;
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i) - ordered.get(i - 1) == 1) {
                steps++;
            }
        }
        return steps / (double) (ordered.size() - 1);
    }

    /// Picks a key per segment: the detected name, else the roster entry when the roster
    /// matches the segment count, else a numbered placeholder. Keys are unique.
    static List<String> resolveKeys(List<String> detectedNames, List<String> roster) {
        boolean useRoster = roster != null && roster.size() == detectedNames.size();
        List<String> keys = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < detectedNames.size(); i++) {
            String key = detectedNames.get(i);
            if (key == null || key.isBlank()) {
                key = useRoster ? roster.get(i) : String.format("Student %02d", i + 1);
            }
            key = key.trim();
            String unique = key;
            for (int n = 2; !used.add(unique.toLowerCase(Locale.ROOT)); n++) {
                unique = key + " #" + n;
            }
            keys.add(unique);
        }
        return keys;
    }

    private static PageView[] pageViews(int pageCount, List<PageSignal> signals) {
        PageView[] pages = new PageView[pageCount];
        for (int p = 0; p < pageCount; p++) {
            pages[p] = new PageView(List.of(), null);
        }
        for (PageSignal signal : signals) {
            if (signal.pageIndex() >= pageCount) {
                logger.warning(
                        "Ignoring signal for page " + signal.pageIndex() + " beyond " + pageCount);
                continue;
            }
            List<Integer> numbers = new ArrayList<>();
            for (String label : signal.questionLabels()) {
                int number = QuestionIds.number(label);
                if (number > 0) {
                    numbers.add(number);
                }
            }
            String name = signal.studentName();
            pages[signal.pageIndex()] =
                    new PageView(numbers, name == null || name.isBlank() ? null : name.trim());
        }
        return pages;
    }

    private static boolean sameName(String a, String b) {
        return a.equalsIgnoreCase(b);
    }

    private static boolean isKind(Cut cut, CutKind kind) {
        return cut != null && cut.kind == kind;
    }

    private enum CutKind {
        NAME,
        RESTART,
        FORCED
    }

    /// A detected boundary; `chosen` is the first page of the following segment.
    private static final class Cut {

        final CutKind kind;
        final int firstCandidate;
        final int restartPage;
        int chosen;

        Cut(CutKind kind, int firstCandidate, int restartPage) {
            this.kind = kind;
            this.firstCandidate = firstCandidate;
            this.restartPage = restartPage;
            this.chosen = restartPage;
        }

        boolean isAmbiguous() {
            return firstCandidate < restartPage;
        }
    }

    private static final class PageView {

        final List<Integer> numbers;
        final String name;

        PageView(List<Integer> numbers, String name) {
            this.numbers = numbers;
            this.name = name;
        }

        int min() {
            return numbers.stream().mapToInt(Integer::intValue).min().orElse(0);
        }

        int max() {
            return numbers.stream().mapToInt(Integer::intValue).max().orElse(0);
        }
    }
}
