package io.gradeflow.core;

import io.gradeflow.core.aggregate.ResultAggregator;
import io.gradeflow.core.grading.GradingDispatcher;
import io.gradeflow.core.progress.ProgressBroadcaster;
import io.gradeflow.core.rubric.RubricParser;
import io.gradeflow.core.segment.BoundaryDetector;
import io.gradeflow.core.segment.BoundaryWeights;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/// Configuration of the grading workflow.
///
/// Use the {@link Builder} for programmatic configuration or {@link #fromProperties} to read
/// `gradeflow.*` keys. Unset values keep their defaults.
///
/// ### Default Values
/// | Property | Default |
/// |----------|---------|
/// | `gradeflow.rubric.pages-per-batch` | `14` |
/// | `gradeflow.rubric.review-threshold` | `0.7` |
/// | `gradeflow.rubric.review-required` | `false` |
/// | `gradeflow.rubric.score-tolerance` | `0.1` |
/// | `gradeflow.boundary.enabled` | `true` |
/// | `gradeflow.boundary.max-pages-per-segment` | `8` |
/// | `gradeflow.boundary.confirmation-threshold` | `0.8` |
/// | `gradeflow.boundary.weight.monotonicity` | `0.4` |
/// | `gradeflow.boundary.weight.question-count` | `0.3` |
/// | `gradeflow.boundary.weight.restart-clarity` | `0.3` |
/// | `gradeflow.boundary.unmarked-page-penalty` | `0.05` |
/// | `gradeflow.boundary.ambiguity-cap` | `0.5` |
/// | `gradeflow.dispatch.batch-size` | `10` |
/// | `gradeflow.dispatch.max-workers` | `5` |
/// | `gradeflow.dispatch.max-retries` | `2` |
/// | `gradeflow.dispatch.task-timeout` | `PT2M` |
/// | `gradeflow.result.review-threshold` | `0.7` |
/// | `gradeflow.result.review-required` | `false` |
/// | `gradeflow.result.pass-ratio` | `0.6` |
/// | `gradeflow.progress.subscriber-buffer` | `256` |
///
/// @implNote Immutable once built; safe to share.
/// @see GradeflowFactory
public final class GradeflowConfig {

    private int rubricPagesPerBatch = RubricParser.DEFAULT_PAGES_PER_BATCH;
    private double rubricReviewThreshold = 0.7;
    private boolean rubricReviewRequired;
    private double scoreTolerance = 0.1;
    private boolean boundaryDetectionEnabled = true;
    private int maxPagesPerSegment = BoundaryDetector.DEFAULT_MAX_PAGES_PER_SEGMENT;
    private double confirmationThreshold = BoundaryDetector.DEFAULT_CONFIRMATION_THRESHOLD;
    private BoundaryWeights boundaryWeights = BoundaryWeights.DEFAULT;
    private int batchSize = GradingDispatcher.DEFAULT_BATCH_SIZE;
    private int maxWorkers = GradingDispatcher.DEFAULT_MAX_WORKERS;
    private int maxRetries = GradingDispatcher.DEFAULT_MAX_RETRIES;
    private Duration taskTimeout = GradingDispatcher.DEFAULT_TASK_TIMEOUT;
    private double resultReviewThreshold = ResultAggregator.DEFAULT_LOW_CONFIDENCE_THRESHOLD;
    private boolean resultReviewRequired;
    private double passRatio = ResultAggregator.DEFAULT_PASS_RATIO;
    private int subscriberBufferSize = ProgressBroadcaster.DEFAULT_BUFFER_SIZE;

    private GradeflowConfig() {}

    /// Returns a configuration with every default.
    public static GradeflowConfig defaults() {
        return new GradeflowConfig();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Reads `gradeflow.*` properties over the defaults.
    ///
    /// @param properties source properties, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static GradeflowConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        GradeflowConfig defaults = defaults();
        BoundaryWeights w = defaults.boundaryWeights;
        return builder()
                .rubricPagesPerBatch(intValue(properties, "gradeflow.rubric.pages-per-batch", defaults.rubricPagesPerBatch))
                .rubricReviewThreshold(doubleValue(properties, "gradeflow.rubric.review-threshold", defaults.rubricReviewThreshold))
                .rubricReviewRequired(booleanValue(properties, "gradeflow.rubric.review-required", false))
                .scoreTolerance(doubleValue(properties, "gradeflow.rubric.score-tolerance", defaults.scoreTolerance))
                .boundaryDetectionEnabled(booleanValue(properties, "gradeflow.boundary.enabled", true))
                .maxPagesPerSegment(intValue(properties, "gradeflow.boundary.max-pages-per-segment", defaults.maxPagesPerSegment))
                .confirmationThreshold(doubleValue(properties, "gradeflow.boundary.confirmation-threshold", defaults.confirmationThreshold))
                .boundaryWeights(
                        new BoundaryWeights(
                                doubleValue(properties, "gradeflow.boundary.weight.monotonicity", w.monotonicity()),
                                doubleValue(properties, "gradeflow.boundary.weight.question-count", w.questionCount()),
                                doubleValue(properties, "gradeflow.boundary.weight.restart-clarity", w.restartClarity()),
                                doubleValue(properties, "gradeflow.boundary.unmarked-page-penalty", w.unmarkedPagePenalty()),
                                doubleValue(properties, "gradeflow.boundary.ambiguity-cap", w.ambiguityCap())))
                .batchSize(intValue(properties, "gradeflow.dispatch.batch-size", defaults.batchSize))
                .maxWorkers(intValue(properties, "gradeflow.dispatch.max-workers", defaults.maxWorkers))
                .maxRetries(intValue(properties, "gradeflow.dispatch.max-retries", defaults.maxRetries))
                .taskTimeout(durationValue(properties, "gradeflow.dispatch.task-timeout", defaults.taskTimeout))
                .resultReviewThreshold(doubleValue(properties, "gradeflow.result.review-threshold", defaults.resultReviewThreshold))
                .resultReviewRequired(booleanValue(properties, "gradeflow.result.review-required", false))
                .passRatio(doubleValue(properties, "gradeflow.result.pass-ratio", defaults.passRatio))
                .subscriberBufferSize(intValue(properties, "gradeflow.progress.subscriber-buffer", defaults.subscriberBufferSize))
                .build();
    }

    public int getRubricPagesPerBatch() {
        return rubricPagesPerBatch;
    }

    /// Rubric confidence below which `rubric_review` suspends the run.
    public double getRubricReviewThreshold() {
        return rubricReviewThreshold;
    }

    public boolean isRubricReviewRequired() {
        return rubricReviewRequired;
    }

    /// Allowed difference between parsed and declared rubric totals.
    public double getScoreTolerance() {
        return scoreTolerance;
    }

    /// Whether answer pages are split per student. When disabled, raw page batches are graded.
    public boolean isBoundaryDetectionEnabled() {
        return boundaryDetectionEnabled;
    }

    public int getMaxPagesPerSegment() {
        return maxPagesPerSegment;
    }

    public double getConfirmationThreshold() {
        return confirmationThreshold;
    }

    public BoundaryWeights getBoundaryWeights() {
        return boundaryWeights;
    }

    /// Pages per raw batch and maximum pages per grading task.
    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    /// Question confidence below which a student result is flagged.
    public double getResultReviewThreshold() {
        return resultReviewThreshold;
    }

    public boolean isResultReviewRequired() {
        return resultReviewRequired;
    }

    public double getPassRatio() {
        return passRatio;
    }

    public int getSubscriberBufferSize() {
        return subscriberBufferSize;
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static Duration durationValue(Properties properties, String key, Duration fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 duration for " + key + ": " + value, e);
        }
    }

    /// Fluent builder for {@link GradeflowConfig}.
    public static final class Builder {

        private final GradeflowConfig config = new GradeflowConfig();

        private Builder() {}

        public Builder rubricPagesPerBatch(int pages) {
            config.rubricPagesPerBatch = positive(pages, "rubricPagesPerBatch");
            return this;
        }

        public Builder rubricReviewThreshold(double threshold) {
            config.rubricReviewThreshold = threshold;
            return this;
        }

        public Builder rubricReviewRequired(boolean required) {
            config.rubricReviewRequired = required;
            return this;
        }

        public Builder scoreTolerance(double tolerance) {
            config.scoreTolerance = tolerance;
            return this;
        }

        public Builder boundaryDetectionEnabled(boolean enabled) {
            config.boundaryDetectionEnabled = enabled;
            return this;
        }

        public Builder maxPagesPerSegment(int pages) {
            config.maxPagesPerSegment = positive(pages, "maxPagesPerSegment");
            return this;
        }

        public Builder confirmationThreshold(double threshold) {
            config.confirmationThreshold = threshold;
            return this;
        }

        public Builder boundaryWeights(BoundaryWeights weights) {
            config.boundaryWeights = Objects.requireNonNull(weights, "weights must not be null");
            return this;
        }

        public Builder batchSize(int pages) {
            config.batchSize = positive(pages, "batchSize");
            return this;
        }

        public Builder maxWorkers(int workers) {
            config.maxWorkers = positive(workers, "maxWorkers");
            return this;
        }

        public Builder maxRetries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, was " + retries);
            }
            config.maxRetries = retries;
            return this;
        }

        public Builder taskTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout must not be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("taskTimeout must be positive, was " + timeout);
            }
            config.taskTimeout = timeout;
            return this;
        }

        public Builder resultReviewThreshold(double threshold) {
            config.resultReviewThreshold = threshold;
            return this;
        }

        public Builder resultReviewRequired(boolean required) {
            config.resultReviewRequired = required;
            return this;
        }

        public Builder passRatio(double ratio) {
            config.passRatio = ratio;
            return this;
        }

        public Builder subscriberBufferSize(int size) {
            config.subscriberBufferSize = positive(size, "subscriberBufferSize");
            return this;
        }

        public GradeflowConfig build() {
            return config;
        }

        private static int positive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, was " + value);
            }
            return value;
        }
    }
}
