package com.dcruver.coursepipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds, caps and toggles for the research pipeline.
 * Invalid values fail application startup.
 */
@ConfigurationProperties(prefix = "course-pipeline")
@Validated
@Data
public class PipelineProperties {

    @Valid
    private Quality quality = new Quality();

    @Valid
    private Terminology terminology = new Terminology();

    @Valid
    private Prompt prompt = new Prompt();

    @Valid
    private Credibility credibility = new Credibility();

    @Valid
    private Executor executor = new Executor();

    /**
     * Quality scoring breakpoints. Each dimension list holds the lower bounds for scores 1 and 2.
     */
    @Data
    public static class Quality {
        @NotNull
        private List<Integer> sourceCountThresholds = new ArrayList<>(List.of(3, 5));
        @NotNull
        private List<Integer> dataPointThresholds = new ArrayList<>(List.of(10, 20));
        @NotNull
        private List<Integer> credibleSourceThresholds = new ArrayList<>(List.of(1, 3));
        @NotNull
        private List<Integer> contentVolumeThresholds = new ArrayList<>(List.of(5000, 10000));

        // Lower bounds for acceptable, good and excellent
        @NotNull
        private List<Integer> tierThresholds = new ArrayList<>(List.of(3, 5, 7));

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minCredibleRatio = 0.5;

        @PositiveOrZero
        private int minTranscriptWords = 5000;

        @PositiveOrZero
        private double minVideoMinutes = 10.0;

        // Documents at or below this many characters count as having no content
        @PositiveOrZero
        private int minContentLength = 100;

        @PositiveOrZero
        private int sampleDataPoints = 5;

        @AssertTrue(message = "each dimension needs two ascending non-negative thresholds")
        public boolean isDimensionThresholdsValid() {
            return ascending(sourceCountThresholds, 2)
                && ascending(dataPointThresholds, 2)
                && ascending(credibleSourceThresholds, 2)
                && ascending(contentVolumeThresholds, 2);
        }

        @AssertTrue(message = "tier thresholds need three ascending values within 0-8")
        public boolean isTierThresholdsValid() {
            return ascending(tierThresholds, 3) && tierThresholds.get(2) <= 8;
        }
    }

    @Data
    public static class Terminology {
        @Min(1)
        private int minTermLength = 2;

        @Min(2)
        private int minFrequency = 2;

        // Size of the full ranked candidate set
        @Positive
        private int candidateCap = 50;

        // Number of candidates surfaced as top terms in reports
        @Positive
        private int topTermsCap = 30;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double dominantCategoryShare = 0.5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minPhaseShare = 0.2;

        @PositiveOrZero
        private int highlightedTerms = 5;

        @NotNull
        private List<String> additionalStopTerms = new ArrayList<>();

        @AssertTrue(message = "top-terms-cap must not exceed candidate-cap")
        public boolean isTopTermsWithinCandidates() {
            return topTermsCap <= candidateCap;
        }
    }

    @Data
    public static class Prompt {
        // Unabridged mode: every document is included with its full text
        private boolean fullText = false;

        @PositiveOrZero
        private int maxWebExcerpts = 5;

        @PositiveOrZero
        private int maxVideoExcerpts = 3;

        @Positive
        private int webPreviewLength = 500;

        @Positive
        private int videoPreviewLength = 800;

        @Positive
        private double charsPerToken = 4.0;

        @Positive
        private long tokenCeiling = 1_000_000L;

        // Usage ratio lower bounds for fine, caution, high and over-limit
        @NotNull
        private List<Double> usageBreakpoints = new ArrayList<>(List.of(0.25, 0.5, 0.75, 1.0));

        @PositiveOrZero
        private int qualityRecommendations = 3;

        @PositiveOrZero
        private int terminologyRecommendations = 2;

        @PositiveOrZero
        private int highlightedTerms = 10;

        @Positive
        private int narrationWordsPerMinute = 150;

        @AssertTrue(message = "usage breakpoints need four ascending positive ratios")
        public boolean isUsageBreakpointsValid() {
            if (usageBreakpoints == null || usageBreakpoints.size() != 4) {
                return false;
            }
            double previous = 0.0;
            for (Double breakpoint : usageBreakpoints) {
                if (breakpoint == null || breakpoint <= previous) {
                    return false;
                }
                previous = breakpoint;
            }
            return true;
        }
    }

    /**
     * Extra domain patterns on top of the built-in lists.
     */
    @Data
    public static class Credibility {
        @NotNull
        private List<String> additionalHighTrust = new ArrayList<>();

        @NotNull
        private List<String> additionalReference = new ArrayList<>();
    }

    @Data
    public static class Executor {
        @Positive
        private int corePoolSize = 2;

        @Positive
        private int maxPoolSize = 2;

        @PositiveOrZero
        private int queueCapacity = 16;

        @AssertTrue(message = "max-pool-size must be at least core-pool-size")
        public boolean isPoolSizesValid() {
            return maxPoolSize >= corePoolSize;
        }
    }

    static boolean ascending(List<Integer> values, int expectedSize) {
        if (values == null || values.size() != expectedSize) {
            return false;
        }
        int previous = -1;
        for (Integer value : values) {
            if (value == null || value <= previous) {
                return false;
            }
            previous = value;
        }
        return true;
    }
}
