package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidentiary quality of a research corpus.
 * The total score is always the sum of the dimension scores.
 */
@Value
@Builder
public class QualityReport {
    @JsonIgnore
    @Singular
    Map<QualityDimension, Integer> dimensionScores;

    QualityTier tier;

    @Singular
    List<String> recommendations;

    Summary summary;

    @Singular
    List<SourceCheck> sourceChecks;

    public int getTotalScore() {
        return dimensionScores.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getScore(QualityDimension dimension) {
        return dimensionScores.getOrDefault(dimension, 0);
    }

    /**
     * Dimension scores in declaration order, keyed by their serialized names
     */
    @JsonProperty("dimension_scores")
    public Map<String, Integer> getDimensionScoresByKey() {
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (QualityDimension dimension : QualityDimension.values()) {
            if (dimensionScores.containsKey(dimension)) {
                ordered.put(dimension.getKey(), dimensionScores.get(dimension));
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    /**
     * Aggregate figures the dimension scores were computed from
     */
    @Value
    @Builder
    public static class Summary {
        int totalSources;
        int webSources;
        int videoSources;
        int numericMentions;
        int credibleSources;
        long webCharacters;
        long videoWords;
        double videoMinutes;
        long contentVolume;
    }

    /**
     * Per-document checks
     */
    @Value
    @Builder
    public static class SourceCheck {
        String sourceId;
        Origin origin;
        String url;
        boolean urlValid;
        boolean hasContent;
        int numericMentions;
        List<String> sampleDataPoints;
        CredibilityLevel credibility;
    }
}
