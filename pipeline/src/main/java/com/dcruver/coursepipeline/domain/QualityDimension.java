package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four independently scored dimensions of research quality. Each scores 0, 1 or 2.
 */
public enum QualityDimension {
    SOURCE_COUNT("source_count", "Source count"),
    DATA_POINTS("data_points", "Numeric data points"),
    CREDIBLE_SOURCES("credible_sources", "Credible sources"),
    CONTENT_VOLUME("content_volume", "Content volume");

    public static final int MAX_SCORE = 2;

    private final String key;
    private final String label;

    QualityDimension(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }
}
