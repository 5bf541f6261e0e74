package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categorical quality label derived from the total quality score.
 * Declared from worst to best.
 */
public enum QualityTier {
    NEEDS_IMPROVEMENT("needs_improvement", "Needs improvement"),
    ACCEPTABLE("acceptable", "Acceptable"),
    GOOD("good", "Good"),
    EXCELLENT("excellent", "Excellent");

    private final String key;
    private final String label;

    QualityTier(String key, String label) {
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
