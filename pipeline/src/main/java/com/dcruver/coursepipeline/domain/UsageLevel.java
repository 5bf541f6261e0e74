package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How close an assembled prompt's estimated token cost is to the model ceiling.
 * Declared from least to most severe.
 */
public enum UsageLevel {
    COMFORTABLE("comfortable"),
    FINE("fine"),
    CAUTION("caution"),
    HIGH("high"),
    OVER_LIMIT("over_limit");

    private final String key;

    UsageLevel(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public boolean isWarning() {
        return compareTo(HIGH) >= 0;
    }
}
