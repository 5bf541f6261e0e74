package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vocabulary category of an extracted term. Declared in classification priority order.
 */
public enum TermCategory {
    TECHNICAL("technical"),
    BUSINESS("business"),
    LEARNING("learning"),

    /**
     * Default when no keyword table matches
     */
    GENERAL("general");

    private final String key;

    TermCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
