package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pedagogical bucket a term belongs to.
 */
public enum LearningPhase {
    /**
     * Basic concepts, definitions, background
     */
    INTRODUCTION("introduction", "Introduction"),

    /**
     * Mechanisms, principles, details
     */
    UNDERSTANDING("understanding", "Understanding"),

    /**
     * Usage, procedures, case studies
     */
    APPLICATION("application", "Application"),

    /**
     * No phase cue matched; kept in term lists but not counted
     */
    NONE("none", "None");

    private final String key;
    private final String label;

    LearningPhase(String key, String label) {
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

    public boolean isAssigned() {
        return this != NONE;
    }
}
