package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trust level of a source, derived from the host of its URL.
 */
public enum CredibilityLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    UNKNOWN("unknown");

    private final String key;

    CredibilityLevel(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * High-trust and whitelisted reference sources both count as credible.
     */
    public boolean isCredible() {
        return this == HIGH || this == MEDIUM;
    }
}
