package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a research document came from.
 */
public enum Origin {
    /**
     * Scraped web page
     */
    WEB("web"),

    /**
     * Video transcript
     */
    VIDEO("video");

    private final String key;

    Origin(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
