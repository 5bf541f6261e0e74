package com.dcruver.coursepipeline.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One unit of normalized research material with its provenance.
 * Immutable once built by the corpus normalizer.
 */
@Value
@Builder
public class Document {
    String sourceId;
    Origin origin;
    String url;

    // As published; null when the source had none
    String title;
    String text;

    // Characters for web pages, words for transcripts
    int count;

    CredibilityLevel credibility;
    int numericMentions;

    // Transcript-only details
    String language;
    double durationSeconds;
    int segmentCount;

    // Web-only detail
    String extractionDate;

    public boolean isNumericDataPresent() {
        return numericMentions > 0;
    }

    /**
     * Title for display: the published title, else the URL for web pages and the source id for transcripts
     */
    public String getDisplayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return origin == Origin.VIDEO ? sourceId : url;
    }

    public int getTextLength() {
        return text != null ? text.length() : 0;
    }

    public double getDurationMinutes() {
        return durationSeconds / 60.0;
    }
}
