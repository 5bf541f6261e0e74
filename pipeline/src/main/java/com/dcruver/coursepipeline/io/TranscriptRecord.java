package com.dcruver.coursepipeline.io;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Objects;

/**
 * One video transcript as produced by the transcript fetcher.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscriptRecord {
    private final String videoId;
    private final String sourceUrl;
    private final String language;
    private final String text;
    private final Integer wordCount;
    private final Double totalDuration;

    @Singular
    private final List<TranscriptSegment> segments;

    @JsonCreator
    public TranscriptRecord(
            @JsonProperty("video_id") String videoId,
            @JsonProperty("source_url") String sourceUrl,
            @JsonProperty("language") String language,
            @JsonProperty("text") String text,
            @JsonProperty("word_count") Integer wordCount,
            @JsonProperty("total_duration") @JsonAlias("duration") Double totalDuration,
            @JsonProperty("segments") List<TranscriptSegment> segments) {
        this.videoId = videoId;
        this.sourceUrl = sourceUrl;
        this.language = language;
        this.text = text;
        this.wordCount = wordCount;
        this.totalDuration = totalDuration;
        this.segments = segments == null ? List.of() : segments.stream()
            .filter(Objects::nonNull)
            .toList();
    }

    /**
     * Total duration in seconds, derived from the last segment when not reported
     */
    public double resolveDurationSeconds() {
        if (totalDuration != null) {
            return totalDuration;
        }
        return segments.isEmpty() ? 0.0 : segments.get(segments.size() - 1).getEnd();
    }
}
