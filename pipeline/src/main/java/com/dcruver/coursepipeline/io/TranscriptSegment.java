package com.dcruver.coursepipeline.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * A timed piece of a transcript.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscriptSegment {
    private final double start;
    private final double duration;
    private final String text;

    @JsonCreator
    public TranscriptSegment(
            @JsonProperty("start") double start,
            @JsonProperty("duration") double duration,
            @JsonProperty("text") String text) {
        this.start = start;
        this.duration = duration;
        this.text = text;
    }

    public double getEnd() {
        return start + duration;
    }
}
