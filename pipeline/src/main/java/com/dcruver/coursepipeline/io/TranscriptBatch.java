package com.dcruver.coursepipeline.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of one transcript fetch run.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscriptBatch {
    private final String transcriptionDate;

    @Singular
    private final List<TranscriptRecord> transcriptions;

    @JsonCreator
    public TranscriptBatch(
            @JsonProperty("transcription_date") String transcriptionDate,
            @JsonProperty("transcriptions") List<TranscriptRecord> transcriptions) {
        this.transcriptionDate = transcriptionDate;
        this.transcriptions = transcriptions == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(transcriptions));
    }
}
