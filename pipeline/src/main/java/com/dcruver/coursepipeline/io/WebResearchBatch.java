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
 * Output of one web research run.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebResearchBatch {
    private final String researchDate;

    @Singular
    private final List<WebResearchRecord> sources;

    @JsonCreator
    public WebResearchBatch(
            @JsonProperty("research_date") String researchDate,
            @JsonProperty("sources") List<WebResearchRecord> sources) {
        this.researchDate = researchDate;
        // Null entries are kept so the normalizer can report them as malformed
        this.sources = sources == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sources));
    }
}
