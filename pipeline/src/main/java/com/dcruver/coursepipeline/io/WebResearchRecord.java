package com.dcruver.coursepipeline.io;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * One scraped page as produced by the web research fetcher.
 * The fetcher has written both {@code content}/{@code character_count} and
 * {@code text}/{@code word_count}; either spelling is accepted.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebResearchRecord {
    private final String url;
    private final String title;
    private final String content;
    private final Integer characterCount;
    private final String extractionDate;

    @JsonCreator
    public WebResearchRecord(
            @JsonProperty("url") String url,
            @JsonProperty("title") String title,
            @JsonProperty("content") @JsonAlias("text") String content,
            @JsonProperty("character_count") @JsonAlias("word_count") Integer characterCount,
            @JsonProperty("extraction_date") String extractionDate) {
        this.url = url;
        this.title = title;
        this.content = content;
        this.characterCount = characterCount;
        this.extractionDate = extractionDate;
    }
}
