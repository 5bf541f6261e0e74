package com.dcruver.coursepipeline.pipeline;

import com.dcruver.coursepipeline.domain.CourseOutline;
import com.dcruver.coursepipeline.io.TranscriptBatch;
import com.dcruver.coursepipeline.io.WebResearchBatch;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Inputs for one generation request. Every input may be absent; the pipeline
 * degrades to empty reports and omitted prompt sections instead of failing.
 */
@Value
@Builder
public class PipelineRequest {
    WebResearchBatch webResearch;
    TranscriptBatch transcripts;
    CourseOutline outline;
    String courseTheme;

    @Builder.Default
    boolean scoreQuality = true;

    @Builder.Default
    boolean analyzeTerminology = true;

    // Attach raw document excerpts to the prompt
    @Builder.Default
    boolean includeExcerpts = true;

    public Optional<WebResearchBatch> getWebResearch() {
        return Optional.ofNullable(webResearch);
    }

    public Optional<TranscriptBatch> getTranscripts() {
        return Optional.ofNullable(transcripts);
    }

    public Optional<CourseOutline> getOutline() {
        return Optional.ofNullable(outline);
    }

    /**
     * Falls back to the outline's course name when no explicit theme was given
     */
    public Optional<String> getCourseTheme() {
        if (courseTheme != null && !courseTheme.isBlank()) {
            return Optional.of(courseTheme);
        }
        return getOutline().map(CourseOutline::getCourseName).filter(name -> !name.isBlank());
    }
}
