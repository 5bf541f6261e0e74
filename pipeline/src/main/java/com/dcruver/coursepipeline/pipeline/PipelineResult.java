package com.dcruver.coursepipeline.pipeline;

import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.PromptDocument;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.TerminologyReport;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything one pipeline run produced. Reports that were not requested are absent.
 * Diagnostics collect the skipped-record and token-usage warnings in the order they arose.
 */
@Value
@Builder
public class PipelineResult {
    @JsonIgnore
    Corpus corpus;

    QualityReport quality;
    TerminologyReport terminology;
    PromptDocument prompt;

    @Singular
    List<String> diagnostics;

    Instant generatedAt;

    public Optional<QualityReport> getQuality() {
        return Optional.ofNullable(quality);
    }

    public Optional<TerminologyReport> getTerminology() {
        return Optional.ofNullable(terminology);
    }

    public Optional<PromptDocument> getPrompt() {
        return Optional.ofNullable(prompt);
    }
}
