package com.dcruver.coursepipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * The assembled generation prompt with its advisory token estimate.
 * Built once per request and never mutated.
 */
@Value
@Builder
public class PromptDocument {
    String text;

    @Singular
    List<Section> sections;

    long estimatedTokens;
    long tokenCeiling;
    double usageRatio;
    UsageLevel usageLevel;

    @Singular
    List<String> warnings;

    public boolean hasSection(SectionKind kind) {
        return sections.stream().anyMatch(section -> section.getKind() == kind);
    }

    public Optional<Section> getSection(SectionKind kind) {
        return sections.stream().filter(section -> section.getKind() == kind).findFirst();
    }

    public enum SectionKind {
        OUTLINE,
        RESEARCH,
        QUALITY,
        TERMINOLOGY,
        TASK
    }

    @Value
    public static class Section {
        SectionKind kind;
        String text;
    }
}
