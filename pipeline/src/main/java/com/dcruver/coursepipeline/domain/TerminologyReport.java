package com.dcruver.coursepipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frequency-ranked terminology of a corpus with category and learning phase distributions.
 * Phase counts never include {@link LearningPhase#NONE}.
 */
@Value
@Builder
public class TerminologyReport {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String courseTheme;

    int totalUniqueTerms;

    @Singular
    List<Term> topTerms;

    @JsonIgnore
    @Singular
    Map<TermCategory, Integer> categoryCounts;

    @JsonIgnore
    @Singular
    Map<LearningPhase, Integer> phaseCounts;

    @Singular
    List<String> recommendations;

    @JsonIgnore
    public Optional<String> getTheme() {
        return Optional.ofNullable(courseTheme);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return topTerms.isEmpty();
    }

    /**
     * Number of surfaced terms that were mapped to a learning phase
     */
    @JsonIgnore
    public int getPhasedTermCount() {
        return phaseCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @JsonProperty("category_counts")
    public Map<String, Integer> getCategoryCountsByKey() {
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (TermCategory category : TermCategory.values()) {
            if (categoryCounts.containsKey(category)) {
                ordered.put(category.getKey(), categoryCounts.get(category));
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    @JsonProperty("phase_counts")
    public Map<String, Integer> getPhaseCountsByKey() {
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (LearningPhase phase : LearningPhase.values()) {
            if (phaseCounts.containsKey(phase)) {
                ordered.put(phase.getKey(), phaseCounts.get(phase));
            }
        }
        return Collections.unmodifiableMap(ordered);
    }
}
