package com.dcruver.coursepipeline.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * A frequent surface form found in the corpus, with its category and learning phase.
 */
@Value
@Builder
public class Term {
    String surfaceForm;
    int frequency;
    TermCategory category;
    LearningPhase learningPhase;
    Set<Origin> origins;
}
