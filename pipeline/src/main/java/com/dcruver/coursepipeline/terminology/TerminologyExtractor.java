package com.dcruver.coursepipeline.terminology;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.LearningPhase;
import com.dcruver.coursepipeline.domain.Origin;
import com.dcruver.coursepipeline.domain.Term;
import com.dcruver.coursepipeline.domain.TermCategory;
import com.dcruver.coursepipeline.domain.TerminologyReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frequency-based terminology extraction.
 *
 * Tokens are runs of letters, digits and underscores in any script. Hiragana break runs,
 * so Japanese particles separate the kanji and katakana compounds around them.
 * Published web titles are counted with the text; transcripts contribute their text only.
 * Counting keeps first-occurrence order (document, then position) so that the stable
 * frequency sort breaks ties deterministically.
 */
@Component
@Slf4j
public class TerminologyExtractor {

    static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}_&&[^\\p{IsHiragana}]]+");

    private final PipelineProperties.Terminology settings;
    private final TerminologyTaxonomy taxonomy;
    private final TerminologyRecommender recommender;

    public TerminologyExtractor(PipelineProperties properties, TerminologyTaxonomy taxonomy) {
        this.settings = properties.getTerminology();
        this.taxonomy = taxonomy;
        this.recommender = new TerminologyRecommender(settings);
    }

    public TerminologyReport analyze(Corpus corpus, Optional<String> courseTheme) {
        Optional<String> theme = courseTheme.map(String::trim).filter(value -> !value.isEmpty());

        List<TermTally> candidates = rankCandidates(corpus);

        List<Term> topTerms = candidates.stream()
            .limit(settings.getTopTermsCap())
            .map(this::classify)
            .toList();

        Map<TermCategory, Integer> categoryCounts = new EnumMap<>(TermCategory.class);
        for (TermCategory category : TermCategory.values()) {
            categoryCounts.put(category, 0);
        }
        Map<LearningPhase, Integer> phaseCounts = new EnumMap<>(LearningPhase.class);
        for (LearningPhase phase : LearningPhase.values()) {
            if (phase.isAssigned()) {
                phaseCounts.put(phase, 0);
            }
        }
        for (Term term : topTerms) {
            categoryCounts.merge(term.getCategory(), 1, Integer::sum);
            if (term.getLearningPhase().isAssigned()) {
                phaseCounts.merge(term.getLearningPhase(), 1, Integer::sum);
            }
        }

        log.info("Extracted {} candidate terms from {} documents, surfacing {}",
            candidates.size(), corpus.size(), topTerms.size());

        return TerminologyReport.builder()
            .courseTheme(theme.orElse(null))
            .totalUniqueTerms(candidates.size())
            .topTerms(topTerms)
            .categoryCounts(categoryCounts)
            .phaseCounts(phaseCounts)
            .recommendations(recommender.recommend(topTerms, categoryCounts, phaseCounts, theme, corpus.isEmpty()))
            .build();
    }

    /**
     * Ranked candidate set: frequent enough, sorted by frequency, capped
     */
    List<TermTally> rankCandidates(Corpus corpus) {
        Map<String, TermTally> tallies = new LinkedHashMap<>();

        for (Document document : corpus.getDocuments()) {
            if (document.getOrigin() == Origin.WEB) {
                count(document.getTitle(), document.getOrigin(), tallies);
            }
            count(document.getText(), document.getOrigin(), tallies);
        }

        return tallies.values().stream()
            .filter(tally -> tally.frequency >= settings.getMinFrequency())
            .sorted(Comparator.comparingInt((TermTally tally) -> tally.frequency).reversed())
            .limit(settings.getCandidateCap())
            .toList();
    }

    private void count(String text, Origin origin, Map<String, TermTally> tallies) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            if (token.codePointCount(0, token.length()) < settings.getMinTermLength()) {
                continue;
            }
            if (taxonomy.isStopTerm(token)) {
                continue;
            }
            tallies.computeIfAbsent(token, TermTally::new).record(origin);
        }
    }

    private Term classify(TermTally tally) {
        return Term.builder()
            .surfaceForm(tally.surfaceForm)
            .frequency(tally.frequency)
            .category(taxonomy.categorize(tally.surfaceForm))
            .learningPhase(taxonomy.phaseOf(tally.surfaceForm))
            .origins(Collections.unmodifiableSet(EnumSet.copyOf(tally.origins)))
            .build();
    }

    static final class TermTally {
        final String surfaceForm;
        final Set<Origin> origins = EnumSet.noneOf(Origin.class);
        int frequency;

        TermTally(String surfaceForm) {
            this.surfaceForm = surfaceForm;
        }

        void record(Origin origin) {
            frequency++;
            if (origin != null) {
                origins.add(origin);
            }
        }
    }
}
