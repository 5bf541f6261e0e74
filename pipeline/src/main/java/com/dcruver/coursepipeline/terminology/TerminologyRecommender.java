package com.dcruver.coursepipeline.terminology;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.LearningPhase;
import com.dcruver.coursepipeline.domain.Term;
import com.dcruver.coursepipeline.domain.TermCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Distribution rules over the surfaced terms. Category shares use all surfaced terms;
 * phase shares only count terms that were mapped to a phase.
 */
class TerminologyRecommender {

    private final PipelineProperties.Terminology settings;

    TerminologyRecommender(PipelineProperties.Terminology settings) {
        this.settings = settings;
    }

    List<String> recommend(List<Term> terms,
                           Map<TermCategory, Integer> categoryCounts,
                           Map<LearningPhase, Integer> phaseCounts,
                           Optional<String> theme,
                           boolean emptyCorpus) {
        List<String> recommendations = new ArrayList<>();

        if (terms.isEmpty()) {
            recommendations.add(emptyCorpus
                ? "✗ Insufficient data: no research documents were supplied, so no terminology could be extracted."
                : "⚠ No term occurs often enough to be significant. Add more research material.");
            return recommendations;
        }

        int total = terms.size();
        double dominant = settings.getDominantCategoryShare();

        if (categoryCounts.getOrDefault(TermCategory.TECHNICAL, 0) > total * dominant) {
            recommendations.add("💡 Many technical terms were detected. "
                + "Expand the glossary explanations for beginners.");
        }
        if (categoryCounts.getOrDefault(TermCategory.BUSINESS, 0) > total * dominant) {
            recommendations.add("💡 Many business terms were detected. "
                + "Include examples of applying them in everyday work.");
        }

        int phased = phaseCounts.values().stream().mapToInt(Integer::intValue).sum();
        double minShare = settings.getMinPhaseShare();
        if (phased == 0) {
            recommendations.add("⚠ No term could be mapped to a learning phase. "
                + "Check that the material covers basics, mechanisms and practical use.");
        } else {
            if (phaseCounts.getOrDefault(LearningPhase.INTRODUCTION, 0) < phased * minShare) {
                recommendations.add("⚠ Few introduction-phase terms. "
                    + "Strengthen the explanation of basic concepts.");
            }
            if (phaseCounts.getOrDefault(LearningPhase.APPLICATION, 0) < phased * minShare) {
                recommendations.add("⚠ Few application-phase terms. "
                    + "Add practical examples and concrete use cases.");
            }
        }

        if (recommendations.isEmpty()) {
            recommendations.add("✓ The terminology is well balanced.");
        }

        theme.flatMap(value -> missingThemeRecommendation(value, terms)).ifPresent(recommendations::add);

        if (settings.getHighlightedTerms() > 0) {
            List<String> highlighted = terms.stream()
                .limit(settings.getHighlightedTerms())
                .map(Term::getSurfaceForm)
                .toList();
            recommendations.add(String.format(Locale.ROOT,
                "💡 Top %d terms: %s. Explain each of them in the appropriate section of the course.",
                highlighted.size(), String.join(", ", highlighted)));
        }

        return recommendations;
    }

    private Optional<String> missingThemeRecommendation(String theme, List<Term> terms) {
        List<String> themeTokens = new ArrayList<>();
        Matcher matcher = TerminologyExtractor.TOKEN.matcher(theme);
        while (matcher.find()) {
            String token = matcher.group();
            if (token.codePointCount(0, token.length()) >= settings.getMinTermLength()) {
                themeTokens.add(token.toLowerCase(Locale.ROOT));
            }
        }
        if (themeTokens.isEmpty()) {
            return Optional.empty();
        }

        boolean covered = terms.stream()
            .map(term -> term.getSurfaceForm().toLowerCase(Locale.ROOT))
            .anyMatch(surface -> themeTokens.stream().anyMatch(surface::contains));
        if (covered) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT,
            "⚠ The course theme \"%s\" does not appear among the frequent terms. "
                + "Check that the research material matches the theme.", theme));
    }
}
