package com.dcruver.coursepipeline.reporting;

import com.dcruver.coursepipeline.domain.PromptDocument;
import com.dcruver.coursepipeline.domain.QualityDimension;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.Term;
import com.dcruver.coursepipeline.domain.TerminologyReport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text console summaries of the pipeline reports.
 */
@Component
public class ReportSummaryFormatter {

    private static final int MAX_TERMS_SHOWN = 10;

    public String formatQuality(QualityReport report) {
        StringBuilder sb = new StringBuilder();
        QualityReport.Summary summary = report.getSummary();

        sb.append("Research Quality Report\n\n");

        sb.append("Summary:\n");
        sb.append(String.format(Locale.ROOT, "- Sources: %d (web %d, video %d)\n",
            summary.getTotalSources(), summary.getWebSources(), summary.getVideoSources()));
        sb.append(String.format(Locale.ROOT, "- Numeric data points: %d\n", summary.getNumericMentions()));
        sb.append(String.format(Locale.ROOT, "- Credible sources: %d\n", summary.getCredibleSources()));
        sb.append(String.format(Locale.ROOT, "- Content volume: %,d (web characters %,d, video words %,d)\n",
            summary.getContentVolume(), summary.getWebCharacters(), summary.getVideoWords()));
        if (summary.getVideoSources() > 0) {
            sb.append(String.format(Locale.ROOT, "- Video time: %.1f min\n", summary.getVideoMinutes()));
        }
        sb.append("\n");

        sb.append("Scores:\n");
        for (QualityDimension dimension : QualityDimension.values()) {
            sb.append(String.format(Locale.ROOT, "- %s: %d / %d\n",
                dimension.getLabel(), report.getScore(dimension), QualityDimension.MAX_SCORE));
        }
        sb.append(String.format(Locale.ROOT, "- Total: %d / %d (%s)\n\n",
            report.getTotalScore(),
            QualityDimension.values().length * QualityDimension.MAX_SCORE,
            report.getTier().getLabel()));

        long flagged = report.getSourceChecks().stream()
            .filter(check -> !check.isUrlValid() || !check.isHasContent())
            .count();
        if (flagged > 0) {
            sb.append(String.format(Locale.ROOT, "Sources needing attention: %d\n", flagged));
            report.getSourceChecks().stream()
                .filter(check -> !check.isUrlValid() || !check.isHasContent())
                .forEach(check -> sb.append(String.format("- %s %s%s%s\n",
                    check.getSourceId(),
                    check.getUrl() != null ? check.getUrl() : "(no url)",
                    check.isUrlValid() ? "" : " [invalid url]",
                    check.isHasContent() ? "" : " [thin content]")));
            sb.append("\n");
        }

        appendRecommendations(sb, report.getRecommendations());
        return sb.toString();
    }

    public String formatTerminology(TerminologyReport report) {
        StringBuilder sb = new StringBuilder();

        sb.append("Terminology Report\n\n");
        report.getTheme().ifPresent(theme -> sb.append("Course theme: ").append(theme).append("\n"));
        sb.append(String.format(Locale.ROOT, "Unique terms: %d (showing %d)\n\n",
            report.getTotalUniqueTerms(), Math.min(report.getTopTerms().size(), MAX_TERMS_SHOWN)));

        List<Term> shown = report.getTopTerms().stream().limit(MAX_TERMS_SHOWN).toList();
        if (!shown.isEmpty()) {
            sb.append("Top terms:\n");
            int rank = 1;
            for (Term term : shown) {
                sb.append(String.format(Locale.ROOT, "%2d. %s (%d) %s / %s\n",
                    rank++, term.getSurfaceForm(), term.getFrequency(),
                    term.getCategory().getKey(), term.getLearningPhase().getKey()));
            }
            sb.append("\n");
        }

        sb.append("Categories: ").append(joinCounts(report.getCategoryCountsByKey())).append("\n");
        sb.append("Learning phases: ").append(joinCounts(report.getPhaseCountsByKey())).append("\n\n");

        appendRecommendations(sb, report.getRecommendations());
        return sb.toString();
    }

    public String formatPrompt(PromptDocument prompt) {
        StringBuilder sb = new StringBuilder();
        sb.append("Prompt assembled.\n\n");
        sb.append("Sections: ");
        sb.append(String.join(", ", prompt.getSections().stream()
            .map(section -> section.getKind().name().toLowerCase(Locale.ROOT))
            .toList()));
        sb.append("\n");
        sb.append(String.format(Locale.ROOT, "- Characters: %,d\n", prompt.getText().length()));
        sb.append(String.format(Locale.ROOT, "- Estimated tokens: %,d / %,d (%.1f%%, %s)\n",
            prompt.getEstimatedTokens(), prompt.getTokenCeiling(),
            prompt.getUsageRatio() * 100, prompt.getUsageLevel().getKey()));
        for (String warning : prompt.getWarnings()) {
            sb.append("⚠ ").append(warning).append("\n");
        }
        return sb.toString();
    }

    private static String joinCounts(Map<String, Integer> counts) {
        return String.join(", ", counts.entrySet().stream()
            .map(entry -> entry.getKey() + " " + entry.getValue())
            .toList());
    }

    private static void appendRecommendations(StringBuilder sb, List<String> recommendations) {
        if (recommendations.isEmpty()) {
            return;
        }
        sb.append("Recommendations:\n");
        for (String recommendation : recommendations) {
            sb.append("- ").append(recommendation).append("\n");
        }
    }
}
