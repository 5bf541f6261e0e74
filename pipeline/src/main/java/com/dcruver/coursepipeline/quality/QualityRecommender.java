package com.dcruver.coursepipeline.quality;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.CredibilityLevel;
import com.dcruver.coursepipeline.domain.Origin;
import com.dcruver.coursepipeline.domain.QualityDimension;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.QualityTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Threshold rules that turn dimension scores and corpus figures into advice.
 * The tier headline always comes first.
 */
class QualityRecommender {

    private final PipelineProperties.Quality settings;

    QualityRecommender(PipelineProperties.Quality settings) {
        this.settings = settings;
    }

    List<String> recommend(QualityTier tier,
                           Map<QualityDimension, Integer> scores,
                           QualityReport.Summary summary,
                           List<QualityReport.SourceCheck> checks) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add(headline(tier));

        if (summary.getTotalSources() == 0) {
            recommendations.add("✗ Insufficient data: no research documents were supplied. "
                + "Run web research or transcript collection before generating the course.");
            return recommendations;
        }

        long thinSources = checks.stream().filter(check -> !check.isHasContent()).count();
        if (thinSources > 0) {
            recommendations.add(String.format(Locale.ROOT,
                "⚠ %d source(s) have little or no content. Consider replacing them with other URLs or videos.",
                thinSources));
        }

        long invalidUrls = checks.stream().filter(check -> !check.isUrlValid()).count();
        if (invalidUrls > 0) {
            recommendations.add(String.format(Locale.ROOT, "⚠ %d source(s) have an invalid URL.", invalidUrls));
        }

        if (scores.getOrDefault(QualityDimension.SOURCE_COUNT, 0) == 0) {
            recommendations.add(String.format(Locale.ROOT,
                "⚠ Only %d source(s) were collected. Add at least %d for a broader evidence base.",
                summary.getTotalSources(), settings.getSourceCountThresholds().get(0)));
        }

        if (scores.getOrDefault(QualityDimension.DATA_POINTS, 0) == 0) {
            recommendations.add(String.format(Locale.ROOT,
                "⚠ Few numeric data points (%d). Add sources that contain statistics.",
                summary.getNumericMentions()));
        }

        long webCredible = checks.stream()
            .filter(check -> check.getOrigin() == Origin.WEB)
            .filter(check -> check.getCredibility() != null && check.getCredibility().isCredible())
            .count();
        if (summary.getWebSources() > 0
            && (double) webCredible / summary.getWebSources() < settings.getMinCredibleRatio()) {
            recommendations.add(String.format(Locale.ROOT,
                "⚠ Few credible web sources (%d/%d). Add sources from public institutions or academic organizations.",
                webCredible, summary.getWebSources()));
        }

        long unknownCredibility = checks.stream()
            .filter(check -> check.getCredibility() == CredibilityLevel.UNKNOWN)
            .count();
        if (unknownCredibility > 0) {
            recommendations.add(String.format(Locale.ROOT,
                "⚠ The credibility of %d source(s) could not be determined.", unknownCredibility));
        }

        if (summary.getVideoSources() > 0) {
            if (summary.getVideoWords() < settings.getMinTranscriptWords()) {
                recommendations.add(String.format(Locale.ROOT,
                    "⚠ Transcript volume is low (%,d words). Consider longer or additional videos.",
                    summary.getVideoWords()));
            }
            if (summary.getVideoMinutes() < settings.getMinVideoMinutes()) {
                recommendations.add(String.format(Locale.ROOT,
                    "⚠ Total video time is short (%.1f min). Add more detailed explanatory videos.",
                    summary.getVideoMinutes()));
            }
        }

        if (summary.getNumericMentions() > 0) {
            recommendations.add(String.format(Locale.ROOT,
                "💡 %d numeric data point(s) were detected. Use them as concrete examples in the course.",
                summary.getNumericMentions()));
        }

        return recommendations;
    }

    private static String headline(QualityTier tier) {
        return switch (tier) {
            case EXCELLENT -> "✓ Excellent research quality. There is enough material to generate the course.";
            case GOOD -> "✓ Good research quality.";
            case ACCEPTABLE -> "⚠ Acceptable research quality. The following improvements are recommended:";
            case NEEDS_IMPROVEMENT -> "✗ Research quality needs improvement. Address the following:";
        };
    }
}
