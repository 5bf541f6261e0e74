package com.dcruver.coursepipeline.quality;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.corpus.CredibilityEvaluator;
import com.dcruver.coursepipeline.corpus.NumericDataDetector;
import com.dcruver.coursepipeline.domain.BucketTable;
import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.QualityDimension;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.QualityTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a corpus on four 0-2 dimensions and maps the 0-8 total to a quality tier.
 *
 * <ul>
 *   <li>Source count: documents of either origin</li>
 *   <li>Data points: aggregate numeric mentions across the corpus</li>
 *   <li>Credible sources: documents whose host is high-trust or a whitelisted reference</li>
 *   <li>Content volume: characters of web pages plus words of transcripts</li>
 * </ul>
 *
 * An empty corpus scores zero everywhere; scoring never fails.
 */
@Component
@Slf4j
public class QualityScorer {

    private final PipelineProperties.Quality settings;
    private final CredibilityEvaluator credibilityEvaluator;
    private final NumericDataDetector numericDataDetector;
    private final QualityRecommender recommender;

    private final Map<QualityDimension, BucketTable<Integer>> dimensionTables;
    private final BucketTable<QualityTier> tierTable;

    public QualityScorer(PipelineProperties properties,
                         CredibilityEvaluator credibilityEvaluator,
                         NumericDataDetector numericDataDetector) {
        this.settings = properties.getQuality();
        this.credibilityEvaluator = credibilityEvaluator;
        this.numericDataDetector = numericDataDetector;
        this.recommender = new QualityRecommender(settings);

        this.dimensionTables = new EnumMap<>(QualityDimension.class);
        dimensionTables.put(QualityDimension.SOURCE_COUNT, scoring(settings.getSourceCountThresholds()));
        dimensionTables.put(QualityDimension.DATA_POINTS, scoring(settings.getDataPointThresholds()));
        dimensionTables.put(QualityDimension.CREDIBLE_SOURCES, scoring(settings.getCredibleSourceThresholds()));
        dimensionTables.put(QualityDimension.CONTENT_VOLUME, scoring(settings.getContentVolumeThresholds()));

        List<Integer> tiers = settings.getTierThresholds();
        this.tierTable = BucketTable.<QualityTier>builder()
            .bucket(Double.NEGATIVE_INFINITY, QualityTier.NEEDS_IMPROVEMENT)
            .bucket(tiers.get(0), QualityTier.ACCEPTABLE)
            .bucket(tiers.get(1), QualityTier.GOOD)
            .bucket(tiers.get(2), QualityTier.EXCELLENT)
            .build();
    }

    public QualityReport score(Corpus corpus) {
        List<Document> documents = corpus.getDocuments();

        QualityReport.Summary summary = summarize(corpus);

        Map<QualityDimension, Integer> scores = new EnumMap<>(QualityDimension.class);
        scores.put(QualityDimension.SOURCE_COUNT, dimensionScore(QualityDimension.SOURCE_COUNT, summary.getTotalSources()));
        scores.put(QualityDimension.DATA_POINTS, dimensionScore(QualityDimension.DATA_POINTS, summary.getNumericMentions()));
        scores.put(QualityDimension.CREDIBLE_SOURCES, dimensionScore(QualityDimension.CREDIBLE_SOURCES, summary.getCredibleSources()));
        scores.put(QualityDimension.CONTENT_VOLUME, dimensionScore(QualityDimension.CONTENT_VOLUME, summary.getContentVolume()));

        int total = scores.values().stream().mapToInt(Integer::intValue).sum();
        QualityTier tier = tierTable.classify(total);

        List<QualityReport.SourceCheck> checks = documents.stream()
            .map(this::check)
            .toList();

        log.info("Quality score {} / {} ({}) over {} documents",
            total, QualityDimension.values().length * QualityDimension.MAX_SCORE, tier.getKey(), documents.size());

        return QualityReport.builder()
            .dimensionScores(scores)
            .tier(tier)
            .summary(summary)
            .sourceChecks(checks)
            .recommendations(recommender.recommend(tier, scores, summary, checks))
            .build();
    }

    private int dimensionScore(QualityDimension dimension, double value) {
        int score = dimensionTables.get(dimension).classify(value);
        return Math.max(0, Math.min(QualityDimension.MAX_SCORE, score));
    }

    private QualityReport.Summary summarize(Corpus corpus) {
        List<Document> web = corpus.getWebDocuments();
        List<Document> video = corpus.getVideoDocuments();

        long webCharacters = web.stream().mapToLong(Document::getCount).sum();
        long videoWords = video.stream().mapToLong(Document::getCount).sum();

        return QualityReport.Summary.builder()
            .totalSources(corpus.size())
            .webSources(web.size())
            .videoSources(video.size())
            .numericMentions(corpus.getDocuments().stream().mapToInt(Document::getNumericMentions).sum())
            .credibleSources((int) corpus.getDocuments().stream()
                .filter(doc -> doc.getCredibility() != null && doc.getCredibility().isCredible())
                .count())
            .webCharacters(webCharacters)
            .videoWords(videoWords)
            .videoMinutes(video.stream().mapToDouble(Document::getDurationMinutes).sum())
            .contentVolume(webCharacters + videoWords)
            .build();
    }

    private QualityReport.SourceCheck check(Document document) {
        boolean hasContent = document.getTextLength() > settings.getMinContentLength()
            || document.getCount() > settings.getMinContentLength();

        return QualityReport.SourceCheck.builder()
            .sourceId(document.getSourceId())
            .origin(document.getOrigin())
            .url(document.getUrl())
            .urlValid(credibilityEvaluator.isValidUrl(document.getUrl()))
            .hasContent(hasContent)
            .numericMentions(document.getNumericMentions())
            .sampleDataPoints(numericDataDetector.samples(document.getText(), settings.getSampleDataPoints()))
            .credibility(document.getCredibility())
            .build();
    }

    private static BucketTable<Integer> scoring(List<Integer> thresholds) {
        return BucketTable.scoring(thresholds.get(0), thresholds.get(1));
    }
}
