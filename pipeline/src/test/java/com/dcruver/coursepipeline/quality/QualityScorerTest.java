package com.dcruver.coursepipeline.quality;

import com.dcruver.coursepipeline.ResearchFixtures;
import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.CredibilityLevel;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.Origin;
import com.dcruver.coursepipeline.domain.QualityDimension;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.QualityTier;
import com.dcruver.coursepipeline.io.WebResearchBatch;
import com.dcruver.coursepipeline.io.WebResearchRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QualityScorerTest {

    private PipelineProperties properties;
    private QualityScorer scorer;

    @BeforeEach
    void setUp() {
        properties = ResearchFixtures.properties();
        scorer = newScorer(properties);
    }

    @Test
    void testMixedCorpusScoresGood() {
        QualityReport report = scorer.score(ResearchFixtures.corpus());

        // Five sources across both origins reach the top source-count bucket
        assertEquals(2, report.getScore(QualityDimension.SOURCE_COUNT));
        assertEquals(0, report.getScore(QualityDimension.DATA_POINTS));
        assertEquals(1, report.getScore(QualityDimension.CREDIBLE_SOURCES));
        assertEquals(2, report.getScore(QualityDimension.CONTENT_VOLUME));
        assertEquals(5, report.getTotalScore());
        assertEquals(QualityTier.GOOD, report.getTier());

        QualityReport.Summary summary = report.getSummary();
        assertEquals(5, summary.getTotalSources());
        assertEquals(3, summary.getNumericMentions());
        assertEquals(1, summary.getCredibleSources());
        assertEquals(22238, summary.getWebCharacters());
        assertEquals(30041, summary.getVideoWords());
        assertEquals(52279, summary.getContentVolume());
    }

    @Test
    void testRecommendationsForMixedCorpus() {
        List<String> recommendations = scorer.score(ResearchFixtures.corpus()).getRecommendations();

        assertEquals("✓ Good research quality.", recommendations.get(0));
        assertTrue(recommendations.stream().anyMatch(rec -> rec.startsWith("⚠ Few numeric data points (3)")));
        assertTrue(recommendations.stream().anyMatch(rec -> rec.startsWith("⚠ Few credible web sources (1/4)")));
        assertTrue(recommendations.stream().anyMatch(rec -> rec.startsWith("💡 3 numeric data point(s)")));
        assertTrue(recommendations.stream().noneMatch(rec -> rec.contains("Transcript volume")));
        assertTrue(recommendations.stream().noneMatch(rec -> rec.contains("little or no content")));
    }

    @Test
    void testEmptyCorpusScoresZeroWithoutFailing() {
        QualityReport report = scorer.score(Corpus.empty());

        for (QualityDimension dimension : QualityDimension.values()) {
            assertEquals(0, report.getScore(dimension), dimension.name());
        }
        assertEquals(0, report.getTotalScore());
        assertEquals(QualityTier.NEEDS_IMPROVEMENT, report.getTier());
        assertEquals(2, report.getRecommendations().size());
        assertTrue(report.getRecommendations().get(1).startsWith("✗ Insufficient data"));
        assertTrue(report.getSourceChecks().isEmpty());
    }

    @Test
    void testTotalIsAlwaysSumOfDimensions() {
        QualityReport report = scorer.score(ResearchFixtures.corpus());

        int sum = report.getDimensionScores().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(sum, report.getTotalScore());
        assertTrue(report.getTotalScore() >= 0 && report.getTotalScore() <= 8);
        assertEquals(List.of("source_count", "data_points", "credible_sources", "content_volume"),
            List.copyOf(report.getDimensionScoresByKey().keySet()));
    }

    @Test
    void testSourceChecksFlagThinContentAndInvalidUrls() {
        WebResearchBatch web = WebResearchBatch.builder()
            .source(WebResearchRecord.builder().url("not a url").content("short").characterCount(5).build())
            .source(WebResearchRecord.builder().url("https://www.mext.go.jp/a")
                .content("In 2024, 42% of schools used it. ".repeat(5)).build())
            .build();
        Corpus corpus = ResearchFixtures.normalizer().normalize(Optional.of(web), Optional.empty());

        QualityReport report = scorer.score(corpus);

        QualityReport.SourceCheck thin = report.getSourceChecks().get(0);
        assertFalse(thin.isUrlValid());
        assertFalse(thin.isHasContent());

        QualityReport.SourceCheck rich = report.getSourceChecks().get(1);
        assertTrue(rich.isUrlValid());
        assertTrue(rich.isHasContent());
        assertEquals(10, rich.getNumericMentions());
        assertEquals(List.of("2024", "42%", "2024", "42%", "2024"), rich.getSampleDataPoints());

        assertTrue(report.getRecommendations().stream().anyMatch(rec -> rec.startsWith("⚠ 1 source(s) have little")));
        assertTrue(report.getRecommendations().stream().anyMatch(rec -> rec.startsWith("⚠ 1 source(s) have an invalid URL")));
    }

    @Test
    void testTierFollowsConfiguredThresholds() {
        properties.getQuality().setTierThresholds(List.of(1, 2, 5));
        QualityScorer lenient = newScorer(properties);

        assertEquals(QualityTier.EXCELLENT, lenient.score(ResearchFixtures.corpus()).getTier());
    }

    @Test
    void testShortTranscriptsAreReported() {
        properties.getQuality().setMinTranscriptWords(50_000);
        properties.getQuality().setMinVideoMinutes(45);
        QualityScorer strict = newScorer(properties);

        List<String> recommendations = strict.score(ResearchFixtures.corpus()).getRecommendations();

        assertTrue(recommendations.stream().anyMatch(rec -> rec.startsWith("⚠ Transcript volume is low (30,041 words)")));
        assertTrue(recommendations.stream().anyMatch(rec -> rec.startsWith("⚠ Total video time is short (30.0 min)")));
    }

    @Test
    void testSourceCountBoundaries() {
        assertEquals(0, scorer.score(corpus(2, 0, 0, 0)).getScore(QualityDimension.SOURCE_COUNT));
        assertEquals(1, scorer.score(corpus(3, 0, 0, 0)).getScore(QualityDimension.SOURCE_COUNT));
        assertEquals(1, scorer.score(corpus(4, 0, 0, 0)).getScore(QualityDimension.SOURCE_COUNT));
        assertEquals(2, scorer.score(corpus(5, 0, 0, 0)).getScore(QualityDimension.SOURCE_COUNT));
    }

    @Test
    void testDataPointBoundaries() {
        assertEquals(0, scorer.score(corpus(1, 0, 9, 0)).getScore(QualityDimension.DATA_POINTS));
        assertEquals(1, scorer.score(corpus(1, 0, 10, 0)).getScore(QualityDimension.DATA_POINTS));
        assertEquals(1, scorer.score(corpus(1, 0, 19, 0)).getScore(QualityDimension.DATA_POINTS));
        assertEquals(2, scorer.score(corpus(1, 0, 20, 0)).getScore(QualityDimension.DATA_POINTS));
    }

    @Test
    void testCredibleSourceBoundaries() {
        assertEquals(0, scorer.score(corpus(3, 0, 0, 0)).getScore(QualityDimension.CREDIBLE_SOURCES));
        assertEquals(1, scorer.score(corpus(3, 1, 0, 0)).getScore(QualityDimension.CREDIBLE_SOURCES));
        assertEquals(1, scorer.score(corpus(3, 2, 0, 0)).getScore(QualityDimension.CREDIBLE_SOURCES));
        assertEquals(2, scorer.score(corpus(3, 3, 0, 0)).getScore(QualityDimension.CREDIBLE_SOURCES));
    }

    @Test
    void testContentVolumeBoundaries() {
        assertEquals(0, scorer.score(corpus(1, 0, 0, 4999)).getScore(QualityDimension.CONTENT_VOLUME));
        assertEquals(1, scorer.score(corpus(1, 0, 0, 5000)).getScore(QualityDimension.CONTENT_VOLUME));
        assertEquals(1, scorer.score(corpus(1, 0, 0, 9999)).getScore(QualityDimension.CONTENT_VOLUME));
        assertEquals(2, scorer.score(corpus(1, 0, 0, 10000)).getScore(QualityDimension.CONTENT_VOLUME));
    }

    @Test
    void testDefaultTierBoundaries() {
        assertTier(8, QualityTier.EXCELLENT, corpus(5, 3, 20, 10000));
        assertTier(7, QualityTier.EXCELLENT, corpus(5, 3, 20, 5000));
        assertTier(6, QualityTier.GOOD, corpus(5, 3, 20, 0));
        assertTier(5, QualityTier.GOOD, corpus(5, 3, 10, 0));
        assertTier(4, QualityTier.ACCEPTABLE, corpus(5, 1, 10, 0));
        assertTier(3, QualityTier.ACCEPTABLE, corpus(3, 1, 10, 0));
        assertTier(2, QualityTier.NEEDS_IMPROVEMENT, corpus(3, 1, 0, 0));
    }

    @Test
    void testSourcesWithoutHostHaveUnknownCredibility() {
        WebResearchBatch web = WebResearchBatch.builder()
            .source(WebResearchRecord.builder().url("notes/offline-copy.html")
                .content("Saved page without its address. ".repeat(5)).build())
            .source(WebResearchRecord.builder().url("https://www.nist.gov/ai")
                .content("Framework overview. ".repeat(5)).build())
            .build();
        Corpus corpus = ResearchFixtures.normalizer().normalize(Optional.of(web), Optional.empty());

        QualityReport report = scorer.score(corpus);

        assertEquals(CredibilityLevel.UNKNOWN, report.getSourceChecks().get(0).getCredibility());
        assertEquals(CredibilityLevel.HIGH, report.getSourceChecks().get(1).getCredibility());
        assertEquals(1, report.getSummary().getCredibleSources());
        assertTrue(report.getRecommendations().contains("⚠ The credibility of 1 source(s) could not be determined."));
    }

    private void assertTier(int expectedTotal, QualityTier expectedTier, Corpus corpus) {
        QualityReport report = scorer.score(corpus);
        assertEquals(expectedTotal, report.getTotalScore());
        assertEquals(expectedTier, report.getTier(), "total " + expectedTotal);
    }

    /**
     * Web corpus of {@code sources} documents, the first {@code credible} on high-trust hosts.
     * The first document carries all numeric mentions and the whole content volume.
     */
    private static Corpus corpus(int sources, int credible, int numericMentions, int volume) {
        List<Document> documents = new ArrayList<>();
        for (int i = 0; i < sources; i++) {
            documents.add(Document.builder()
                .sourceId("web-" + (i + 1))
                .origin(Origin.WEB)
                .url("https://source" + i + ".example.com")
                .text("")
                .credibility(i < credible ? CredibilityLevel.HIGH : CredibilityLevel.LOW)
                .numericMentions(i == 0 ? numericMentions : 0)
                .count(i == 0 ? volume : 0)
                .build());
        }
        return new Corpus(documents, List.of());
    }

    private static QualityScorer newScorer(PipelineProperties properties) {
        return new QualityScorer(properties,
            ResearchFixtures.credibilityEvaluator(),
            ResearchFixtures.numericDataDetector());
    }
}
