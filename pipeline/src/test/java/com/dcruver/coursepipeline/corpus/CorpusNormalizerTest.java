package com.dcruver.coursepipeline.corpus;

import com.dcruver.coursepipeline.ResearchFixtures;
import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.CredibilityLevel;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.Origin;
import com.dcruver.coursepipeline.io.TranscriptBatch;
import com.dcruver.coursepipeline.io.TranscriptRecord;
import com.dcruver.coursepipeline.io.TranscriptSegment;
import com.dcruver.coursepipeline.io.WebResearchBatch;
import com.dcruver.coursepipeline.io.WebResearchRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CorpusNormalizerTest {

    private CorpusNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = ResearchFixtures.normalizer();
    }

    @Test
    void testWebDocumentsPrecedeVideoInInputOrder() {
        Corpus corpus = ResearchFixtures.corpus();

        assertEquals(5, corpus.size());
        assertEquals(List.of("web-1", "web-2", "web-3", "web-4", "abc123XYZ"),
            corpus.getDocuments().stream().map(Document::getSourceId).toList());
        assertEquals(4, corpus.getWebDocuments().size());
        assertEquals(1, corpus.getVideoDocuments().size());
        assertTrue(corpus.getWarnings().isEmpty());
    }

    @Test
    void testDocumentsCarryProvenanceAndNumericData() {
        Corpus corpus = ResearchFixtures.corpus();

        Document government = corpus.getDocuments().get(0);
        assertEquals(Origin.WEB, government.getOrigin());
        assertEquals(CredibilityLevel.HIGH, government.getCredibility());
        assertEquals(5000, government.getCount());
        assertEquals(1, government.getNumericMentions());
        assertTrue(government.isNumericDataPresent());

        Document blank = corpus.getDocuments().get(2);
        assertEquals(0, blank.getNumericMentions());
        assertFalse(blank.isNumericDataPresent());

        Document video = corpus.getVideoDocuments().get(0);
        assertEquals(30041, video.getCount());
        assertEquals(1, video.getNumericMentions());
        assertEquals("en", video.getLanguage());
        assertEquals(30.0, video.getDurationMinutes(), 0.001);
    }

    @Test
    void testEitherSideMayBeAbsent() {
        Corpus webOnly = normalizer.normalize(Optional.of(ResearchFixtures.webResearch()), Optional.empty());
        Corpus videoOnly = normalizer.normalize(Optional.empty(), Optional.of(ResearchFixtures.transcripts()));
        Corpus none = normalizer.normalize(Optional.empty(), Optional.empty());

        assertEquals(4, webOnly.size());
        assertTrue(webOnly.getVideoDocuments().isEmpty());
        assertEquals(1, videoOnly.size());
        assertTrue(none.isEmpty());
        assertTrue(none.getWarnings().isEmpty());
    }

    @Test
    void testMalformedRecordsAreSkippedWithWarnings() {
        WebResearchBatch web = new WebResearchBatch("2025-01-15", Arrays.asList(
            WebResearchRecord.builder().url("https://example.com/a").title("No content").build(),
            null,
            WebResearchRecord.builder().title("No URL").content("Some text").build(),
            WebResearchRecord.builder().url("https://example.com/ok").content("Kept").build()));
        TranscriptBatch video = TranscriptBatch.builder()
            .transcription(TranscriptRecord.builder().text("Anonymous transcript").build())
            .build();

        Corpus corpus = normalizer.normalize(Optional.of(web), Optional.of(video));

        assertEquals(1, corpus.size());
        assertEquals("web-4", corpus.getDocuments().get(0).getSourceId());
        assertEquals(4, corpus.getWarnings().size());
        assertTrue(corpus.getWarnings().get(0).contains("#1"));
        assertTrue(corpus.getWarnings().get(1).contains("#2"));
        assertTrue(corpus.getWarnings().get(2).contains("no URL"));
        assertTrue(corpus.getWarnings().get(3).startsWith("Transcript #1"));
        assertTrue(corpus.getWarnings().stream().allMatch(warning -> warning.endsWith("record skipped")));
    }

    @Test
    void testCountsFallBackToTextLength() {
        WebResearchBatch web = WebResearchBatch.builder()
            .source(WebResearchRecord.builder().url("https://example.com").content("twelve chars").build())
            .build();

        Document document = normalizer.normalize(Optional.of(web), Optional.empty()).getDocuments().get(0);

        assertEquals(12, document.getCount());
        assertNull(document.getTitle());
        assertEquals("https://example.com", document.getDisplayTitle());
    }

    @Test
    void testTranscriptUrlAndDurationAreDerived() {
        TranscriptBatch video = TranscriptBatch.builder()
            .transcription(TranscriptRecord.builder()
                .videoId("xyz")
                .text("Segmented transcript")
                .segment(new TranscriptSegment(0.0, 30.0, "first"))
                .segment(new TranscriptSegment(30.0, 90.0, "second"))
                .build())
            .build();

        Document document = normalizer.normalize(Optional.empty(), Optional.of(video)).getDocuments().get(0);

        assertEquals("https://www.youtube.com/watch?v=xyz", document.getUrl());
        assertEquals(120.0, document.getDurationSeconds(), 0.001);
        assertEquals(2, document.getSegmentCount());
        assertNull(document.getTitle());
        assertEquals("xyz", document.getDisplayTitle());
    }
}
