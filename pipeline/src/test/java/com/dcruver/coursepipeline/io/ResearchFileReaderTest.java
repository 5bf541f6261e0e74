package com.dcruver.coursepipeline.io;

import com.dcruver.coursepipeline.config.PipelineConfiguration;
import com.dcruver.coursepipeline.domain.CourseOutline;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.QualityTier;
import com.dcruver.coursepipeline.ResearchFixtures;
import com.dcruver.coursepipeline.quality.QualityScorer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading fetcher output and writing reports.
 */
class ResearchFileReaderTest {

    private ObjectMapper objectMapper;
    private ResearchFileReader reader;
    private ReportWriter writer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        objectMapper = PipelineConfiguration.createObjectMapper();
        reader = new ResearchFileReader(objectMapper);
        writer = new ReportWriter(objectMapper);
    }

    @Test
    void testReadsWebResearchWithAlternateFieldNames() throws Exception {
        Path file = tempDir.resolve("web_research.json");
        Files.writeString(file, """
            {
              "research_date": "2025-01-15T10:00:00",
              "total_sources": 2,
              "sources": [
                {"url": "https://example.com/a", "title": "A", "content": "Alpha", "character_count": 5,
                 "extraction_date": "2025-01-15"},
                {"url": "https://example.com/b", "title": "B", "text": "Beta text", "word_count": 9}
              ]
            }
            """);

        WebResearchBatch batch = reader.readWebResearch(file);

        assertEquals("2025-01-15T10:00:00", batch.getResearchDate());
        assertEquals(2, batch.getSources().size());
        assertEquals("Alpha", batch.getSources().get(0).getContent());
        assertEquals(5, batch.getSources().get(0).getCharacterCount());
        assertEquals("Beta text", batch.getSources().get(1).getContent());
        assertEquals(9, batch.getSources().get(1).getCharacterCount());
    }

    @Test
    void testReadsTranscripts() throws Exception {
        Path file = tempDir.resolve("transcripts.json");
        Files.writeString(file, """
            {
              "transcription_date": "2025-01-16",
              "transcriptions": [
                {"video_id": "abc", "source_url": "https://www.youtube.com/watch?v=abc", "language": "ja",
                 "text": "こんにちは", "word_count": 5,
                 "segments": [{"start": 0.0, "duration": 2.5, "text": "こんにちは"}]}
              ]
            }
            """);

        TranscriptBatch batch = reader.readTranscripts(file);

        TranscriptRecord record = batch.getTranscriptions().get(0);
        assertEquals("abc", record.getVideoId());
        assertEquals("ja", record.getLanguage());
        assertEquals(1, record.getSegments().size());
        assertEquals(2.5, record.resolveDurationSeconds(), 0.001);
    }

    @Test
    void testReadsOutlineSortedByNumber() throws Exception {
        Path file = tempDir.resolve("outline.json");
        Files.writeString(file, """
            {
              "course_name": "Generative AI basics",
              "tone": "Casual",
              "units": [
                {"number": 2, "name": "Practice", "slides": [{"number": 1, "title": "Prompts"}]},
                {"number": 1, "name": "Intro", "slides": [{"number": 2, "title": "History"}, {"number": 1, "title": "What is it"}]}
              ]
            }
            """);

        CourseOutline outline = reader.readOutline(file);

        assertEquals("Generative AI basics", outline.getCourseName());
        assertEquals("Intro", outline.getUnits().get(0).getName());
        assertEquals("What is it", outline.getUnits().get(0).getSlides().get(0).getTitle());
        assertEquals(3, outline.getSlideCount());
        assertTrue(outline.learnerProfile().isEmpty());
        assertEquals("Casual", outline.tone().orElseThrow());
    }

    @Test
    void testMissingFileIsReported() {
        Path missing = tempDir.resolve("missing.json");

        NoSuchFileException e = assertThrows(NoSuchFileException.class, () -> reader.readWebResearch(missing));
        assertTrue(e.getMessage().contains("missing.json"));
    }

    @Test
    void testMalformedFileNamesTheFile() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"sources\": [");

        IOException e = assertThrows(IOException.class, () -> reader.readWebResearch(file));
        assertTrue(e.getMessage().startsWith("Malformed web research file"));
        assertTrue(e.getMessage().contains("broken.json"));
    }

    @Test
    void testReportIsWrittenAsSnakeCaseJson() throws Exception {
        QualityReport report = new QualityScorer(ResearchFixtures.properties(),
            ResearchFixtures.credibilityEvaluator(), ResearchFixtures.numericDataDetector())
            .score(ResearchFixtures.corpus());

        Path written = writer.writeJson(tempDir.resolve("reports/quality.json"), report);

        JsonNode json = objectMapper.readTree(written.toFile());
        assertEquals(5, json.get("total_score").asInt());
        assertEquals(QualityTier.GOOD.getKey(), json.get("tier").asText());
        assertEquals(2, json.get("dimension_scores").get("source_count").asInt());
        assertEquals(22238, json.get("summary").get("web_characters").asInt());
        assertEquals("web", json.get("source_checks").get(0).get("origin").asText());
    }

    @Test
    void testPromptIsWrittenAsText() throws Exception {
        Path written = writer.writeText(tempDir.resolve("out/prompt.md"), "# Prompt\n生成AI");

        assertEquals("# Prompt\n生成AI", Files.readString(written));
    }
}
