package com.dcruver.coursepipeline.io;

import com.dcruver.coursepipeline.domain.CourseOutline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads the JSON artifacts produced by the research fetchers and the outline editor.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResearchFileReader {

    private final ObjectMapper objectMapper;

    public WebResearchBatch readWebResearch(Path file) throws IOException {
        WebResearchBatch batch = read(file, WebResearchBatch.class, "web research");
        log.info("Loaded {} web research records from {}", batch.getSources().size(), file);
        return batch;
    }

    public TranscriptBatch readTranscripts(Path file) throws IOException {
        TranscriptBatch batch = read(file, TranscriptBatch.class, "transcript");
        log.info("Loaded {} transcripts from {}", batch.getTranscriptions().size(), file);
        return batch;
    }

    public CourseOutline readOutline(Path file) throws IOException {
        CourseOutline outline = read(file, CourseOutline.class, "course outline");
        log.info("Loaded outline '{}' with {} units and {} slides from {}",
            outline.getCourseName(), outline.getUnits().size(), outline.getSlideCount(), file);
        return outline;
    }

    private <T> T read(Path file, Class<T> type, String description) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, description + " file not found");
        }
        try {
            T value = objectMapper.readValue(file.toFile(), type);
            if (value == null) {
                throw new IOException("Empty " + description + " file: " + file);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed " + description + " file " + file + ": " + e.getOriginalMessage(), e);
        }
    }
}
