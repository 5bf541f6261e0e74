package com.dcruver.coursepipeline.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports as pretty-printed JSON and prompts as plain text.
 * Parent directories are created as needed; existing files are replaced.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportWriter {

    private final ObjectMapper objectMapper;

    public Path writeJson(Path file, Object report) throws IOException {
        createParent(file);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        log.info("Wrote {} to {}", report.getClass().getSimpleName(), file);
        return file;
    }

    public Path writeText(Path file, String text) throws IOException {
        createParent(file);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        log.info("Wrote {} characters to {}", text.length(), file);
        return file;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
