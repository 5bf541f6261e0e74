package com.dcruver.coursepipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the course research pipeline.
 *
 * Scores research material, extracts its terminology and assembles the
 * course-generation prompt from the interactive shell.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class CoursePipelineApplication {

    public static void main(String[] args) {
        log.info("Starting course research pipeline...");
        SpringApplication.run(CoursePipelineApplication.class, args);
    }
}
