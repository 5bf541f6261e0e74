package com.dcruver.coursepipeline.app;

import com.dcruver.coursepipeline.domain.CourseOutline;
import com.dcruver.coursepipeline.domain.PromptDocument;
import com.dcruver.coursepipeline.io.ReportWriter;
import com.dcruver.coursepipeline.io.ResearchFileReader;
import com.dcruver.coursepipeline.io.TranscriptBatch;
import com.dcruver.coursepipeline.io.WebResearchBatch;
import com.dcruver.coursepipeline.pipeline.PipelineRequest;
import com.dcruver.coursepipeline.pipeline.PipelineResult;
import com.dcruver.coursepipeline.pipeline.ResearchPipeline;
import com.dcruver.coursepipeline.reporting.ReportSummaryFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Spring Shell commands that drive the research pipeline from JSON files.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class CoursePipelineShellCommands {

    private final ResearchPipeline pipeline;
    private final ResearchFileReader fileReader;
    private final ReportWriter reportWriter;
    private final ReportSummaryFormatter formatter;

    @ShellMethod(key = {"quality", "score-quality"}, value = "Score the evidentiary quality of research files")
    public String quality(
        @ShellOption(value = "--web", defaultValue = ShellOption.NULL, help = "Web research JSON file") String web,
        @ShellOption(value = "--transcripts", defaultValue = ShellOption.NULL, help = "Transcript JSON file") String transcripts,
        @ShellOption(value = "--output", defaultValue = ShellOption.NULL, help = "Write the report as JSON") String output
    ) {
        log.info("Scoring research quality...");

        try {
            PipelineResult result = pipeline.run(inputs(web, transcripts)
                .analyzeTerminology(false)
                .build());

            StringBuilder sb = new StringBuilder();
            sb.append(formatter.formatQuality(result.getQuality().orElseThrow()));
            appendDiagnostics(sb, result);

            if (output != null) {
                Path written = reportWriter.writeJson(Paths.get(output), result.getQuality().orElseThrow());
                sb.append("\nReport written to ").append(written).append("\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Quality scoring failed", e);
            return "Quality scoring failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"terminology", "terms"}, value = "Extract and classify the key terminology of research files")
    public String terminology(
        @ShellOption(value = "--web", defaultValue = ShellOption.NULL, help = "Web research JSON file") String web,
        @ShellOption(value = "--transcripts", defaultValue = ShellOption.NULL, help = "Transcript JSON file") String transcripts,
        @ShellOption(value = "--theme", defaultValue = ShellOption.NULL, help = "Course theme to check coverage for") String theme,
        @ShellOption(value = "--output", defaultValue = ShellOption.NULL, help = "Write the report as JSON") String output
    ) {
        log.info("Extracting terminology...");

        try {
            PipelineResult result = pipeline.run(inputs(web, transcripts)
                .courseTheme(theme)
                .scoreQuality(false)
                .build());

            StringBuilder sb = new StringBuilder();
            sb.append(formatter.formatTerminology(result.getTerminology().orElseThrow()));
            appendDiagnostics(sb, result);

            if (output != null) {
                Path written = reportWriter.writeJson(Paths.get(output), result.getTerminology().orElseThrow());
                sb.append("\nReport written to ").append(written).append("\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Terminology extraction failed", e);
            return "Terminology extraction failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"assemble", "assemble-prompt"}, value = "Assemble the course-generation prompt for an outline")
    public String assemble(
        @ShellOption(value = "--outline", help = "Course outline JSON file") String outline,
        @ShellOption(value = "--web", defaultValue = ShellOption.NULL, help = "Web research JSON file") String web,
        @ShellOption(value = "--transcripts", defaultValue = ShellOption.NULL, help = "Transcript JSON file") String transcripts,
        @ShellOption(value = "--theme", defaultValue = ShellOption.NULL, help = "Course theme, defaults to the course name") String theme,
        @ShellOption(value = "--skip-quality", defaultValue = "false", help = "Leave out the quality section") boolean skipQuality,
        @ShellOption(value = "--skip-terminology", defaultValue = "false", help = "Leave out the terminology section") boolean skipTerminology,
        @ShellOption(value = "--skip-excerpts", defaultValue = "false", help = "Leave out the research excerpts") boolean skipExcerpts,
        @ShellOption(value = "--output", defaultValue = ShellOption.NULL, help = "Write the prompt text to this file") String output
    ) {
        log.info("Assembling prompt...");

        try {
            CourseOutline courseOutline = fileReader.readOutline(Paths.get(outline));
            PipelineResult result = pipeline.run(inputs(web, transcripts)
                .outline(courseOutline)
                .courseTheme(theme)
                .scoreQuality(!skipQuality)
                .analyzeTerminology(!skipTerminology)
                .includeExcerpts(!skipExcerpts)
                .build());

            PromptDocument prompt = result.getPrompt().orElseThrow();
            StringBuilder sb = new StringBuilder();
            sb.append(formatter.formatPrompt(prompt));
            appendDiagnostics(sb, result);

            if (output != null) {
                Path written = reportWriter.writeText(Paths.get(output), prompt.getText());
                sb.append("\nPrompt written to ").append(written).append("\n");
            } else {
                sb.append("\n").append(prompt.getText()).append("\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Prompt assembly failed", e);
            return "Prompt assembly failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"pipeline", "run-pipeline"}, value = "Run the full pipeline and write every artifact to a directory")
    public String runPipeline(
        @ShellOption(value = "--outline", help = "Course outline JSON file") String outline,
        @ShellOption(value = "--web", defaultValue = ShellOption.NULL, help = "Web research JSON file") String web,
        @ShellOption(value = "--transcripts", defaultValue = ShellOption.NULL, help = "Transcript JSON file") String transcripts,
        @ShellOption(value = "--theme", defaultValue = ShellOption.NULL, help = "Course theme, defaults to the course name") String theme,
        @ShellOption(value = "--output-dir", defaultValue = "pipeline-output", help = "Directory for the artifacts") String outputDir
    ) {
        log.info("Running full pipeline...");

        try {
            CourseOutline courseOutline = fileReader.readOutline(Paths.get(outline));
            PipelineResult result = pipeline.run(inputs(web, transcripts)
                .outline(courseOutline)
                .courseTheme(theme)
                .build());

            Path directory = Paths.get(outputDir);
            StringBuilder sb = new StringBuilder();
            sb.append("Pipeline completed.\n\n");

            result.getQuality().ifPresent(report -> sb.append(formatter.formatQuality(report)).append("\n"));
            result.getTerminology().ifPresent(report -> sb.append(formatter.formatTerminology(report)).append("\n"));
            result.getPrompt().ifPresent(prompt -> sb.append(formatter.formatPrompt(prompt)));
            appendDiagnostics(sb, result);

            sb.append("\nArtifacts:\n");
            sb.append("- ").append(reportWriter.writeJson(directory.resolve("pipeline-result.json"), result)).append("\n");
            if (result.getPrompt().isPresent()) {
                sb.append("- ").append(reportWriter.writeText(
                    directory.resolve("prompt.md"), result.getPrompt().get().getText())).append("\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Pipeline failed", e);
            return "Pipeline failed: " + e.getMessage();
        }
    }

    private PipelineRequest.PipelineRequestBuilder inputs(String web, String transcripts) throws IOException {
        WebResearchBatch webBatch = web != null ? fileReader.readWebResearch(Paths.get(web)) : null;
        TranscriptBatch transcriptBatch = transcripts != null ? fileReader.readTranscripts(Paths.get(transcripts)) : null;
        if (webBatch == null && transcriptBatch == null) {
            log.warn("No research files given; reports will be empty");
        }
        return PipelineRequest.builder()
            .webResearch(webBatch)
            .transcripts(transcriptBatch);
    }

    private static void appendDiagnostics(StringBuilder sb, PipelineResult result) {
        if (result.getDiagnostics().isEmpty()) {
            return;
        }
        sb.append("\nDiagnostics:\n");
        result.getDiagnostics().forEach(diagnostic -> sb.append("- ").append(diagnostic).append("\n"));
    }
}
