package com.dcruver.coursepipeline.prompt;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.CourseOutline;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.Origin;
import com.dcruver.coursepipeline.domain.PromptDocument;
import com.dcruver.coursepipeline.domain.PromptDocument.SectionKind;
import com.dcruver.coursepipeline.domain.QualityDimension;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.Term;
import com.dcruver.coursepipeline.domain.TerminologyReport;
import com.dcruver.coursepipeline.domain.UsageLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Merges the course outline, research excerpts and analysis reports into one generation prompt.
 *
 * Research, quality and terminology sections appear only when their input is present: a
 * missing report never produces an empty heading. The outline and the task instructions are
 * part of every prompt, so a prompt without reports holds the outline followed by the task,
 * and the token estimate counts both. The estimate is advisory and never blocks assembly.
 */
@Component
@Slf4j
public class PromptAssembler {

    private final PipelineProperties.Prompt settings;
    private final TokenEstimator tokenEstimator;

    public PromptAssembler(PipelineProperties properties) {
        this.settings = properties.getPrompt();
        this.tokenEstimator = new TokenEstimator(settings);
    }

    public PromptDocument assemble(CourseOutline outline,
                                   Optional<QualityReport> quality,
                                   Optional<TerminologyReport> terminology,
                                   List<Document> excerpts) {
        List<PromptDocument.Section> sections = new ArrayList<>();

        sections.add(new PromptDocument.Section(SectionKind.OUTLINE, formatOutline(outline)));

        if (!excerpts.isEmpty()) {
            sections.add(new PromptDocument.Section(SectionKind.RESEARCH, formatResearch(excerpts)));
        }
        quality.map(this::formatQuality)
            .ifPresent(text -> sections.add(new PromptDocument.Section(SectionKind.QUALITY, text)));
        terminology.filter(report -> !report.isEmpty())
            .map(this::formatTerminology)
            .ifPresent(text -> sections.add(new PromptDocument.Section(SectionKind.TERMINOLOGY, text)));

        sections.add(new PromptDocument.Section(SectionKind.TASK, formatTask()));

        String text = sections.stream()
            .map(PromptDocument.Section::getText)
            .collect(Collectors.joining("\n\n"));

        TokenEstimator.Estimate estimate = tokenEstimator.estimate(text.length());

        PromptDocument.PromptDocumentBuilder builder = PromptDocument.builder()
            .text(text)
            .sections(sections)
            .estimatedTokens(estimate.getTokens())
            .tokenCeiling(estimate.getCeiling())
            .usageRatio(estimate.getRatio())
            .usageLevel(estimate.getLevel());

        if (estimate.getLevel().isWarning()) {
            String warning = estimate.getLevel() == UsageLevel.OVER_LIMIT
                ? String.format(Locale.ROOT, "Estimated prompt size (%,d tokens) exceeds the model limit of %,d tokens",
                    estimate.getTokens(), estimate.getCeiling())
                : String.format(Locale.ROOT, "Estimated prompt size (%,d tokens) is %.0f%% of the model limit",
                    estimate.getTokens(), estimate.getRatio() * 100);
            log.warn(warning);
            builder.warning(warning);
        }

        log.info("Assembled prompt for '{}': {} sections, {} characters, ~{} tokens ({})",
            outline.getCourseName(), sections.size(), text.length(), estimate.getTokens(), estimate.getLevel().getKey());

        return builder.build();
    }

    private String formatOutline(CourseOutline outline) {
        StringBuilder sb = new StringBuilder();
        String courseName = outline.getCourseName() != null ? outline.getCourseName() : "Untitled course";

        sb.append("# Course Specification\n");
        sb.append("- **Course theme**: ").append(courseName).append('\n');
        outline.learnerProfile().ifPresent(value -> sb.append("- **Learner profile**: ").append(value).append('\n'));
        outline.targetBehavior().ifPresent(value -> sb.append("- **Target behavior (goal)**: ").append(value).append('\n'));
        outline.duration().ifPresent(value -> sb.append("- **Expected duration**: ").append(value).append('\n'));
        outline.tone().ifPresent(value -> sb.append("- **Tone and manner**: ").append(value).append('\n'));

        sb.append("\n# Course Structure (follow this structure exactly)\n");
        sb.append("---\n");
        if (outline.getUnits().isEmpty()) {
            sb.append("# ").append(courseName).append("\n\n");
            sb.append("(No slides were found for this course.)\n");
        } else {
            sb.append("## Course: ").append(courseName).append('\n');
            for (CourseOutline.Unit unit : outline.getUnits()) {
                sb.append("\n### Unit ").append(unit.getNumber()).append(": ").append(unit.getName()).append('\n');
                for (CourseOutline.Slide slide : unit.getSlides()) {
                    sb.append("- Slide ").append(slide.getNumber()).append(": ").append(slide.getTitle()).append('\n');
                }
            }
        }
        sb.append("---");
        return sb.toString();
    }

    private String formatResearch(List<Document> excerpts) {
        List<Document> web = excerpts.stream().filter(doc -> doc.getOrigin() == Origin.WEB).toList();
        List<Document> video = excerpts.stream().filter(doc -> doc.getOrigin() == Origin.VIDEO).toList();

        StringBuilder sb = new StringBuilder();
        sb.append("# Research Data (reference material for this course)\n");
        sb.append("The following research makes the course content more accurate and practical.\n");
        sb.append("Use it to create current and reliable content.\n");

        if (!web.isEmpty()) {
            sb.append("\n### Web Research\n");
            sb.append(String.format(Locale.ROOT, "- Sources: %d\n", web.size()));
            sb.append(String.format(Locale.ROOT, "- Total characters: %,d\n",
                web.stream().mapToLong(Document::getCount).sum()));

            int limit = settings.isFullText() ? web.size() : Math.min(web.size(), settings.getMaxWebExcerpts());
            for (int i = 0; i < limit; i++) {
                Document doc = web.get(i);
                sb.append(String.format(Locale.ROOT, "\n**Source %d: %s**\n", i + 1, doc.getDisplayTitle()));
                sb.append("- URL: ").append(doc.getUrl()).append('\n');
                sb.append(String.format(Locale.ROOT, "- Characters: %,d\n", doc.getCount()));
                appendExcerpt(sb, doc.getText(), settings.getWebPreviewLength());
            }
            if (web.size() > limit) {
                sb.append(String.format(Locale.ROOT, "\n(%d more sources omitted)\n", web.size() - limit));
            }
        }

        if (!video.isEmpty()) {
            sb.append("\n### Video Transcripts\n");
            sb.append(String.format(Locale.ROOT, "- Videos: %d\n", video.size()));
            sb.append(String.format(Locale.ROOT, "- Total words: %,d\n",
                video.stream().mapToLong(Document::getCount).sum()));
            sb.append(String.format(Locale.ROOT, "- Total duration: %.1f min\n",
                video.stream().mapToDouble(Document::getDurationMinutes).sum()));

            int limit = settings.isFullText() ? video.size() : Math.min(video.size(), settings.getMaxVideoExcerpts());
            for (int i = 0; i < limit; i++) {
                Document doc = video.get(i);
                sb.append(String.format(Locale.ROOT, "\n**Video %d: %s**\n", i + 1, doc.getSourceId()));
                sb.append("- URL: ").append(doc.getUrl()).append('\n');
                sb.append("- Language: ").append(doc.getLanguage() != null ? doc.getLanguage() : "N/A").append('\n');
                sb.append(String.format(Locale.ROOT, "- Words: %,d\n", doc.getCount()));
                sb.append(String.format(Locale.ROOT, "- Duration: %.1f min\n", doc.getDurationMinutes()));
                appendExcerpt(sb, doc.getText(), settings.getVideoPreviewLength());
            }
            if (video.size() > limit) {
                sb.append(String.format(Locale.ROOT, "\n(%d more videos omitted)\n", video.size() - limit));
            }
        }

        sb.append("\n---");
        return sb.toString();
    }

    private void appendExcerpt(StringBuilder sb, String text, int previewLength) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (settings.isFullText()) {
            sb.append("- Full text:\n").append(text).append('\n');
        } else {
            sb.append("- Excerpt: ").append(preview(text, previewLength)).append('\n');
        }
    }

    /**
     * Leading slice of at most {@code length} code points, with an ellipsis when cut
     */
    static String preview(String text, int length) {
        if (text.codePointCount(0, text.length()) <= length) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, length)) + "...";
    }

    private String formatQuality(QualityReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Research Quality\n");
        sb.append("Use the following quality analysis as guidance for accurate, educationally valuable content.\n\n");

        sb.append(String.format(Locale.ROOT, "**Quality rating**: %s (%d / %d)\n",
            report.getTier().getLabel(),
            report.getTotalScore(),
            QualityDimension.values().length * QualityDimension.MAX_SCORE));
        if (report.getSummary() != null) {
            sb.append(String.format(Locale.ROOT, "- Numeric data points: %d\n", report.getSummary().getNumericMentions()));
            sb.append(String.format(Locale.ROOT, "- Credible sources: %d\n", report.getSummary().getCredibleSources()));
        }

        List<String> recommendations = report.getRecommendations().stream()
            .limit(settings.getQualityRecommendations())
            .toList();
        if (!recommendations.isEmpty()) {
            sb.append("\n**Quality notes**:\n");
            recommendations.forEach(rec -> sb.append("- ").append(rec).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private String formatTerminology(TerminologyReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Key Terminology\n");
        sb.append(String.format(Locale.ROOT, "- Key terms detected: %d\n", report.getTotalUniqueTerms()));

        String categories = report.getCategoryCounts().entrySet().stream()
            .filter(entry -> entry.getValue() > 0)
            .map(entry -> entry.getKey().getKey() + ": " + entry.getValue())
            .collect(Collectors.joining(", "));
        if (!categories.isEmpty()) {
            sb.append("- Category distribution: ").append(categories).append('\n');
        }

        String phases = report.getPhaseCounts().entrySet().stream()
            .filter(entry -> entry.getValue() > 0)
            .map(entry -> entry.getKey().getLabel() + ": " + entry.getValue())
            .collect(Collectors.joining(", "));
        if (!phases.isEmpty()) {
            sb.append("- Learning phase distribution: ").append(phases).append('\n');
        }

        List<Term> highlighted = report.getTopTerms().stream()
            .limit(settings.getHighlightedTerms())
            .toList();
        if (!highlighted.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "\n**Top %d terms that must be explained**:\n", highlighted.size()));
            sb.append(highlighted.stream().map(Term::getSurfaceForm).collect(Collectors.joining(", "))).append('\n');
            sb.append("\n→ Define these terms clearly and explain them at the right point in the course.\n");
        }

        List<String> recommendations = report.getRecommendations().stream()
            .limit(settings.getTerminologyRecommendations())
            .toList();
        if (!recommendations.isEmpty()) {
            sb.append("\n**Terminology recommendations**:\n");
            recommendations.forEach(rec -> sb.append("- ").append(rec).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private String formatTask() {
        int wordsPerMinute = settings.getNarrationWordsPerMinute();
        double wordsPerSecond = wordsPerMinute / 60.0;

        return """
            # Your Task
            Generate both "Part 1" and "Part 2" below, in this order.

            ---
            ## Part 1: Visual slide design blueprint

            Following the format below, describe the visual design of every slide in Markdown.
            This blueprint is the instruction sheet a designer uses to build the slides. Aim for a modern, easy-to-read design.

            ### Unit [unit number]: [unit name]

            **Slide [slide number]: [slide title]**
            - **Layout**: the overall composition of the slide.
            - **Key visual**: the central graphic element, described concretely.
            - **Slide text**: the exact text on the slide. Apart from the title, keep to 3-5 short bullet points or keywords.
            - **Colors**: two or three base colors for the slide.

            ---
            ## Part 2: Timestamped narration and subtitle script

            Generate the narration and the video subtitles as a Markdown table in the format below.

            ### Script rules
            1. **Timing**: assume a narration speed of %d words per minute (%s words per second) and compute each block's start and end time from its word count.
            2. **Subtitle blocks**: split the full narration into short blocks that make sense on their own. Each subtitle must fit in **at most two lines**.
            3. **Timestamp format**: write times as `MM:SS` (for example `00:08`, `02:15`).

            ### Output format (Markdown table)

            | Slide | Start | End | Subtitle (max. 2 lines) | Full narration (spoken style) |
            |---|---|---|---|---|
            | 1 | 00:00 | 00:05 | ... | ... |
            """.formatted(wordsPerMinute, String.format(Locale.ROOT, "%.1f", wordsPerSecond)).stripTrailing();
    }
}
