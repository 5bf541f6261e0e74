package com.dcruver.coursepipeline.corpus;

import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.Origin;
import com.dcruver.coursepipeline.io.TranscriptBatch;
import com.dcruver.coursepipeline.io.TranscriptRecord;
import com.dcruver.coursepipeline.io.WebResearchBatch;
import com.dcruver.coursepipeline.io.WebResearchRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Merges web research and video transcripts into one ordered corpus.
 * Web documents come first, then transcripts, each in input order.
 * Records missing their text or any identifier are skipped with a warning.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CorpusNormalizer {

    private static final String VIDEO_URL_PREFIX = "https://www.youtube.com/watch?v=";

    private final NumericDataDetector numericDataDetector;
    private final CredibilityEvaluator credibilityEvaluator;

    public Corpus normalize(Optional<WebResearchBatch> web, Optional<TranscriptBatch> video) {
        List<Document> documents = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<WebResearchRecord> sources = web.map(WebResearchBatch::getSources).orElse(List.of());
        for (int i = 0; i < sources.size(); i++) {
            normalizeWeb(sources.get(i), i + 1, warnings).ifPresent(documents::add);
        }

        List<TranscriptRecord> transcripts = video.map(TranscriptBatch::getTranscriptions).orElse(List.of());
        for (int i = 0; i < transcripts.size(); i++) {
            normalizeVideo(transcripts.get(i), i + 1, warnings).ifPresent(documents::add);
        }

        log.info("Normalized corpus: {} documents ({} web, {} video), {} skipped",
            documents.size(),
            documents.stream().filter(doc -> doc.getOrigin() == Origin.WEB).count(),
            documents.stream().filter(doc -> doc.getOrigin() == Origin.VIDEO).count(),
            warnings.size());

        return new Corpus(documents, warnings);
    }

    private Optional<Document> normalizeWeb(WebResearchRecord record, int index, List<String> warnings) {
        if (record == null) {
            return skip(warnings, "Web source #%d is empty", index);
        }
        if (record.getContent() == null) {
            return skip(warnings, "Web source #%d (%s) has no content", index, record.getUrl());
        }
        if (isBlank(record.getUrl())) {
            return skip(warnings, "Web source #%d (%s) has no URL", index, record.getTitle());
        }

        String text = record.getContent();
        int count = record.getCharacterCount() != null ? record.getCharacterCount() : text.length();

        Document document = Document.builder()
            .sourceId("web-" + index)
            .origin(Origin.WEB)
            .url(record.getUrl())
            .title(isBlank(record.getTitle()) ? null : record.getTitle())
            .text(text)
            .count(count)
            .credibility(credibilityEvaluator.evaluate(record.getUrl()))
            .numericMentions(numericDataDetector.count(text))
            .extractionDate(record.getExtractionDate())
            .build();

        log.debug("Web source {}: {} chars, {} numeric mentions, credibility {}",
            document.getUrl(), count, document.getNumericMentions(), document.getCredibility());
        return Optional.of(document);
    }

    private Optional<Document> normalizeVideo(TranscriptRecord record, int index, List<String> warnings) {
        if (record == null) {
            return skip(warnings, "Transcript #%d is empty", index);
        }
        if (record.getText() == null) {
            return skip(warnings, "Transcript #%d (%s) has no text", index, record.getVideoId());
        }
        if (isBlank(record.getVideoId()) && isBlank(record.getSourceUrl())) {
            return skip(warnings, "Transcript #%d has neither a video id nor a source URL", index);
        }

        String text = record.getText();
        String url = !isBlank(record.getSourceUrl()) ? record.getSourceUrl() : VIDEO_URL_PREFIX + record.getVideoId();
        String sourceId = !isBlank(record.getVideoId()) ? record.getVideoId() : "video-" + index;
        int count = record.getWordCount() != null ? record.getWordCount() : text.length();

        Document document = Document.builder()
            .sourceId(sourceId)
            .origin(Origin.VIDEO)
            .url(url)
            .text(text)
            .count(count)
            .credibility(credibilityEvaluator.evaluate(url))
            .numericMentions(numericDataDetector.count(text))
            .language(record.getLanguage())
            .durationSeconds(record.resolveDurationSeconds())
            .segmentCount(record.getSegments().size())
            .build();

        log.debug("Transcript {}: {} words, {} numeric mentions",
            sourceId, count, document.getNumericMentions());
        return Optional.of(document);
    }

    private static Optional<Document> skip(List<String> warnings, String format, Object... args) {
        String warning = String.format(format, args) + "; record skipped";
        log.warn(warning);
        warnings.add(warning);
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
