package com.dcruver.coursepipeline.pipeline;

import com.dcruver.coursepipeline.corpus.CorpusNormalizer;
import com.dcruver.coursepipeline.domain.Corpus;
import com.dcruver.coursepipeline.domain.Document;
import com.dcruver.coursepipeline.domain.PromptDocument;
import com.dcruver.coursepipeline.domain.QualityReport;
import com.dcruver.coursepipeline.domain.TerminologyReport;
import com.dcruver.coursepipeline.prompt.PromptAssembler;
import com.dcruver.coursepipeline.quality.QualityScorer;
import com.dcruver.coursepipeline.terminology.TerminologyExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one generation request end to end.
 *
 * Normalization happens first. Quality scoring and terminology extraction only read the
 * immutable corpus, so they run concurrently on the analysis executor; prompt assembly
 * waits for both.
 */
@Service
@Slf4j
public class ResearchPipeline {

    private final CorpusNormalizer normalizer;
    private final QualityScorer qualityScorer;
    private final TerminologyExtractor terminologyExtractor;
    private final PromptAssembler promptAssembler;
    private final Executor executor;

    public ResearchPipeline(CorpusNormalizer normalizer,
                            QualityScorer qualityScorer,
                            TerminologyExtractor terminologyExtractor,
                            PromptAssembler promptAssembler,
                            @Qualifier("analysisTaskExecutor") Executor executor) {
        this.normalizer = normalizer;
        this.qualityScorer = qualityScorer;
        this.terminologyExtractor = terminologyExtractor;
        this.promptAssembler = promptAssembler;
        this.executor = executor;
    }

    public PipelineResult run(PipelineRequest request) {
        log.info("Starting pipeline run (quality={}, terminology={}, outline={})",
            request.isScoreQuality(), request.isAnalyzeTerminology(), request.getOutline().isPresent());

        Corpus corpus = normalizer.normalize(request.getWebResearch(), request.getTranscripts());

        CompletableFuture<Optional<QualityReport>> quality = request.isScoreQuality()
            ? CompletableFuture.supplyAsync(() -> Optional.of(qualityScorer.score(corpus)), executor)
            : CompletableFuture.completedFuture(Optional.empty());

        CompletableFuture<Optional<TerminologyReport>> terminology = request.isAnalyzeTerminology()
            ? CompletableFuture.supplyAsync(
                () -> Optional.of(terminologyExtractor.analyze(corpus, request.getCourseTheme())), executor)
            : CompletableFuture.completedFuture(Optional.empty());

        Optional<QualityReport> qualityReport = await(quality);
        Optional<TerminologyReport> terminologyReport = await(terminology);

        List<Document> excerpts = request.isIncludeExcerpts() ? corpus.getDocuments() : List.of();
        Optional<PromptDocument> prompt = request.getOutline()
            .map(outline -> promptAssembler.assemble(outline, qualityReport, terminologyReport, excerpts));

        PipelineResult.PipelineResultBuilder result = PipelineResult.builder()
            .corpus(corpus)
            .quality(qualityReport.orElse(null))
            .terminology(terminologyReport.orElse(null))
            .prompt(prompt.orElse(null))
            .diagnostics(corpus.getWarnings())
            .generatedAt(Instant.now());
        prompt.ifPresent(document -> result.diagnostics(document.getWarnings()));

        log.info("Pipeline run finished: {} documents, quality={}, terms={}, prompt tokens={}",
            corpus.size(),
            qualityReport.map(report -> report.getTier().getKey()).orElse("skipped"),
            terminologyReport.map(report -> String.valueOf(report.getTopTerms().size())).orElse("skipped"),
            prompt.map(document -> String.valueOf(document.getEstimatedTokens())).orElse("none"));

        return result.build();
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
