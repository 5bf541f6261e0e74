package com.dcruver.coursepipeline.config;

import com.dcruver.coursepipeline.corpus.CredibleDomains;
import com.dcruver.coursepipeline.terminology.TerminologyTaxonomy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Beans built from {@link PipelineProperties}: the classification taxonomies,
 * the analysis executor and the JSON mapper shared by readers and writers.
 */
@Configuration
@Slf4j
public class PipelineConfiguration {

    @Bean
    public TerminologyTaxonomy terminologyTaxonomy(PipelineProperties properties) {
        List<String> extra = properties.getTerminology().getAdditionalStopTerms();
        if (!extra.isEmpty()) {
            log.info("Adding {} configured stop terms to the default taxonomy", extra.size());
        }
        return TerminologyTaxonomy.defaults().toBuilder()
            .stopTerms(extra)
            .build();
    }

    @Bean
    public CredibleDomains credibleDomains(PipelineProperties properties) {
        PipelineProperties.Credibility credibility = properties.getCredibility();
        return CredibleDomains.defaults()
            .withAdditional(credibility.getAdditionalHighTrust(), credibility.getAdditionalReference());
    }

    @Bean("analysisTaskExecutor")
    public Executor analysisTaskExecutor(PipelineProperties properties) {
        PipelineProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("Analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    /**
     * snake_case JSON with ISO-8601 dates and {@code Optional} support
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .addModule(new Jdk8Module())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }
}
