package com.dcruver.coursepipeline.prompt;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.BucketTable;
import com.dcruver.coursepipeline.domain.UsageLevel;
import lombok.Value;

import java.util.List;

/**
 * Character-count heuristic for prompt token cost: a fixed characters-per-token ratio
 * against a fixed model ceiling. No real tokenizer is involved.
 */
public class TokenEstimator {

    private final double charsPerToken;
    private final long tokenCeiling;
    private final BucketTable<UsageLevel> usageTable;

    public TokenEstimator(PipelineProperties.Prompt settings) {
        this.charsPerToken = settings.getCharsPerToken();
        this.tokenCeiling = settings.getTokenCeiling();

        List<Double> breakpoints = settings.getUsageBreakpoints();
        this.usageTable = BucketTable.<UsageLevel>builder()
            .bucket(Double.NEGATIVE_INFINITY, UsageLevel.COMFORTABLE)
            .bucket(breakpoints.get(0), UsageLevel.FINE)
            .bucket(breakpoints.get(1), UsageLevel.CAUTION)
            .bucket(breakpoints.get(2), UsageLevel.HIGH)
            .bucket(breakpoints.get(3), UsageLevel.OVER_LIMIT)
            .build();
    }

    public Estimate estimate(int characters) {
        long tokens = (long) Math.ceil(characters / charsPerToken);
        double ratio = (double) tokens / tokenCeiling;
        return new Estimate(tokens, tokenCeiling, ratio, usageTable.classify(ratio));
    }

    @Value
    public static class Estimate {
        long tokens;
        long ceiling;
        double ratio;
        UsageLevel level;
    }
}
