package com.dcruver.coursepipeline.prompt;

import com.dcruver.coursepipeline.config.PipelineProperties;
import com.dcruver.coursepipeline.domain.UsageLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    private TokenEstimator estimator;

    @BeforeEach
    void setUp() {
        PipelineProperties.Prompt settings = new PipelineProperties.Prompt();
        settings.setTokenCeiling(1_000);
        estimator = new TokenEstimator(settings);
    }

    @Test
    void testTokensRoundUp() {
        assertEquals(0, estimator.estimate(0).getTokens());
        assertEquals(1, estimator.estimate(1).getTokens());
        assertEquals(250, estimator.estimate(1_000).getTokens());
        assertEquals(251, estimator.estimate(1_001).getTokens());
    }

    @Test
    void testUsageLevelsFollowBreakpoints() {
        assertEquals(UsageLevel.COMFORTABLE, estimator.estimate(996).getLevel());
        assertEquals(UsageLevel.FINE, estimator.estimate(1_000).getLevel());
        assertEquals(UsageLevel.CAUTION, estimator.estimate(2_000).getLevel());
        assertEquals(UsageLevel.HIGH, estimator.estimate(3_000).getLevel());
        assertEquals(UsageLevel.OVER_LIMIT, estimator.estimate(4_000).getLevel());
        assertEquals(UsageLevel.OVER_LIMIT, estimator.estimate(40_000).getLevel());
    }

    @Test
    void testRatioIsTokensOverCeiling() {
        TokenEstimator.Estimate estimate = estimator.estimate(2_000);

        assertEquals(500, estimate.getTokens());
        assertEquals(1_000, estimate.getCeiling());
        assertEquals(0.5, estimate.getRatio(), 1e-9);
        assertFalse(estimate.getLevel().isWarning());
        assertTrue(estimator.estimate(3_000).getLevel().isWarning());
    }
}
