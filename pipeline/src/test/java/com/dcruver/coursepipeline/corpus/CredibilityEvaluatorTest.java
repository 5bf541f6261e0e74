package com.dcruver.coursepipeline.corpus;

import com.dcruver.coursepipeline.domain.CredibilityLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CredibilityEvaluatorTest {

    private CredibilityEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new CredibilityEvaluator(CredibleDomains.defaults());
    }

    @Test
    void testGovernmentAndAcademicHostsAreHighTrust() {
        assertEquals(CredibilityLevel.HIGH, evaluator.evaluate("https://www.digital.go.jp/policy/ai"));
        assertEquals(CredibilityLevel.HIGH, evaluator.evaluate("https://www.nist.gov/ai"));
        assertEquals(CredibilityLevel.HIGH, evaluator.evaluate("https://en.wikipedia.org/wiki/ChatGPT"));
        assertEquals(CredibilityLevel.HIGH, evaluator.evaluate("https://arxiv.org/abs/2303.08774"));
    }

    @Test
    void testReferenceSitesAreMedium() {
        assertEquals(CredibilityLevel.MEDIUM, evaluator.evaluate("https://qiita.com/items/abc"));
        assertEquals(CredibilityLevel.MEDIUM, evaluator.evaluate("https://github.com/openai"));
    }

    @Test
    void testOnlyTheHostIsMatched() {
        // The path mentions a high-trust domain, the host does not
        assertEquals(CredibilityLevel.LOW, evaluator.evaluate("https://blog.example.com/wikipedia.org-review"));
    }

    @Test
    void testPatternsMatchOnLabelBoundaries() {
        assertEquals(CredibilityLevel.LOW, evaluator.evaluate("https://foo.education.com/course"));
        assertEquals(CredibilityLevel.LOW, evaluator.evaluate("https://x.gov.evil.com/"));
        assertEquals(CredibilityLevel.LOW, evaluator.evaluate("https://notgithub.com/repo"));
        assertEquals(CredibilityLevel.HIGH, evaluator.evaluate("https://cs.stanford.edu/"));
        assertEquals(CredibilityLevel.MEDIUM, evaluator.evaluate("https://gist.github.com/abc"));
        assertEquals(CredibilityLevel.HIGH, evaluator.evaluate("https://scholar.google.com/scholar?q=llm"));
    }

    @Test
    void testMissingUrlIsUnknown() {
        assertEquals(CredibilityLevel.UNKNOWN, evaluator.evaluate(null));
        assertEquals(CredibilityLevel.UNKNOWN, evaluator.evaluate("  "));
    }

    @Test
    void testUrlWithoutHostIsUnknown() {
        assertEquals(CredibilityLevel.UNKNOWN, evaluator.evaluate("notes/offline-copy.html"));
        assertEquals(CredibilityLevel.UNKNOWN, evaluator.evaluate("https://exa mple.com"));
    }

    @Test
    void testAdditionalDomainsExtendDefaults() {
        CredibleDomains domains = CredibleDomains.defaults()
            .withAdditional(List.of("Example.NET"), List.of("blog.example.com"));
        CredibilityEvaluator extended = new CredibilityEvaluator(domains);

        assertEquals(CredibilityLevel.HIGH, extended.evaluate("https://news.example.net/article"));
        assertEquals(CredibilityLevel.MEDIUM, extended.evaluate("https://blog.example.com/post"));
        assertEquals(CredibilityLevel.HIGH, extended.evaluate("https://www.digital.go.jp/"));
    }

    @Test
    void testUrlValidityNeedsSchemeAndHost() {
        assertTrue(evaluator.isValidUrl("https://example.com/page"));
        assertFalse(evaluator.isValidUrl("example.com/page"));
        assertFalse(evaluator.isValidUrl("https://exa mple.com"));
        assertFalse(evaluator.isValidUrl(null));
    }
}
