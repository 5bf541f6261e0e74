package com.dcruver.coursepipeline.corpus;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Host patterns that mark a source as credible. High-trust patterns cover government,
 * academic, encyclopedic and preprint hosts; reference patterns are whitelisted
 * trade press and developer sites. Patterns match the lower-case host on label boundaries:
 * a leading dot marks a suffix, a bare domain also covers its subdomains.
 */
@Value
public class CredibleDomains {
    List<String> highTrust;
    List<String> reference;

    public CredibleDomains(List<String> highTrust, List<String> reference) {
        this.highTrust = normalize(highTrust);
        this.reference = normalize(reference);
    }

    public static CredibleDomains defaults() {
        return new CredibleDomains(
            List.of("wikipedia.org", ".gov", ".edu", ".go.jp", ".ac.jp", ".ac.uk",
                "scholar.google.com", "researchgate.net", "arxiv.org"),
            List.of("itmedia.co.jp", "nikkei.com", "diamond.jp", "forbes.com",
                "techcrunch.com", "qiita.com", "zenn.dev", "github.com"));
    }

    /**
     * Copy with extra patterns appended to each list
     */
    public CredibleDomains withAdditional(List<String> extraHighTrust, List<String> extraReference) {
        List<String> high = new ArrayList<>(highTrust);
        high.addAll(extraHighTrust);
        List<String> ref = new ArrayList<>(reference);
        ref.addAll(extraReference);
        return new CredibleDomains(high, ref);
    }

    private static List<String> normalize(List<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream()
            .filter(pattern -> pattern != null && !pattern.isBlank())
            .map(pattern -> pattern.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    }
}
