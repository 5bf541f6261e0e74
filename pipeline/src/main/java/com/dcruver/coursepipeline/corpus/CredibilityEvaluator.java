package com.dcruver.coursepipeline.corpus;

import com.dcruver.coursepipeline.domain.CredibilityLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Rates a source URL against the configured credible-domain patterns.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CredibilityEvaluator {

    private final CredibleDomains domains;

    /**
     * HIGH or MEDIUM when the URL host matches a pattern of that list, LOW otherwise.
     * UNKNOWN when the URL is missing or has no parseable host.
     */
    public CredibilityLevel evaluate(String url) {
        if (url == null || url.isBlank()) {
            return CredibilityLevel.UNKNOWN;
        }

        Optional<String> parsed = host(url);
        if (parsed.isEmpty()) {
            return CredibilityLevel.UNKNOWN;
        }
        String host = parsed.get().toLowerCase(Locale.ROOT);

        if (domains.getHighTrust().stream().anyMatch(pattern -> matches(host, pattern))) {
            return CredibilityLevel.HIGH;
        }
        if (domains.getReference().stream().anyMatch(pattern -> matches(host, pattern))) {
            return CredibilityLevel.MEDIUM;
        }
        return CredibilityLevel.LOW;
    }

    /**
     * ".gov" matches "gov" and any host ending in ".gov"; "github.com" matches itself and its subdomains
     */
    static boolean matches(String host, String pattern) {
        if (pattern.startsWith(".")) {
            return host.endsWith(pattern) || host.equals(pattern.substring(1));
        }
        return host.equals(pattern) || host.endsWith("." + pattern);
    }

    /**
     * A URL is valid when it has both a scheme and a host
     */
    public boolean isValidUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (Exception e) {
            log.debug("Invalid URL {}: {}", url, e.getMessage());
            return false;
        }
    }

    private Optional<String> host(String url) {
        try {
            return Optional.ofNullable(new URI(url.trim()).getHost());
        } catch (Exception e) {
            log.debug("Could not parse host of {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
