package dev.sitemapper.crawl;

import java.util.List;
import java.util.Locale;

/**
 * Immutable crawl boundary: the domain whose authority bounds the crawl and the substrings that
 * exclude a URL. Exclusion patterns are lowercased on construction since matching runs against
 * the lowercased URL.
 */
public record CrawlScope(String domain, List<String> excludedPatterns) {

    public CrawlScope {
        excludedPatterns = excludedPatterns == null
                ? List.of()
                : excludedPatterns.stream()
                        .filter(pattern -> pattern != null && !pattern.isEmpty())
                        .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                        .toList();
    }

    /**
     * Creates a scope with no exclusion patterns.
     *
     * @param domain absolute URL whose authority bounds the crawl
     * @return scope that only enforces the domain boundary
     */
    public static CrawlScope forDomain(String domain) {
        return new CrawlScope(domain, List.of());
    }

    /**
     * Builds a CrawlScope from the bound crawl configuration.
     *
     * @param properties the crawl configuration
     * @return scope reflecting the configured domain and exclusion patterns
     */
    public static CrawlScope fromProperties(CrawlProperties properties) {
        return new CrawlScope(properties.domain(), properties.excludedPatterns());
    }
}
