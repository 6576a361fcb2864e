package dev.sitemapper.crawl;

import java.util.Locale;

/**
 * Static utility deciding whether a URL is eligible for crawling within a {@link CrawlScope}.
 * Callers pass URLs that are already normalized; the filter never normalizes.
 */
public final class CrawlFilter {

    private CrawlFilter() {
        // utility class
    }

    /**
     * Check whether a URL passes the scope rules.
     * <p>
     * Both rules must pass:
     * <ol>
     *   <li>The URL authority (host and optional port) equals the scope domain's authority exactly.
     *       No subdomain matching.</li>
     *   <li>The lowercased URL contains none of the exclusion patterns. This is a plain substring
     *       test, so {@code /login} also rejects {@code /login-help}.</li>
     * </ol>
     *
     * @param url the candidate URL
     * @param scope the crawl scope with domain and exclusion patterns
     * @return true if the URL may be crawled
     */
    public static boolean isAllowed(String url, CrawlScope scope) {
        if (url == null || url.isBlank()) {
            return false;
        }

        String authority = UrlNormalizer.authorityOf(url);
        if (authority.isEmpty() || !authority.equals(UrlNormalizer.authorityOf(scope.domain()))) {
            return false;
        }

        String lowered = url.toLowerCase(Locale.ROOT);
        for (String pattern : scope.excludedPatterns()) {
            if (lowered.contains(pattern)) {
                return false;
            }
        }
        return true;
    }
}
