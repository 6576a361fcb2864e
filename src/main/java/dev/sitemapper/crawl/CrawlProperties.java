package dev.sitemapper.crawl;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crawl configuration bound from {@code sitemapper.*}.
 *
 * <p>{@code domain} defaults to the start URL when omitted. Values are validated on binding; the
 * application fails to start if a required value is missing or a bound is out of range.
 */
@ConfigurationProperties(prefix = "sitemapper")
public record CrawlProperties(
    String startUrl,
    String domain,
    String outputDir,
    int workers,
    int maxConcurrentFetches,
    Duration fetchTimeout,
    String userAgent,
    List<String> excludedPatterns) {

  public CrawlProperties {
    if (startUrl == null || startUrl.isBlank()) {
      throw new IllegalArgumentException("sitemapper.start-url must be set");
    }
    if (domain == null || domain.isBlank()) {
      domain = startUrl;
    }
    if (UrlNormalizer.authorityOf(domain).isEmpty()) {
      throw new IllegalArgumentException(
          "sitemapper.domain must be an absolute URL, got: " + domain);
    }
    if (!UrlNormalizer.authorityOf(startUrl).equals(UrlNormalizer.authorityOf(domain))) {
      throw new IllegalArgumentException(
          "sitemapper.start-url must be on the crawl domain " + domain + ", got: " + startUrl);
    }
    if (workers < 1) {
      throw new IllegalArgumentException("sitemapper.workers must be >= 1, got: " + workers);
    }
    if (maxConcurrentFetches < 1) {
      throw new IllegalArgumentException(
          "sitemapper.max-concurrent-fetches must be >= 1, got: " + maxConcurrentFetches);
    }
    if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
      throw new IllegalArgumentException(
          "sitemapper.fetch-timeout must be positive, got: " + fetchTimeout);
    }
    outputDir = outputDir == null || outputDir.isBlank() ? "sitemaps" : outputDir;
    userAgent = userAgent == null || userAgent.isBlank() ? "sitemapper/1.0" : userAgent;
    excludedPatterns = excludedPatterns == null ? List.of() : List.copyOf(excludedPatterns);
  }
}
