package dev.sitemapper.crawl;

import java.util.UUID;

/**
 * Outcome of one crawl run: the filled store plus the final progress counters.
 *
 * @param runId    the crawl run
 * @param store    pages recorded during the run
 * @param progress final progress snapshot
 */
public record CrawlSiteResult(UUID runId, SitemapStore store, CrawlProgress progress) {}
