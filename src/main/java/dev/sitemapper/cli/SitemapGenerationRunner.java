package dev.sitemapper.cli;

import dev.sitemapper.crawl.CrawlEngine;
import dev.sitemapper.crawl.CrawlProperties;
import dev.sitemapper.crawl.CrawlScope;
import dev.sitemapper.crawl.CrawlSiteResult;
import dev.sitemapper.snapshot.ChangeSet;
import dev.sitemapper.snapshot.SnapshotResult;
import dev.sitemapper.snapshot.SnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command line adapter: crawls the configured site once, persists the snapshot and prints the
 * run summary.
 *
 * <p>A {@link dev.sitemapper.snapshot.SnapshotWriteException} is not caught here; it aborts the
 * application with a non-zero exit status.
 */
@Component
@ConditionalOnProperty(
    prefix = "sitemapper.runner",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SitemapGenerationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SitemapGenerationRunner.class);

  private final CrawlEngine crawlEngine;
  private final SnapshotService snapshotService;
  private final CrawlProperties properties;

  public SitemapGenerationRunner(
      CrawlEngine crawlEngine, SnapshotService snapshotService, CrawlProperties properties) {
    this.crawlEngine = crawlEngine;
    this.snapshotService = snapshotService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info("Starting sitemap generation for {} (domain: {})",
        properties.startUrl(), properties.domain());

    CrawlSiteResult result =
        crawlEngine.crawl(properties.startUrl(), CrawlScope.fromProperties(properties));
    SnapshotResult snapshot = snapshotService.save(result.store());

    logSummary(result, snapshot);
  }

  private void logSummary(CrawlSiteResult result, SnapshotResult snapshot) {
    if (snapshot.hasChanges()) {
      ChangeSet changes = snapshot.changes();
      log.info("Changes summary:");
      log.info("  New URLs: {}", changes.newUrls().size());
      log.info("  Removed URLs: {}", changes.removedUrls().size());
      log.info("  URL count change: {}", String.format("%+d", changes.urlCountChange()));
      log.info("  Changes: {}", snapshot.changesJson());
    }
    log.info("Sitemaps saved:");
    log.info("  XML: {}", snapshot.sitemapXml());
    log.info("  JSON: {}", snapshot.snapshotJson());
    log.info("  Total URLs: {} ({} claimed, {} without content, status {})",
        result.store().size(),
        result.progress().pagesClaimed(),
        result.progress().pagesFailed(),
        result.progress().status());
  }
}
