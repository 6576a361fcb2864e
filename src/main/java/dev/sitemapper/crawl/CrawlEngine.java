package dev.sitemapper.crawl;

import dev.sitemapper.priority.PriorityClassifier;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Concurrent crawl scheduler. Owns the frontier, the visited set and a fixed pool of workers, and
 * drives {@link PageFetcher} and {@link LinkExtractor} until the frontier drains.
 *
 * <p>Concurrency is bounded twice: {@code sitemapper.workers} threads poll the frontier, and an
 * admission gate of {@code sitemapper.max-concurrent-fetches} permits caps the fetches in flight.
 * When the gate is smaller than the pool, the gate is the binding limit.
 *
 * <p>A URL may sit in the frontier several times; it is claimed at most once, by the worker whose
 * {@code visited.add()} succeeds. Workers stop when the frontier is empty and no URL is pending
 * anywhere, so a worker that finds the queue momentarily empty while another one is still fetching
 * keeps polling instead of leaving early.
 */
@Service
public class CrawlEngine {

  private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

  /** How long an idle worker waits on the frontier before re-checking for termination. */
  private static final long IDLE_POLL_MILLIS = 25;

  private final PageFetcher pageFetcher;
  private final LinkExtractor linkExtractor;
  private final PriorityClassifier priorityClassifier;
  private final CrawlProgressTracker progressTracker;
  private final Clock clock;
  private final int workers;
  private final int maxConcurrentFetches;

  public CrawlEngine(
      PageFetcher pageFetcher,
      LinkExtractor linkExtractor,
      PriorityClassifier priorityClassifier,
      CrawlProgressTracker progressTracker,
      Clock clock,
      CrawlProperties properties) {
    this.pageFetcher = pageFetcher;
    this.linkExtractor = linkExtractor;
    this.priorityClassifier = priorityClassifier;
    this.progressTracker = progressTracker;
    this.clock = clock;
    this.workers = properties.workers();
    this.maxConcurrentFetches = properties.maxConcurrentFetches();
  }

  /**
   * Crawl every page reachable from the start URL inside the scope.
   *
   * @param startUrl the URL to seed the frontier with (normalized before use)
   * @param scope the domain boundary and exclusion patterns
   * @return the recorded pages with the run's final progress
   */
  public CrawlSiteResult crawl(String startUrl, CrawlScope scope) {
    UUID runId = UUID.randomUUID();
    CrawlRun run = new CrawlRun(runId, scope, new Semaphore(maxConcurrentFetches));
    progressTracker.startCrawl(runId);

    String seed = UrlNormalizer.normalize(startUrl);
    log.info(
        "Starting crawl {} of {} (workers={}, maxConcurrentFetches={})",
        runId,
        seed,
        workers,
        maxConcurrentFetches);
    run.enqueue(seed);

    ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
    List<Callable<Void>> tasks = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      tasks.add(
          () -> {
            runWorker(run);
            return null;
          });
    }

    try {
      executor.invokeAll(tasks);
      progressTracker.completeCrawl(runId);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Crawl {} interrupted with {} URLs still queued", runId, run.frontier.size());
      progressTracker.interruptCrawl(runId);
    } finally {
      executor.shutdownNow();
    }

    CrawlProgress progress = progressTracker.getProgress(runId).orElseThrow();
    progressTracker.removeCrawl(runId);
    log.info(
        "Crawl complete: {} pages recorded, {} URLs claimed, {} without content",
        run.store.size(),
        progress.pagesClaimed(),
        progress.pagesFailed());
    return new CrawlSiteResult(runId, run.store, progress);
  }

  private void runWorker(CrawlRun run) throws InterruptedException {
    while (true) {
      String url = run.frontier.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
      if (url == null) {
        if (run.pending.get() == 0) {
          return;
        }
        continue;
      }
      try {
        processUrl(run, url);
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        log.error("Error crawling {}: {}", url, e.getMessage(), e);
      } finally {
        run.pending.decrementAndGet();
      }
    }
  }

  private void processUrl(CrawlRun run, String queuedUrl) throws InterruptedException {
    String url = UrlNormalizer.normalize(queuedUrl);

    if (!run.visited.add(url)) {
      progressTracker.recordDuplicate(run.runId);
      return;
    }
    int claimed = progressTracker.recordClaimed(run.runId);
    log.info("Crawling: {} ({} URLs found)", url, claimed);

    String html = fetchAdmitted(run, url);
    if (html == null) {
      progressTracker.recordFailure(run.runId);
      return;
    }

    run.store.record(
        new PageRecord(url, LocalDate.now(clock), priorityClassifier.classify(url)));
    progressTracker.recordPageRecorded(run.runId);

    for (String link : linkExtractor.extract(html, url, run.scope)) {
      if (!run.visited.contains(link)) {
        run.enqueue(link);
      }
    }
  }

  private @Nullable String fetchAdmitted(CrawlRun run, String url) throws InterruptedException {
    run.admissionGate.acquire();
    try {
      return pageFetcher.fetch(url);
    } finally {
      run.admissionGate.release();
    }
  }

  /** Shared mutable state of one crawl run; discarded when the run ends. */
  private static final class CrawlRun {

    private final UUID runId;
    private final CrawlScope scope;
    private final Semaphore admissionGate;
    private final BlockingQueue<String> frontier = new LinkedBlockingQueue<>();
    private final Set<String> visited = ConcurrentHashMap.newKeySet();
    private final SitemapStore store = new SitemapStore();

    /** Queued plus in-process URLs; the run is over when this reaches zero. */
    private final AtomicInteger pending = new AtomicInteger();

    private CrawlRun(UUID runId, CrawlScope scope, Semaphore admissionGate) {
      this.runId = runId;
      this.scope = scope;
      this.admissionGate = admissionGate;
    }

    private void enqueue(String url) {
      pending.incrementAndGet();
      frontier.offer(url);
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "crawl-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
