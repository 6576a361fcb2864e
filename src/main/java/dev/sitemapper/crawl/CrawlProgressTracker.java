package dev.sitemapper.crawl;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for crawl run progress.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link CrawlProgress} snapshots keyed by run ID.
 * Each update atomically reads the current state, creates a new immutable record with the
 * updated counter, and writes it back using {@code computeIfPresent()}, so concurrent workers
 * never lose an increment.
 *
 * <p>Progress data is transient (in-memory only); the snapshot files are the durable record.
 */
@Component
public class CrawlProgressTracker {

    private final ConcurrentHashMap<UUID, CrawlProgress> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    public CrawlProgressTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Start tracking a new crawl run.
     *
     * @param runId the run being started
     */
    public void startCrawl(UUID runId) {
        runs.put(runId, new CrawlProgress(
                runId, CrawlProgress.Status.CRAWLING, 0, 0, 0, 0, clock.instant()));
    }

    /**
     * Record that a worker claimed a URL and marked it visited.
     *
     * @param runId the run
     * @return the number of URLs claimed so far, including this one
     */
    public int recordClaimed(UUID runId) {
        CrawlProgress updated = update(runId, CrawlProgress::withClaimed);
        return updated == null ? 0 : updated.pagesClaimed();
    }

    /**
     * Record that a fetched page was stored.
     *
     * @param runId the run
     */
    public void recordPageRecorded(UUID runId) {
        update(runId, CrawlProgress::withRecorded);
    }

    /**
     * Record that a claimed URL produced no content.
     *
     * @param runId the run
     */
    public void recordFailure(UUID runId) {
        update(runId, CrawlProgress::withFailed);
    }

    /**
     * Record that a dequeued URL was already claimed by another worker.
     *
     * @param runId the run
     */
    public void recordDuplicate(UUID runId) {
        update(runId, CrawlProgress::withDuplicateSkipped);
    }

    /**
     * Mark a run as completed (frontier drained).
     *
     * @param runId the run that finished
     */
    public void completeCrawl(UUID runId) {
        update(runId, progress -> progress.withStatus(CrawlProgress.Status.COMPLETED));
    }

    /**
     * Mark a run as interrupted before the frontier drained.
     *
     * @param runId the run that was interrupted
     */
    public void interruptCrawl(UUID runId) {
        update(runId, progress -> progress.withStatus(CrawlProgress.Status.INTERRUPTED));
    }

    /**
     * Get the current progress snapshot for a run.
     *
     * @param runId the run to check
     * @return progress snapshot, or empty if not tracking this run
     */
    public Optional<CrawlProgress> getProgress(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * Remove a run from tracking (cleanup after completion).
     *
     * @param runId the run to stop tracking
     */
    public void removeCrawl(UUID runId) {
        runs.remove(runId);
    }

    private CrawlProgress update(UUID runId, UnaryOperator<CrawlProgress> change) {
        return runs.computeIfPresent(runId, (id, progress) -> change.apply(progress));
    }
}
