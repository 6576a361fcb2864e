package dev.sitemapper.crawl;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a crawl run's progress.
 *
 * <p>Created and updated by {@link CrawlProgressTracker} during crawl execution.
 * Each mutation produces a new record (value semantics for thread safety).
 *
 * @param runId             the crawl run
 * @param status            current crawl status
 * @param pagesClaimed      URLs claimed by a worker (the visited count)
 * @param pagesRecorded     URLs whose fetch returned HTML and were stored
 * @param pagesFailed       claimed URLs discarded because the fetch returned nothing
 * @param duplicatesSkipped dequeued URLs discarded because another worker already claimed them
 * @param startedAt         when the crawl started
 */
public record CrawlProgress(
        UUID runId,
        Status status,
        int pagesClaimed,
        int pagesRecorded,
        int pagesFailed,
        int duplicatesSkipped,
        Instant startedAt
) {

    CrawlProgress withStatus(Status newStatus) {
        return new CrawlProgress(runId, newStatus, pagesClaimed, pagesRecorded, pagesFailed,
                duplicatesSkipped, startedAt);
    }

    CrawlProgress withClaimed() {
        return new CrawlProgress(runId, status, pagesClaimed + 1, pagesRecorded, pagesFailed,
                duplicatesSkipped, startedAt);
    }

    CrawlProgress withRecorded() {
        return new CrawlProgress(runId, status, pagesClaimed, pagesRecorded + 1, pagesFailed,
                duplicatesSkipped, startedAt);
    }

    CrawlProgress withFailed() {
        return new CrawlProgress(runId, status, pagesClaimed, pagesRecorded, pagesFailed + 1,
                duplicatesSkipped, startedAt);
    }

    CrawlProgress withDuplicateSkipped() {
        return new CrawlProgress(runId, status, pagesClaimed, pagesRecorded, pagesFailed,
                duplicatesSkipped + 1, startedAt);
    }

    /**
     * Crawl run status.
     */
    public enum Status {
        CRAWLING,
        COMPLETED,
        INTERRUPTED
    }
}
