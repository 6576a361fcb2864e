package dev.sitemapper.crawl;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe map from normalized URL to {@link PageRecord}, filled by crawl workers after each
 * successful fetch and read once the crawl is over.
 *
 * <p>Lookups never insert: an unknown URL yields {@link Optional#empty()}.
 */
public class SitemapStore {

    private final ConcurrentHashMap<String, PageRecord> records = new ConcurrentHashMap<>();

    /**
     * Record (or overwrite) the metadata of a fetched page.
     *
     * @param record the page record, keyed by its URL
     */
    public void record(PageRecord record) {
        records.put(record.url(), record);
    }

    /**
     * Look up the record of a page.
     *
     * @param url the normalized URL
     * @return the record, or empty if the page was never recorded
     */
    public Optional<PageRecord> find(String url) {
        return Optional.ofNullable(records.get(url));
    }

    public boolean contains(String url) {
        return records.containsKey(url);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Unmodifiable view of the recorded URLs. */
    public Set<String> urls() {
        return Collections.unmodifiableSet(records.keySet());
    }

    /**
     * Copy of the records sorted lexicographically by URL, the order every output file uses.
     *
     * @return sorted, unmodifiable copy
     */
    public SortedMap<String, PageRecord> sorted() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(records));
    }
}
