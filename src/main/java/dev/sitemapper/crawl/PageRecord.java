package dev.sitemapper.crawl;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Sitemap metadata for one successfully fetched HTML page.
 *
 * @param url          the normalized page URL
 * @param lastModified the date the page was fetched
 * @param priority     relative importance in [0, 1]
 */
public record PageRecord(String url, LocalDate lastModified, double priority) {

    public PageRecord {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(lastModified, "lastModified");
        if (!(priority >= 0.0 && priority <= 1.0)) {
            throw new IllegalArgumentException("priority must be in [0, 1], got: " + priority);
        }
    }
}
