package dev.sitemapper.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.sitemapper.crawl.PageRecord;
import dev.sitemapper.crawl.SitemapStore;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of a sitemap snapshot ({@code sitemap_<timestamp>.json}).
 *
 * @param generatedAt ISO-8601 local date-time the snapshot was taken
 * @param totalUrls number of URLs in the snapshot
 * @param urls URL to metadata, in URL order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotDocument(
    @JsonProperty("generated_at") String generatedAt,
    @JsonProperty("total_urls") int totalUrls,
    @JsonProperty("urls") Map<String, UrlEntry> urls) {

  public SnapshotDocument {
    urls = urls == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(urls));
  }

  /**
   * Builds the snapshot of a crawl result.
   *
   * @param store the recorded pages
   * @param generatedAt when the snapshot is taken
   * @return snapshot with URLs in lexicographic order
   */
  public static SnapshotDocument of(SitemapStore store, LocalDateTime generatedAt) {
    Map<String, UrlEntry> urls = new LinkedHashMap<>();
    for (PageRecord record : store.sorted().values()) {
      urls.put(
          record.url(),
          new UrlEntry(
              record.lastModified().format(DateTimeFormatter.ISO_LOCAL_DATE), record.priority()));
    }
    return new SnapshotDocument(
        generatedAt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME), urls.size(), urls);
  }

  /**
   * Per-URL metadata in a snapshot.
   *
   * @param lastmod fetch date as {@code YYYY-MM-DD}
   * @param priority sitemap priority
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record UrlEntry(
      @JsonProperty("lastmod") String lastmod, @JsonProperty("priority") double priority) {}
}
