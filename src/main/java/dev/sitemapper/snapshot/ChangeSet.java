package dev.sitemapper.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

/**
 * Difference between the URL sets of two sitemap snapshots. Lists are sorted so the change log is
 * stable across runs.
 *
 * @param newUrls        URLs present now but not in the previous snapshot
 * @param removedUrls    URLs present in the previous snapshot but not now
 * @param updatedUrls    URLs present in both
 * @param urlCountChange current URL count minus previous URL count
 */
public record ChangeSet(
    @JsonProperty("new_urls") List<String> newUrls,
    @JsonProperty("removed_urls") List<String> removedUrls,
    @JsonProperty("updated_urls") List<String> updatedUrls,
    @JsonProperty("url_count_change") int urlCountChange) {

  public ChangeSet {
    newUrls = List.copyOf(newUrls);
    removedUrls = List.copyOf(removedUrls);
    updatedUrls = List.copyOf(updatedUrls);
  }

  /**
   * Computes the change set between two URL sets.
   *
   * @param previous URLs of the older snapshot
   * @param current URLs of the current crawl
   * @return the set differences and intersection, each sorted
   */
  public static ChangeSet between(Set<String> previous, Set<String> current) {
    return new ChangeSet(
        current.stream().filter(url -> !previous.contains(url)).sorted().toList(),
        previous.stream().filter(url -> !current.contains(url)).sorted().toList(),
        current.stream().filter(previous::contains).sorted().toList(),
        current.size() - previous.size());
  }

  /**
   * Change set used when no previous snapshot is usable: every current URL is new.
   *
   * @param current URLs of the current crawl
   * @return change set with all URLs new and nothing removed
   */
  public static ChangeSet allNew(Set<String> current) {
    return between(Set.of(), current);
  }
}
