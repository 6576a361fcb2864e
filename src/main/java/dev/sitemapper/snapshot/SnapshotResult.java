package dev.sitemapper.snapshot;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * Files written by one snapshot save.
 *
 * @param sitemapXml the overwritten {@code sitemap.xml}
 * @param snapshotJson the new {@code sitemap_<timestamp>.json}
 * @param changesJson the new {@code changes_<timestamp>.json}, null if no earlier snapshot existed
 * @param changes the change set written to {@code changesJson}, null alongside it
 */
public record SnapshotResult(
    Path sitemapXml,
    Path snapshotJson,
    @Nullable Path changesJson,
    @Nullable ChangeSet changes) {

  public boolean hasChanges() {
    return changes != null;
  }
}
