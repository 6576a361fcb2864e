package dev.sitemapper.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.sitemapper.crawl.CrawlProperties;
import dev.sitemapper.crawl.PageRecord;
import dev.sitemapper.crawl.SitemapStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotServiceTest {

  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2024-05-17T10:15:30Z"), ZoneId.of("UTC"));

  private static final LocalDate DAY = LocalDate.of(2024, 5, 17);

  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir Path tempDir;

  @Test
  void first_run_writes_sitemap_and_snapshot_but_no_change_log() throws IOException {
    SnapshotService service = service(tempDir.resolve("out"));

    SnapshotResult result = service.save(store("https://x.io", "https://x.io/docs"));

    assertThat(result.sitemapXml()).hasFileName("sitemap.xml").exists();
    assertThat(result.snapshotJson()).hasFileName("sitemap_20240517_101530.json").exists();
    assertThat(result.hasChanges()).isFalse();
    assertThat(result.changesJson()).isNull();
    assertThat(listNames(tempDir.resolve("out")))
        .containsExactlyInAnyOrder("sitemap.xml", "sitemap_20240517_101530.json");
  }

  @Test
  void snapshot_json_contains_metadata_per_url() throws IOException {
    SnapshotService service = service(tempDir);

    SnapshotResult result = service.save(store("https://x.io/b", "https://x.io/a"));

    JsonNode json = objectMapper.readTree(result.snapshotJson().toFile());
    assertThat(json.path("generated_at").asText()).isEqualTo("2024-05-17T10:15:30");
    assertThat(json.path("total_urls").asInt()).isEqualTo(2);
    assertThat(json.path("urls").path("https://x.io/a").path("lastmod").asText())
        .isEqualTo("2024-05-17");
    assertThat(json.path("urls").path("https://x.io/a").path("priority").asDouble())
        .isEqualTo(0.51);
  }

  @Test
  void snapshot_json_is_pretty_printed_with_two_space_indent() throws IOException {
    SnapshotService service = service(tempDir);

    SnapshotResult result = service.save(store("https://x.io"));

    String text = Files.readString(result.snapshotJson());
    assertThat(text)
        .startsWith("{\n  \"generated_at\": \"2024-05-17T10:15:30\",\n  \"total_urls\": 1,")
        .contains("\n    \"https://x.io\": {\n      \"lastmod\": \"2024-05-17\",")
        .endsWith("}\n");
  }

  @Test
  void later_run_diffs_against_most_recent_earlier_snapshot() throws IOException {
    Files.writeString(
        tempDir.resolve("sitemap_20190101_000000.json"),
        "{\"urls\": {\"https://x.io/ancient\": {}}}");
    Files.writeString(
        tempDir.resolve("sitemap_20200101_000000.json"),
        "{\"generated_at\": \"2020-01-01T00:00:00\", \"total_urls\": 3, \"urls\": {"
            + "\"https://x.io/a\": {\"lastmod\": \"2020-01-01\", \"priority\": 0.51},"
            + "\"https://x.io/b\": {\"lastmod\": \"2020-01-01\", \"priority\": 0.51},"
            + "\"https://x.io/c\": {\"lastmod\": \"2020-01-01\", \"priority\": 0.51}}}");
    SnapshotService service = service(tempDir);

    SnapshotResult result = service.save(store("https://x.io/b", "https://x.io/c", "https://x.io/d"));

    assertThat(result.changesJson()).hasFileName("changes_20240517_101530.json").exists();
    ChangeSet changes = result.changes();
    assertThat(changes.newUrls()).containsExactly("https://x.io/d");
    assertThat(changes.removedUrls()).containsExactly("https://x.io/a");
    assertThat(changes.updatedUrls()).containsExactly("https://x.io/b", "https://x.io/c");
    assertThat(changes.urlCountChange()).isZero();

    JsonNode json = objectMapper.readTree(result.changesJson().toFile());
    assertThat(json.path("new_urls").get(0).asText()).isEqualTo("https://x.io/d");
    assertThat(json.path("removed_urls").get(0).asText()).isEqualTo("https://x.io/a");
    assertThat(json.path("updated_urls")).hasSize(2);
    assertThat(json.path("url_count_change").asInt()).isZero();
  }

  @Test
  void unreadable_previous_snapshot_treats_all_urls_as_new() throws IOException {
    Files.writeString(tempDir.resolve("sitemap_20200101_000000.json"), "not json at all");
    SnapshotService service = service(tempDir);

    SnapshotResult result = service.save(store("https://x.io", "https://x.io/a"));

    assertThat(result.changes().newUrls()).containsExactly("https://x.io", "https://x.io/a");
    assertThat(result.changes().removedUrls()).isEmpty();
    assertThat(result.changes().urlCountChange()).isEqualTo(2);
  }

  @Test
  void rerun_within_same_second_keeps_first_snapshot_and_diffs_against_it() throws IOException {
    SnapshotService service = service(tempDir);

    SnapshotResult first = service.save(store("https://x.io"));
    String firstContent = Files.readString(first.snapshotJson());
    SnapshotResult second = service.save(store("https://x.io", "https://x.io/new"));

    assertThat(second.snapshotJson())
        .isNotEqualTo(first.snapshotJson())
        .hasFileName("sitemap_20240517_101530_1.json");
    assertThat(Files.readString(first.snapshotJson())).isEqualTo(firstContent);
    assertThat(objectMapper.readTree(first.snapshotJson().toFile()).path("total_urls").asInt())
        .isEqualTo(1);
    assertThat(second.changesJson()).hasFileName("changes_20240517_101530_1.json");
    assertThat(second.changes().newUrls()).containsExactly("https://x.io/new");
    assertThat(second.changes().updatedUrls()).containsExactly("https://x.io");
  }

  @Test
  void third_run_within_same_second_diffs_against_second() throws IOException {
    SnapshotService service = service(tempDir);

    service.save(store("https://x.io"));
    service.save(store("https://x.io", "https://x.io/a"));
    SnapshotResult third = service.save(store("https://x.io/a"));

    assertThat(third.snapshotJson()).hasFileName("sitemap_20240517_101530_2.json");
    assertThat(third.changes().removedUrls()).containsExactly("https://x.io");
    assertThat(third.changes().newUrls()).isEmpty();
    assertThat(listNames(tempDir)).hasSize(6);
  }

  @Test
  void sequence_numbers_order_numerically_after_plain_timestamp() throws IOException {
    for (String name : new String[] {
        "sitemap_20240517_101530.json",
        "sitemap_20240517_101530_2.json",
        "sitemap_20240517_101530_10.json",
        "sitemap_20240517_101529_99.json"}) {
      Files.writeString(tempDir.resolve(name), "{}");
    }
    SnapshotService service = service(tempDir);

    assertThat(service.findPreviousSnapshot(tempDir.resolve("sitemap_20240517_101531.json")))
        .contains(tempDir.resolve("sitemap_20240517_101530_10.json"));
    assertThat(service.findPreviousSnapshot(tempDir.resolve("sitemap_20240517_101530_10.json")))
        .contains(tempDir.resolve("sitemap_20240517_101530_2.json"));
  }

  @Test
  void output_directory_comes_from_crawl_properties() throws IOException {
    Path configured = tempDir.resolve("configured");
    SnapshotService service =
        new SnapshotService(properties(configured.toString()), new SitemapXmlWriter(),
            objectMapper, FIXED_CLOCK);

    SnapshotResult result = service.save(store("https://x.io"));

    assertThat(result.sitemapXml().getParent()).isEqualTo(configured);
  }

  @Test
  void blank_output_directory_falls_back_to_default() {
    assertThat(properties(" ").outputDir()).isEqualTo("sitemaps");
  }

  @Test
  void earlier_snapshots_are_left_untouched() throws IOException {
    Path older = tempDir.resolve("sitemap_20200101_000000.json");
    String content = "{\"urls\": {\"https://x.io\": {}}}";
    Files.writeString(older, content);

    service(tempDir).save(store("https://x.io"));

    assertThat(older).hasContent(content);
  }

  @Test
  void find_previous_snapshot_ignores_other_files() throws IOException {
    Files.writeString(tempDir.resolve("changes_20300101_000000.json"), "{}");
    Files.writeString(tempDir.resolve("sitemap.xml"), "<urlset/>");
    Files.writeString(tempDir.resolve("sitemap_20210101_000000.json"), "{}");
    Files.writeString(tempDir.resolve("sitemap_20220101_000000.json"), "{}");
    SnapshotService service = service(tempDir);

    assertThat(service.findPreviousSnapshot(tempDir.resolve("sitemap_20220101_000000.json")))
        .contains(tempDir.resolve("sitemap_20210101_000000.json"));
  }

  @Test
  void unwritable_output_directory_fails_with_exit_code() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "a regular file");
    SnapshotService service = service(blocker);

    assertThatThrownBy(() -> service.save(store("https://x.io")))
        .isInstanceOfSatisfying(
            SnapshotWriteException.class,
            e -> {
              assertThat(e.getPath()).isEqualTo(blocker);
              assertThat(e.getExitCode()).isEqualTo(3);
            })
        .hasCauseInstanceOf(IOException.class);
  }

  private SnapshotService service(Path outputDir) {
    return new SnapshotService(
        properties(outputDir.toString()), new SitemapXmlWriter(), objectMapper, FIXED_CLOCK);
  }

  private static CrawlProperties properties(String outputDir) {
    return new CrawlProperties(
        "https://x.io", null, outputDir, 1, 1, Duration.ofSeconds(1), null, null);
  }

  private static SitemapStore store(String... urls) {
    SitemapStore store = new SitemapStore();
    for (String url : urls) {
      store.record(new PageRecord(url, DAY, 0.51));
    }
    return store;
  }

  private static List<String> listNames(Path dir) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files.map(path -> path.getFileName().toString()).toList();
    }
  }
}
