package dev.sitemapper.snapshot;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.sitemapper.crawl.SitemapStore;
import java.io.IOException;
import dev.sitemapper.crawl.CrawlProperties;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists crawl results into the output directory and diffs them against the previous run.
 *
 * <p>Each save overwrites {@code sitemap.xml}, adds a new {@code sitemap_<yyyyMMdd_HHmmss>.json}
 * and, when an older snapshot exists, adds {@code changes_<yyyyMMdd_HHmmss>.json}. Earlier
 * snapshots are never modified: a second save within the same second gets a sequence suffix
 * ({@code sitemap_20240517_101530_1.json}). The previous snapshot is the greatest other
 * {@code sitemap_*.json} ordered by timestamp, then sequence number.
 */
@Service
public class SnapshotService {

  private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  static final String SITEMAP_XML = "sitemap.xml";
  static final String SNAPSHOT_PREFIX = "sitemap_";
  static final String CHANGES_PREFIX = "changes_";
  static final String JSON_SUFFIX = ".json";

  /** {@code <timestamp>} or {@code <timestamp>_<sequence>} between prefix and suffix. */
  private static final Pattern RUN_ID = Pattern.compile("(\\d{8}_\\d{6})(?:_(\\d+))?");

  private static final Comparator<String> BY_RUN_ID =
      Comparator.<String, String>comparing(SnapshotService::timestampOf)
          .thenComparingLong(SnapshotService::sequenceOf)
          .thenComparing(Comparator.naturalOrder());

  private final Path outputDir;
  private final SitemapXmlWriter xmlWriter;
  private final ObjectMapper objectMapper;
  private final ObjectWriter jsonWriter;
  private final Clock clock;

  public SnapshotService(
      CrawlProperties properties,
      SitemapXmlWriter xmlWriter,
      ObjectMapper objectMapper,
      Clock clock) {
    this.outputDir = Path.of(properties.outputDir());
    this.xmlWriter = xmlWriter;
    this.objectMapper = objectMapper;
    this.jsonWriter = objectMapper.writer(twoSpacePrettyPrinter());
    this.clock = clock;
  }

  /**
   * Writes the sitemap, the JSON snapshot and, if possible, the change log.
   *
   * @param store the pages recorded by the crawl
   * @return the paths written and the change set, if one was computed
   * @throws SnapshotWriteException if the directory cannot be created or a file cannot be written
   */
  public SnapshotResult save(SitemapStore store) {
    createOutputDir();

    LocalDateTime now = LocalDateTime.now(clock);
    String timestamp = now.format(TIMESTAMP_FORMAT);

    Path xmlPath = outputDir.resolve(SITEMAP_XML);
    write(xmlPath, xmlWriter.render(store), StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

    String snapshotJson = toJson(
        SnapshotDocument.of(store, now), outputDir.resolve(SNAPSHOT_PREFIX + timestamp + JSON_SUFFIX));
    Path snapshotPath = createSnapshot(timestamp, snapshotJson);
    String runId = runIdOf(snapshotPath.getFileName().toString());

    Optional<Path> previous = findPreviousSnapshot(snapshotPath);
    if (previous.isEmpty()) {
      log.debug("No earlier snapshot in {}, skipping change log", outputDir);
      return new SnapshotResult(xmlPath, snapshotPath, null, null);
    }

    ChangeSet changes = diffAgainst(previous.get(), store.urls());
    Path changesPath = outputDir.resolve(CHANGES_PREFIX + runId + JSON_SUFFIX);
    write(changesPath, toJson(changes, changesPath), StandardOpenOption.CREATE_NEW);
    return new SnapshotResult(xmlPath, snapshotPath, changesPath, changes);
  }

  /**
   * Finds the most recent snapshot other than the one just written.
   *
   * @param current the snapshot of this run
   * @return the previous snapshot, or empty on a first run
   */
  Optional<Path> findPreviousSnapshot(Path current) {
    String currentName = current.getFileName().toString();
    try (Stream<Path> files = Files.list(outputDir)) {
      return files
          .map(path -> path.getFileName().toString())
          .filter(name -> name.startsWith(SNAPSHOT_PREFIX) && name.endsWith(JSON_SUFFIX))
          .filter(name -> !name.equals(currentName))
          .max(BY_RUN_ID)
          .map(outputDir::resolve);
    } catch (IOException e) {
      throw new SnapshotWriteException("Cannot list output directory", outputDir, e);
    }
  }

  /**
   * Creates {@code sitemap_<timestamp>.json}, or the first free {@code sitemap_<timestamp>_<n>.json}
   * if a snapshot was already taken within the same second. Existing files are never opened.
   */
  private Path createSnapshot(String timestamp, String content) {
    for (int sequence = 0; ; sequence++) {
      String runId = sequence == 0 ? timestamp : timestamp + "_" + sequence;
      Path path = outputDir.resolve(SNAPSHOT_PREFIX + runId + JSON_SUFFIX);
      try {
        Files.writeString(path, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE);
        return path;
      } catch (FileAlreadyExistsException e) {
        log.debug("Snapshot {} already exists, trying next sequence number", path);
      } catch (IOException e) {
        throw new SnapshotWriteException("Cannot write file", path, e);
      }
    }
  }

  private static String runIdOf(String fileName) {
    return fileName.substring(SNAPSHOT_PREFIX.length(), fileName.length() - JSON_SUFFIX.length());
  }

  private static String timestampOf(String fileName) {
    Matcher matcher = RUN_ID.matcher(runIdOf(fileName));
    return matcher.matches() ? matcher.group(1) : runIdOf(fileName);
  }

  private static long sequenceOf(String fileName) {
    Matcher matcher = RUN_ID.matcher(runIdOf(fileName));
    if (!matcher.matches() || matcher.group(2) == null) {
      return 0;
    }
    try {
      return Long.parseLong(matcher.group(2));
    } catch (NumberFormatException e) {
      return Long.MAX_VALUE;
    }
  }

  private ChangeSet diffAgainst(Path previous, Set<String> currentUrls) {
    try {
      JsonNode urls = objectMapper.readTree(previous.toFile()).path("urls");
      Set<String> previousUrls = new HashSet<>();
      urls.fieldNames().forEachRemaining(previousUrls::add);
      return ChangeSet.between(previousUrls, currentUrls);
    } catch (IOException e) {
      log.warn("Could not read previous snapshot {}, treating all URLs as new: {}",
          previous, e.getMessage());
      return ChangeSet.allNew(currentUrls);
    }
  }

  private void createOutputDir() {
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new SnapshotWriteException("Cannot create output directory", outputDir, e);
    }
  }

  private String toJson(Object value, Path target) {
    try {
      return jsonWriter.writeValueAsString(value) + "\n";
    } catch (IOException e) {
      throw new SnapshotWriteException("Cannot serialize snapshot", target, e);
    }
  }

  private static void write(Path path, String content, StandardOpenOption... options) {
    try {
      Files.writeString(path, content, StandardCharsets.UTF_8, options);
    } catch (IOException e) {
      throw new SnapshotWriteException("Cannot write file", path, e);
    }
  }

  private static DefaultPrettyPrinter twoSpacePrettyPrinter() {
    DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
    return new DefaultPrettyPrinter()
        .withObjectIndenter(indenter)
        .withArrayIndenter(indenter)
        .withSeparators(
            Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
  }
}
