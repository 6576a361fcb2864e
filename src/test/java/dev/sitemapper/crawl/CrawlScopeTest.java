package dev.sitemapper.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class CrawlScopeTest {

  @Test
  void nullPatternsDefaultToEmptyList() {
    var scope = new CrawlScope("https://x.io", null);

    assertThat(scope.excludedPatterns()).isEmpty();
  }

  @Test
  void patternsAreLowercasedAndEmptyOnesDropped() {
    var scope = new CrawlScope("https://x.io", Arrays.asList(".PDF", "", null, "/Login"));

    assertThat(scope.excludedPatterns()).containsExactly(".pdf", "/login");
  }

  @Test
  void patternsAreDefensivelyCopied() {
    var patterns = new ArrayList<>(List.of("/admin"));
    var scope = new CrawlScope("https://x.io", patterns);

    patterns.add("/search");

    assertThat(scope.excludedPatterns()).containsExactly("/admin");
  }

  @Test
  void forDomainHasNoExclusions() {
    var scope = CrawlScope.forDomain("https://x.io");

    assertThat(scope.domain()).isEqualTo("https://x.io");
    assertThat(scope.excludedPatterns()).isEmpty();
  }

  @Test
  void fromPropertiesUsesConfiguredDomainAndPatterns() {
    var properties =
        new CrawlProperties(
            "https://x.io/docs",
            null,
            null,
            2,
            1,
            Duration.ofSeconds(5),
            null,
            List.of(".zip"));

    var scope = CrawlScope.fromProperties(properties);

    assertThat(scope.domain()).isEqualTo("https://x.io/docs");
    assertThat(scope.excludedPatterns()).containsExactly(".zip");
  }
}
