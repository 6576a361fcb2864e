package dev.sitemapper.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class LinkExtractorTest {

    private static final String SOURCE = "https://x.io/docs/intro";
    private static final CrawlScope SCOPE = new CrawlScope("https://x.io", List.of(".pdf", "/login"));

    private final LinkExtractor extractor = new LinkExtractor();

    @Test
    void resolvesRelativeAbsolutePathAndProtocolRelativeLinks() {
        String html = """
                <html><body>
                  <a href="guide">relative</a>
                  <a href="/blog">absolute path</a>
                  <a href="//x.io/pricing">protocol relative</a>
                  <a href="https://x.io/about">absolute</a>
                </body></html>
                """;

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).containsExactly(
                "https://x.io/docs/guide",
                "https://x.io/blog",
                "https://x.io/pricing",
                "https://x.io/about");
    }

    @Test
    void resolvesAgainstPageUrlAndIgnoresBaseElement() {
        String html = """
                <html><head><base href="https://x.io/elsewhere/deep/"></head><body>
                  <a href="guide">relative</a>
                  <a href="/root">absolute path</a>
                </body></html>
                """;

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).containsExactly("https://x.io/docs/guide", "https://x.io/root");
    }

    @Test
    void keepsUnencodedCharactersForTheFetcherToEscape() {
        String html = "<a href=\"/release notes\">notes</a><a href=\"/café\">café</a>";

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).hasSize(2);
        assertThat(links).allSatisfy(link ->
                assertThat(UrlNormalizer.encodeIllegalCharacters(link))
                        .isIn("https://x.io/release%20notes", "https://x.io/caf%C3%A9"));
    }

    @Test
    void includesLinkElementsWithHref() {
        String html = """
                <html><head>
                  <link rel="alternate" href="/feed">
                  <link rel="stylesheet">
                </head><body></body></html>
                """;

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).containsExactly("https://x.io/feed");
    }

    @Test
    void dropsExternalAndExcludedLinks() {
        String html = """
                <a href="https://other.io/a">external</a>
                <a href="https://docs.x.io/a">subdomain</a>
                <a href="/files/report.PDF">pdf</a>
                <a href="/login">login</a>
                <a href="mailto:team@x.io">mail</a>
                <a href="/kept">kept</a>
                """;

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).containsExactly("https://x.io/kept");
    }

    @Test
    void collapsesFragmentQueryAndSlashVariants() {
        String html = """
                <a href="/a#one">1</a>
                <a href="/a?ref=nav">2</a>
                <a href="/a/">3</a>
                <a href="/a">4</a>
                """;

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).containsExactly("https://x.io/a");
    }

    @Test
    void skipsBlankAndMissingHref() {
        String html = """
                <a href="">empty</a>
                <a href="   ">blank</a>
                <a>no href</a>
                <a href="/real">real</a>
                """;

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).containsExactly("https://x.io/real");
    }

    @Test
    void toleratesMalformedMarkup() {
        String html = "<html><body><div><a href=\"/one\">one<p><a href='/two'>two</div><a href=/three>";

        Set<String> links = extractor.extract(html, SOURCE, SCOPE);

        assertThat(links).contains("https://x.io/one", "https://x.io/two", "https://x.io/three");
    }

    @Test
    void emptyBodyYieldsNoLinks() {
        assertThat(extractor.extract("", SOURCE, SCOPE)).isEmpty();
        assertThat(extractor.extract(null, SOURCE, SCOPE)).isEmpty();
    }

    @Test
    void returnedSetIsReadOnly() {
        Set<String> links = extractor.extract("<a href=\"/a\">a</a>", SOURCE, SCOPE);

        assertThat(links).isUnmodifiable();
    }
}
