package dev.sitemapper.crawl;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts crawlable links from an HTML page using jsoup.
 *
 * <p>Anchor and {@code <link>} elements with a non-blank {@code href} are resolved against the
 * page URL (relative, absolute-path and protocol-relative forms), normalized with
 * {@link UrlNormalizer} and kept only if {@link CrawlFilter} accepts them. Each element is handled
 * on its own, so one bad attribute never drops the rest of the page.
 *
 * <p>Links are always resolved against the URL the page was fetched from; a {@code <base href>}
 * in the page is ignored.
 */
@Component
public class LinkExtractor {

    private static final Logger log = LoggerFactory.getLogger(LinkExtractor.class);

    private static final String LINK_SELECTOR = "a[href], link[href]";

    /**
     * Extract the normalized, in-scope links of a page.
     *
     * @param html      the page body
     * @param sourceUrl the URL the page was fetched from, used as base for relative links
     * @param scope     the crawl scope links must fall into
     * @return insertion-ordered set of unique links, empty if the page could not be parsed at all
     */
    public Set<String> extract(String html, String sourceUrl, CrawlScope scope) {
        if (html == null || html.isEmpty()) {
            return Set.of();
        }

        Document document;
        try {
            document = Jsoup.parse(html, sourceUrl);
            // a <base href> in the page would otherwise become the resolution base
            document.setBaseUri(sourceUrl);
        } catch (RuntimeException e) {
            log.debug("Could not parse HTML from {}: {}", sourceUrl, e.getMessage());
            return Set.of();
        }

        Set<String> links = new LinkedHashSet<>();
        for (Element element : document.select(LINK_SELECTOR)) {
            try {
                String href = element.attr("href").strip();
                if (href.isEmpty()) {
                    continue;
                }
                String absolute = element.absUrl("href");
                if (absolute.isEmpty()) {
                    continue;
                }
                String normalized = UrlNormalizer.normalize(absolute);
                if (CrawlFilter.isAllowed(normalized, scope)) {
                    links.add(normalized);
                }
            } catch (RuntimeException e) {
                log.debug("Skipping unusable link on {}: {}", sourceUrl, e.getMessage());
            }
        }
        return Collections.unmodifiableSet(links);
    }
}
