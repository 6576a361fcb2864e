package dev.sitemapper.crawl;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

/**
 * Fetches a single page over HTTP and hands back its HTML.
 *
 * <p>One GET per call, no retries. Characters that are illegal in a URI are percent-encoded
 * before the request, so the URL as linked and the URL as served may differ in escaping. Only a {@code 200} response whose {@code Content-Type}
 * contains {@code text/html} yields content; every other outcome, including transport errors,
 * yields {@code null} and is logged at DEBUG only.
 */
@Service
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private static final String HTML_CONTENT_TYPE = "text/html";

    private final RestClient restClient;

    public PageFetcher(@Qualifier("pageFetcherRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Fetch the HTML body of a URL.
     *
     * @param url absolute URL to fetch
     * @return the response body, or null if the page is not a successfully served HTML page
     */
    public @Nullable String fetch(String url) {
        try {
            return restClient.get()
                    .uri(URI.create(UrlNormalizer.encodeIllegalCharacters(url)))
                    .exchange((request, response) -> {
                        if (response.getStatusCode().value() != 200) {
                            log.debug("Skipping {}: HTTP {}", url, response.getStatusCode().value());
                            return null;
                        }
                        String contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
                        if (contentType == null
                                || !contentType.toLowerCase(Locale.ROOT).contains(HTML_CONTENT_TYPE)) {
                            log.debug("Skipping {}: content type {}", url, contentType);
                            return null;
                        }
                        Charset charset = charsetOf(response.getHeaders().getContentType());
                        return StreamUtils.copyToString(response.getBody(), charset);
                    });
        } catch (Exception e) {
            log.debug("Could not fetch {}: {}", url, e.getMessage());
            return null;
        }
    }

    private static Charset charsetOf(@Nullable MediaType mediaType) {
        if (mediaType == null || mediaType.getCharset() == null) {
            return StandardCharsets.UTF_8;
        }
        return mediaType.getCharset();
    }
}
