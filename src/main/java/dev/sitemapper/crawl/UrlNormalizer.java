package dev.sitemapper.crawl;

import java.nio.charset.StandardCharsets;

/**
 * Utility class that canonicalizes URLs so equivalent links collapse to one page identity.
 * Works on the raw string: no percent-decoding, no case folding, no default-port stripping.
 */
public final class UrlNormalizer {

    /** Characters allowed unescaped in the path and query of a URI. */
    private static final String LEGAL =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~:/?#@!$&'()*+,;=";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL for deduplication:
     * - Truncate at the first fragment marker (#section)
     * - Truncate at the first query marker (?utm_source=x)
     * - Remove trailing slashes ({@code https://x.io/} becomes {@code https://x.io})
     *
     * <p>Idempotent: normalizing an already normalized URL returns it unchanged.
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input unchanged if null or blank
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        String result = truncateAt(url, '#');
        result = truncateAt(result, '?');

        int end = result.length();
        while (end > 0 && result.charAt(end - 1) == '/') {
            end--;
        }
        return result.substring(0, end);
    }

    /**
     * Extract the authority (host plus optional port) of an absolute URL, e.g.
     * {@code docs.example.com:8080} for {@code https://docs.example.com:8080/guide}.
     * Parsing is lenient and does not validate the characters of the URL.
     *
     * @param url the URL to inspect
     * @return the authority, or an empty string if the URL has no {@code scheme://} prefix
     */
    public static String authorityOf(String url) {
        if (url == null) {
            return "";
        }
        int schemeEnd = url.indexOf("://");
        if (schemeEnd <= 0) {
            return "";
        }
        int start = schemeEnd + 3;
        int end = authorityEnd(url, start);
        return url.substring(start, end);
    }

    /**
     * Percent-encode the characters of a URL that are not legal in a URI, so that links such as
     * {@code /release notes}, {@code /café} or {@code /a|b} can be requested. Escapes already
     * present ({@code %20}) are kept as they are; a {@code %} not followed by two hex digits is
     * encoded as {@code %25}. The authority is never touched.
     *
     * @param url the URL as found in the page
     * @return the URL with every illegal character replaced by its UTF-8 escape
     */
    public static String encodeIllegalCharacters(String url) {
        if (url == null || url.isEmpty()) {
            return url;
        }
        int schemeEnd = url.indexOf("://");
        int start = schemeEnd > 0 ? authorityEnd(url, schemeEnd + 3) : 0;

        StringBuilder result = new StringBuilder(url.length() + 16).append(url, 0, start);
        int i = start;
        while (i < url.length()) {
            int codePoint = url.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (codePoint == '%' && isEscape(url, i)) {
                result.append(url, i, i + 3);
                i += 3;
                continue;
            }
            if (codePoint < 0x80 && codePoint != '%' && LEGAL.indexOf(codePoint) >= 0) {
                result.append((char) codePoint);
            } else {
                for (byte b : url.substring(i, i + width).getBytes(StandardCharsets.UTF_8)) {
                    result.append('%')
                            .append(HEX[(b >> 4) & 0x0F])
                            .append(HEX[b & 0x0F]);
                }
            }
            i += width;
        }
        return result.toString();
    }

    private static boolean isEscape(String url, int index) {
        return index + 2 < url.length()
                && Character.digit(url.charAt(index + 1), 16) >= 0
                && Character.digit(url.charAt(index + 2), 16) >= 0;
    }

    private static int authorityEnd(String url, int start) {
        for (int i = start; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                return i;
            }
        }
        return url.length();
    }

    private static String truncateAt(String value, char marker) {
        int index = value.indexOf(marker);
        return index < 0 ? value : value.substring(0, index);
    }
}
