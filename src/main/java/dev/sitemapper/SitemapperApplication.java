package dev.sitemapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the sitemap generator.
 *
 * <p>Runs one crawl as a command line application (no web server) and exits. Every input is a
 * {@code sitemapper.*} property, settable as {@code --sitemapper.start-url=https://example.com}
 * or through the environment ({@code SITEMAPPER_START_URL}).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SitemapperApplication {
    public static void main(String[] args) {
        SpringApplication.run(SitemapperApplication.class, args);
    }
}
