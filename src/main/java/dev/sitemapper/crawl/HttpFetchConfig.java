package dev.sitemapper.crawl;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used by {@link PageFetcher}.
 *
 * <p>Connect and read timeouts both come from {@code sitemapper.fetch-timeout}. Certificate and
 * host name validation are disabled so sites with self-signed or mismatched certificates can
 * still be mapped. The client is qualified as {@code "pageFetcherRestClient"}.
 */
@Configuration
public class HttpFetchConfig {

    /**
     * Creates the REST client for page fetches.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties crawl configuration (timeout, user agent)
     * @return a named REST client bean for injection into {@link PageFetcher}
     */
    @Bean
    public RestClient pageFetcherRestClient(RestClient.Builder builder, CrawlProperties properties) {
        var requestFactory = new TrustAllRequestFactory(trustAllSocketFactory());
        requestFactory.setConnectTimeout(properties.fetchTimeout());
        requestFactory.setReadTimeout(properties.fetchTimeout());

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .build();
    }

    static SSLSocketFactory trustAllSocketFactory() {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
                // all clients trusted
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
                // all servers trusted
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS context not available", e);
        }
    }

    private static final class TrustAllRequestFactory extends SimpleClientHttpRequestFactory {

        private final SSLSocketFactory socketFactory;

        TrustAllRequestFactory(SSLSocketFactory socketFactory) {
            this.socketFactory = socketFactory;
        }

        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod)
                throws IOException {
            if (connection instanceof HttpsURLConnection https) {
                https.setSSLSocketFactory(socketFactory);
                https.setHostnameVerifier((hostname, session) -> true);
            }
            super.prepareConnection(connection, httpMethod);
        }
    }
}
