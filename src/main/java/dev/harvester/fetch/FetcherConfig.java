package dev.harvester.fetch;

import dev.harvester.config.HarvesterProperties;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to download event stream pages and enables the
 * declarative retry support used by {@link DocumentFetcher}.
 *
 * <p>Timeouts are externalized via {@code harvester.http.*} properties. The client asks for
 * JSON-LD first and plain JSON second and is qualified as {@code "ldesRestClient"}.
 */
@Configuration
@EnableRetry
public class FetcherConfig {

    static final String ACCEPT = "application/ld+json, application/json;q=0.9";

    /**
     * Creates the REST client for page downloads.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties harvester configuration holding the HTTP timeouts
     * @return a named REST client bean for injection into {@link DocumentFetcher}
     */
    @Bean
    public RestClient ldesRestClient(RestClient.Builder builder, HarvesterProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.getHttp().getConnectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.getHttp().getReadTimeoutMs()));

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, ACCEPT)
                .build();
    }
}
