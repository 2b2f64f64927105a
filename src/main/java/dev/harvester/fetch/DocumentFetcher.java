package dev.harvester.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class DocumentFetcher {

    private static final Logger log = LoggerFactory.getLogger(DocumentFetcher.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public DocumentFetcher(@Qualifier("ldesRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Download a page and parse its body as a JSON object.
     * Retries on transient RestClientException (I/O errors and HTTP error statuses) with
     * exponential backoff. Malformed bodies and malformed URLs fail immediately.
     *
     * @throws DocumentFetchException when the page cannot be retrieved after all attempts
     * @throws DocumentParseException when the body is not a JSON object
     */
    @Retryable(
            retryFor = RestClientException.class,
            noRetryFor = DocumentFetchException.class,
            maxAttemptsExpression = "${harvester.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${harvester.retry.delay-ms:1000}",
                    multiplierExpression = "${harvester.retry.multiplier:2.0}",
                    maxDelayExpression = "${harvester.retry.max-delay-ms:30000}"
            )
    )
    public PageDocument fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new DocumentFetchException(url, e);
        }

        log.info("Fetching: {}", url);
        String body;
        try {
            body = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            log.warn("Attempt {} failed for {}: {}", currentAttempt(), url, e.getMessage());
            throw e;
        }
        return new PageDocument(url, parse(url, body));
    }

    @Recover
    PageDocument recoverFetch(RestClientException e, String url) {
        throw new DocumentFetchException(url, e);
    }

    @Recover
    PageDocument recoverFailedDocument(DocumentFetchException e, String url) {
        throw e;
    }

    private ObjectNode parse(String url, String body) {
        if (body == null || body.isBlank()) {
            throw new DocumentParseException(url, "empty body", null);
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException(url, e.getOriginalMessage(), e);
        }
        if (!(tree instanceof ObjectNode object)) {
            throw new DocumentParseException(url, "expected a JSON object but got " + tree.getNodeType(), null);
        }
        return object;
    }

    private static int currentAttempt() {
        RetryContext context = RetrySynchronizationManager.getContext();
        return context == null ? 1 : context.getRetryCount() + 1;
    }
}
