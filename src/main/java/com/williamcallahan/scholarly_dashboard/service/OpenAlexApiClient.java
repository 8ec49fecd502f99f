package com.williamcallahan.scholarly_dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.scholarly_dashboard.config.OpenAlexConfigurationProperties;
import com.williamcallahan.scholarly_dashboard.exception.CatalogApiException;
import com.williamcallahan.scholarly_dashboard.util.ExternalApiLogger;
import com.williamcallahan.scholarly_dashboard.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Fetches pages of works from the OpenAlex works endpoint.
 *
 * <p>Transient failures (5xx, timeouts, transport errors) are retried with exponential
 * backoff and jitter; 4xx responses fail immediately. Every failure that survives the
 * retries surfaces as a {@link CatalogApiException}.
 */
@Service
@Slf4j
public class OpenAlexApiClient {

    static final String API_NAME = "OpenAlex";

    private final WebClient webClient;
    private final OpenAlexConfigurationProperties properties;

    /**
     * Constructs OpenAlexApiClient with required dependencies
     *
     * @param webClientBuilder shared WebClient builder (timeouts and codecs preconfigured)
     * @param properties OpenAlex API settings
     */
    public OpenAlexApiClient(WebClient.Builder webClientBuilder, OpenAlexConfigurationProperties properties) {
        this.webClient = webClientBuilder.clone().build();
        this.properties = properties;
    }

    /**
     * Blocking fetch of one page, used by the sequential harvester.
     *
     * @throws CatalogApiException when the page cannot be fetched
     */
    public WorksPage fetchPage(String filter, int perPage, String cursor, String mailto) {
        WorksPage page = fetchPageAsync(filter, perPage, cursor, mailto).block();
        if (page == null) {
            throw new CatalogApiException("Empty response body", CatalogApiException.NO_STATUS,
                buildUri(filter, perPage, cursor, mailto).toString());
        }
        return page;
    }

    /**
     * Fetches one page.
     *
     * @param filter filter expression, see {@link OpenAlexFilterBuilder}
     * @param perPage page size, already validated by the caller
     * @param cursor cursor for this page, {@code "*"} for the first one
     * @param mailto optional contact address for the polite pool
     */
    public Mono<WorksPage> fetchPageAsync(String filter, int perPage, String cursor, String mailto) {
        URI uri = buildUri(filter, perPage, cursor, mailto);
        String url = uri.toString();
        ExternalApiLogger.logHttpRequest(log, "GET", url);

        Mono<JsonNode> request = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout());

        OpenAlexConfigurationProperties.Retry retry = properties.getRetry();
        if (retry != null && retry.getMaxAttempts() > 0) {
            request = request.retryWhen(Retry.backoff(retry.getMaxAttempts(), retry.getInitialBackoff())
                    .jitter(retry.getJitter())
                    .filter(OpenAlexApiClient::isTransient)
                    .doBeforeRetry(retrySignal -> ExternalApiLogger.logRetry(log, API_NAME, url,
                            retrySignal.totalRetries() + 1, describe(retrySignal.failure())))
                    .onRetryExhaustedThrow((retryBackoffSpec, retrySignal) -> {
                        LoggingUtils.error(log, retrySignal.failure(), "All retries failed for API call {}", url);
                        return retrySignal.failure();
                    }));
        }

        return request
                .map(body -> toPage(body, url))
                .onErrorMap(e -> !(e instanceof CatalogApiException), e -> {
                    ExternalApiLogger.logApiCallFailure(log, API_NAME, "FETCH_WORKS", url, describe(e));
                    int status = e instanceof WebClientResponseException wcre
                            ? wcre.getStatusCode().value()
                            : CatalogApiException.NO_STATUS;
                    return new CatalogApiException("Failed to fetch works page: " + describe(e), status, url, e);
                });
    }

    URI buildUri(String filter, int perPage, String cursor, String mailto) {
        // Values go through template variables so reserved characters such as '+' in cursors are percent-encoded.
        Map<String, Object> values = new HashMap<>();
        values.put("filter", filter);
        values.put("perPage", perPage);
        values.put("cursor", cursor == null ? "*" : cursor);
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .queryParam("filter", "{filter}")
                .queryParam("per-page", "{perPage}")
                .queryParam("cursor", "{cursor}");
        if (mailto != null && !mailto.isBlank()) {
            values.put("mailto", mailto.strip());
            builder.queryParam("mailto", "{mailto}");
        }
        return builder.encode().buildAndExpand(values).toUri();
    }

    private WorksPage toPage(JsonNode body, String url) {
        if (body == null || !body.isObject()) {
            throw new CatalogApiException("Response is not a JSON object", CatalogApiException.NO_STATUS, url);
        }
        List<JsonNode> results = new ArrayList<>();
        JsonNode resultsNode = body.path("results");
        if (resultsNode.isArray()) {
            resultsNode.forEach(results::add);
        }
        JsonNode meta = body.path("meta");
        JsonNode cursorNode = meta.path("next_cursor");
        String nextCursor = cursorNode.isTextual() && !cursorNode.asText().isBlank() ? cursorNode.asText() : null;
        Integer totalCount = meta.path("count").isNumber() ? meta.path("count").intValue() : null;

        ExternalApiLogger.logHttpResponse(log, 200, url, results.size());
        return new WorksPage(results, nextCursor, totalCount);
    }

    private Duration timeout() {
        Duration timeout = properties.getTimeout();
        return timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(30) : timeout;
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof WebClientResponseException wcre) {
            return wcre.getStatusCode().is5xxServerError();
        }
        return throwable instanceof TimeoutException
                || throwable instanceof IOException
                || throwable instanceof WebClientRequestException;
    }

    private static String describe(Throwable throwable) {
        if (throwable instanceof WebClientResponseException wcre) {
            return "HTTP " + wcre.getStatusCode().value();
        }
        return throwable.getClass().getSimpleName() + (throwable.getMessage() == null ? "" : ": " + throwable.getMessage());
    }
}
