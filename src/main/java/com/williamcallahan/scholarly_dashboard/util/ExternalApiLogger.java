package com.williamcallahan.scholarly_dashboard.util;

import org.slf4j.Logger;

/**
 * Centralized logging for catalog API calls made while harvesting.
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix so a harvest can be followed
 * page by page in the logs: request, response, page result and failure.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url) {
        log.info("{} [HTTP] {} request to: {}", PREFIX, method, url);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int resultCount) {
        log.info("{} [HTTP] Response: status={}, url={}, results={}", PREFIX, statusCode, url, resultCount);
    }

    /**
     * Log a retry of a transient failure
     */
    public static void logRetry(Logger log, String apiName, String url, long attempt, String reason) {
        log.warn("{} [{}] RETRY #{} for url='{}' - {}", PREFIX, apiName, attempt, url, reason);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String url, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for url='{}' - {}", PREFIX, apiName, operation, url, reason);
    }

    /**
     * Log page progress of a cursor walk
     */
    public static void logPageProgress(Logger log, String apiName, int pageNumber, int resultCount, String cursor) {
        log.info("{} [{}] PAGE {}: {} result(s), cursor='{}'", PREFIX, apiName, pageNumber, resultCount, cursor);
    }
}
