package com.williamcallahan.scholarly_dashboard.exception;

/**
 * Thrown when a catalog API page cannot be fetched.
 *
 * {@code statusCode} is the HTTP status, or {@link #NO_STATUS} for transport failures
 * (timeouts, refused connections, unreadable bodies).
 */
public class CatalogApiException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String url;

    public CatalogApiException(String message, int statusCode, String url) {
        super(message);
        this.statusCode = statusCode;
        this.url = url;
    }

    public CatalogApiException(String message, int statusCode, String url, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
