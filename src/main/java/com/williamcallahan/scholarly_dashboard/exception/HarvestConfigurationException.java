package com.williamcallahan.scholarly_dashboard.exception;

/**
 * Thrown when a harvest request is invalid, before any call to the catalog API
 *
 * @author William Callahan
 *
 * Features:
 * - Covers page size, year bounds, missing sink/handler and sink file collisions
 * - Never retried; the request has to be corrected by the caller
 */
public class HarvestConfigurationException extends RuntimeException {

    public HarvestConfigurationException(String message) {
        super(message);
    }
}
