package com.williamcallahan.scholarly_dashboard.controller.support;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error payloads shared by the aggregate endpoints: {@code {"error": ..., "message": ...}}.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
    }

    public static Map<String, String> errorBody(String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    /**
     * 400 response for a rejected query parameter.
     */
    public static ResponseEntity<Map<String, String>> invalidParameter(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody("Invalid request", ex.getMessage()));
    }
}
