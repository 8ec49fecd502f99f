package com.williamcallahan.scholarly_dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of catalog works.
 *
 * @param results raw work records, in response order
 * @param nextCursor continuation cursor, {@code null} when the walk is complete
 * @param totalCount {@code meta.count} as reported by the API, if present
 */
public record WorksPage(List<JsonNode> results, String nextCursor, Integer totalCount) {

    public WorksPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
