package com.williamcallahan.scholarly_dashboard.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular result of a read query: ordered column labels and one map per row, keyed
 * by label in column order. Values may be null.
 */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows) {

    private static final QueryResult EMPTY = new QueryResult(List.of(), List.of());

    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : rows.stream()
            .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
            .toList();
    }

    public static QueryResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
