package com.williamcallahan.scholarly_dashboard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All rows extracted from one catalog work record, grouped by destination table.
 *
 * Iteration order of {@link #rowsByTable()} is the schema's insertion order, so callers
 * can insert table by table without re-deriving dependencies.
 */
public record ParsedWork(String workId, Map<String, List<TableRow>> rowsByTable) {

    public ParsedWork {
        Map<String, List<TableRow>> copy = new LinkedHashMap<>();
        if (rowsByTable != null) {
            rowsByTable.forEach((table, rows) -> copy.put(table, rows == null ? List.of() : List.copyOf(rows)));
        }
        rowsByTable = Collections.unmodifiableMap(copy);
    }

    public List<TableRow> rowsFor(String table) {
        return rowsByTable.getOrDefault(table, List.of());
    }

    public Set<String> tableNames() {
        return rowsByTable.keySet();
    }

    public int totalRows() {
        return rowsByTable.values().stream().mapToInt(List::size).sum();
    }
}
