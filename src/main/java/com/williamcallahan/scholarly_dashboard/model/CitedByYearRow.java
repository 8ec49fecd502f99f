package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record CitedByYearRow(String workId, Integer year, Integer citedCount) implements TableRow {

    public static final String TABLE = "cited_by_year";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("work_id", workId);
        values.put("year", year);
        values.put("cited_count", citedCount);
        return values;
    }
}
