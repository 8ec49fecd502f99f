package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record AuthorRow(String authorId, String authorName, String orcid) implements TableRow {

    public static final String TABLE = "authors";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("author_id", authorId);
        values.put("author_name", authorName);
        values.put("orcid", orcid);
        return values;
    }
}
