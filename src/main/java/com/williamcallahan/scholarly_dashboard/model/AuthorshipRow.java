package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One author on one work, with zero or more affiliated institution ids.
 */
public record AuthorshipRow(
    String workId,
    String authorId,
    String authorPosition,
    Boolean isCorresponding,
    List<String> institutionIds
) implements TableRow {

    public static final String TABLE = "authorships";

    public AuthorshipRow {
        institutionIds = institutionIds == null ? List.of() : List.copyOf(institutionIds);
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("work_id", workId);
        values.put("author_id", authorId);
        values.put("author_position", authorPosition);
        values.put("is_corresponding", isCorresponding);
        values.put("institution_id", institutionIds);
        return values;
    }
}
