package com.williamcallahan.scholarly_dashboard.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One publication. {@code primarySourceId} references {@link SourceRow#sourceId()}.
 */
public record WorkRow(
    String workId,
    String doi,
    String workTitle,
    Integer publicationYear,
    LocalDate publicationDate,
    String workType,
    Integer citedByCount,
    String primarySourceId,
    Boolean isOa,
    String oaStatus,
    Integer referencedWorksCount,
    List<String> indexedIn
) implements TableRow {

    public static final String TABLE = "works";

    public WorkRow {
        indexedIn = indexedIn == null ? List.of() : List.copyOf(indexedIn);
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("work_id", workId);
        values.put("doi", doi);
        values.put("work_title", workTitle);
        values.put("publication_year", publicationYear);
        values.put("publication_date", publicationDate);
        values.put("work_type", workType);
        values.put("cited_by_count", citedByCount);
        values.put("primary_source_id", primarySourceId);
        values.put("is_oa", isOa);
        values.put("oa_status", oaStatus);
        values.put("referenced_works_count", referencedWorksCount);
        values.put("indexed_in", indexedIn);
        return values;
    }
}
