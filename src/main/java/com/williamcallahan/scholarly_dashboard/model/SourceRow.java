package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publication venue taken from a work's primary location.
 */
public record SourceRow(
    String sourceId,
    String sourceName,
    String sourceIssnL,
    Boolean isOa,
    String hostOrganizationId,
    String hostOrganizationName,
    List<String> issn,
    String type
) implements TableRow {

    public static final String TABLE = "primary_source";

    public SourceRow {
        issn = issn == null ? List.of() : List.copyOf(issn);
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("source_id", sourceId);
        values.put("source_name", sourceName);
        values.put("source_issn_l", sourceIssnL);
        values.put("is_oa", isOa);
        values.put("host_organization_id", hostOrganizationId);
        values.put("host_organization_name", hostOrganizationName);
        values.put("issn", issn);
        values.put("type", type);
        return values;
    }
}
