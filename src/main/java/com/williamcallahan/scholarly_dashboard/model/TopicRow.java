package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Topic dimension row with its subfield, field and domain denormalized onto it.
 */
public record TopicRow(
    String topicId,
    String topicName,
    String subfieldId,
    String subfieldName,
    String fieldId,
    String fieldName,
    String domainId,
    String domainName
) implements TableRow {

    public static final String TABLE = "topics";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("topic_id", topicId);
        values.put("topic_name", topicName);
        values.put("subfield_id", subfieldId);
        values.put("subfield_name", subfieldName);
        values.put("field_id", fieldId);
        values.put("field_name", fieldName);
        values.put("domain_id", domainId);
        values.put("domain_name", domainName);
        return values;
    }
}
