package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record TopicByWorkRow(String workId, String topicId, Double score) implements TableRow {

    public static final String TABLE = "topics_by_work";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("work_id", workId);
        values.put("topic_id", topicId);
        values.put("score", score);
        return values;
    }
}
