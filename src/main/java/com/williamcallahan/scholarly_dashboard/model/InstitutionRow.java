package com.williamcallahan.scholarly_dashboard.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record InstitutionRow(
    String institutionId,
    String institutionName,
    String ror,
    String type,
    String countryCode
) implements TableRow {

    public static final String TABLE = "institutions";

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("institution_id", institutionId);
        values.put("institution_name", institutionName);
        values.put("ror", ror);
        values.put("type", type);
        values.put("country_code", countryCode);
        return values;
    }
}
