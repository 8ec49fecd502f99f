package com.williamcallahan.scholarly_dashboard.repository.schema;

/**
 * PostgreSQL column types used by the normalized schema.
 */
public enum ColumnType {
    TEXT("TEXT"),
    INTEGER("INTEGER"),
    DATE("DATE"),
    BOOLEAN("BOOLEAN"),
    DOUBLE("DOUBLE PRECISION"),
    TEXT_ARRAY("TEXT[]");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String sqlType() {
        return sqlType;
    }
}
