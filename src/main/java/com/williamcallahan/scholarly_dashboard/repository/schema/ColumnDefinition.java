package com.williamcallahan.scholarly_dashboard.repository.schema;

public record ColumnDefinition(String name, ColumnType type) {

    public static ColumnDefinition of(String name, ColumnType type) {
        return new ColumnDefinition(name, type);
    }

    String ddl() {
        return name + " " + type.sqlType();
    }
}
