package com.williamcallahan.scholarly_dashboard.repository.schema;

/**
 * Single-column foreign key from {@code column} to {@code referencedTable(referencedColumn)}.
 */
public record ForeignKeyDefinition(String column, String referencedTable, String referencedColumn) {

    String ddl() {
        return "FOREIGN KEY (" + column + ") REFERENCES " + referencedTable + "(" + referencedColumn + ")";
    }
}
