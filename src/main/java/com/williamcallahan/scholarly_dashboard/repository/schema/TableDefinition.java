package com.williamcallahan.scholarly_dashboard.repository.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Declarative description of one table: columns in order, primary key columns and
 * foreign keys. Generates the DDL and the statements used by the insert path.
 */
public record TableDefinition(
    String name,
    List<ColumnDefinition> columns,
    List<String> primaryKey,
    List<ForeignKeyDefinition> foreignKeys
) {

    public TableDefinition {
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        if (primaryKey.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " declares no primary key");
        }
        List<String> columnNames = columnNames();
        for (String key : primaryKey) {
            if (!columnNames.contains(key)) {
                throw new IllegalArgumentException("Primary key column " + key + " is not a column of " + name);
            }
        }
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::name).toList();
    }

    public String createTableSql() {
        List<String> parts = new ArrayList<>();
        columns.forEach(c -> parts.add(c.ddl()));
        parts.add("PRIMARY KEY (" + String.join(", ", primaryKey) + ")");
        foreignKeys.forEach(fk -> parts.add(fk.ddl()));
        return "CREATE TABLE IF NOT EXISTS " + name + " (\n    " + String.join(",\n    ", parts) + "\n)";
    }

    /**
     * Selects the row matching the primary key; parameters follow {@link #primaryKey()} order.
     */
    public String existsSql() {
        String predicate = primaryKey.stream().map(k -> k + " = ?").collect(Collectors.joining(" AND "));
        return "SELECT 1 FROM " + name + " WHERE " + predicate;
    }

    /**
     * Inserts one row; parameters follow {@link #columnNames()} order. The unique
     * constraint decides when two writers race on the same key.
     */
    public String insertSql() {
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + name + " (" + String.join(", ", columnNames()) + ") VALUES (" + placeholders
            + ") ON CONFLICT (" + String.join(", ", primaryKey) + ") DO NOTHING";
    }
}
