package com.williamcallahan.scholarly_dashboard.repository;

import com.williamcallahan.scholarly_dashboard.model.TableRow;

import java.util.Collection;
import java.util.List;

/**
 * Capability interface over a normalized relational store.
 *
 * <p>Implementations own one schema family: they declare its tables, the order in which
 * those tables must be populated, and provide idempotent writes plus failure-absorbing reads.
 */
public interface DatabaseHandler {

    /**
     * Creates every declared table that does not exist yet. Safe to call repeatedly.
     */
    void ensureSchema();

    /**
     * Table names in dependency order: parents before the tables that reference them.
     */
    List<String> insertionOrder();

    /**
     * Inserts each row whose primary key is not stored yet.
     *
     * <p>Rows with a null primary key component are skipped and logged; the remaining rows
     * are still attempted. Re-submitting stored keys is a no-op.
     *
     * @throws IllegalArgumentException when {@code table} is not part of the schema
     */
    InsertSummary insertIfAbsent(String table, Collection<? extends TableRow> rows);

    default InsertSummary insertIfAbsent(String table, TableRow row) {
        return insertIfAbsent(table, row == null ? List.of() : List.of(row));
    }

    /**
     * Runs a read query. Failures are logged and reported as {@link QueryResult#empty()}.
     */
    QueryResult query(String sql, Object... args);
}
