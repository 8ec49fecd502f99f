package com.williamcallahan.scholarly_dashboard.model;

import java.util.Map;

/**
 * A flat row destined for one table of the normalized schema.
 *
 * Column values are keyed by column name in declaration order; values may be null.
 */
public interface TableRow {

    String tableName();

    Map<String, Object> columnValues();
}
