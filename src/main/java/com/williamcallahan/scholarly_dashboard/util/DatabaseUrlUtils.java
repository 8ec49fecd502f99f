package com.williamcallahan.scholarly_dashboard.util;

import java.util.regex.Pattern;

/**
 * Helpers for pulling the database name out of a JDBC URL and pointing a URL at a
 * different database (used when bootstrapping the target database through an admin
 * connection).
 */
public final class DatabaseUrlUtils {

    private static final Pattern SAFE_DATABASE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private DatabaseUrlUtils() {
    }

    /**
     * Returns the database segment of a URL such as
     * {@code jdbc:postgresql://host:5432/openalex_db?sslmode=require}, or {@code null}.
     */
    public static String databaseName(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String withoutQuery = stripQuery(url);
        int schemeEnd = withoutQuery.indexOf("://");
        int lastSlash = withoutQuery.lastIndexOf('/');
        if (lastSlash < 0 || lastSlash <= schemeEnd + 2) {
            return null;
        }
        String name = withoutQuery.substring(lastSlash + 1);
        return name.isBlank() ? null : name;
    }

    /**
     * Replaces the database segment of {@code url} with {@code newDatabaseName}, keeping any query string.
     */
    public static String replaceDatabaseName(String url, String newDatabaseName) {
        if (url == null || newDatabaseName == null) {
            return url;
        }
        String query = "";
        String base = url;
        int queryIndex = url.indexOf('?');
        if (queryIndex >= 0) {
            query = url.substring(queryIndex);
            base = url.substring(0, queryIndex);
        }
        int schemeEnd = base.indexOf("://");
        int lastSlash = base.lastIndexOf('/');
        if (lastSlash < 0 || lastSlash <= schemeEnd + 2) {
            return base + "/" + newDatabaseName + query;
        }
        return base.substring(0, lastSlash + 1) + newDatabaseName + query;
    }

    /**
     * Database names are interpolated into DDL, so only plain identifiers are accepted.
     */
    public static boolean isSafeDatabaseName(String name) {
        return name != null && SAFE_DATABASE_NAME.matcher(name).matches();
    }

    private static String stripQuery(String url) {
        int queryIndex = url.indexOf('?');
        return queryIndex >= 0 ? url.substring(0, queryIndex) : url;
    }
}
