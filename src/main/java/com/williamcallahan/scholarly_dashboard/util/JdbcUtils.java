package com.williamcallahan.scholarly_dashboard.util;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC helper methods so the handler and bootstrap code do not repeat
 * boilerplate try/catch blocks.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for an optional single result of any type, handling EmptyResultDataAccessException gracefully.
     */
    public static <T> Optional<T> queryForOptional(JdbcTemplate jdbc, String sql, Class<T> type, Object... params) {
        try {
            return Optional.ofNullable(jdbc.queryForObject(sql, type, params));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    /**
     * Check if a record exists.
     */
    public static boolean exists(JdbcTemplate jdbc, String sql, Object... params) {
        Long count = queryForOptional(jdbc, "SELECT COUNT(*) FROM (" + sql + ") AS subquery", Long.class, params).orElse(0L);
        return count > 0;
    }

    /**
     * Converts a driver-level SQL array into a list, keeping element order.
     */
    public static List<Object> toList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        try {
            Object raw = array.getArray();
            if (raw instanceof Object[] elements) {
                return new ArrayList<>(Arrays.asList(elements));
            }
            return List.of();
        } finally {
            array.free();
        }
    }
}
