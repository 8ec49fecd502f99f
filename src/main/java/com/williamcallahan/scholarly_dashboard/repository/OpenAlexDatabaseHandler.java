package com.williamcallahan.scholarly_dashboard.repository;

import com.williamcallahan.scholarly_dashboard.model.TableRow;
import com.williamcallahan.scholarly_dashboard.repository.schema.ColumnDefinition;
import com.williamcallahan.scholarly_dashboard.repository.schema.OpenAlexSchema;
import com.williamcallahan.scholarly_dashboard.repository.schema.TableDefinition;
import com.williamcallahan.scholarly_dashboard.util.JdbcUtils;
import com.williamcallahan.scholarly_dashboard.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PostgreSQL handler for the OpenAlex-shaped schema declared in {@link OpenAlexSchema}.
 *
 * <p>Each row is checked by primary key and inserted only when absent. The insert itself
 * carries {@code ON CONFLICT DO NOTHING}, so a concurrent writer that wins the race turns
 * our insert into a no-op instead of a constraint violation.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class OpenAlexDatabaseHandler implements DatabaseHandler {

    private static final Logger log = LoggerFactory.getLogger(OpenAlexDatabaseHandler.class);

    private static final ResultSetExtractor<QueryResult> QUERY_RESULT_EXTRACTOR = rs -> {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), readValue(rs.getObject(i)));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    };

    private final JdbcTemplate jdbcTemplate;

    public OpenAlexDatabaseHandler(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void ensureSchema() {
        for (TableDefinition table : OpenAlexSchema.tables()) {
            jdbcTemplate.execute(table.createTableSql());
            log.debug("Ensured table {}", table.name());
        }
        log.info("Schema ready: {} tables ({})", OpenAlexSchema.tables().size(), String.join(", ", insertionOrder()));
    }

    @Override
    public List<String> insertionOrder() {
        return OpenAlexSchema.insertionOrder();
    }

    @Override
    public InsertSummary insertIfAbsent(String table, Collection<? extends TableRow> rows) {
        TableDefinition definition = OpenAlexSchema.table(table)
            .orElseThrow(() -> new IllegalArgumentException("Unknown table: " + table));
        if (rows == null || rows.isEmpty()) {
            return InsertSummary.EMPTY;
        }

        int inserted = 0;
        int alreadyPresent = 0;
        int skipped = 0;
        for (TableRow row : rows) {
            if (row == null) {
                skipped++;
                continue;
            }
            Map<String, Object> values = row.columnValues();
            Object[] keyValues = definition.primaryKey().stream().map(values::get).toArray();
            if (hasNullKey(keyValues)) {
                log.warn("Skipping {} row with missing primary key {}: {}", table, definition.primaryKey(), values);
                skipped++;
                continue;
            }
            if (JdbcUtils.exists(jdbcTemplate, definition.existsSql(), keyValues)) {
                log.debug("{} row {} already present", table, List.of(keyValues));
                alreadyPresent++;
                continue;
            }
            int affected = jdbcTemplate.update(definition.insertSql(), ps -> bindRow(ps, definition, values));
            if (affected > 0) {
                inserted++;
            } else {
                // Lost the race to another writer; the unique constraint kept one copy.
                log.debug("{} row {} inserted concurrently", table, List.of(keyValues));
                alreadyPresent++;
            }
        }
        return new InsertSummary(inserted, alreadyPresent, skipped);
    }

    @Override
    public QueryResult query(String sql, Object... args) {
        if (sql == null || sql.isBlank()) {
            log.warn("Ignoring blank query");
            return QueryResult.empty();
        }
        try {
            QueryResult result = jdbcTemplate.query(sql, QUERY_RESULT_EXTRACTOR, args);
            return result == null ? QueryResult.empty() : result;
        } catch (DataAccessException ex) {
            LoggingUtils.warn(log, ex, "Query failed, returning empty result: {} [{}]", ex.getMostSpecificCause().getMessage(), sql);
            return QueryResult.empty();
        }
    }

    private static boolean hasNullKey(Object[] keyValues) {
        for (Object value : keyValues) {
            if (value == null || (value instanceof String s && s.isBlank())) {
                return true;
            }
        }
        return false;
    }

    private static void bindRow(PreparedStatement ps, TableDefinition definition, Map<String, Object> values) throws SQLException {
        int index = 1;
        for (ColumnDefinition column : definition.columns()) {
            bindValue(ps, index++, column, values.get(column.name()));
        }
    }

    private static void bindValue(PreparedStatement ps, int index, ColumnDefinition column, Object value) throws SQLException {
        switch (column.type()) {
            case TEXT -> {
                if (value == null) {
                    ps.setNull(index, Types.VARCHAR);
                } else {
                    ps.setString(index, value.toString());
                }
            }
            case INTEGER -> {
                if (value instanceof Number number) {
                    ps.setInt(index, number.intValue());
                } else {
                    ps.setNull(index, Types.INTEGER);
                }
            }
            case DOUBLE -> {
                if (value instanceof Number number) {
                    ps.setDouble(index, number.doubleValue());
                } else {
                    ps.setNull(index, Types.DOUBLE);
                }
            }
            case BOOLEAN -> {
                if (value instanceof Boolean bool) {
                    ps.setBoolean(index, bool);
                } else {
                    ps.setNull(index, Types.BOOLEAN);
                }
            }
            case DATE -> {
                if (value instanceof LocalDate date) {
                    ps.setDate(index, Date.valueOf(date));
                } else {
                    ps.setNull(index, Types.DATE);
                }
            }
            case TEXT_ARRAY -> {
                if (value instanceof Collection<?> collection) {
                    Object[] elements = collection.stream().filter(Objects::nonNull).map(Object::toString).toArray();
                    ps.setArray(index, ps.getConnection().createArrayOf("text", elements));
                } else {
                    ps.setNull(index, Types.ARRAY);
                }
            }
        }
    }

    private static Object readValue(Object value) throws SQLException {
        if (value instanceof Array array) {
            return JdbcUtils.toList(array);
        }
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        return value;
    }
}
