package com.williamcallahan.scholarly_dashboard.repository;

import com.williamcallahan.scholarly_dashboard.mapper.OpenAlexWorkParser;
import com.williamcallahan.scholarly_dashboard.model.AuthorRow;
import com.williamcallahan.scholarly_dashboard.model.ParsedWork;
import com.williamcallahan.scholarly_dashboard.model.TableRow;
import com.williamcallahan.scholarly_dashboard.testutil.OpenAlexFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the handler against a real PostgreSQL; skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class OpenAlexDatabaseHandlerIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

    private JdbcTemplate jdbcTemplate;
    private OpenAlexDatabaseHandler handler;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("DROP SCHEMA public CASCADE");
        jdbcTemplate.execute("CREATE SCHEMA public");
        handler = new OpenAlexDatabaseHandler(jdbcTemplate);
        handler.ensureSchema();
    }

    @Test
    @DisplayName("ensureSchema is repeatable")
    void ensureSchemaTwice() {
        handler.ensureSchema();

        Integer tables = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'public'", Integer.class);
        assertThat(tables).isEqualTo(8);
    }

    @Test
    @DisplayName("inserting the same row twice stores it once")
    void insertTwiceStoresOnce() {
        AuthorRow author = new AuthorRow("A1", "Ada Lovelace", "0000-0001-0000-0001");

        assertThat(handler.insertIfAbsent(AuthorRow.TABLE, author)).isEqualTo(new InsertSummary(1, 0, 0));
        assertThat(handler.insertIfAbsent(AuthorRow.TABLE, author)).isEqualTo(new InsertSummary(0, 1, 0));

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM authors", Integer.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("a null key is skipped and the other rows are still written")
    void nullKeyDoesNotBlockBatch() {
        InsertSummary summary = handler.insertIfAbsent(AuthorRow.TABLE, List.of(
            new AuthorRow(null, "Anonymous", null),
            new AuthorRow("A2", "Grace Hopper", null)));

        assertThat(summary).isEqualTo(new InsertSummary(1, 0, 1));
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM authors", Integer.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("a parsed work round-trips through the schema and replays idempotently")
    void parsedWorkInsertedTwice() {
        ParsedWork parsed = new OpenAlexWorkParser().parse(OpenAlexFixtures.sampleWork());

        InsertSummary first = insertAll(parsed);
        InsertSummary second = insertAll(parsed);

        assertThat(first.inserted()).isEqualTo(parsed.totalRows());
        assertThat(second.inserted()).isZero();
        assertThat(second.alreadyPresent()).isEqualTo(parsed.totalRows());

        QueryResult works = handler.query("SELECT work_id, publication_date, indexed_in FROM works");
        assertThat(works.size()).isEqualTo(1);
        Map<String, Object> row = works.rows().get(0);
        assertThat(row).containsEntry("work_id", "W4391234567");
        assertThat(row).containsEntry("publication_date", LocalDate.of(2024, 2, 15));
        assertThat(row.get("indexed_in")).isEqualTo(List.of("crossref", "doaj"));

        QueryResult affiliations = handler.query(
            "SELECT i.country_code FROM authorships a JOIN institutions i ON i.institution_id = ANY(a.institution_id)"
                + " WHERE a.work_id = ? ORDER BY i.country_code", "W4391234567");
        assertThat(affiliations.rows()).extracting(r -> r.get("country_code")).containsExactly("BR", "GB");
    }

    @Test
    @DisplayName("a failing query yields an empty result")
    void failingQueryIsAbsorbed() {
        assertThat(handler.query("SELECT * FROM no_such_table").isEmpty()).isTrue();
    }

    private InsertSummary insertAll(ParsedWork parsed) {
        InsertSummary summary = InsertSummary.EMPTY;
        for (String table : handler.insertionOrder()) {
            List<TableRow> rows = parsed.rowsFor(table);
            summary = summary.plus(handler.insertIfAbsent(table, rows));
        }
        return summary;
    }
}
