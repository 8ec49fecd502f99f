package com.williamcallahan.scholarly_dashboard.repository.schema;

import com.williamcallahan.scholarly_dashboard.model.AuthorRow;
import com.williamcallahan.scholarly_dashboard.model.AuthorshipRow;
import com.williamcallahan.scholarly_dashboard.model.CitedByYearRow;
import com.williamcallahan.scholarly_dashboard.model.InstitutionRow;
import com.williamcallahan.scholarly_dashboard.model.SourceRow;
import com.williamcallahan.scholarly_dashboard.model.TopicByWorkRow;
import com.williamcallahan.scholarly_dashboard.model.TopicRow;
import com.williamcallahan.scholarly_dashboard.model.WorkRow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnDefinition.of;
import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnType.BOOLEAN;
import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnType.DATE;
import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnType.DOUBLE;
import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnType.INTEGER;
import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnType.TEXT;
import static com.williamcallahan.scholarly_dashboard.repository.schema.ColumnType.TEXT_ARRAY;

/**
 * The OpenAlex-shaped schema: eight tables declared in dependency order.
 *
 * <p>Dimension tables (sources, authors, institutions, topics) come before the fact and
 * join tables that reference them. The same order is used for creation and for inserts.
 */
public final class OpenAlexSchema {

    public static final TableDefinition PRIMARY_SOURCE = new TableDefinition(
        SourceRow.TABLE,
        List.of(
            of("source_id", TEXT),
            of("source_name", TEXT),
            of("source_issn_l", TEXT),
            of("is_oa", BOOLEAN),
            of("host_organization_id", TEXT),
            of("host_organization_name", TEXT),
            of("issn", TEXT_ARRAY),
            of("type", TEXT)),
        List.of("source_id"),
        List.of());

    public static final TableDefinition AUTHORS = new TableDefinition(
        AuthorRow.TABLE,
        List.of(
            of("author_id", TEXT),
            of("author_name", TEXT),
            of("orcid", TEXT)),
        List.of("author_id"),
        List.of());

    public static final TableDefinition INSTITUTIONS = new TableDefinition(
        InstitutionRow.TABLE,
        List.of(
            of("institution_id", TEXT),
            of("institution_name", TEXT),
            of("ror", TEXT),
            of("type", TEXT),
            of("country_code", TEXT)),
        List.of("institution_id"),
        List.of());

    public static final TableDefinition TOPICS = new TableDefinition(
        TopicRow.TABLE,
        List.of(
            of("topic_id", TEXT),
            of("topic_name", TEXT),
            of("subfield_id", TEXT),
            of("subfield_name", TEXT),
            of("field_id", TEXT),
            of("field_name", TEXT),
            of("domain_id", TEXT),
            of("domain_name", TEXT)),
        List.of("topic_id"),
        List.of());

    public static final TableDefinition WORKS = new TableDefinition(
        WorkRow.TABLE,
        List.of(
            of("work_id", TEXT),
            of("doi", TEXT),
            of("work_title", TEXT),
            of("publication_year", INTEGER),
            of("publication_date", DATE),
            of("work_type", TEXT),
            of("cited_by_count", INTEGER),
            of("primary_source_id", TEXT),
            of("is_oa", BOOLEAN),
            of("oa_status", TEXT),
            of("referenced_works_count", INTEGER),
            of("indexed_in", TEXT_ARRAY)),
        List.of("work_id"),
        List.of(new ForeignKeyDefinition("primary_source_id", SourceRow.TABLE, "source_id")));

    public static final TableDefinition AUTHORSHIPS = new TableDefinition(
        AuthorshipRow.TABLE,
        List.of(
            of("work_id", TEXT),
            of("author_id", TEXT),
            of("author_position", TEXT),
            of("is_corresponding", BOOLEAN),
            of("institution_id", TEXT_ARRAY)),
        List.of("work_id", "author_id"),
        List.of(new ForeignKeyDefinition("work_id", WorkRow.TABLE, "work_id")));

    public static final TableDefinition CITED_BY_YEAR = new TableDefinition(
        CitedByYearRow.TABLE,
        List.of(
            of("work_id", TEXT),
            of("year", INTEGER),
            of("cited_count", INTEGER)),
        List.of("work_id", "year"),
        List.of(new ForeignKeyDefinition("work_id", WorkRow.TABLE, "work_id")));

    public static final TableDefinition TOPICS_BY_WORK = new TableDefinition(
        TopicByWorkRow.TABLE,
        List.of(
            of("work_id", TEXT),
            of("topic_id", TEXT),
            of("score", DOUBLE)),
        List.of("work_id", "topic_id"),
        List.of(
            new ForeignKeyDefinition("work_id", WorkRow.TABLE, "work_id"),
            new ForeignKeyDefinition("topic_id", TopicRow.TABLE, "topic_id")));

    private static final List<TableDefinition> TABLES = List.of(
        PRIMARY_SOURCE, AUTHORS, INSTITUTIONS, TOPICS, WORKS, AUTHORSHIPS, CITED_BY_YEAR, TOPICS_BY_WORK);

    private static final Map<String, TableDefinition> BY_NAME;

    static {
        Map<String, TableDefinition> byName = new LinkedHashMap<>();
        TABLES.forEach(t -> byName.put(t.name(), t));
        BY_NAME = Map.copyOf(byName);
    }

    private OpenAlexSchema() {
    }

    /**
     * Tables in creation/insertion order.
     */
    public static List<TableDefinition> tables() {
        return TABLES;
    }

    public static List<String> insertionOrder() {
        return TABLES.stream().map(TableDefinition::name).toList();
    }

    public static Optional<TableDefinition> table(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
