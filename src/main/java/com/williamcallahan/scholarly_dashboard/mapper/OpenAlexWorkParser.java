package com.williamcallahan.scholarly_dashboard.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.williamcallahan.scholarly_dashboard.model.AuthorRow;
import com.williamcallahan.scholarly_dashboard.model.AuthorshipRow;
import com.williamcallahan.scholarly_dashboard.model.CitedByYearRow;
import com.williamcallahan.scholarly_dashboard.model.InstitutionRow;
import com.williamcallahan.scholarly_dashboard.model.ParsedWork;
import com.williamcallahan.scholarly_dashboard.model.SourceRow;
import com.williamcallahan.scholarly_dashboard.model.TableRow;
import com.williamcallahan.scholarly_dashboard.model.TopicByWorkRow;
import com.williamcallahan.scholarly_dashboard.model.TopicRow;
import com.williamcallahan.scholarly_dashboard.model.WorkRow;
import com.williamcallahan.scholarly_dashboard.repository.schema.OpenAlexSchema;
import com.williamcallahan.scholarly_dashboard.util.IdentifierNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens one OpenAlex work record into the rows of the normalized schema.
 * <p>
 * Sub-extractions:
 * - work: one row from top-level fields, source id taken from {@code primary_location.source}
 * - source: one row when {@code primary_location.source} is present, none otherwise
 * - authorships/authors: one of each per {@code authorships[]} entry
 * - institutions: one per institution nested under any authorship (duplicates kept)
 * - cited_by_year: one per {@code counts_by_year[]} entry
 * - topics_by_work/topics: one of each per {@code topics[]} entry
 * <p>
 * Missing nested objects degrade to null fields and missing lists to no rows.
 * Duplicate keys across rows are left for the idempotent insert to resolve.
 * Stateless and thread-safe.
 */
@Component
@Slf4j
public class OpenAlexWorkParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Parse one work record.
     *
     * @param work the raw work object as returned in a catalog {@code results} array
     * @return rows grouped by table, in schema insertion order
     */
    public ParsedWork parse(JsonNode work) {
        if (work == null || !work.isObject()) {
            throw new IllegalArgumentException("Work record must be a JSON object");
        }
        String workId = IdentifierNormalizer.normalize(text(work, "id"));
        JsonNode source = object(object(work, "primary_location"), "source");

        List<TableRow> sources = new ArrayList<>();
        if (!source.isMissingNode()) {
            sources.add(parseSource(source));
        }
        List<TableRow> authorships = new ArrayList<>();
        List<TableRow> authors = new ArrayList<>();
        List<TableRow> institutions = new ArrayList<>();
        for (JsonNode authorship : array(work, "authorships")) {
            authorships.add(parseAuthorship(workId, authorship));
            authors.add(parseAuthor(object(authorship, "author")));
            for (JsonNode institution : array(authorship, "institutions")) {
                institutions.add(parseInstitution(institution));
            }
        }
        List<TableRow> citedByYear = new ArrayList<>();
        for (JsonNode count : array(work, "counts_by_year")) {
            citedByYear.add(new CitedByYearRow(workId, integer(count, "year"), integer(count, "cited_by_count")));
        }
        List<TableRow> topicsByWork = new ArrayList<>();
        List<TableRow> topics = new ArrayList<>();
        for (JsonNode topic : array(work, "topics")) {
            topicsByWork.add(new TopicByWorkRow(workId, id(topic, "id"), decimal(topic, "score")));
            topics.add(parseTopic(topic));
        }

        Map<String, List<TableRow>> byTable = new LinkedHashMap<>();
        byTable.put(SourceRow.TABLE, sources);
        byTable.put(AuthorRow.TABLE, authors);
        byTable.put(InstitutionRow.TABLE, institutions);
        byTable.put(TopicRow.TABLE, topics);
        byTable.put(WorkRow.TABLE, List.of(parseWork(work, workId, source)));
        byTable.put(AuthorshipRow.TABLE, authorships);
        byTable.put(CitedByYearRow.TABLE, citedByYear);
        byTable.put(TopicByWorkRow.TABLE, topicsByWork);

        // Schema insertion order is authoritative
        Map<String, List<TableRow>> ordered = new LinkedHashMap<>();
        for (String table : OpenAlexSchema.insertionOrder()) {
            ordered.put(table, byTable.getOrDefault(table, List.of()));
        }
        return new ParsedWork(workId, ordered);
    }

    /**
     * Parse one line of a line-delimited JSON sink.
     *
     * @throws IllegalArgumentException when the line is not a JSON object
     */
    public ParsedWork parseLine(String line) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("Empty work line");
        }
        try {
            return parse(OBJECT_MAPPER.readTree(line));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed work line: " + e.getOriginalMessage(), e);
        }
    }

    private WorkRow parseWork(JsonNode work, String workId, JsonNode source) {
        JsonNode openAccess = object(work, "open_access");
        return new WorkRow(
            workId,
            IdentifierNormalizer.normalize(text(work, "doi")),
            text(work, "title"),
            integer(work, "publication_year"),
            date(work, "publication_date"),
            text(work, "type"),
            integer(work, "cited_by_count"),
            id(source, "id"),
            bool(openAccess, "is_oa"),
            text(openAccess, "oa_status"),
            integer(work, "referenced_works_count"),
            strings(work, "indexed_in"));
    }

    private SourceRow parseSource(JsonNode source) {
        return new SourceRow(
            id(source, "id"),
            text(source, "display_name"),
            text(source, "issn_l"),
            bool(source, "is_oa"),
            id(source, "host_organization"),
            text(source, "host_organization_name"),
            strings(source, "issn"),
            text(source, "type"));
    }

    private AuthorshipRow parseAuthorship(String workId, JsonNode authorship) {
        List<String> institutionIds = new ArrayList<>();
        for (JsonNode institution : array(authorship, "institutions")) {
            String institutionId = id(institution, "id");
            if (institutionId != null) {
                institutionIds.add(institutionId);
            }
        }
        return new AuthorshipRow(
            workId,
            id(object(authorship, "author"), "id"),
            text(authorship, "author_position"),
            bool(authorship, "is_corresponding"),
            institutionIds);
    }

    private AuthorRow parseAuthor(JsonNode author) {
        return new AuthorRow(id(author, "id"), text(author, "display_name"), id(author, "orcid"));
    }

    private InstitutionRow parseInstitution(JsonNode institution) {
        return new InstitutionRow(
            id(institution, "id"),
            text(institution, "display_name"),
            id(institution, "ror"),
            text(institution, "type"),
            text(institution, "country_code"));
    }

    private TopicRow parseTopic(JsonNode topic) {
        JsonNode subfield = object(topic, "subfield");
        JsonNode field = object(topic, "field");
        JsonNode domain = object(topic, "domain");
        return new TopicRow(
            id(topic, "id"),
            text(topic, "display_name"),
            id(subfield, "id"),
            text(subfield, "display_name"),
            id(field, "id"),
            text(field, "display_name"),
            id(domain, "id"),
            text(domain, "display_name"));
    }

    // ---- JSON access helpers; absent and JSON null are treated alike ----

    private static JsonNode object(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        return node.isObject() ? node : MissingNode.getInstance();
    }

    private static List<JsonNode> array(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (!node.isArray()) {
            return List.of();
        }
        List<JsonNode> elements = new ArrayList<>(node.size());
        node.forEach(element -> {
            if (element.isObject()) {
                elements.add(element);
            }
        });
        return elements;
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static String id(JsonNode parent, String field) {
        return IdentifierNormalizer.normalize(text(parent, field));
    }

    private static Integer integer(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (node.isNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().strip());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-integer {}='{}'", field, node.asText());
            }
        }
        return null;
    }

    private static Double decimal(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        return node.isNumber() ? node.doubleValue() : null;
    }

    private static Boolean bool(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        return node.isBoolean() ? node.booleanValue() : null;
    }

    private static LocalDate date(JsonNode parent, String field) {
        String value = text(parent, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.strip());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable {}='{}'", field, value);
            return null;
        }
    }

    private static List<String> strings(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (!node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        node.forEach(element -> {
            if (!element.isNull() && !element.isContainerNode()) {
                values.add(element.asText());
            }
        });
        return values;
    }
}
