package com.williamcallahan.scholarly_dashboard.service.aggregate;

import com.williamcallahan.scholarly_dashboard.dto.CountryCollaboration;
import com.williamcallahan.scholarly_dashboard.dto.DomainYearValue;
import com.williamcallahan.scholarly_dashboard.dto.PrimaryTopicCount;
import com.williamcallahan.scholarly_dashboard.dto.TopicSummary;
import com.williamcallahan.scholarly_dashboard.dto.YearCount;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.repository.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Read side of the dashboard: loads snapshots through {@link DatabaseHandler#query} on each
 * request and hands them to {@link WorksAggregates}.
 *
 * Without a configured database every aggregate is empty. Query failures are absorbed by the
 * handler and surface here as empty snapshots too.
 */
@Service
@Slf4j
public class WorksAggregateService {

    static final String WORKS_SQL = """
        SELECT work_id, publication_year, work_type, is_oa, oa_status
        FROM works
        """;

    static final String AFFILIATIONS_SQL = """
        SELECT a.work_id, i.institution_id, i.institution_name, i.country_code
        FROM authorships a
        JOIN institutions i ON i.institution_id = ANY(a.institution_id)
        """;

    static final String WORK_TOPICS_SQL = """
        SELECT w.work_id, w.publication_year, w.work_type, w.cited_by_count, w.referenced_works_count,
               t.topic_id, t.topic_name, tw.score, t.subfield_name, t.field_name, t.domain_name
        FROM works w
        LEFT JOIN topics_by_work tw ON tw.work_id = w.work_id
        LEFT JOIN topics t ON t.topic_id = tw.topic_id
        ORDER BY w.work_id, tw.score DESC NULLS LAST
        """;

    static final String CITATIONS_SQL = """
        SELECT work_id, year, cited_count
        FROM cited_by_year
        """;

    private final ObjectProvider<DatabaseHandler> databaseHandlerProvider;

    public WorksAggregateService(ObjectProvider<DatabaseHandler> databaseHandlerProvider) {
        this.databaseHandlerProvider = databaseHandlerProvider;
    }

    public List<YearCount> publicationsByYear(Integer fromYear, Integer toYear, GroupBy groupBy) {
        return WorksAggregates.publicationsByYear(loadWorks(), fromYear, toYear, groupBy);
    }

    public List<CountryCollaboration> collaborationsByCountry(String homeInstitution, boolean includeAllCountries) {
        return WorksAggregates.collaborationsByCountry(loadAffiliations(), homeInstitution, includeAllCountries);
    }

    public List<PrimaryTopicCount> primaryTopics() {
        return WorksAggregates.primaryTopics(loadWorkTopics());
    }

    public List<DomainYearValue> domainCitationsByYear() {
        return WorksAggregates.domainCitationsByYear(loadWorkTopics(), loadCitations());
    }

    public List<DomainYearValue> domainWorksByYear() {
        return WorksAggregates.domainWorksByYear(loadWorkTopics());
    }

    public List<TopicSummary> topicSummary(TopicLevel level) {
        return WorksAggregates.topicSummary(loadWorkTopics(), level);
    }

    List<WorkSnapshot> loadWorks() {
        return load(WORKS_SQL, row -> new WorkSnapshot(
            string(row, "work_id"),
            integer(row, "publication_year"),
            string(row, "work_type"),
            bool(row, "is_oa"),
            string(row, "oa_status")));
    }

    List<AffiliationSnapshot> loadAffiliations() {
        return load(AFFILIATIONS_SQL, row -> new AffiliationSnapshot(
            string(row, "work_id"),
            string(row, "institution_id"),
            string(row, "institution_name"),
            string(row, "country_code")));
    }

    List<WorkTopicSnapshot> loadWorkTopics() {
        return load(WORK_TOPICS_SQL, row -> new WorkTopicSnapshot(
            string(row, "work_id"),
            integer(row, "publication_year"),
            string(row, "work_type"),
            integer(row, "cited_by_count"),
            integer(row, "referenced_works_count"),
            string(row, "topic_id"),
            string(row, "topic_name"),
            decimal(row, "score"),
            string(row, "subfield_name"),
            string(row, "field_name"),
            string(row, "domain_name")));
    }

    List<CitationSnapshot> loadCitations() {
        return load(CITATIONS_SQL, row -> new CitationSnapshot(
            string(row, "work_id"),
            integer(row, "year"),
            integer(row, "cited_count")));
    }

    private <T> List<T> load(String sql, Function<Map<String, Object>, T> mapper) {
        DatabaseHandler handler = databaseHandlerProvider.getIfAvailable();
        if (handler == null) {
            log.debug("No database configured; aggregate input is empty");
            return List.of();
        }
        QueryResult result = handler.query(sql);
        return result.rows().stream().map(mapper).toList();
    }

    private static String string(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    private static Integer integer(Map<String, Object> row, String column) {
        return row.get(column) instanceof Number number ? number.intValue() : null;
    }

    private static Double decimal(Map<String, Object> row, String column) {
        return row.get(column) instanceof Number number ? number.doubleValue() : null;
    }

    private static Boolean bool(Map<String, Object> row, String column) {
        return row.get(column) instanceof Boolean value ? value : null;
    }
}
