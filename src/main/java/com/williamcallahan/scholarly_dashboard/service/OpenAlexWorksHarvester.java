package com.williamcallahan.scholarly_dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.scholarly_dashboard.config.OpenAlexConfigurationProperties;
import com.williamcallahan.scholarly_dashboard.exception.CatalogApiException;
import com.williamcallahan.scholarly_dashboard.exception.HarvestConfigurationException;
import com.williamcallahan.scholarly_dashboard.mapper.OpenAlexWorkParser;
import com.williamcallahan.scholarly_dashboard.model.ParsedWork;
import com.williamcallahan.scholarly_dashboard.monitoring.HarvestMetrics;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.repository.InsertSummary;
import com.williamcallahan.scholarly_dashboard.util.ExternalApiLogger;
import com.williamcallahan.scholarly_dashboard.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Cursor-paginated harvest of one institution's works.
 *
 * <p>Pages are processed strictly one after another: a page is fetched, appended to the
 * sink, parsed and inserted table by table in the handler's insertion order before the
 * next fetch starts. Inserts are idempotent, so a failed run can simply be repeated or
 * resumed from the last logged cursor.
 *
 * <p>Request validation happens before the first call to the API and raises
 * {@link HarvestConfigurationException}. Failures after that point (API, database,
 * sink I/O) end the run in {@link HarvestState#FAILED}; the cause is carried by the result.
 */
@Service
@Slf4j
public class OpenAlexWorksHarvester {

    static final String INITIAL_CURSOR = "*";

    private final OpenAlexApiClient apiClient;
    private final OpenAlexWorkParser parser;
    private final OpenAlexConfigurationProperties properties;
    private final HarvestMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public OpenAlexWorksHarvester(OpenAlexApiClient apiClient,
                                  OpenAlexWorkParser parser,
                                  OpenAlexConfigurationProperties properties,
                                  HarvestMetrics metrics,
                                  ObjectMapper objectMapper) {
        this(apiClient, parser, properties, metrics, objectMapper, Clock.systemDefaultZone());
    }

    OpenAlexWorksHarvester(OpenAlexApiClient apiClient,
                           OpenAlexWorkParser parser,
                           OpenAlexConfigurationProperties properties,
                           HarvestMetrics metrics,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.apiClient = apiClient;
        this.parser = parser;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Walks every page for the request's institution and year range.
     *
     * @throws HarvestConfigurationException when the request is invalid; nothing is fetched
     */
    public HarvestResult harvest(HarvestRequest request) {
        validate(request);

        int perPage = request.perPage() != null ? request.perPage() : properties.getDefaultPerPage();
        String mailto = request.mailto() != null ? request.mailto() : properties.getMailto();
        String filter = OpenAlexFilterBuilder.build(request.ror(), request.startYear(), request.endYear());
        JsonLinesWorkSink sink = request.jsonlPath() != null
                ? new JsonLinesWorkSink(request.jsonlPath(), objectMapper)
                : null;
        DatabaseHandler handler = request.databaseHandler();

        String cursor = isBlank(request.startCursor()) ? INITIAL_CURSOR : request.startCursor();
        int pages = 0;
        int records = 0;
        InsertSummary inserts = InsertSummary.EMPTY;
        HarvestState state = HarvestState.IDLE;

        log.info("Starting harvest: filter='{}', perPage={}, maxPages={}, cursor='{}', sink={}, database={}",
                filter, perPage, request.maxPages(), cursor, sink != null ? sink.path() : "none", handler != null);
        metrics.harvestStarted();
        try {
            while (true) {
                if (request.maxPages() != null && pages >= request.maxPages()) {
                    log.info("Reached page cap of {}; resume with cursor '{}'", request.maxPages(), cursor);
                    break;
                }
                state = HarvestState.FETCHING;
                long startedAt = System.nanoTime();
                WorksPage page = apiClient.fetchPage(filter, perPage, cursor, mailto);
                pages++;
                metrics.recordPageFetched();

                state = HarvestState.PROCESSING;
                if (sink != null) {
                    sink.appendPage(page.results());
                }
                if (handler != null) {
                    InsertSummary pageInserts = persistPage(handler, page.results());
                    metrics.recordInserts(pageInserts);
                    inserts = inserts.plus(pageInserts);
                }
                records += page.results().size();
                metrics.recordRecordsProcessed(page.results().size());
                metrics.pageTimer().record(System.nanoTime() - startedAt, TimeUnit.NANOSECONDS);
                ExternalApiLogger.logPageProgress(log, OpenAlexApiClient.API_NAME, pages, page.results().size(), cursor);

                if (!page.hasNext()) {
                    cursor = null;
                    break;
                }
                cursor = page.nextCursor();
            }
            state = HarvestState.DONE;
            log.info("Harvest done: {} page(s), {} record(s), inserted={}, alreadyPresent={}, skipped={}",
                    pages, records, inserts.inserted(), inserts.alreadyPresent(), inserts.skipped());
            return new HarvestResult(state, pages, records, inserts, cursor, null);
        } catch (CatalogApiException | DataAccessException | UncheckedIOException e) {
            LoggingUtils.error(log, e, "Harvest failed while {} after {} page(s); resume with cursor '{}'",
                    state, pages, cursor);
            metrics.recordFailure();
            return new HarvestResult(HarvestState.FAILED, pages, records, inserts, cursor, e);
        } finally {
            metrics.harvestFinished();
        }
    }

    /**
     * Parses each record and inserts its rows table by table in the handler's insertion order.
     */
    InsertSummary persistPage(DatabaseHandler handler, List<JsonNode> results) {
        List<String> order = handler.insertionOrder();
        InsertSummary summary = InsertSummary.EMPTY;
        for (JsonNode record : results) {
            if (record == null || !record.isObject()) {
                log.warn("Skipping non-object record in page: {}", record);
                continue;
            }
            ParsedWork parsed = parser.parse(record);
            for (String table : order) {
                summary = summary.plus(handler.insertIfAbsent(table, parsed.rowsFor(table)));
            }
        }
        return summary;
    }

    void validate(HarvestRequest request) {
        if (request == null) {
            throw new HarvestConfigurationException("Harvest request is required");
        }
        if (isBlank(request.ror())) {
            throw new HarvestConfigurationException("Institution ROR is required");
        }
        if (request.jsonlPath() == null && request.databaseHandler() == null) {
            throw new HarvestConfigurationException("Either a JSON lines sink path or a database handler is required");
        }
        if (request.jsonlPath() != null && Files.exists(request.jsonlPath())) {
            throw new HarvestConfigurationException("Sink file already exists: " + request.jsonlPath());
        }
        int currentYear = Year.now(clock).getValue();
        if (request.startYear() != null && request.startYear() > currentYear) {
            throw new HarvestConfigurationException(
                    "Start year " + request.startYear() + " is after the current year " + currentYear);
        }
        if (request.endYear() != null && request.endYear() > currentYear) {
            throw new HarvestConfigurationException(
                    "End year " + request.endYear() + " is after the current year " + currentYear);
        }
        if (request.startYear() != null && request.endYear() != null && request.startYear() > request.endYear()) {
            throw new HarvestConfigurationException(
                    "Start year " + request.startYear() + " is after end year " + request.endYear());
        }
        if (request.perPage() != null) {
            if (request.perPage() < 1) {
                throw new HarvestConfigurationException("Page size must be at least 1, got " + request.perPage());
            }
            if (request.perPage() > properties.getMaxPerPage()) {
                throw new HarvestConfigurationException("Page size " + request.perPage()
                        + " exceeds the API maximum of " + properties.getMaxPerPage());
            }
        }
        if (request.maxPages() != null && request.maxPages() < 1) {
            throw new HarvestConfigurationException("Page cap must be at least 1, got " + request.maxPages());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
