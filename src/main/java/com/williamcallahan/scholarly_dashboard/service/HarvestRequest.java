package com.williamcallahan.scholarly_dashboard.service;

import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import lombok.Builder;

import java.nio.file.Path;

/**
 * Parameters of one harvest.
 *
 * @param ror institution ROR identifier (required)
 * @param startYear inclusive lower publication year, optional
 * @param endYear inclusive upper publication year, optional
 * @param perPage page size; defaults to {@code openalex.api.default-per-page}
 * @param mailto contact address for the polite pool; defaults to {@code openalex.api.mailto}
 * @param maxPages stop after this many pages, optional
 * @param jsonlPath line-delimited JSON sink, must not exist yet
 * @param databaseHandler target store
 * @param startCursor resume from this cursor instead of {@code "*"}
 */
@Builder
public record HarvestRequest(
    String ror,
    Integer startYear,
    Integer endYear,
    Integer perPage,
    String mailto,
    Integer maxPages,
    Path jsonlPath,
    DatabaseHandler databaseHandler,
    String startCursor
) {
}
