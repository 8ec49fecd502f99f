package com.williamcallahan.scholarly_dashboard.service;

import com.williamcallahan.scholarly_dashboard.mapper.OpenAlexWorkParser;
import com.williamcallahan.scholarly_dashboard.model.ParsedWork;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.repository.InsertSummary;
import com.williamcallahan.scholarly_dashboard.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a line-delimited JSON sink written by an earlier harvest into the database,
 * through the same parser and ordered insert path the harvester uses.
 */
@Service
@Slf4j
public class JsonlReplayService {

    private final OpenAlexWorkParser parser;

    public JsonlReplayService(OpenAlexWorkParser parser) {
        this.parser = parser;
    }

    /**
     * Replays every line of {@code path} into {@code handler}. Malformed lines are logged and skipped.
     *
     * @throws UncheckedIOException when the file cannot be read
     */
    public ReplayResult replay(Path path, DatabaseHandler handler) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Replay file not found: " + path);
        }
        if (handler == null) {
            throw new IllegalArgumentException("A database handler is required to replay " + path);
        }

        int lines = 0;
        int skipped = 0;
        InsertSummary inserts = InsertSummary.EMPTY;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines++;
                if (line.isBlank()) {
                    skipped++;
                    continue;
                }
                ParsedWork parsed;
                try {
                    parsed = parser.parseLine(line);
                } catch (IllegalArgumentException e) {
                    LoggingUtils.warn(log, e, "Skipping malformed line {} of {}", lines, path);
                    skipped++;
                    continue;
                }
                for (String table : handler.insertionOrder()) {
                    inserts = inserts.plus(handler.insertIfAbsent(table, parsed.rowsFor(table)));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        log.info("Replayed {}: {} line(s), {} skipped, inserted={}, alreadyPresent={}",
                path, lines, skipped, inserts.inserted(), inserts.alreadyPresent());
        return new ReplayResult(lines, skipped, inserts);
    }

    public record ReplayResult(int linesRead, int linesSkipped, InsertSummary inserts) {
    }
}
