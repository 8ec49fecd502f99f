package com.williamcallahan.scholarly_dashboard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.scholarly_dashboard.exception.HarvestConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Appends raw work records to a line-delimited JSON file, one compact object per line.
 *
 * <p>The file is opened, written, flushed and closed once per page, so an interrupted
 * harvest keeps every page written before the interruption. A sink never adopts an
 * existing file.
 */
@Slf4j
public class JsonLinesWorkSink {

    private final Path path;
    private final ObjectMapper objectMapper;
    private long linesWritten;
    private boolean created;

    /**
     * @throws HarvestConfigurationException when a file already exists at {@code path}
     */
    public JsonLinesWorkSink(Path path, ObjectMapper objectMapper) {
        if (path == null) {
            throw new HarvestConfigurationException("Sink path is required");
        }
        if (Files.exists(path)) {
            throw new HarvestConfigurationException("Sink file already exists: " + path);
        }
        this.path = path;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws UncheckedIOException when the write fails, including when another process
     *         created the file before this sink's first page
     */
    public void appendPage(List<JsonNode> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // The first page must create the file; later pages append to the file this sink created.
            StandardOpenOption mode = created ? StandardOpenOption.APPEND : StandardOpenOption.CREATE_NEW;
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    mode, StandardOpenOption.WRITE)) {
                for (JsonNode record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.write('\n');
                }
                writer.flush();
            }
            created = true;
            linesWritten += records.size();
            log.debug("Appended {} record(s) to {} ({} total)", records.size(), path, linesWritten);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to sink " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    public long linesWritten() {
        return linesWritten;
    }
}
