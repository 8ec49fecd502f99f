package com.williamcallahan.scholarly_dashboard.testutil;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Shared OpenAlex payloads for tests.
 */
public final class OpenAlexFixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private OpenAlexFixtures() {
    }

    public static String fixtureText(String name) {
        try {
            return Files.readString(Paths.get("src/test/resources/fixtures/" + name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode sampleWork() {
        try {
            return (ObjectNode) MAPPER.readTree(fixtureText("openalex-work-sample.json"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Minimal work with only an id and a year.
     */
    public static ObjectNode minimalWork(String id, int year) {
        ObjectNode work = MAPPER.createObjectNode();
        work.put("id", "https://openalex.org/" + id);
        work.put("publication_year", year);
        return work;
    }

    /**
     * A works page body as returned by the API; {@code nextCursor} may be null.
     */
    public static String pageBody(String nextCursor, JsonNode... works) {
        ObjectNode body = MAPPER.createObjectNode();
        ObjectNode meta = body.putObject("meta");
        meta.put("count", works.length);
        if (nextCursor == null) {
            meta.putNull("next_cursor");
        } else {
            meta.put("next_cursor", nextCursor);
        }
        ArrayNode results = body.putArray("results");
        for (JsonNode work : works) {
            results.add(work);
        }
        return body.toString();
    }
}
