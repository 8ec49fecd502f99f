package com.williamcallahan.scholarly_dashboard.service.aggregate;

import java.util.Locale;
import java.util.function.Function;

/**
 * Level of the topic hierarchy a summary is computed at.
 */
public enum TopicLevel {
    TOPIC(WorkTopicSnapshot::topicName),
    SUBFIELD(WorkTopicSnapshot::subfieldName),
    FIELD(WorkTopicSnapshot::fieldName),
    DOMAIN(WorkTopicSnapshot::domainName);

    private final Function<WorkTopicSnapshot, String> extractor;

    TopicLevel(Function<WorkTopicSnapshot, String> extractor) {
        this.extractor = extractor;
    }

    String valueOf(WorkTopicSnapshot row) {
        return extractor.apply(row);
    }

    /**
     * Accepts {@code topic}, {@code subfield}, {@code field}, {@code domain}, optionally with a
     * {@code _name} suffix.
     */
    public static TopicLevel fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return TOPIC;
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("_NAME")) {
            normalized = normalized.substring(0, normalized.length() - "_NAME".length());
        }
        for (TopicLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported topic level: " + value);
    }
}
