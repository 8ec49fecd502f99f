package com.williamcallahan.scholarly_dashboard.dto;

public record PrimaryTopicCount(
    String topicName,
    String subfieldName,
    String fieldName,
    String domainName,
    long works
) {
}
