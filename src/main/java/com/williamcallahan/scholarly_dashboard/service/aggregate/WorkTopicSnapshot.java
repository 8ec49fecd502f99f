package com.williamcallahan.scholarly_dashboard.service.aggregate;

/**
 * A work joined to one of its topic assignments. Topic fields are {@code null} for works
 * without any assignment.
 */
public record WorkTopicSnapshot(
    String workId,
    Integer publicationYear,
    String workType,
    Integer citedByCount,
    Integer referencedWorksCount,
    String topicId,
    String topicName,
    Double score,
    String subfieldName,
    String fieldName,
    String domainName
) {
}
