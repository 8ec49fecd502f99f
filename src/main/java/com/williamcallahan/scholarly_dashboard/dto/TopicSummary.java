package com.williamcallahan.scholarly_dashboard.dto;

/**
 * Research-article summary for one value of a classification level.
 *
 * @param name topic, subfield, field or domain name
 * @param articles number of distinct articles and reviews
 * @param hIndex h-index over the works' citation counts
 * @param meanReferencedWorks mean reference count, two decimals; {@code null} without data
 * @param domainName domain the value belongs to
 */
public record TopicSummary(
    String name,
    long articles,
    int hIndex,
    Double meanReferencedWorks,
    String domainName
) {
}
