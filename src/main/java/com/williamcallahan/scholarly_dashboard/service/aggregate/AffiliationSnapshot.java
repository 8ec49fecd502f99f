package com.williamcallahan.scholarly_dashboard.service.aggregate;

/**
 * One (work, institution) pair resolved through an authorship's institution list.
 */
public record AffiliationSnapshot(
    String workId,
    String institutionId,
    String institutionName,
    String countryCode
) {
}
