package com.williamcallahan.scholarly_dashboard.service.aggregate;

public record WorkSnapshot(
    String workId,
    Integer publicationYear,
    String workType,
    Boolean isOa,
    String oaStatus
) {
}
