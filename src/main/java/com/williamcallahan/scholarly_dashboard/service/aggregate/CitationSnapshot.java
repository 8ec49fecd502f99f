package com.williamcallahan.scholarly_dashboard.service.aggregate;

public record CitationSnapshot(String workId, Integer year, Integer citedCount) {
}
