package com.williamcallahan.scholarly_dashboard.service.aggregate;

import java.util.Locale;
import java.util.function.Function;

/**
 * Optional split for the publications-per-year histogram.
 */
public enum GroupBy {
    NONE(work -> null),
    WORK_TYPE(WorkSnapshot::workType),
    IS_OA(work -> work.isOa() == null ? null : work.isOa().toString()),
    OA_STATUS(WorkSnapshot::oaStatus);

    private final Function<WorkSnapshot, String> extractor;

    GroupBy(Function<WorkSnapshot, String> extractor) {
        this.extractor = extractor;
    }

    String valueOf(WorkSnapshot work) {
        return extractor.apply(work);
    }

    /**
     * Accepts {@code none}, {@code work_type}, {@code is_oa}, {@code oa_status} (case-insensitive,
     * dashes allowed).
     */
    public static GroupBy fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.strip().replace('-', '_').toUpperCase(Locale.ROOT);
        for (GroupBy groupBy : values()) {
            if (groupBy.name().equals(normalized)) {
                return groupBy;
            }
        }
        throw new IllegalArgumentException("Unsupported groupBy: " + value);
    }
}
