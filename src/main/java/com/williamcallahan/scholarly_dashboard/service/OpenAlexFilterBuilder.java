package com.williamcallahan.scholarly_dashboard.service;

/**
 * Builds the {@code filter} query parameter for an institution's works.
 *
 * <p>The institution predicate is always present; a publication-year predicate is
 * AND-ed on (comma-joined) when either bound is given:
 * <ul>
 *   <li>both bounds: {@code publication_year:2019-2023}</li>
 *   <li>lower only: {@code publication_year:>=2019}</li>
 *   <li>upper only: {@code publication_year:<=2023}</li>
 * </ul>
 */
public final class OpenAlexFilterBuilder {

    private OpenAlexFilterBuilder() {
    }

    public static String build(String ror, Integer startYear, Integer endYear) {
        if (ror == null || ror.isBlank()) {
            throw new IllegalArgumentException("Institution ROR is required");
        }
        StringBuilder filter = new StringBuilder("institutions.ror:").append(ror.strip());
        if (startYear != null && endYear != null) {
            filter.append(",publication_year:").append(startYear).append('-').append(endYear);
        } else if (startYear != null) {
            filter.append(",publication_year:>=").append(startYear);
        } else if (endYear != null) {
            filter.append(",publication_year:<=").append(endYear);
        }
        return filter.toString();
    }
}
