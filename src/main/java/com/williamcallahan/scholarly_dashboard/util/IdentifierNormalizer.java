package com.williamcallahan.scholarly_dashboard.util;

import java.util.Locale;

/**
 * Strips provider URL prefixes from OpenAlex, ORCID, ROR and DOI identifiers so only
 * the bare trailing identifier is persisted.
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code https://openalex.org/W123456789/} becomes {@code W123456789}</li>
 *   <li>{@code https://doi.org/10.1234/abc} becomes {@code 10.1234/abc}</li>
 *   <li>{@code https://orcid.org/0000-0001-2345-6789} becomes {@code 0000-0001-2345-6789}</li>
 * </ul>
 */
public final class IdentifierNormalizer {

    private static final String DOI_MARKER = "doi.org/";

    private IdentifierNormalizer() {
    }

    /**
     * Returns the bare identifier, or {@code null} when the input is null, blank, or
     * reduces to nothing once trailing separators are removed.
     */
    public static String normalize(String rawId) {
        if (rawId == null) {
            return null;
        }
        String trimmed = rawId.strip();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        if (end == 0) {
            return null;
        }
        String candidate = trimmed.substring(0, end);

        // DOIs contain slashes themselves, so keep everything after the resolver host
        int doiIndex = candidate.toLowerCase(Locale.ROOT).lastIndexOf(DOI_MARKER);
        if (doiIndex >= 0) {
            return blankToNull(candidate.substring(doiIndex + DOI_MARKER.length()));
        }

        int lastSlash = candidate.lastIndexOf('/');
        return blankToNull(lastSlash >= 0 ? candidate.substring(lastSlash + 1) : candidate);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
