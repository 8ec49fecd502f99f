package com.williamcallahan.scholarly_dashboard.dto;

/**
 * Distinct co-authored works per partner country.
 *
 * @param countryCode ISO 3166 alpha-3 code, or {@code Unknown}
 * @param works number of distinct works with at least one partner institution in the country
 * @param logWorks {@code ln(1 + works)}, for map colour scales
 */
public record CountryCollaboration(String countryCode, long works, double logWorks) {
}
