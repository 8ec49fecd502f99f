package com.williamcallahan.scholarly_dashboard.dto;

/**
 * Number of works published in a year, optionally split by a grouping value.
 *
 * @param group grouping value, {@code null} when ungrouped
 */
public record YearCount(int year, String group, long count) {
}
