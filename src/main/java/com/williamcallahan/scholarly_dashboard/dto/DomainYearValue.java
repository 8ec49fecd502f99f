package com.williamcallahan.scholarly_dashboard.dto;

/**
 * A per-domain yearly value with its running total (ordered by year within the domain).
 */
public record DomainYearValue(String domainName, int year, long value, long cumulative) {
}
