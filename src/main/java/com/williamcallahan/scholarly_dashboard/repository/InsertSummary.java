package com.williamcallahan.scholarly_dashboard.repository;

/**
 * Outcome counts of one {@code insertIfAbsent} call.
 *
 * @param inserted rows written by this call
 * @param alreadyPresent rows whose primary key was already stored
 * @param skipped rows rejected because a primary key column was null
 */
public record InsertSummary(int inserted, int alreadyPresent, int skipped) {

    public static final InsertSummary EMPTY = new InsertSummary(0, 0, 0);

    public InsertSummary plus(InsertSummary other) {
        if (other == null) {
            return this;
        }
        return new InsertSummary(
            inserted + other.inserted,
            alreadyPresent + other.alreadyPresent,
            skipped + other.skipped);
    }
}
