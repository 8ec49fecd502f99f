package com.williamcallahan.scholarly_dashboard.service;

import com.williamcallahan.scholarly_dashboard.repository.InsertSummary;

/**
 * Outcome of a harvest run.
 *
 * @param state {@link HarvestState#DONE} or {@link HarvestState#FAILED}
 * @param pagesFetched pages successfully fetched
 * @param recordsProcessed work records handed to the sink and/or database
 * @param inserts accumulated insert counts over every table
 * @param nextCursor cursor to resume from; {@code null} once the API reported the end
 * @param failure cause of a failed run, otherwise {@code null}
 */
public record HarvestResult(
    HarvestState state,
    int pagesFetched,
    int recordsProcessed,
    InsertSummary inserts,
    String nextCursor,
    RuntimeException failure
) {

    public boolean isSuccess() {
        return state == HarvestState.DONE;
    }

    /**
     * True when the walk stopped at the page cap with pages still remaining.
     */
    public boolean isTruncated() {
        return isSuccess() && nextCursor != null;
    }

    /**
     * Rethrows the failure of a failed run; returns this result otherwise.
     */
    public HarvestResult orThrow() {
        if (failure != null) {
            throw failure;
        }
        return this;
    }
}
