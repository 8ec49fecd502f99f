package com.williamcallahan.scholarly_dashboard.service;

/**
 * Lifecycle of one harvest run. {@code FETCHING} and {@code PROCESSING} alternate per page
 * until the API stops returning a cursor ({@code DONE}) or a fatal error occurs ({@code FAILED}).
 */
public enum HarvestState {
    IDLE,
    FETCHING,
    PROCESSING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
