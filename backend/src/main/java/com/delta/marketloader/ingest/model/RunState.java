package com.delta.marketloader.ingest.model;

public enum RunState {
    RUNNING,
    SUCCESS,
    COMPLETED_WITH_ERRORS,
    FAILED;

    /**
     * Terminal state for a finished run: no failures is a success, failures with no
     * success is a failure, anything else completed with errors.
     */
    public static RunState fromCounts(int succeeded, int failed) {
        if (failed <= 0) {
            return SUCCESS;
        }
        if (succeeded <= 0) {
            return FAILED;
        }
        return COMPLETED_WITH_ERRORS;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
