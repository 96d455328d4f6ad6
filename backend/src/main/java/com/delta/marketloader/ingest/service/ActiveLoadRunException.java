package com.delta.marketloader.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveLoadRunException extends RuntimeException {
    private final long activeRunId;

    public ActiveLoadRunException(String message, long activeRunId) {
        super(message);
        this.activeRunId = activeRunId;
    }

    public long getActiveRunId() {
        return activeRunId;
    }
}
