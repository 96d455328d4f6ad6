package com.delta.marketloader.ingest.model;

public enum TaskState {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
