package com.delta.marketloader.ingest.batch;

public record BatchFailure<T>(T item, Throwable error) {
}
