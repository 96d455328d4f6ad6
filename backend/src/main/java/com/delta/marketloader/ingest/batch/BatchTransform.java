package com.delta.marketloader.ingest.batch;

@FunctionalInterface
public interface BatchTransform<T, R> {
    R apply(T item) throws Exception;
}
