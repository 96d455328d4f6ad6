package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.batch.BatchOptions;
import com.delta.marketloader.ingest.cache.CachePolicy;

public record PipelineOptions(BatchOptions batch, CachePolicy cache, RetryPolicy retry) {

    public static PipelineOptions from(LoaderProperties properties) {
        return new PipelineOptions(
            BatchOptions.from(properties.getBatch()),
            CachePolicy.from(properties.getCache()),
            RetryPolicy.from(properties.getRetry())
        );
    }
}
