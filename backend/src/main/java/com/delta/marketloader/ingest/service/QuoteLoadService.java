package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.cache.CachePolicy;
import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.model.LoadRunRequest;
import com.delta.marketloader.ingest.model.LoadRunSummary;
import com.delta.marketloader.ingest.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@Service
public class QuoteLoadService {
    private static final Logger log = LoggerFactory.getLogger(QuoteLoadService.class);

    private final LoaderPipeline pipeline;
    private final LatestQuoteLoader loader;
    private final ProcessTracker tracker;
    private final LoaderProperties properties;
    private final ExecutorService loadRunExecutor;

    public QuoteLoadService(
        LoaderPipeline pipeline,
        LatestQuoteLoader loader,
        ProcessTracker tracker,
        LoaderProperties properties,
        @Qualifier("loadRunExecutor") ExecutorService loadRunExecutor
    ) {
        this.pipeline = pipeline;
        this.loader = loader;
        this.tracker = tracker;
        this.properties = properties;
        this.loadRunExecutor = loadRunExecutor;
    }

    public LoadRunSummary run(LoadRunRequest request) {
        LoadRunRequest safeRequest = request == null ? LoadRunRequest.defaults() : request;
        List<FetchTask> tasks = loader.buildTasks(safeRequest);
        return pipeline.run(processName(), tasks, loader, options(safeRequest));
    }

    /**
     * Records the run start and hands execution to the run executor.
     *
     * @return id of the started run
     */
    public long startAsync(LoadRunRequest request) {
        LoadRunRequest safeRequest = request == null ? LoadRunRequest.defaults() : request;
        long runId = tracker.start(processName());
        try {
            loadRunExecutor.submit(() -> {
                try {
                    List<FetchTask> tasks = loader.buildTasks(safeRequest);
                    LoadRunSummary summary = pipeline.execute(runId, processName(), tasks, loader, options(safeRequest));
                    log.info("Async run {} finished with state {}", runId, summary.state());
                } catch (Exception e) {
                    log.warn("Async run {} failed: {}", runId, e.getMessage(), e);
                    markFailedIfRunning(runId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            tracker.complete(runId, RunState.FAILED, 0, 0, 0, "rejected by run executor");
            throw e;
        }
        return runId;
    }

    private void markFailedIfRunning(long runId, Exception error) {
        tracker.find(runId)
            .filter(run -> run.state() == RunState.RUNNING)
            .ifPresent(run -> tracker.complete(runId, RunState.FAILED, 0, 0, 0, String.valueOf(error.getMessage())));
    }

    PipelineOptions options(LoadRunRequest request) {
        PipelineOptions defaults = PipelineOptions.from(properties);
        CachePolicy cache = defaults.cache().withOverrides(request.cacheEnabled(), request.forceRefresh());
        return new PipelineOptions(
            request.continueOnError() == null
                ? defaults.batch()
                : defaults.batch().withContinueOnError(request.continueOnError()),
            cache,
            defaults.retry()
        );
    }

    private String processName() {
        return properties.getQuotes().getProcessName();
    }
}
