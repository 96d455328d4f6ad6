package com.delta.marketloader.ingest.service;

import com.delta.marketloader.ingest.batch.BatchAbortedException;
import com.delta.marketloader.ingest.batch.BatchFailure;
import com.delta.marketloader.ingest.batch.BatchResult;
import com.delta.marketloader.ingest.batch.ConcurrencyGate;
import com.delta.marketloader.ingest.cache.CacheKeys;
import com.delta.marketloader.ingest.cache.CacheLookup;
import com.delta.marketloader.ingest.cache.ResponseCache;
import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.model.LoadRunSummary;
import com.delta.marketloader.ingest.model.RunState;
import com.delta.marketloader.ingest.model.TaskOutcome;
import com.delta.marketloader.ingest.model.TaskState;
import com.delta.marketloader.ingest.source.DataSource;
import com.delta.marketloader.ingest.source.FetchErrorKind;
import com.delta.marketloader.ingest.source.SourceFallbackCoordinator;
import com.delta.marketloader.ingest.source.SourceFetchException;
import com.delta.marketloader.ingest.source.SourcePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of {@link FetchTask}s end to end.
 *
 * <p>Per task: skip check, cached payload per source in priority order, then a
 * gate-bounded fallback fetch retried with exponential backoff while any source
 * reported a retryable error. A fetched payload is cached only after the loader
 * accepted it. The run is bracketed by {@link ProcessTracker} start and complete.
 *
 * <p>An authentication failure aborts the run: tasks dispatched afterwards fail
 * without a fetch and the run completes as FAILED.
 */
@Service
public class LoaderPipeline {
    static final String RUN_ABORTED = "run_aborted";

    private static final Logger log = LoggerFactory.getLogger(LoaderPipeline.class);

    private final ResponseCache cache;
    private final SourceFallbackCoordinator coordinator;
    private final ProcessTracker tracker;
    private final MissingSymbolService missingSymbols;
    private final ConcurrencyGate gate;
    private final Clock clock;

    public LoaderPipeline(
        ResponseCache cache,
        SourceFallbackCoordinator coordinator,
        ProcessTracker tracker,
        MissingSymbolService missingSymbols,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        Clock clock
    ) {
        this.cache = cache;
        this.coordinator = coordinator;
        this.tracker = tracker;
        this.missingSymbols = missingSymbols;
        this.gate = new ConcurrencyGate(fetchExecutor);
        this.clock = clock;
    }

    public LoadRunSummary run(String processName, List<FetchTask> tasks, PayloadLoader loader, PipelineOptions options) {
        long runId = tracker.start(processName);
        return execute(runId, processName, tasks, loader, options);
    }

    /**
     * Executes a run whose start was already recorded by {@link ProcessTracker#start}.
     */
    public LoadRunSummary execute(
        long runId,
        String processName,
        List<FetchTask> tasks,
        PayloadLoader loader,
        PipelineOptions options
    ) {
        Instant startedAt = clock.instant();
        RunContext context = new RunContext(loader, options);
        log.info("Run {} ({}) processing {} tasks", runId, processName, tasks.size());

        BatchResult<FetchTask, TaskOutcome> result;
        try {
            result = gate.run(tasks, task -> process(task, context), options.batch());
        } catch (BatchAbortedException e) {
            String notes = "aborted after first failure: " + rootMessage(e.getCause());
            tracker.complete(runId, RunState.FAILED, context.succeeded.get(), context.failed.get(), context.skipped.get(), notes);
            log.warn("Run {} ({}) aborted: {}", runId, processName, notes);
            throw e;
        } catch (RuntimeException e) {
            tracker.complete(runId, RunState.FAILED, context.succeeded.get(), context.failed.get(), context.skipped.get(), rootMessage(e));
            throw e;
        }

        List<TaskOutcome> outcomes = new ArrayList<>(result.successes());
        for (BatchFailure<FetchTask> failure : result.failures()) {
            if (failure.error() instanceof TaskFailedException taskFailed) {
                outcomes.add(taskFailed.outcome());
            } else {
                outcomes.add(TaskOutcome.failed(failure.item(), 0, null, rootMessage(failure.error())));
            }
        }

        int succeeded = count(outcomes, TaskState.SUCCEEDED);
        int failed = count(outcomes, TaskState.FAILED);
        int skipped = count(outcomes, TaskState.SKIPPED);
        boolean aborted = context.aborted.get();
        RunState state = aborted ? RunState.FAILED : RunState.fromCounts(succeeded, failed);
        String notes = aborted
            ? "aborted: authentication failure"
            : "cache_hits=" + context.cacheHits.get();
        tracker.complete(runId, state, succeeded, failed, skipped, notes);

        return new LoadRunSummary(
            runId,
            processName,
            state,
            startedAt,
            clock.instant(),
            tasks.size(),
            succeeded,
            failed,
            skipped,
            context.cacheHits.get(),
            aborted,
            List.copyOf(outcomes)
        );
    }

    private TaskOutcome process(FetchTask task, RunContext context) throws TaskFailedException {
        if (context.aborted.get()) {
            throw context.fail(TaskOutcome.failed(task, 0, FetchErrorKind.AUTH_FAILURE, RUN_ABORTED));
        }
        Optional<String> skipReason = context.loader.skipReason(task);
        if (skipReason.isPresent()) {
            log.debug("Skipping {}: {}", task.symbol(), skipReason.get());
            context.skipped.incrementAndGet();
            return TaskOutcome.skipped(task, skipReason.get());
        }

        TaskOutcome cached = fromCache(task, context);
        if (cached != null) {
            return cached;
        }

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                SourcePayload payload = coordinator.resolve(task, task.sources());
                context.loader.load(task, payload);
                DataSource winner = payload.source();
                cache.set(
                    CacheKeys.forRequest(winner.key(), task.endpointTag(), task.entityId(), task.symbol()),
                    winner.key(),
                    payload.endpoint(),
                    payload.body(),
                    context.options.cache()
                );
                context.succeeded.incrementAndGet();
                return TaskOutcome.succeeded(task, winner, false, attempt);
            } catch (SourceFetchException e) {
                Set<FetchErrorKind> kinds = e.observedKinds();
                if (kinds.contains(FetchErrorKind.AUTH_FAILURE)) {
                    if (context.aborted.compareAndSet(false, true)) {
                        log.error("Authentication failure for {} while loading {}; aborting run", e.getSource(), task.symbol());
                    }
                    throw context.fail(TaskOutcome.failed(task, attempt, FetchErrorKind.AUTH_FAILURE, e.getMessage()));
                }
                if (kinds.stream().allMatch(kind -> kind == FetchErrorKind.UNSUPPORTED)) {
                    context.skipped.incrementAndGet();
                    return TaskOutcome.skipped(task, e.getMessage());
                }
                boolean retryable = kinds.stream().anyMatch(FetchErrorKind::retryable);
                if (retryable && attempt <= context.options.retry().maxRetries()) {
                    Duration delay = context.options.retry().delayForAttempt(attempt);
                    log.debug("Retrying {} in {} ms after attempt {}: {}", task.symbol(), delay.toMillis(), attempt, e.getMessage());
                    if (!sleep(delay)) {
                        throw context.fail(TaskOutcome.failed(task, attempt, e.getKind(), "interrupted during backoff"));
                    }
                    continue;
                }
                if (kinds.stream().allMatch(kind -> kind == FetchErrorKind.NOT_FOUND)) {
                    missingSymbols.record(task, task.sources());
                }
                log.warn("Task {} failed after {} attempt(s): {}", task.symbol(), attempt, e.getMessage());
                throw context.fail(TaskOutcome.failed(task, attempt, e.getKind(), e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Task {} failed: {}", task.symbol(), rootMessage(e));
                throw context.fail(TaskOutcome.failed(task, attempt, null, rootMessage(e)));
            }
        }
    }

    private TaskOutcome fromCache(FetchTask task, RunContext context) {
        if (!context.options.cache().readsAllowed()) {
            return null;
        }
        for (DataSource source : task.sources()) {
            String key = CacheKeys.forRequest(source.key(), task.endpointTag(), task.entityId(), task.symbol());
            CacheLookup lookup = cache.get(key, source.key(), context.options.cache());
            if (!lookup.hit()) {
                continue;
            }
            try {
                String identifier = coordinator.identifierFor(task, source);
                context.loader.load(task, new SourcePayload(source, identifier, lookup.payload(), 200, "cache"));
                context.cacheHits.incrementAndGet();
                context.succeeded.incrementAndGet();
                return TaskOutcome.succeeded(task, source, true, 0);
            } catch (RuntimeException e) {
                log.warn("Cached {} payload for {} rejected, refetching: {}", source, task.symbol(), e.getMessage());
            }
        }
        return null;
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static int count(List<TaskOutcome> outcomes, TaskState state) {
        int total = 0;
        for (TaskOutcome outcome : outcomes) {
            if (outcome.state() == state) {
                total++;
            }
        }
        return total;
    }

    private static String rootMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message == null ? current.getClass().getSimpleName() : message;
    }

    private static final class RunContext {
        private final PayloadLoader loader;
        private final PipelineOptions options;
        private final AtomicBoolean aborted = new AtomicBoolean();
        private final AtomicInteger succeeded = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();
        private final AtomicInteger cacheHits = new AtomicInteger();

        private RunContext(PayloadLoader loader, PipelineOptions options) {
            this.loader = loader;
            this.options = options;
        }

        private TaskFailedException fail(TaskOutcome outcome) {
            failed.incrementAndGet();
            return new TaskFailedException(outcome);
        }
    }

    static final class TaskFailedException extends Exception {
        private final transient TaskOutcome outcome;

        TaskFailedException(TaskOutcome outcome) {
            super(outcome.message());
            this.outcome = outcome;
        }

        TaskOutcome outcome() {
            return outcome;
        }
    }
}
