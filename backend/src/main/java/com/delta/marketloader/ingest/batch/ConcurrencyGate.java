package com.delta.marketloader.ingest.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs items through a transform in fixed-size chunks with at most
 * {@code maxConcurrent} transforms in flight, pausing between chunks.
 *
 * <p>With continue-on-error enabled every item lands in exactly one bucket of the
 * returned {@link BatchResult}. With it disabled, dispatch stops at the first
 * failure, in-flight items are allowed to finish, and a {@link BatchAbortedException}
 * carrying that first error is thrown instead of a result.
 */
public class ConcurrencyGate {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyGate.class);

    private final Executor executor;

    public ConcurrencyGate(Executor executor) {
        this.executor = executor;
    }

    public <T, R> BatchResult<T, R> run(List<T> items, BatchTransform<T, R> transform, BatchOptions options) {
        if (items == null || items.isEmpty()) {
            return BatchResult.empty();
        }
        int total = items.size();
        AtomicReferenceArray<R> results = new AtomicReferenceArray<>(total);
        boolean[] completed = new boolean[total];
        Throwable[] errors = new Throwable[total];

        Semaphore permits = new Semaphore(options.maxConcurrent());
        AtomicReference<Integer> firstFailure = new AtomicReference<>();
        boolean stopOnFailure = !options.continueOnError();

        dispatch:
        for (int start = 0; start < total; start += options.batchSize()) {
            if (stopOnFailure && firstFailure.get() != null) {
                break;
            }
            if (start > 0) {
                pause(options);
            }
            int end = Math.min(total, start + options.batchSize());
            List<CompletableFuture<Void>> chunk = new ArrayList<>(end - start);
            for (int index = start; index < end; index++) {
                acquire(permits);
                if (stopOnFailure && firstFailure.get() != null) {
                    permits.release();
                    awaitAll(chunk);
                    break dispatch;
                }
                int slot = index;
                T item = items.get(index);
                try {
                    chunk.add(CompletableFuture.runAsync(() -> {
                        try {
                            results.set(slot, transform.apply(item));
                            completed[slot] = true;
                        } catch (Exception e) {
                            errors[slot] = e;
                            firstFailure.compareAndSet(null, slot);
                        } finally {
                            permits.release();
                        }
                    }, executor));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    errors[slot] = e;
                    firstFailure.compareAndSet(null, slot);
                }
            }
            awaitAll(chunk);
            log.debug("Batch chunk {}-{} of {} finished", start, end - 1, total);
        }

        Integer first = firstFailure.get();
        if (stopOnFailure && first != null) {
            log.warn("Batch aborted at item {} of {}: {}", first, total, errors[first].getMessage());
            throw new BatchAbortedException(items.get(first), errors[first]);
        }

        List<R> successes = new ArrayList<>();
        List<BatchFailure<T>> failures = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            if (errors[i] != null) {
                failures.add(new BatchFailure<>(items.get(i), errors[i]));
            } else if (completed[i]) {
                successes.add(results.get(i));
            }
        }
        return new BatchResult<>(successes, failures);
    }

    private void acquire(Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a batch slot", e);
        }
    }

    private void pause(BatchOptions options) {
        long delayMs = options.interBatchDelay().toMillis();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during inter-batch delay", e);
        }
    }

    private void awaitAll(List<CompletableFuture<Void>> futures) {
        if (futures.isEmpty()) {
            return;
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }
}
