package com.delta.marketloader.ingest.service;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Executes blocking JDBC work on the dedicated persistence pool and waits for it,
 * so fetch workers never hold a database connection themselves.
 */
@Component
public class BlockingPersistenceRunner {
    private final Executor persistenceExecutor;

    public BlockingPersistenceRunner(@Qualifier("persistenceExecutor") Executor persistenceExecutor) {
        this.persistenceExecutor = persistenceExecutor;
    }

    public <T> T call(Supplier<T> work) {
        try {
            return CompletableFuture.supplyAsync(work, persistenceExecutor).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public void run(Runnable work) {
        call(() -> {
            work.run();
            return null;
        });
    }
}
