package io.arrayshim.common.database;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool on which blocking calls into the backing database run, so that a slow
 * database cannot occupy every RPC thread.
 */
public class DatabaseCallExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseCallExecutor.class);

    private final ExecutorService executorService;

    public DatabaseCallExecutor(int maxConcurrentCalls) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("max_concurrent_calls must be positive: " + maxConcurrentCalls);
        }
        this.executorService = Executors.newFixedThreadPool(maxConcurrentCalls,
                new ThreadFactoryBuilder()
                        .setNameFormat("database-call-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * Runs {@code callable} on the pool and waits for it. Exceptions thrown by the call are
     * rethrown unwrapped.
     */
    public <T> T call(Callable<T> callable) throws Exception {
        var future = executorService.submit(callable);
        try {
            return future.get();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Database calls still running after shutdown, interrupting");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
