package io.github.jsxpatch.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs edit tasks on an executor so that tasks for the same file run one at a time, in submission order, while
 * tasks for different files run in parallel. Each task sees the file as the previous task for that file left it.
 */
public class PerFileExecutor {
    private static final Logger logger = LogManager.getLogger(PerFileExecutor.class);

    private final ExecutorService executor;

    /** Last task submitted for each file; removed once it completes and nothing newer was queued. */
    private final ConcurrentHashMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();
    private final Object submissionLock = new Object();

    public PerFileExecutor(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    public <T> CompletableFuture<T> submit(String filePath, Callable<T> task) {
        CompletableFuture<T> future;
        synchronized (submissionLock) {
            var previous = tails.get(filePath);
            if (previous == null) {
                future = CompletableFuture.supplyAsync(() -> call(filePath, task), executor);
            } else {
                // a failed edit must not block later edits to the same file
                future = previous.handle((r, e) -> null)
                                 .thenApplyAsync(ignored -> call(filePath, task), executor);
            }
            tails.put(filePath, future);
        }
        var queued = future;
        queued.whenComplete((r, e) -> tails.remove(filePath, queued));
        return future;
    }

    private static <T> T call(String filePath, Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            logger.error("Edit task for {} failed", filePath, e);
            throw e;
        } catch (Exception e) {
            logger.error("Edit task for {} failed", filePath, e);
            throw new CompletionException(e);
        }
    }
}
