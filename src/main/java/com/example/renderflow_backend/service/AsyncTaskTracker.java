package com.example.renderflow_backend.service;

import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.TaskStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * Rendezvous between items waiting on an async task handle and the engine completion webhook.
 */
@Component
public class AsyncTaskTracker {
    private final ConcurrentMap<String, CompletableFuture<TaskStatus>> waiting = new ConcurrentHashMap<>();

    /** Registers interest in a handle so a webhook arriving before the first wait is kept. */
    public void expect(String taskHandle) {
        waiting.putIfAbsent(taskHandle, new CompletableFuture<>());
    }

    /**
     * Waits up to {@code timeout} for a webhook result.
     *
     * @return the resolved status, empty when nothing arrived in time
     */
    public Optional<TaskStatus> await(String taskHandle, Duration timeout) throws InterruptedException {
        CompletableFuture<TaskStatus> future = waiting.computeIfAbsent(taskHandle, k -> new CompletableFuture<>());
        try {
            return Optional.ofNullable(future.get(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.of(TaskStatus.failed(String.valueOf(e.getCause())));
        }
    }

    /**
     * Hands a webhook result to the item waiting on {@code taskHandle}.
     *
     * @return {@code false} when nobody waits on the handle any more; the result is dropped
     */
    public boolean complete(String taskHandle, TaskStatus status) {
        CompletableFuture<TaskStatus> future = waiting.get(taskHandle);
        if (future == null) {
            return false;
        }
        future.complete(status);
        return true;
    }

    public void forget(String taskHandle) {
        if (taskHandle != null) {
            waiting.remove(taskHandle);
        }
    }

    int tracked() {
        return waiting.size();
    }
}
