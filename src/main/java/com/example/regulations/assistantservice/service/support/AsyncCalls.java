package com.example.regulations.assistantservice.service.support;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Bridges blocking client calls onto a bounded executor as {@link CompletableFuture}s whose
 * cancellation interrupts the worker thread.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class AsyncCalls {

    public static <T> CompletableFuture<T> submit(ExecutorService executor, Callable<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                result.complete(call.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }
}
