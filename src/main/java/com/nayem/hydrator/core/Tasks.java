package com.nayem.hydrator.core;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

final class Tasks {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(Tasks.class);

    private Tasks() {
    }

    /**
     * Runs {@code supplier} on {@code executor} with the caller's MDC. When the
     * executor rejects the task it runs on the calling thread instead.
     */
    static <V> CompletableFuture<V> supply(Executor executor, Supplier<V> supplier) {
        final Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        Supplier<V> task = () -> {
            if (mdcContext != null) {
                MDC.setContextMap(mdcContext);
            }
            try {
                return supplier.get();
            } finally {
                MDC.clear();
            }
        };
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.debug("Executor saturated, running hydration task on the calling thread");
            try {
                return CompletableFuture.completedFuture(supplier.get());
            } catch (RuntimeException failure) {
                return CompletableFuture.failedFuture(failure);
            }
        }
    }
}
