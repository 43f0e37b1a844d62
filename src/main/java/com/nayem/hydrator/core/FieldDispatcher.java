package com.nayem.hydrator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Turns the bindings of one object into concurrently running field tasks.
 * <p>
 * Each task takes a slot from the shared {@link ConcurrencyGate} for the
 * duration of its resolver or method call and always yields exactly one
 * {@link FieldResolution}; failures never escape the returned futures.
 * </p>
 */
class FieldDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FieldDispatcher.class);

    private final ResolverRegistry registry;
    private final ConcurrencyGate gate;
    private final Executor executor;
    private final HydrationMetrics metrics;

    FieldDispatcher(ResolverRegistry registry, ConcurrencyGate gate, Executor executor, HydrationMetrics metrics) {
        this.registry = registry;
        this.gate = gate;
        this.executor = executor;
        this.metrics = metrics;
    }

    List<CompletableFuture<FieldResolution>> dispatch(HydrationContext context, Object target,
            HydrationSchema schema) {
        List<CompletableFuture<FieldResolution>> tasks = new ArrayList<>(schema.getBindings().size());

        for (FieldBinding binding : schema.getBindings()) {
            if (binding instanceof MethodBinding method) {
                tasks.add(Tasks.supply(executor,
                        () -> invoke(context, target, binding, () -> method.invoke(context, target))));
                continue;
            }

            FinderBinding finder = (FinderBinding) binding;
            Optional<Resolver> resolver = registry.lookup(finder.getElementTypeKey());
            if (resolver.isEmpty()) {
                log.debug("No resolver registered for {}, skipping {}.{}", finder.getElementTypeKey(),
                        schema.getType().getSimpleName(), finder.getName());
                metrics.recordSkipped();
                continue;
            }
            if (!finder.hasSource()) {
                tasks.add(CompletableFuture.completedFuture(FieldResolution.failure(binding,
                        new ResolverException(schema.getType(), binding.getName(),
                                "no readable property '" + finder.getDirective() + "'", null))));
                continue;
            }

            Object input;
            try {
                input = finder.readSource(target);
            } catch (ReflectiveOperationException e) {
                tasks.add(CompletableFuture.completedFuture(FieldResolution.failure(binding,
                        new ResolverException(schema.getType(), binding.getName(),
                                "cannot read property '" + finder.getDirective() + "'", unwrap(e)))));
                continue;
            }
            final Object sourceValue = input;
            Resolver r = resolver.get();
            tasks.add(Tasks.supply(executor,
                    () -> invoke(context, target, binding, () -> r.resolve(context, sourceValue))));
        }

        return tasks;
    }

    private FieldResolution invoke(HydrationContext context, Object target, FieldBinding binding,
            Callable<Object> call) {
        Class<?> type = target.getClass();
        if (context.isCancelled()) {
            return FieldResolution.failure(binding, new HydrationCancelledException(type, binding.getName()));
        }

        try {
            if (!gate.acquire(context)) {
                return FieldResolution.failure(binding, new HydrationCancelledException(type, binding.getName()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FieldResolution.failure(binding, new HydrationCancelledException(type, binding.getName(), e));
        }

        try {
            return FieldResolution.success(binding, metrics.timeResolve(call));
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
            return FieldResolution.failure(binding, new ResolverException(type, binding.getName(), message, cause));
        } finally {
            gate.release();
        }
    }

    private static Throwable unwrap(Exception e) {
        if (e instanceof InvocationTargetException && e.getCause() != null) {
            return e.getCause();
        }
        return e;
    }
}
