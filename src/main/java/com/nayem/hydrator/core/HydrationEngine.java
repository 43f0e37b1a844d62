package com.nayem.hydrator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link Hydrator}.
 * <p>
 * For each object the engine dispatches one task per bound field, waits for
 * all of them, then applies the results on the calling thread: a resolved
 * object is hydrated before it is assigned, the object elements of a resolved
 * list or array are hydrated concurrently, and every value must match the
 * container shape of its field. Nested work reuses this engine's gate,
 * registry and executor.
 * </p>
 * <p>
 * Failures of individual fields do not stop their siblings. All of them are
 * collected and reported together in a {@link HydrationFailedException}.
 * </p>
 */
public class HydrationEngine implements Hydrator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HydrationEngine.class);

    private final ResolverRegistry registry;
    private final ConcurrencyGate gate;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Duration shutdownTimeout;
    private final SchemaCache schemas;
    private final FieldDispatcher dispatcher;
    private final HydrationMetrics metrics;

    HydrationEngine(ResolverRegistry registry,
            int concurrencyLimit,
            Class<? extends Annotation> annotation,
            long schemaCacheSize,
            ExecutorService executor,
            boolean ownsExecutor,
            Duration shutdownTimeout,
            io.micrometer.core.instrument.MeterRegistry meterRegistry) {
        this.registry = registry;
        this.gate = new ConcurrencyGate(concurrencyLimit);
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.shutdownTimeout = shutdownTimeout;
        this.schemas = new SchemaCache(annotation, schemaCacheSize);
        this.metrics = new HydrationMetrics(meterRegistry, gate);
        this.dispatcher = new FieldDispatcher(registry, gate, executor, metrics);
    }

    /**
     * An engine with the default settings: a concurrency limit of 10 and the
     * {@link Hydrate} annotation.
     */
    public HydrationEngine() {
        this(new Builder());
    }

    private HydrationEngine(Builder builder) {
        this(builder.registry != null ? builder.registry : new ResolverRegistry(),
                builder.concurrencyLimit,
                builder.annotation,
                builder.schemaCacheSize,
                builder.executor != null ? builder.executor
                        : defaultExecutor(builder.threadNamePrefix, builder.effectiveMaxThreads()),
                builder.executor == null,
                builder.shutdownTimeout,
                builder.meterRegistry);
    }

    public void register(Class<?> elementType, Resolver resolver) {
        registry.register(elementType, resolver);
    }

    public void register(Object sample, Resolver resolver) {
        registry.register(sample, resolver);
    }

    public ResolverRegistry getRegistry() {
        return registry;
    }

    public ConcurrencyGate getGate() {
        return gate;
    }

    /**
     * Returns the bindings used for instances of {@code type}, building them if
     * needed. Useful to surface directive mistakes at startup rather than on
     * the first hydration.
     *
     * @throws HydrationException if a directive is placed on an unusable field
     */
    public HydrationSchema schemaOf(Class<?> type) {
        return schemas.get(type);
    }

    @Override
    public void hydrate(HydrationContext context, Object root) {
        Objects.requireNonNull(context, "context");
        if (root == null || !TypeShapes.isRecordLike(root.getClass())) {
            throw new InvalidRootException(root);
        }
        metrics.recordHydration();
        hydrateObject(context, root);
    }

    @Override
    public CompletableFuture<Void> hydrateAsync(HydrationContext context, Object root) {
        return Tasks.supply(executor, () -> {
            hydrate(context, root);
            return null;
        });
    }

    private void hydrateObject(HydrationContext context, Object target) {
        HydrationSchema schema = schemas.get(target.getClass());
        if (schema.isEmpty()) {
            return;
        }

        List<CompletableFuture<FieldResolution>> tasks = dispatcher.dispatch(context, target, schema);
        List<PendingField> pending = new ArrayList<>(tasks.size());
        for (CompletableFuture<FieldResolution> task : tasks) {
            pending.add(descend(context, target, join(task)));
        }

        List<HydrationException> errors = new ArrayList<>();
        for (PendingField field : pending) {
            apply(target, field, errors);
        }

        if (!errors.isEmpty()) {
            throw new HydrationFailedException(target.getClass(), errors);
        }
    }

    /**
     * Starts the nested hydrations of a resolved value: the value itself when it
     * is an object, or each object element of a list or array. They run while
     * the remaining fields of the parent are still being collected.
     */
    private PendingField descend(HydrationContext context, Object target, FieldResolution resolution) {
        Object value = resolution.value();
        if (resolution.failed() || value == null) {
            return new PendingField(resolution, List.of());
        }

        FieldBinding binding = resolution.binding();
        FieldKind valueKind = FieldKind.ofValue(value);
        if (valueKind == FieldKind.REFERENCE) {
            if (!TypeShapes.isRecordLike(value.getClass())) {
                return new PendingField(resolution, List.of());
            }
            return new PendingField(resolution, List.of(nested(context, target, binding, binding.getName(), value)));
        }

        List<CompletableFuture<HydrationException>> elements = new ArrayList<>();
        int index = 0;
        for (Object element : elementsOf(value)) {
            String path = binding.getName() + "[" + index++ + "]";
            if (element != null && TypeShapes.isRecordLike(element.getClass())) {
                elements.add(nested(context, target, binding, path, element));
            }
        }
        return new PendingField(resolution, elements);
    }

    private CompletableFuture<HydrationException> nested(HydrationContext context, Object target,
            FieldBinding binding, String path, Object value) {
        return Tasks.supply(executor, () -> {
            try {
                hydrateObject(context, value);
                return null;
            } catch (HydrationException e) {
                return new NestedHydrationException(target.getClass(), binding.getName(), path, e);
            }
        });
    }

    /**
     * Records the outcome of one field and assigns it. Runs on the thread that
     * hydrates {@code target}, which is the only writer of its fields.
     * <p>
     * A failed nested object leaves the field unset; failed list or array
     * elements are reported but the container is still assigned.
     * </p>
     */
    private void apply(Object target, PendingField field, List<HydrationException> errors) {
        FieldResolution resolution = field.resolution();
        FieldBinding binding = resolution.binding();
        Class<?> type = target.getClass();

        if (resolution.failed()) {
            fail(errors, resolution.error());
            return;
        }

        Object value = resolution.value();
        if (value == null) {
            log.debug("{}.{} resolved to null, leaving it unchanged", type.getSimpleName(), binding.getName());
            return;
        }

        boolean nestedFailed = false;
        for (CompletableFuture<HydrationException> nested : field.nested()) {
            HydrationException error = join(nested);
            if (error != null) {
                fail(errors, error);
                nestedFailed = true;
            }
        }

        FieldKind valueKind = FieldKind.ofValue(value);
        if (nestedFailed && valueKind == FieldKind.REFERENCE) {
            return;
        }

        if (valueKind != binding.getKind() || !binding.getFieldType().isInstance(value)) {
            fail(errors, new KindMismatchException(type, binding.getName(), binding.getFieldType(), value.getClass()));
            return;
        }

        try {
            binding.write(target, value);
            metrics.recordResolved();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(errors, new ResolverException(type, binding.getName(),
                    "setter failed: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName()),
                    cause));
        } catch (ReflectiveOperationException | RuntimeException e) {
            fail(errors, new PrivateFieldException(type, binding.getName(), e));
        }
    }

    private record PendingField(FieldResolution resolution, List<CompletableFuture<HydrationException>> nested) {
    }

    private void fail(List<HydrationException> errors, HydrationException error) {
        log.warn("{}", error.getMessage());
        metrics.recordFailure(error);
        errors.add(error);
    }

    private static List<Object> elementsOf(Object container) {
        if (container instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        int length = Array.getLength(container);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(container, i));
        }
        return elements;
    }

    private static <V> V join(CompletableFuture<V> future) {
        try {
            return future.join();
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

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Stops the executor if this engine created it. An executor supplied
     * through the builder is left to its owner.
     */
    public void shutdown() {
        if (!ownsExecutor) {
            return;
        }
        log.info("HydrationEngine shutting down, {} resolver calls in flight", gate.inFlight());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Hydration executor did not terminate in {}ms, forcing shutdown", shutdownTimeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /**
     * A pool that never queues: once {@code maxThreads} workers are busy, new
     * tasks are rejected and run on the submitting thread.
     */
    private static ExecutorService defaultExecutor(String threadNamePrefix, int maxThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(0, maxThreads, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(), factory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating a {@link HydrationEngine} instance.
     * <p>
     * Every setting has a default, so {@code HydrationEngine.builder().build()}
     * yields a working engine.
     * </p>
     */
    public static class Builder {
        private ResolverRegistry registry;
        private int concurrencyLimit = 10;
        private Integer maxThreads;
        private Class<? extends Annotation> annotation = Hydrate.class;
        private long schemaCacheSize = 1024;
        private ExecutorService executor;
        private String threadNamePrefix = "hydrator-worker-";
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private io.micrometer.core.instrument.MeterRegistry meterRegistry;

        /**
         * Sets the maximum number of resolver and method invocations running at
         * once, counted across every nested hydration. Default is 10.
         *
         * @param concurrencyLimit a positive limit
         * @return this builder
         */
        public Builder concurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        /**
         * Caps the threads of the engine-owned executor. Tasks submitted while
         * every worker is busy run on the submitting thread. Default is four
         * times the concurrency limit. Ignored when an executor is supplied.
         *
         * @param maxThreads a positive thread count
         * @return this builder
         */
        public Builder maxThreads(int maxThreads) {
            this.maxThreads = maxThreads;
            return this;
        }

        /**
         * Sets the field annotation carrying directives. It must be retained at
         * runtime and declare a {@code String value()} element. Default is
         * {@link Hydrate}.
         *
         * @param annotation the annotation type
         * @return this builder
         */
        public Builder annotation(Class<? extends Annotation> annotation) {
            this.annotation = annotation;
            return this;
        }

        /**
         * Shares an existing registry, e.g. between several engines.
         *
         * @param registry the registry
         * @return this builder
         */
        public Builder registry(ResolverRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the maximum number of classes whose schema is kept. Default is
         * 1024.
         *
         * @param schemaCacheSize the cache bound
         * @return this builder
         */
        public Builder schemaCacheSize(long schemaCacheSize) {
            this.schemaCacheSize = schemaCacheSize;
            return this;
        }

        /**
         * Runs field and element tasks on {@code executor} instead of an
         * engine-owned bounded pool.
         * <p>
         * Nested hydrations wait for their own tasks, so a bounded executor must
         * reject rather than queue; rejected tasks run on the calling thread.
         * </p>
         *
         * @param executor the executor, not shut down by the engine
         * @return this builder
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the prefix for threads of the engine-owned executor. Default is
         * "hydrator-worker-".
         *
         * @param prefix the thread name prefix
         * @return this builder
         */
        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        /**
         * Sets how long {@link HydrationEngine#shutdown()} waits for running tasks.
         * Default is 5 seconds.
         *
         * @param timeout the shutdown timeout
         * @return this builder
         */
        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        /**
         * Sets the Micrometer registry for recording metrics.
         *
         * @param registry The Micrometer registry.
         * @return this builder
         */
        public Builder metrics(io.micrometer.core.instrument.MeterRegistry registry) {
            this.meterRegistry = registry;
            return this;
        }

        /**
         * Builds and returns a configured {@link HydrationEngine}.
         *
         * @return The new engine instance.
         * @throws IllegalArgumentException if the limit is not positive or the
         *                                  annotation is unusable
         */
        public HydrationEngine build() {
            if (concurrencyLimit < 1) {
                throw new IllegalArgumentException("Concurrency limit must be at least 1, got " + concurrencyLimit);
            }
            if (maxThreads != null && maxThreads < 1) {
                throw new IllegalArgumentException("Max threads must be at least 1, got " + maxThreads);
            }
            Objects.requireNonNull(annotation, "annotation");
            if (!annotation.isAnnotation()) {
                throw new IllegalArgumentException(annotation.getName() + " is not an annotation type");
            }
            return new HydrationEngine(this);
        }

        private int effectiveMaxThreads() {
            return maxThreads != null ? maxThreads : (int) Math.min(Integer.MAX_VALUE, concurrencyLimit * 4L);
        }
    }
}
