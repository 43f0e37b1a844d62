package com.nayem.hydrator.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.Callable;

/**
 * Micrometer instrumentation for a {@link HydrationEngine}. Every method is a
 * no-op when no {@link MeterRegistry} was supplied.
 */
class HydrationMetrics {

    private final MeterRegistry registry;
    private final Counter hydrations;
    private final Counter resolved;
    private final Counter skipped;
    private final Timer resolveTimer;

    HydrationMetrics(MeterRegistry registry, ConcurrencyGate gate) {
        this.registry = registry;
        if (registry != null) {
            this.hydrations = Counter.builder("hydrator.hydrations")
                    .description("Number of root hydrations started")
                    .register(registry);
            this.resolved = Counter.builder("hydrator.fields.resolved")
                    .description("Number of fields assigned a resolved value")
                    .register(registry);
            this.skipped = Counter.builder("hydrator.fields.skipped")
                    .description("Number of finder fields skipped for lack of a resolver")
                    .register(registry);
            this.resolveTimer = Timer.builder("hydrator.resolve")
                    .description("Resolver and directive method execution time")
                    .register(registry);
            Gauge.builder("hydrator.gate.in_flight", gate, ConcurrencyGate::inFlight)
                    .description("Resolver invocations currently holding a gate slot")
                    .strongReference(true)
                    .register(registry);
        } else {
            this.hydrations = null;
            this.resolved = null;
            this.skipped = null;
            this.resolveTimer = null;
        }
    }

    void recordHydration() {
        if (hydrations != null) {
            hydrations.increment();
        }
    }

    void recordResolved() {
        if (resolved != null) {
            resolved.increment();
        }
    }

    void recordSkipped() {
        if (skipped != null) {
            skipped.increment();
        }
    }

    void recordFailure(HydrationException error) {
        if (registry != null) {
            registry.counter("hydrator.fields.failed", "error", error.getClass().getSimpleName()).increment();
        }
    }

    <V> V timeResolve(Callable<V> call) throws Exception {
        if (resolveTimer == null) {
            return call.call();
        }
        return resolveTimer.recordCallable(call);
    }
}
