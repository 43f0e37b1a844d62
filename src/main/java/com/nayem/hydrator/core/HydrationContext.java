package com.nayem.hydrator.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cancellation signal handed to every resolver and method invoked during a
 * hydration.
 * <p>
 * Cancellation is advisory. The engine checks the context only before a task
 * takes its gate slot; once a resolver is running it is up to the resolver to
 * honor {@link #isCancelled()}.
 * </p>
 */
public final class HydrationContext {

    private static final HydrationContext BACKGROUND = new HydrationContext(null, null);

    private final HydrationContext parent;
    private final Instant deadline;
    private volatile boolean cancelled;

    private HydrationContext(HydrationContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * A context that is never cancelled and has no deadline.
     */
    public static HydrationContext background() {
        return BACKGROUND;
    }

    /**
     * A fresh context that can be cancelled through {@link #cancel()}.
     */
    public static HydrationContext cancellable() {
        return new HydrationContext(null, null);
    }

    /**
     * A child of this context that also expires after {@code timeout}.
     */
    public HydrationContext withTimeout(Duration timeout) {
        Instant candidate = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(candidate) ? deadline : candidate;
        return new HydrationContext(this, effective);
    }

    /**
     * Marks this context, and every child derived from it, as cancelled.
     *
     * @throws IllegalStateException for the shared background context
     */
    public void cancel() {
        if (this == BACKGROUND) {
            throw new IllegalStateException("The background context cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        if (cancelled) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return true;
        }
        return parent != null && parent.isCancelled();
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }
}
