package com.nayem.hydrator.core;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of resolver and method invocations in flight for one
 * engine, across every nested hydration it performs.
 * <p>
 * A slot is held only while a resolver or directive method runs. Tasks that
 * wait for other tasks (an object waiting for its fields, a list waiting for
 * its elements) never hold one, so recursion cannot exhaust the gate.
 * </p>
 */
public class ConcurrencyGate {

    private static final long POLL_INTERVAL_MILLIS = 25;

    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public ConcurrencyGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Waits for a slot. The shared background context waits without limit;
     * other contexts poll, so a cancelled or expired context stops waiting
     * within one poll interval and queued waiters may be overtaken between
     * polls.
     *
     * @return {@code true} once a slot is held, {@code false} if the context was
     *         cancelled or expired first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean acquire(HydrationContext context) throws InterruptedException {
        if (context == HydrationContext.background()) {
            permits.acquire();
            onAcquired();
            return true;
        }
        // cancel() has no wake-up hook, so it is seen at poll boundaries. The
        // last poll before a deadline is cut to end on it.
        while (!context.isCancelled()) {
            if (permits.tryAcquire(pollMillis(context), TimeUnit.MILLISECONDS)) {
                onAcquired();
                return true;
            }
        }
        return false;
    }

    private static long pollMillis(HydrationContext context) {
        return context.getDeadline()
                .map(deadline -> Math.min(POLL_INTERVAL_MILLIS,
                        Math.max(0L, Duration.between(Instant.now(), deadline).toMillis())))
                .orElse(POLL_INTERVAL_MILLIS);
    }

    public void release() {
        inFlight.decrementAndGet();
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Highest number of simultaneously held slots since construction.
     */
    public int peakInFlight() {
        return peakInFlight.get();
    }

    private void onAcquired() {
        int current = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(current, Math::max);
    }
}
