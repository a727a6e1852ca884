package com.example.prsync.service;

import org.springframework.stereotype.Component;

/**
 * Thread-local flag raised when a unit of work loses a Jira lookup but keeps going.
 *
 * Pattern:
 * 1. The worker acquires the signal at unit entry
 * 2. The correlator calls {@link #markDegraded} when a lookup fails
 * 3. The worker checks {@link #isDegraded()} before closing the SyncJob
 * 4. AutoCloseable clears the ThreadLocal on scope exit (pooled threads)
 */
@Component
public class DegradedSyncSignal implements AutoCloseable {

    private static final ThreadLocal<Degradation> current = new ThreadLocal<>();

    /**
     * Record a degradation. The first reason is kept; later ones bump the count.
     */
    public void markDegraded(String reason) {
        Degradation existing = current.get();
        if (existing == null) {
            current.set(new Degradation(reason, 1));
        } else {
            current.set(new Degradation(existing.reason(), existing.count() + 1));
        }
    }

    public boolean isDegraded() {
        return current.get() != null;
    }

    public String getReason() {
        Degradation degradation = current.get();
        if (degradation == null) {
            return null;
        }
        return degradation.count() == 1
                ? degradation.reason()
                : degradation.reason() + " (+" + (degradation.count() - 1) + " more)";
    }

    /**
     * Start a fresh scope for the current thread.
     * <pre>
     * try (DegradedSyncSignal signal = degradedSyncSignal.acquire()) {
     *     // sync logic
     * }
     * </pre>
     */
    public DegradedSyncSignal acquire() {
        current.remove();
        return this;
    }

    @Override
    public void close() {
        current.remove();
    }

    private record Degradation(String reason, int count) {
    }
}
