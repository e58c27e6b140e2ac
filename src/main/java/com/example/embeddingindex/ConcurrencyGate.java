package com.example.embeddingindex;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide registry of named counting semaphores, one per scarce resource
 * (for example a GPU). Callers take one {@link Permit} per call into the
 * resource and close it on every exit path.
 *
 * <pre>{@code
 * try (ConcurrencyGate.Permit permit = gate.acquire("embedding")) {
 *     return model.embedText(text);
 * }
 * }</pre>
 */
public class ConcurrencyGate {

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if {@code maxConcurrency < 1}
     * @throws IllegalStateException if the resource is already registered
     */
    public void register(String resource, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("max_concurrency must be >= 1, got " + maxConcurrency + " for '" + resource + "'");
        }
        Slot previous = slots.putIfAbsent(resource, new Slot(maxConcurrency));
        if (previous != null) {
            throw new IllegalStateException("Concurrency gate '" + resource + "' is already registered");
        }
    }

    /**
     * Blocks the calling thread until a slot is free. An interrupt while
     * waiting leaves no slot taken.
     */
    public Permit acquire(String resource) throws InterruptedException {
        Slot slot = slot(resource);
        slot.semaphore.acquire();
        return new Permit(slot.semaphore);
    }

    /**
     * Like {@link #acquire(String)} but gives up after {@code timeout}.
     *
     * @throws GateExhaustedException when no slot frees up in time
     */
    public Permit tryAcquire(String resource, Duration timeout) throws InterruptedException {
        Slot slot = slot(resource);
        if (!slot.semaphore.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new GateExhaustedException(resource, timeout);
        }
        return new Permit(slot.semaphore);
    }

    public int available(String resource) {
        return slot(resource).semaphore.availablePermits();
    }

    public int capacity(String resource) {
        return slot(resource).capacity;
    }

    public boolean isRegistered(String resource) {
        return slots.containsKey(resource);
    }

    public Map<String, Map<String, Integer>> snapshot() {
        Map<String, Map<String, Integer>> out = new LinkedHashMap<>();
        slots.forEach((name, slot) -> {
            Map<String, Integer> m = new LinkedHashMap<>();
            m.put("capacity", slot.capacity);
            m.put("available", slot.semaphore.availablePermits());
            out.put(name, m);
        });
        return Collections.unmodifiableMap(out);
    }

    private Slot slot(String resource) {
        Slot slot = slots.get(resource);
        if (slot == null) throw new GateMisconfiguredException(resource);
        return slot;
    }

    private static final class Slot {
        final int capacity;
        final Semaphore semaphore;

        Slot(int capacity) {
            this.capacity = capacity;
            this.semaphore = new Semaphore(capacity, true);
        }
    }

    /**
     * One held slot. Closing releases it; further closes are no-ops.
     */
    public static final class Permit implements AutoCloseable {
        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
