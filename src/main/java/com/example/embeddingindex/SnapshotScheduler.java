package com.example.embeddingindex;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic remote backups on a single worker thread. Each tick is best effort;
 * stop() trips the cancel latch and waits for the final backup.
 */
@Slf4j
@Component
public class SnapshotScheduler {

    public static final Duration MIN_INTERVAL = Duration.ofMinutes(1);

    private final SnapshotManager snapshots;
    private final boolean enabled;
    private final Duration interval;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "snapshot-scheduler");
        t.setDaemon(true);
        return t;
    });

    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile Future<?> worker;

    @Autowired
    public SnapshotScheduler(SnapshotManager snapshots, EmbeddingIndexProperties props) {
        this(snapshots, props.getSnapshot().isRemoteEnabled(), props.getSnapshot().getInterval(), MIN_INTERVAL);
    }

    SnapshotScheduler(SnapshotManager snapshots, boolean enabled, Duration interval, Duration floor) {
        this.snapshots = snapshots;
        this.enabled = enabled;
        if (interval == null || interval.compareTo(floor) < 0) {
            log.warn("Snapshot interval {} is below the minimum {}, using the minimum", interval, floor);
            this.interval = floor;
        } else {
            this.interval = interval;
        }
    }

    /**
     * @return false when remote snapshots are disabled or the worker already runs
     */
    public synchronized boolean start() {
        if (!enabled) {
            log.info("Remote snapshots disabled, scheduler not started");
            return false;
        }
        if (worker != null) return false;
        worker = executor.submit(this::runLoop);
        log.info("Snapshot scheduler started, interval={}", interval);
        return true;
    }

    private void runLoop() {
        try {
            while (!cancelSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                tick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Snapshot scheduler interrupted");
        } finally {
            log.info("Snapshot scheduler stopping, taking final backup");
            tick();
        }
    }

    private void tick() {
        ticks.incrementAndGet();
        try {
            snapshots.backupToRemote();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("Periodic snapshot failed (will retry next tick): {}", e.getMessage());
        }
    }

    @PreDestroy
    public synchronized void stop() {
        cancelSignal.countDown();
        Future<?> f = worker;
        if (f != null) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.error("Snapshot scheduler terminated abnormally", e.getCause());
            }
        }
        executor.shutdown();
    }

    public boolean isRunning() {
        Future<?> f = worker;
        return f != null && !f.isDone();
    }

    public Duration getInterval() { return interval; }
    public long getTicks() { return ticks.get(); }
    public long getFailures() { return failures.get(); }

    public Map<String, Object> info() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("running", isRunning());
        out.put("interval", interval.toString());
        out.put("ticks", ticks.get());
        out.put("failures", failures.get());
        return out;
    }
}
