package com.example.arena.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded scheduler for fixed-rate tick tasks. Everything scheduled
 * here runs on the one "arena-tick" daemon thread, so tasks never overlap.
 */
public class TickService {
    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "arena-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a named task. A task already registered under the name is cancelled first.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(task, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) {
            logger.warn("[TickService] task '{}' rescheduled, cancelling previous instance", name);
            previous.cancel(false);
        }
        return f;
    }

    public boolean isScheduled(String name) {
        ScheduledFuture<?> f = tasks.get(name);
        return f != null && !f.isDone();
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    /**
     * Cancel every task and stop the thread, waiting up to {@code timeoutMs}.
     * @return true if the thread terminated in time
     */
    public boolean shutdown(long timeoutMs) throws InterruptedException {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdown();
        boolean terminated = scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
        if (!terminated) {
            logger.warn("[TickService] tick thread still busy after {} ms, forcing shutdown", timeoutMs);
            scheduler.shutdownNow();
        }
        return terminated;
    }
}
