package com.xksgroup.conversionengine.service.helper;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the engine's periodic jobs (space monitor, heartbeat) and keeps the last failure
 * of each one, so failures are visible instead of dying silently inside an executor.
 */
@Slf4j
@Component
public class BackgroundSupervisor {

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "engine-background-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });
    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
    private final Map<String, Throwable> lastFailures = new ConcurrentHashMap<>();

    public void scheduleWithFixedDelay(String name, Runnable job, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                () -> runSupervised(name, job), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = jobs.put(name, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Background job '{}' scheduled every {} ms", name, periodMs);
    }

    public void submit(String name, Runnable job) {
        scheduler.execute(() -> runSupervised(name, job));
    }

    public Map<String, Throwable> lastFailures() {
        return Map.copyOf(lastFailures);
    }

    private void runSupervised(String name, Runnable job) {
        try {
            job.run();
            lastFailures.remove(name);
        } catch (RuntimeException e) {
            // Keep the schedule alive; a thrown exception would cancel it
            lastFailures.put(name, e);
            log.error("Background job '{}' failed", name, e);
        }
    }

    @PreDestroy
    public void stop() {
        shutdown();
    }

    /**
     * Stops all jobs and reports the ones whose last run failed.
     */
    public Map<String, Throwable> shutdown() {
        jobs.values().forEach(future -> future.cancel(false));
        scheduler.shutdownNow();
        Map<String, Throwable> failures = lastFailures();
        failures.forEach((name, error) ->
                log.warn("Background job '{}' had failed on its last run: {}", name, error.getMessage()));
        return failures;
    }
}
