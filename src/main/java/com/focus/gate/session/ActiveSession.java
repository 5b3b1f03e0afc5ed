package com.focus.gate.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
final class ActiveSession {

    private final Long recordId;
    private final String task;
    private final Instant startTime;
    private final Instant endTime;
    private final String secretHash;

    private final AtomicReference<EnforcementHandle> handle;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicBoolean terminating = new AtomicBoolean();
    private final ScheduledExecutorService monitors;

    ActiveSession(Long recordId, String task, Instant startTime, Instant endTime,
                  String secretHash, EnforcementHandle handle) {
        this.recordId = recordId;
        this.task = task;
        this.startTime = startTime;
        this.endTime = endTime;
        this.secretHash = secretHash;
        this.handle = new AtomicReference<>(handle);
        this.monitors = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "session-monitor-" + recordId);
            t.setDaemon(true);
            return t;
        });
    }

    Long recordId() {
        return recordId;
    }

    String task() {
        return task;
    }

    Instant startTime() {
        return startTime;
    }

    Instant endTime() {
        return endTime;
    }

    String secretHash() {
        return secretHash;
    }

    EnforcementHandle handle() {
        return handle.get();
    }

    void replaceHandle(EnforcementHandle replacement) {
        handle.set(replacement);
    }

    int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    int failures() {
        return consecutiveFailures.get();
    }

    void resetFailures() {
        consecutiveFailures.set(0);
    }

    boolean terminating() {
        return terminating.get();
    }

    boolean beginTermination() {
        return terminating.compareAndSet(false, true);
    }

    void startMonitors(Runnable expiryCheck, Duration expiryInterval,
                       Runnable healthCheck, Duration healthInterval) {
        monitors.scheduleWithFixedDelay(guarded("expiry", expiryCheck),
                expiryInterval.toMillis(), expiryInterval.toMillis(), TimeUnit.MILLISECONDS);
        monitors.scheduleWithFixedDelay(guarded("health", healthCheck),
                healthInterval.toMillis(), healthInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean stopMonitors(Duration joinTimeout) {
        monitors.shutdownNow();
        try {
            boolean stopped = monitors.awaitTermination(joinTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!stopped) {
                log.warn("Session monitors did not stop within {} ms", joinTimeout.toMillis());
            }
            return stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // An exception escaping a scheduled task would silently cancel the loop.
    private static Runnable guarded(String loop, Runnable check) {
        return () -> {
            try {
                check.run();
            } catch (RuntimeException e) {
                log.error("Session {} check failed", loop, e);
            }
        };
    }
}
