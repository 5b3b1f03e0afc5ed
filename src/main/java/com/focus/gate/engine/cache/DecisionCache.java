package com.focus.gate.engine.cache;

import com.focus.gate.dto.AdmissionVerdict;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class DecisionCache {

    private final Map<String, CachedDecision> entries = new HashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final int sweepThreshold;
    private int nextSweepAt;

    public DecisionCache(Clock clock, Duration ttl) {
        this(clock, ttl, 1024);
    }

    public DecisionCache(Clock clock, Duration ttl, int sweepThreshold) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        if (sweepThreshold < 1) {
            throw new IllegalArgumentException("Sweep threshold must be positive: " + sweepThreshold);
        }
        this.clock = clock;
        this.ttl = ttl;
        this.sweepThreshold = sweepThreshold;
        this.nextSweepAt = sweepThreshold;
    }

    public Optional<AdmissionVerdict> get(String url) {
        CachedDecision entry = entries.get(url);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(url);
            return Optional.empty();
        }
        return Optional.of(entry.verdict());
    }

    public void put(String url, AdmissionVerdict verdict) {
        entries.put(url, new CachedDecision(verdict, clock.instant()));
        if (entries.size() >= nextSweepAt) {
            entries.values().removeIf(this::isExpired);
            // next sweep at twice the live size
            nextSweepAt = Math.max(sweepThreshold, entries.size() * 2);
        }
    }

    public void clear() {
        entries.clear();
        nextSweepAt = sweepThreshold;
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(CachedDecision entry) {
        Instant now = clock.instant();
        return Duration.between(entry.storedAt(), now).compareTo(ttl) >= 0;
    }
}
