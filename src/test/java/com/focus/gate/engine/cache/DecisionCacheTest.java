package com.focus.gate.engine.cache;

import com.focus.gate.dto.AdmissionVerdict;
import com.focus.gate.model.AdmissionAction;
import com.focus.gate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DecisionCacheTest {

    private static final String URL = "https://github.com/org/repo";

    private MutableClock clock;
    private DecisionCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new DecisionCache(clock, Duration.ofSeconds(300));
    }

    private static AdmissionVerdict verdict(AdmissionAction action) {
        return new AdmissionVerdict(URL, action, 1.0, "educational-domain", false);
    }

    @Test
    void hitWithinTtl() {
        cache.put(URL, verdict(AdmissionAction.ALLOW));
        clock.advance(Duration.ofSeconds(299));
        assertEquals(AdmissionAction.ALLOW, cache.get(URL).orElseThrow().action());
    }

    @Test
    void expiredEntryIsEvictedOnRead() {
        cache.put(URL, verdict(AdmissionAction.ALLOW));
        clock.advance(Duration.ofSeconds(300));
        assertTrue(cache.get(URL).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void putOverwritesAndRestartsTtl() {
        cache.put(URL, verdict(AdmissionAction.ALLOW));
        clock.advance(Duration.ofSeconds(200));
        cache.put(URL, verdict(AdmissionAction.BLOCK));
        clock.advance(Duration.ofSeconds(200));
        assertEquals(AdmissionAction.BLOCK, cache.get(URL).orElseThrow().action());
    }

    @Test
    void keyIsTheRawUrlString() {
        cache.put(URL, verdict(AdmissionAction.ALLOW));
        assertTrue(cache.get(URL + "/").isEmpty());
    }

    @Test
    void clearDropsEverything() {
        cache.put(URL, verdict(AdmissionAction.ALLOW));
        cache.put("https://reddit.com", verdict(AdmissionAction.BLOCK));
        cache.clear();
        assertEquals(0, cache.size());
        assertTrue(cache.get(URL).isEmpty());
    }

    @Test
    void ttlMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new DecisionCache(clock, Duration.ZERO));
    }

    @Test
    void expiredEntriesAreSweptOnceTheMapGrows() {
        DecisionCache small = new DecisionCache(clock, Duration.ofSeconds(300), 4);
        small.put("https://a.example/1", verdict(AdmissionAction.ALLOW));
        small.put("https://a.example/2", verdict(AdmissionAction.ALLOW));
        small.put("https://a.example/3", verdict(AdmissionAction.ALLOW));
        clock.advance(Duration.ofSeconds(300));

        small.put("https://a.example/4", verdict(AdmissionAction.BLOCK));

        assertEquals(1, small.size());
        assertEquals(AdmissionAction.BLOCK, small.get("https://a.example/4").orElseThrow().action());
    }

    @Test
    void liveEntriesSurviveTheSweep() {
        DecisionCache small = new DecisionCache(clock, Duration.ofSeconds(300), 2);
        small.put("https://a.example/1", verdict(AdmissionAction.ALLOW));
        small.put("https://a.example/2", verdict(AdmissionAction.ALLOW));
        small.put("https://a.example/3", verdict(AdmissionAction.ALLOW));

        assertEquals(3, small.size());
        assertTrue(small.get("https://a.example/1").isPresent());
    }
}
