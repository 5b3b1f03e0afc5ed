package com.focus.gate.engine.lookup;

import com.focus.gate.dto.PageMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class BoundedMetadataLookupTest {

    private static final String URL = "https://example.org/post";

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void fetchedMetadataFillsTheGaps() {
        PageMetadata fetched = PageMetadata.builder()
                .url("https://example.org/redirected")
                .title("Fetched title")
                .description("Fetched description")
                .keywords(List.of("java"))
                .linkCount(12)
                .build();
        BoundedMetadataLookup lookup = new BoundedMetadataLookup(url -> Optional.of(fetched), executor, Duration.ofSeconds(1));

        PageMetadata supplied = PageMetadata.builder().url(URL).description("Caller description").build();
        PageMetadata enriched = lookup.enrich(supplied);

        assertEquals(URL, enriched.url());
        assertEquals("Fetched title", enriched.title());
        assertEquals("Caller description", enriched.description());
        assertEquals(12, enriched.linkCount());
    }

    @Test
    void slowFetcherIsCutOffAtTheTimeout() {
        PageMetadataFetcher slow = url -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of(PageMetadata.builder().url(url).title("too late").build());
        };
        BoundedMetadataLookup lookup = new BoundedMetadataLookup(slow, executor, Duration.ofMillis(100));

        long started = System.nanoTime();
        PageMetadata result = lookup.enrich(PageMetadata.basic(URL));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertEquals("", result.title());
        assertTrue(elapsedMillis < 2_000, "waited " + elapsedMillis + " ms");
    }

    @Test
    void failingFetcherDegradesToSuppliedMetadata() {
        BoundedMetadataLookup lookup = new BoundedMetadataLookup(url -> {
            throw new IllegalStateException("connection refused");
        }, executor, Duration.ofSeconds(1));

        PageMetadata supplied = PageMetadata.basic(URL);
        assertSame(supplied, lookup.enrich(supplied));
    }

    @Test
    void saturatedPoolDegradesToSuppliedMetadata() {
        executor.shutdown();
        BoundedMetadataLookup lookup = new BoundedMetadataLookup(new NoopPageMetadataFetcher(), executor, Duration.ofSeconds(1));

        PageMetadata supplied = PageMetadata.basic(URL);
        assertSame(supplied, lookup.enrich(supplied));
    }
}
