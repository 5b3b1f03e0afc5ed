package com.focus.gate.engine.lookup;

import com.focus.gate.dto.PageMetadata;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the metadata fetcher on a small bounded pool and waits at most {@code timeout}.
 * Any failure, rejection or timeout yields the metadata the caller already had.
 */
@Slf4j
public class BoundedMetadataLookup {

    private final PageMetadataFetcher fetcher;
    private final ExecutorService executor;
    private final Duration timeout;

    public BoundedMetadataLookup(PageMetadataFetcher fetcher, ExecutorService executor, Duration timeout) {
        this.fetcher = fetcher;
        this.executor = executor;
        this.timeout = timeout;
    }

    public PageMetadata enrich(PageMetadata metadata) {
        Future<Optional<PageMetadata>> pending;
        try {
            pending = executor.submit(() -> fetcher.fetch(metadata.url()));
        } catch (RejectedExecutionException e) {
            log.warn("Metadata fetch for url={} rejected, fetch pool saturated", metadata.url());
            return metadata;
        }

        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .map(fetched -> merge(metadata, fetched))
                    .orElse(metadata);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("Metadata fetch for url={} timed out after {} ms, using basic metadata",
                    metadata.url(), timeout.toMillis());
            return metadata;
        } catch (ExecutionException e) {
            log.warn("Metadata fetch for url={} failed: {}", metadata.url(), e.getCause().getMessage());
            return metadata;
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return metadata;
        }
    }

    // Caller-supplied title/description win; everything else comes from the fetch.
    private static PageMetadata merge(PageMetadata supplied, PageMetadata fetched) {
        return fetched.toBuilder()
                .url(supplied.url())
                .title(supplied.title().isBlank() ? fetched.title() : supplied.title())
                .description(supplied.description().isBlank() ? fetched.description() : supplied.description())
                .build();
    }
}
