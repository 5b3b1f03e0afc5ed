package com.focus.gate.config;

import com.focus.gate.engine.feature.FeatureExtractor;
import com.focus.gate.engine.lookup.BoundedMetadataLookup;
import com.focus.gate.engine.lookup.NoopPageMetadataFetcher;
import com.focus.gate.engine.lookup.PageMetadataFetcher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    @Value("${focus.fetch.workers:3}")
    private int fetchWorkers;

    @Value("${focus.fetch.queue-capacity:16}")
    private int fetchQueueCapacity;

    @Value("${focus.fetch.timeout:2s}")
    private Duration fetchTimeout;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FeatureExtractor featureExtractor(Clock clock) {
        return new FeatureExtractor(clock);
    }

    @Bean
    public PageMetadataFetcher pageMetadataFetcher() {
        return new NoopPageMetadataFetcher();
    }

    @Bean(name = "metadataFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService metadataFetchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.max(1, fetchWorkers);
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, fetchQueueCapacity)),
                r -> {
                    Thread t = new Thread(r, "metadata-fetch-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public BoundedMetadataLookup boundedMetadataLookup(PageMetadataFetcher fetcher,
                                                       @Qualifier("metadataFetchExecutor") ExecutorService executor) {
        return new BoundedMetadataLookup(fetcher, executor, fetchTimeout);
    }
}
