package com.naag.clinicalqa.metrics;

import io.micrometer.core.instrument.*;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for dataset loading, search and related-concept lookups.
 * Exposed through the actuator Prometheus/metrics endpoints.
 */
@Component
public class ClinicalQaMetrics {

    // Timers
    private final Timer searchTimer;
    private final Timer relatedTimer;
    private final Timer datasetLoadTimer;

    // Counters
    private final Counter searchCounter;
    private final Counter emptySearchCounter;
    private final Counter graphCacheHitCounter;
    private final Counter graphCacheMissCounter;
    private final Counter skippedRecordCounter;
    private final Counter loadErrorCounter;

    private volatile long publishedDocuments = 0;

    public ClinicalQaMetrics(MeterRegistry registry) {
        this.searchTimer = Timer.builder("clinical.search.duration")
                .description("Time to rank and filter one query")
                .tags("operation", "search")
                .register(registry);

        this.relatedTimer = Timer.builder("clinical.related.duration")
                .description("Time to look up related concepts")
                .tags("operation", "related")
                .register(registry);

        this.datasetLoadTimer = Timer.builder("clinical.dataset.load.duration")
                .description("Time to load a dataset and build index and graph")
                .tags("operation", "load")
                .register(registry);

        this.searchCounter = Counter.builder("clinical.search.requests")
                .description("Number of search requests")
                .tags("operation", "search")
                .register(registry);

        this.emptySearchCounter = Counter.builder("clinical.search.empty")
                .description("Number of searches that returned no results")
                .tags("operation", "search")
                .register(registry);

        this.graphCacheHitCounter = Counter.builder("clinical.graph.cache.hit")
                .description("Graph loaded from the persisted cache")
                .tags("cache", "graph")
                .register(registry);

        this.graphCacheMissCounter = Counter.builder("clinical.graph.cache.miss")
                .description("Graph rebuilt because the cache was absent, stale or corrupt")
                .tags("cache", "graph")
                .register(registry);

        this.skippedRecordCounter = Counter.builder("clinical.dataset.records.skipped")
                .description("Records dropped by validation")
                .tags("operation", "load")
                .register(registry);

        this.loadErrorCounter = Counter.builder("clinical.dataset.load.errors")
                .description("Dataset loads that failed")
                .tags("operation", "load")
                .register(registry);

        Gauge.builder("clinical.dataset.documents", this, ClinicalQaMetrics::getPublishedDocuments)
                .description("Documents in the published snapshot")
                .register(registry);
    }

    public void recordSearch(long durationMs, int resultCount) {
        searchTimer.record(durationMs, TimeUnit.MILLISECONDS);
        searchCounter.increment();
        if (resultCount == 0) {
            emptySearchCounter.increment();
        }
    }

    public void recordRelatedLookup(long durationMs) {
        relatedTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordDatasetLoad(long durationMs, int documents, int skippedRecords) {
        datasetLoadTimer.record(durationMs, TimeUnit.MILLISECONDS);
        skippedRecordCounter.increment(skippedRecords);
        this.publishedDocuments = documents;
    }

    public void recordLoadError() {
        loadErrorCounter.increment();
    }

    public void recordGraphCacheHit() {
        graphCacheHitCounter.increment();
    }

    public void recordGraphCacheMiss() {
        graphCacheMissCounter.increment();
    }

    public double getPublishedDocuments() {
        return publishedDocuments;
    }
}
