package com.naag.clinicalqa.service;

import com.naag.clinicalqa.config.ClinicalQaProperties;
import com.naag.clinicalqa.dataset.ClinicalDocument;
import com.naag.clinicalqa.dataset.DatasetFingerprint;
import com.naag.clinicalqa.dataset.DatasetLoader;
import com.naag.clinicalqa.dataset.DocumentStore;
import com.naag.clinicalqa.exception.ClinicalQaException;
import com.naag.clinicalqa.exception.DatasetNotLoadedException;
import com.naag.clinicalqa.exception.GraphCacheException;
import com.naag.clinicalqa.graph.GraphCacheStore;
import com.naag.clinicalqa.graph.KnowledgeGraph;
import com.naag.clinicalqa.graph.KnowledgeGraphBuilder;
import com.naag.clinicalqa.metrics.ClinicalQaMetrics;
import com.naag.clinicalqa.search.InvertedIndex;
import com.naag.clinicalqa.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the published {@link CorpusSnapshot}.
 *
 * <p>Loads build a complete snapshot off to the side and publish it with a single reference swap,
 * so readers see either the old snapshot or the new one. Loads are serialized; a load of a dataset
 * whose fingerprint matches the published snapshot keeps the existing one.
 */
@Service
@Slf4j
public class ClinicalCorpusService {

    private final DatasetLoader datasetLoader;
    private final Tokenizer tokenizer;
    private final KnowledgeGraphBuilder graphBuilder;
    private final GraphCacheStore graphCacheStore;
    private final ClinicalQaMetrics metrics;
    private final ClinicalQaProperties properties;
    private final ResourceLoader resourceLoader;

    private final AtomicReference<CorpusSnapshot> current = new AtomicReference<>();
    private final ReentrantLock loadLock = new ReentrantLock();

    public ClinicalCorpusService(DatasetLoader datasetLoader,
                                 Tokenizer tokenizer,
                                 KnowledgeGraphBuilder graphBuilder,
                                 GraphCacheStore graphCacheStore,
                                 ClinicalQaMetrics metrics,
                                 ClinicalQaProperties properties,
                                 ResourceLoader resourceLoader) {
        this.datasetLoader = datasetLoader;
        this.tokenizer = tokenizer;
        this.graphBuilder = graphBuilder;
        this.graphCacheStore = graphCacheStore;
        this.metrics = metrics;
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Result of a load request.
     *
     * @param rebuilt false when the dataset was unchanged and the published snapshot was kept
     */
    public record LoadOutcome(CorpusSnapshot snapshot, boolean rebuilt) {}

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!properties.getDataset().isLoadOnStartup()) {
            log.info("Dataset load on startup disabled");
            return;
        }
        try {
            reload();
        } catch (ClinicalQaException e) {
            // the service stays up without a snapshot; queries answer 503 until a reload succeeds
            log.error("Failed to load clinical dataset from {}: {}", properties.getDataset().getLocation(), e.getMessage());
        }
    }

    /**
     * Loads the dataset at the configured location.
     */
    public LoadOutcome reload() {
        String location = properties.getDataset().getLocation();
        return loadDataset(resourceLoader.getResource(location));
    }

    public LoadOutcome loadDataset(Resource source) {
        loadLock.lock();
        try {
            long start = System.currentTimeMillis();
            DocumentStore store;
            try {
                store = datasetLoader.load(source);
            } catch (ClinicalQaException e) {
                metrics.recordLoadError();
                throw e;
            }
            String fingerprint = DatasetFingerprint.of(store.documents());

            CorpusSnapshot published = current.get();
            if (published != null && published.fingerprint().equals(fingerprint)) {
                log.info("Dataset {} unchanged (fingerprint {}), keeping published snapshot", source.getDescription(), fingerprint);
                return new LoadOutcome(published, false);
            }

            InvertedIndex index = InvertedIndex.build(store, tokenizer);
            KnowledgeGraph graph = buildOrLoadGraph(store.documents(), cacheLocation());
            CorpusSnapshot snapshot = new CorpusSnapshot(
                    store, index, graph, fingerprint, source.getDescription(), Instant.now());
            current.set(snapshot);

            long duration = System.currentTimeMillis() - start;
            metrics.recordDatasetLoad(duration, store.size(), store.rejectedRecords());
            log.info("Published snapshot {} in {}ms: {} documents, {} tokens, {} graph keywords",
                    fingerprint, duration, store.size(), index.vocabularySize(), graph.keywords().size());
            return new LoadOutcome(snapshot, true);
        } finally {
            loadLock.unlock();
        }
    }

    /**
     * Restores the graph from {@code cacheLocation} when it was saved for the same documents,
     * otherwise builds it and refreshes the cache. Cache problems are logged and never fail the call.
     */
    public KnowledgeGraph buildOrLoadGraph(List<ClinicalDocument> documents, Optional<Path> cacheLocation) {
        if (cacheLocation.isEmpty()) {
            return graphBuilder.build(documents);
        }
        Path location = cacheLocation.get();
        String fingerprint = DatasetFingerprint.of(documents);

        try {
            Optional<KnowledgeGraph> cached = graphCacheStore.load(location, fingerprint);
            if (cached.isPresent()) {
                metrics.recordGraphCacheHit();
                log.info("Loaded knowledge graph from cache {}", location);
                return cached.get();
            }
        } catch (GraphCacheException e) {
            log.warn("Ignoring graph cache {}, rebuilding: {}", location, e.getMessage());
        }

        metrics.recordGraphCacheMiss();
        KnowledgeGraph graph = graphBuilder.build(documents);
        try {
            graphCacheStore.save(graph, location);
        } catch (GraphCacheException e) {
            log.warn("Could not persist knowledge graph: {}", e.getMessage());
        }
        return graph;
    }

    private Optional<Path> cacheLocation() {
        String location = properties.getGraph().getCacheLocation();
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(location));
    }

    /**
     * The published snapshot.
     *
     * @throws DatasetNotLoadedException before the first successful load
     */
    public CorpusSnapshot snapshot() {
        CorpusSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new DatasetNotLoadedException();
        }
        return snapshot;
    }

    public boolean isLoaded() {
        return current.get() != null;
    }
}
