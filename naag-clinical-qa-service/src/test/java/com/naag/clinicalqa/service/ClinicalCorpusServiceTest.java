package com.naag.clinicalqa.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.naag.clinicalqa.config.ClinicalQaProperties;
import com.naag.clinicalqa.dataset.DatasetLoader;
import com.naag.clinicalqa.exception.DatasetNotLoadedException;
import com.naag.clinicalqa.exception.DatasetParseException;
import com.naag.clinicalqa.exception.EmptyDatasetException;
import com.naag.clinicalqa.graph.GraphCacheStore;
import com.naag.clinicalqa.graph.KnowledgeGraph;
import com.naag.clinicalqa.graph.KnowledgeGraphBuilder;
import com.naag.clinicalqa.metrics.ClinicalQaMetrics;
import com.naag.clinicalqa.service.ClinicalCorpusService.LoadOutcome;
import com.naag.clinicalqa.text.Tokenizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Loading, publishing and graph caching with real components.
 */
class ClinicalCorpusServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Tokenizer tokenizer = new Tokenizer();

    private SimpleMeterRegistry registry;
    private ClinicalQaProperties properties;
    private ClinicalCorpusService corpusService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new ClinicalQaProperties();
        corpusService = newService();
    }

    private ClinicalCorpusService newService() {
        return new ClinicalCorpusService(
                new DatasetLoader(objectMapper),
                tokenizer,
                new KnowledgeGraphBuilder(tokenizer),
                new GraphCacheStore(objectMapper),
                new ClinicalQaMetrics(registry),
                properties,
                new DefaultResourceLoader()
        );
    }

    private static Resource dataset(String... prompts) {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < prompts.length; i++) {
            if (i > 0) json.append(',');
            json.append("{\"prompt\": \"").append(prompts[i])
                    .append("\", \"completion\": \"Answer ").append(i)
                    .append("\", \"cancer_type\": \"NSCLC\", \"genes\": \"PD-L1\"}");
        }
        json.append(']');
        return new ByteArrayResource(json.toString().getBytes(StandardCharsets.UTF_8), "test dataset");
    }

    private static Resource sourcedDataset(String source) {
        String json = "[{\"prompt\": \"Atezolizumab dose\", \"completion\": \"1200 mg\", "
                + "\"cancer_type\": \"NSCLC\", \"genes\": \"PD-L1\", \"source\": \"" + source + "\"}]";
        return new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8), "sourced dataset");
    }

    private double count(String meter) {
        return registry.get(meter).counter().count();
    }

    @Nested
    @DisplayName("Publishing")
    class PublishingTests {

        @Test
        @DisplayName("Should reject queries before the first load")
        void shouldFailBeforeFirstLoad() {
            assertThat(corpusService.isLoaded()).isFalse();
            assertThatThrownBy(() -> corpusService.snapshot()).isInstanceOf(DatasetNotLoadedException.class);
        }

        @Test
        @DisplayName("Should load the bundled dataset from the configured location")
        void shouldReloadConfiguredDataset() {
            LoadOutcome outcome = corpusService.reload();

            assertThat(outcome.rebuilt()).isTrue();
            assertThat(corpusService.snapshot()).isSameAs(outcome.snapshot());
            assertThat(outcome.snapshot().store().size()).isEqualTo(12);
            assertThat(outcome.snapshot().index().documentCount()).isEqualTo(12);
            assertThat(outcome.snapshot().graph().datasetFingerprint()).isEqualTo(outcome.snapshot().fingerprint());
            assertThat(registry.get("clinical.dataset.documents").gauge().value()).isEqualTo(12.0);
        }

        @Test
        @DisplayName("Should keep the published snapshot when the dataset is unchanged")
        void shouldCoalesceUnchangedReload() {
            LoadOutcome first = corpusService.loadDataset(dataset("Atezolizumab dose", "Atezolizumab safety"));
            LoadOutcome second = corpusService.loadDataset(dataset("Atezolizumab dose", "Atezolizumab safety"));

            assertThat(first.rebuilt()).isTrue();
            assertThat(second.rebuilt()).isFalse();
            assertThat(second.snapshot()).isSameAs(first.snapshot());
        }

        @Test
        @DisplayName("Should publish a new snapshot when the dataset changes")
        void shouldPublishChangedDataset() {
            LoadOutcome first = corpusService.loadDataset(dataset("Atezolizumab dose"));
            LoadOutcome second = corpusService.loadDataset(dataset("Atezolizumab dose", "Atezolizumab safety"));

            assertThat(second.rebuilt()).isTrue();
            assertThat(second.snapshot().fingerprint()).isNotEqualTo(first.snapshot().fingerprint());
            assertThat(corpusService.snapshot().store().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should publish a new snapshot when only metadata changes")
        void shouldPublishMetadataChange() {
            LoadOutcome first = corpusService.loadDataset(sourcedDataset("old label"));
            LoadOutcome second = corpusService.loadDataset(sourcedDataset("FDA label 2024"));

            assertThat(second.rebuilt()).isTrue();
            assertThat(second.snapshot().fingerprint()).isNotEqualTo(first.snapshot().fingerprint());
            assertThat(corpusService.snapshot().store().get(0).metadata()).containsEntry("source", "FDA label 2024");
            assertThat(second.snapshot().graph().datasetFingerprint()).isEqualTo(second.snapshot().fingerprint());
        }

        @Test
        @DisplayName("Should keep the previous snapshot when a load fails")
        void shouldKeepSnapshotOnFailure() {
            LoadOutcome good = corpusService.loadDataset(dataset("Atezolizumab dose"));

            assertThatThrownBy(() -> corpusService.loadDataset(new ClassPathResource("datasets/malformed.json")))
                    .isInstanceOf(DatasetParseException.class);
            assertThatThrownBy(() -> corpusService.loadDataset(new ClassPathResource("datasets/all_invalid.json")))
                    .isInstanceOf(EmptyDatasetException.class);

            assertThat(corpusService.snapshot()).isSameAs(good.snapshot());
            assertThat(count("clinical.dataset.load.errors")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should stay up without a snapshot when the startup load fails")
        void shouldSurviveStartupFailure() {
            properties.getDataset().setLocation("classpath:datasets/does-not-exist.json");

            corpusService.loadOnStartup();

            assertThat(corpusService.isLoaded()).isFalse();
        }

        @Test
        @DisplayName("Should skip the startup load when disabled")
        void shouldHonourStartupSwitch() {
            properties.getDataset().setLoadOnStartup(false);

            corpusService.loadOnStartup();

            assertThat(corpusService.isLoaded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Graph cache")
    class GraphCacheTests {

        private Path cacheFile;

        @BeforeEach
        void setUp() {
            cacheFile = tempDir.resolve("graph.json");
            properties.getGraph().setCacheLocation(cacheFile.toString());
        }

        @Test
        @DisplayName("Should build and persist the graph on a cold start")
        void shouldPersistOnMiss() {
            corpusService.reload();

            assertThat(cacheFile).exists();
            assertThat(count("clinical.graph.cache.miss")).isEqualTo(1.0);
            assertThat(count("clinical.graph.cache.hit")).isZero();
        }

        @Test
        @DisplayName("Should reuse a cache built from the same dataset")
        void shouldReuseCache() {
            KnowledgeGraph built = corpusService.reload().snapshot().graph();

            KnowledgeGraph restored = newService().reload().snapshot().graph();

            assertThat(count("clinical.graph.cache.hit")).isEqualTo(1.0);
            assertThat(restored.cooccurrenceEdges()).isEqualTo(built.cooccurrenceEdges());
            assertThat(restored.relations()).containsExactlyElementsOf(built.relations());
        }

        @Test
        @DisplayName("Should rebuild when the cache belongs to another dataset")
        void shouldRebuildStaleCache() {
            corpusService.loadDataset(dataset("Atezolizumab dose"));

            KnowledgeGraph graph = newService().loadDataset(dataset("Atezolizumab safety")).snapshot().graph();

            assertThat(count("clinical.graph.cache.miss")).isEqualTo(2.0);
            assertThat(graph.hasKeyword("safety")).isTrue();
            assertThat(graph.hasKeyword("dose")).isFalse();
        }

        @Test
        @DisplayName("Should rebuild and overwrite a corrupt cache")
        void shouldRecoverFromCorruptCache() throws Exception {
            Files.writeString(cacheFile, "not json at all");

            LoadOutcome outcome = corpusService.reload();

            assertThat(outcome.snapshot().graph().keywords()).isNotEmpty();
            assertThat(count("clinical.graph.cache.miss")).isEqualTo(1.0);
            assertThat(new GraphCacheStore(objectMapper).load(cacheFile, outcome.snapshot().fingerprint())).isPresent();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should rebuild once when the same dataset is reloaded concurrently")
        void shouldRebuildOnceForConcurrentReloads() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<LoadOutcome>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return corpusService.loadDataset(dataset("Atezolizumab dose", "Atezolizumab safety"));
                    }));
                }
                start.countDown();

                int rebuilt = 0;
                for (Future<LoadOutcome> future : futures) {
                    LoadOutcome outcome = future.get(30, TimeUnit.SECONDS);
                    assertThat(outcome.snapshot()).isSameAs(corpusService.snapshot());
                    if (outcome.rebuilt()) rebuilt++;
                }
                assertThat(rebuilt).isEqualTo(1);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should only ever expose complete snapshots to readers")
        void shouldExposeConsistentSnapshots() throws Exception {
            Resource small = dataset("Atezolizumab dose");
            Resource large = dataset("Atezolizumab dose", "Atezolizumab safety", "Atezolizumab in breast cancer");
            corpusService.loadDataset(small);

            ExecutorService executor = Executors.newFixedThreadPool(4);
            AtomicBoolean running = new AtomicBoolean(true);
            try {
                List<Future<Integer>> readers = new ArrayList<>();
                for (int r = 0; r < 3; r++) {
                    readers.add(executor.submit(() -> {
                        int checks = 0;
                        do {
                            CorpusSnapshot snapshot = corpusService.snapshot();
                            assertThat(snapshot.index().documentCount()).isEqualTo(snapshot.store().size());
                            assertThat(snapshot.graph().datasetFingerprint()).isEqualTo(snapshot.fingerprint());
                            checks++;
                        } while (running.get());
                        return checks;
                    }));
                }

                for (int i = 0; i < 50; i++) {
                    corpusService.loadDataset(i % 2 == 0 ? large : small);
                }
                running.set(false);

                for (Future<Integer> reader : readers) {
                    assertThat(reader.get(30, TimeUnit.SECONDS)).isPositive();
                }
            } finally {
                running.set(false);
                executor.shutdownNow();
            }
        }
    }
}
