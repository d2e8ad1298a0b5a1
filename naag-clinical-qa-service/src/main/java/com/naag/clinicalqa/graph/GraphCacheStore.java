package com.naag.clinicalqa.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.naag.clinicalqa.exception.GraphCacheException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persists a {@link KnowledgeGraph} as JSON and restores it.
 *
 * <p>The file records the fingerprint of the dataset the graph was built from. A cache whose
 * fingerprint differs from the current dataset is treated as absent, so a changed dataset always
 * leads to a rebuild.
 */
@Slf4j
@RequiredArgsConstructor
public class GraphCacheStore {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public record CachedNode(String key, NodeType type, String label) {}

    public record CachedGraph(
            int formatVersion,
            String datasetFingerprint,
            List<CachedNode> nodes,
            List<CooccurrenceEdge> cooccurrence,
            List<RelationEdge> relations
    ) {}

    /**
     * Returns the cached graph when the file exists and matches {@code expectedFingerprint}.
     *
     * @throws GraphCacheException when the file exists but cannot be read or decoded
     */
    public Optional<KnowledgeGraph> load(Path location, String expectedFingerprint) {
        if (!Files.isRegularFile(location)) {
            log.debug("No graph cache at {}", location);
            return Optional.empty();
        }
        KnowledgeGraph graph = read(location);
        if (!graph.datasetFingerprint().equals(expectedFingerprint)) {
            log.info("Graph cache at {} is stale (cached {}, dataset {})",
                    location, graph.datasetFingerprint(), expectedFingerprint);
            return Optional.empty();
        }
        return Optional.of(graph);
    }

    public KnowledgeGraph read(Path location) {
        CachedGraph cached;
        try {
            cached = objectMapper.readValue(location.toFile(), CachedGraph.class);
        } catch (IOException e) {
            throw new GraphCacheException("Unreadable graph cache " + location + ": " + e.getMessage(), e);
        }
        if (cached == null || cached.formatVersion() != FORMAT_VERSION) {
            throw new GraphCacheException("Unsupported graph cache format in " + location);
        }
        if (cached.datasetFingerprint() == null || cached.nodes() == null
                || cached.cooccurrence() == null || cached.relations() == null) {
            throw new GraphCacheException("Incomplete graph cache " + location);
        }

        try {
            KnowledgeGraph.Builder builder = KnowledgeGraph.builder(cached.datasetFingerprint());
            for (CachedNode node : cached.nodes()) {
                builder.addNode(GraphNode.of(node.type(), node.key(), node.label()));
            }
            cached.cooccurrence().forEach(builder::putCooccurrence);
            cached.relations().forEach(builder::addRelation);
            return builder.build();
        } catch (RuntimeException e) {
            throw new GraphCacheException("Inconsistent graph cache " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes to a sibling temp file and moves it into place, so readers never see half a file.
     */
    public void save(KnowledgeGraph graph, Path location) {
        CachedGraph cached = new CachedGraph(
                FORMAT_VERSION,
                graph.datasetFingerprint(),
                graph.nodes().stream()
                        .map(n -> new CachedNode(n.key(), n.type(), n.label()))
                        .collect(Collectors.toList()),
                graph.cooccurrenceEdges(),
                List.copyOf(graph.relations())
        );

        try {
            Path parent = location.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, location.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), cached);
                moveIntoPlace(temp, location);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.info("Saved knowledge graph cache to {} ({} nodes, {} co-occurrence edges)",
                    location, graph.nodeCount(), graph.cooccurrenceEdgeCount());
        } catch (IOException e) {
            throw new GraphCacheException("Failed to write graph cache " + location + ": " + e.getMessage(), e);
        }
    }

    private static void moveIntoPlace(Path temp, Path location) throws IOException {
        try {
            Files.move(temp, location, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, location, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
