package com.naag.clinicalqa.graph;

import java.util.*;

/**
 * Term co-occurrence graph plus entity-relationship graph for one dataset version.
 *
 * <p>Instances are immutable and safe to share across query threads. Use {@link Builder} to
 * assemble one, either from documents ({@link KnowledgeGraphBuilder}) or from a cache file
 * ({@link GraphCacheStore}).
 */
public final class KnowledgeGraph {

    private final String datasetFingerprint;
    private final SortedMap<String, GraphNode> nodes;
    private final SortedMap<String, SortedMap<String, Integer>> cooccurrence;
    private final SortedSet<RelationEdge> relations;
    private final int cooccurrenceEdgeCount;

    private KnowledgeGraph(String datasetFingerprint,
                           SortedMap<String, GraphNode> nodes,
                           SortedMap<String, SortedMap<String, Integer>> cooccurrence,
                           SortedSet<RelationEdge> relations) {
        this.datasetFingerprint = datasetFingerprint;
        this.nodes = nodes;
        this.cooccurrence = cooccurrence;
        this.relations = relations;
        int halfEdges = 0;
        for (Map<String, Integer> neighbours : cooccurrence.values()) {
            halfEdges += neighbours.size();
        }
        this.cooccurrenceEdgeCount = halfEdges / 2;
    }

    public String datasetFingerprint() {
        return datasetFingerprint;
    }

    public Optional<GraphNode> node(String key) {
        return Optional.ofNullable(nodes.get(key));
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    /**
     * Keywords that appear in the co-occurrence graph, ascending.
     */
    public Set<String> keywords() {
        return cooccurrence.keySet();
    }

    public boolean hasKeyword(String keyword) {
        return cooccurrence.containsKey(keyword);
    }

    /**
     * Weighted co-occurrence neighbours of a keyword. Empty when the keyword is unknown.
     */
    public Map<String, Integer> neighbours(String keyword) {
        SortedMap<String, Integer> neighbours = cooccurrence.get(keyword);
        return neighbours == null ? Collections.emptySortedMap() : neighbours;
    }

    public int weight(String a, String b) {
        return neighbours(a).getOrDefault(b, 0);
    }

    /**
     * Every co-occurrence edge once, ordered by source then target.
     */
    public List<CooccurrenceEdge> cooccurrenceEdges() {
        List<CooccurrenceEdge> edges = new ArrayList<>(cooccurrenceEdgeCount);
        cooccurrence.forEach((source, neighbours) -> neighbours.forEach((target, weight) -> {
            if (source.compareTo(target) < 0) {
                edges.add(new CooccurrenceEdge(source, target, weight));
            }
        }));
        return edges;
    }

    public SortedSet<RelationEdge> relations() {
        return relations;
    }

    /**
     * Whether a co-occurrence keyword also names a cancer type or gene in the entity graph.
     */
    public NodeType kindOf(String keyword) {
        if (nodes.containsKey(NodeType.CANCER_TYPE.keyFor(keyword))) {
            return NodeType.CANCER_TYPE;
        }
        if (nodes.containsKey(NodeType.GENE.keyFor(keyword))) {
            return NodeType.GENE;
        }
        return NodeType.TERM;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int cooccurrenceEdgeCount() {
        return cooccurrenceEdgeCount;
    }

    public int relationCount() {
        return relations.size();
    }

    public Map<String, Object> getStats() {
        return Map.of(
                "entityNodes", nodeCount(),
                "relations", relationCount(),
                "keywords", cooccurrence.size(),
                "cooccurrenceEdges", cooccurrenceEdgeCount
        );
    }

    public static Builder builder(String datasetFingerprint) {
        return new Builder(datasetFingerprint);
    }

    /**
     * Mutable staging area. Not thread-safe; {@link #build()} hands out an immutable copy.
     */
    public static final class Builder {

        private final String datasetFingerprint;
        private final SortedMap<String, GraphNode> nodes = new TreeMap<>();
        private final SortedMap<String, SortedMap<String, Integer>> cooccurrence = new TreeMap<>();
        private final SortedSet<RelationEdge> relations = new TreeSet<>();

        private Builder(String datasetFingerprint) {
            this.datasetFingerprint = Objects.requireNonNull(datasetFingerprint, "datasetFingerprint");
        }

        public Builder addNode(GraphNode node) {
            nodes.putIfAbsent(node.key(), node);
            return this;
        }

        public Builder addRelation(GraphNode document, GraphNode target, Relation relation) {
            addNode(document);
            addNode(target);
            relations.add(new RelationEdge(document.key(), target.key(), relation));
            return this;
        }

        /**
         * Adds an edge whose nodes were added separately. Used when restoring from a cache.
         */
        public Builder addRelation(RelationEdge edge) {
            if (!nodes.containsKey(edge.documentKey()) || !nodes.containsKey(edge.targetKey())) {
                throw new IllegalArgumentException("Relation references unknown node: " + edge);
            }
            relations.add(edge);
            return this;
        }

        /**
         * Adds one co-occurrence between two distinct keywords.
         */
        public Builder incrementCooccurrence(String a, String b) {
            if (a.equals(b)) {
                return this;
            }
            cooccurrence.computeIfAbsent(a, k -> new TreeMap<>()).merge(b, 1, Integer::sum);
            cooccurrence.computeIfAbsent(b, k -> new TreeMap<>()).merge(a, 1, Integer::sum);
            return this;
        }

        public Builder putCooccurrence(CooccurrenceEdge edge) {
            cooccurrence.computeIfAbsent(edge.source(), k -> new TreeMap<>()).put(edge.target(), edge.weight());
            cooccurrence.computeIfAbsent(edge.target(), k -> new TreeMap<>()).put(edge.source(), edge.weight());
            return this;
        }

        public KnowledgeGraph build() {
            SortedMap<String, SortedMap<String, Integer>> frozen = new TreeMap<>();
            cooccurrence.forEach((keyword, neighbours) ->
                    frozen.put(keyword, Collections.unmodifiableSortedMap(new TreeMap<>(neighbours))));
            return new KnowledgeGraph(
                    datasetFingerprint,
                    Collections.unmodifiableSortedMap(new TreeMap<>(nodes)),
                    Collections.unmodifiableSortedMap(frozen),
                    Collections.unmodifiableSortedSet(new TreeSet<>(relations))
            );
        }
    }
}
