package com.naag.clinicalqa.graph;

/**
 * Vertex of the entity-relationship graph.
 *
 * <p>Keys are derived from content ({@code doc:<hash>}, {@code cancer:nsclc}, {@code gene:egfr},
 * {@code term:atezolizumab}) so they survive rebuilds and round trips through the cache.
 */
public interface GraphNode {

    String key();

    String label();

    NodeType type();

    static GraphNode of(NodeType type, String key, String label) {
        return switch (type) {
            case DOCUMENT -> new DocumentNode(key, label);
            case CANCER_TYPE -> new CancerTypeNode(key, label);
            case GENE -> new GeneNode(key, label);
            case TERM -> new TermNode(key, label);
        };
    }

    record DocumentNode(String key, String label) implements GraphNode {
        @Override
        public NodeType type() {
            return NodeType.DOCUMENT;
        }
    }

    record CancerTypeNode(String key, String label) implements GraphNode {
        @Override
        public NodeType type() {
            return NodeType.CANCER_TYPE;
        }
    }

    record GeneNode(String key, String label) implements GraphNode {
        @Override
        public NodeType type() {
            return NodeType.GENE;
        }
    }

    record TermNode(String key, String label) implements GraphNode {
        @Override
        public NodeType type() {
            return NodeType.TERM;
        }
    }
}
