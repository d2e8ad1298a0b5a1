package com.naag.clinicalqa.graph;

/**
 * Undirected weighted edge between two keywords, stored with {@code source < target}.
 */
public record CooccurrenceEdge(String source, String target, int weight) {

    public CooccurrenceEdge {
        if (source.equals(target)) {
            throw new IllegalArgumentException("Self loop on " + source);
        }
        if (weight < 1) {
            throw new IllegalArgumentException("Edge weight must be at least 1, got " + weight);
        }
        if (source.compareTo(target) > 0) {
            String swap = source;
            source = target;
            target = swap;
        }
    }
}
