package com.naag.clinicalqa.graph;

public record RelationEdge(String documentKey, String targetKey, Relation relation) implements Comparable<RelationEdge> {

    @Override
    public int compareTo(RelationEdge other) {
        int c = documentKey.compareTo(other.documentKey);
        if (c != 0) return c;
        c = targetKey.compareTo(other.targetKey);
        if (c != 0) return c;
        return relation.compareTo(other.relation);
    }
}
