package com.naag.clinicalqa.graph;

/**
 * Label of an entity-graph edge, always from a document to the entity.
 */
public enum Relation {
    ABOUT,      // cancer type
    INVOLVES,   // gene
    MENTIONS    // significant term
}
