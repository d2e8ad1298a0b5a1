package com.naag.clinicalqa.graph;

/**
 * A keyword reachable from the query through co-occurrence edges, with its summed edge weight.
 */
public record RelatedConcept(String concept, int weight, NodeType kind) {}
