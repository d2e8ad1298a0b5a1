package com.naag.clinicalqa.service;

import com.naag.clinicalqa.dataset.DocumentStore;
import com.naag.clinicalqa.graph.KnowledgeGraph;
import com.naag.clinicalqa.search.InvertedIndex;

import java.time.Instant;

/**
 * Everything derived from one dataset version. Published as a unit, never modified.
 */
public record CorpusSnapshot(
        DocumentStore store,
        InvertedIndex index,
        KnowledgeGraph graph,
        String fingerprint,
        String source,
        Instant loadedAt
) {}
