package com.naag.clinicalqa.service;

import com.naag.clinicalqa.config.ClinicalQaProperties;
import com.naag.clinicalqa.dto.SearchRequest;
import com.naag.clinicalqa.graph.RelatedConcept;
import com.naag.clinicalqa.graph.RelatedConceptRetriever;
import com.naag.clinicalqa.metrics.ClinicalQaMetrics;
import com.naag.clinicalqa.search.ClosestMatchRetriever;
import com.naag.clinicalqa.search.ClosestMatchRetriever.ClosestMatch;
import com.naag.clinicalqa.search.Facet;
import com.naag.clinicalqa.search.FacetFilter;
import com.naag.clinicalqa.search.RankingEngine;
import com.naag.clinicalqa.search.ScoredResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Query-time entry points. Every call reads the snapshot published by
 * {@link ClinicalCorpusService} once and works on it alone, so a concurrent reload never mixes
 * two dataset versions within one answer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClinicalSearchService {

    private final ClinicalCorpusService corpusService;
    private final RankingEngine rankingEngine;
    private final FacetFilter facetFilter;
    private final RelatedConceptRetriever relatedConceptRetriever;
    private final ClosestMatchRetriever closestMatchRetriever;
    private final ClinicalQaMetrics metrics;
    private final ClinicalQaProperties properties;

    /**
     * Ranks the query, applies the request's filters, then truncates to its page size.
     */
    public List<ScoredResult> search(SearchRequest request) {
        request.validate();
        CorpusSnapshot snapshot = corpusService.snapshot();
        long start = System.currentTimeMillis();

        List<ScoredResult> ranked = rankingEngine.search(request.getQueryOrEmpty(), snapshot.store(), snapshot.index());
        List<ScoredResult> filtered = facetFilter.filter(
                ranked,
                request.getMinScoreOrDefault(),
                request.getKeywordFiltersOrEmpty(),
                request.getFacetFilters()
        );

        int topN = request.getTopNOrDefault(properties.getSearch().getDefaultTopN());
        if (topN > 0 && filtered.size() > topN) {
            filtered = filtered.subList(0, topN);
        }

        long duration = System.currentTimeMillis() - start;
        metrics.recordSearch(duration, filtered.size());
        log.debug("Search '{}' -> {} ranked, {} after filters ({}ms)",
                request.query(), ranked.size(), filtered.size(), duration);
        return List.copyOf(filtered);
    }

    public List<RelatedConcept> relatedConcepts(String query, Integer topN) {
        int limit = topN != null ? topN : properties.getRelated().getDefaultTopN();
        if (limit < 0) {
            throw new IllegalArgumentException("topN must not be negative");
        }
        CorpusSnapshot snapshot = corpusService.snapshot();
        long start = System.currentTimeMillis();

        List<RelatedConcept> concepts = relatedConceptRetriever.relatedConcepts(snapshot.graph(), query, limit);

        metrics.recordRelatedLookup(System.currentTimeMillis() - start);
        return concepts;
    }

    public Optional<ClosestMatch> closestMatch(String query) {
        return closestMatchRetriever.findClosest(query, corpusService.snapshot().store());
    }

    /**
     * Distinct values per facet in the published dataset, sorted, for building filter pickers.
     */
    public Map<String, SortedSet<String>> facetValues() {
        CorpusSnapshot snapshot = corpusService.snapshot();
        Map<String, SortedSet<String>> values = new LinkedHashMap<>();
        for (Facet facet : Facet.values()) {
            SortedSet<String> distinct = new TreeSet<>();
            snapshot.store().documents().forEach(doc -> distinct.addAll(facet.valuesOf(doc)));
            values.put(facet.getFieldName(), distinct);
        }
        return values;
    }

    public Map<String, Object> stats() {
        CorpusSnapshot snapshot = corpusService.snapshot();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("source", snapshot.source());
        stats.put("fingerprint", snapshot.fingerprint());
        stats.put("loadedAt", snapshot.loadedAt().toString());
        stats.put("rejectedRecords", snapshot.store().rejectedRecords());
        stats.putAll(snapshot.index().getStats());
        stats.putAll(snapshot.graph().getStats());
        return stats;
    }
}
