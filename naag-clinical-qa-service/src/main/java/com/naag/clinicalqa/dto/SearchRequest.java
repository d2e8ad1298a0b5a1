package com.naag.clinicalqa.dto;

import com.naag.clinicalqa.search.Facet;

import java.util.*;

/**
 * One search as issued by the UI: the query plus the filters and page size currently active.
 * Every field is optional; a missing query searches for nothing.
 */
public record SearchRequest(
        String query,
        Integer minScore,
        List<String> keywordFilters,
        Map<String, List<String>> categoryFilters,
        Integer topN
) {
    public static SearchRequest of(String query) {
        return new SearchRequest(query, null, null, null, null);
    }

    public void validate() {
        if (minScore != null && minScore < 0) {
            throw new IllegalArgumentException("minScore must not be negative");
        }
        if (topN != null && topN < 0) {
            throw new IllegalArgumentException("topN must not be negative");
        }
        if (categoryFilters != null) {
            for (String name : categoryFilters.keySet()) {
                if (Facet.fromName(name).isEmpty()) {
                    throw new IllegalArgumentException("unknown category filter: " + name);
                }
            }
        }
    }

    public String getQueryOrEmpty() {
        return query != null ? query : "";
    }

    public int getMinScoreOrDefault() {
        return minScore != null ? minScore : 0;
    }

    public int getTopNOrDefault(int defaultTopN) {
        return topN != null && topN > 0 ? topN : defaultTopN;
    }

    public List<String> getKeywordFiltersOrEmpty() {
        return keywordFilters != null ? keywordFilters : List.of();
    }

    /**
     * Category filters keyed by facet. Call {@link #validate()} first.
     */
    public Map<Facet, Set<String>> getFacetFilters() {
        Map<Facet, Set<String>> facets = new EnumMap<>(Facet.class);
        if (categoryFilters == null) {
            return facets;
        }
        categoryFilters.forEach((name, values) -> Facet.fromName(name).ifPresent(facet -> {
            if (values != null) {
                facets.computeIfAbsent(facet, f -> new LinkedHashSet<>()).addAll(values);
            }
        }));
        return facets;
    }
}
