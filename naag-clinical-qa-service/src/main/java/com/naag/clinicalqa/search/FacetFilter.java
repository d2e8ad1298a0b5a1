package com.naag.clinicalqa.search;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Post-filters ranked results. Order preserving, no side effects.
 *
 * A result passes when
 * - its score is at least {@code minScore},
 * - {@code keywordFilters} is empty or one of them is among its matched tokens (ignoring case),
 * - for every facet with a non-empty filter set, the document's values intersect that set.
 */
public class FacetFilter {

    public List<ScoredResult> filter(List<ScoredResult> results,
                                     int minScore,
                                     Collection<String> keywordFilters,
                                     Map<Facet, ? extends Collection<String>> categoryFilters) {
        Set<String> keywords = keywordFilters == null ? Set.of() : keywordFilters.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        Map<Facet, Set<String>> facets = new EnumMap<>(Facet.class);
        if (categoryFilters != null) {
            categoryFilters.forEach((facet, values) -> {
                if (facet == null || values == null) {
                    return;
                }
                Set<String> accepted = values.stream().filter(Objects::nonNull).collect(Collectors.toSet());
                if (!accepted.isEmpty()) {
                    facets.put(facet, accepted);
                }
            });
        }

        return results.stream()
                .filter(r -> r.score() >= minScore)
                .filter(r -> keywords.isEmpty() || matchesKeyword(r, keywords))
                .filter(r -> matchesFacets(r, facets))
                .collect(Collectors.toList());
    }

    private static boolean matchesKeyword(ScoredResult result, Set<String> keywords) {
        for (String token : result.matchedTokens()) {
            if (keywords.contains(token.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesFacets(ScoredResult result, Map<Facet, Set<String>> facets) {
        for (Map.Entry<Facet, Set<String>> entry : facets.entrySet()) {
            Set<String> values = entry.getKey().valuesOf(result.document());
            if (Collections.disjoint(values, entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
