package com.naag.clinicalqa.graph;

import com.naag.clinicalqa.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Looks up concepts related to a free-text query.
 *
 * For every query token (longer than three characters) that is a keyword of the graph, each
 * incident co-occurrence weight is added to the neighbour's aggregate. Aggregates accumulate
 * across tokens. Runs of up to four consecutive query words are also looked up as a whole, so
 * multi-word and short metadata keywords ("breast cancer", "alk") are reachable. Results are
 * ordered by aggregate descending, then concept ascending.
 */
public class RelatedConceptRetriever {

    private static final Logger log = LoggerFactory.getLogger(RelatedConceptRetriever.class);

    static final int QUERY_TOKEN_MIN_LENGTH = 4;

    static final int MAX_PHRASE_WORDS = 4;

    private static final Comparator<RelatedConcept> BY_WEIGHT_THEN_CONCEPT = Comparator
            .comparingInt(RelatedConcept::weight).reversed()
            .thenComparing(RelatedConcept::concept);

    private final Tokenizer tokenizer;

    public RelatedConceptRetriever(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public List<RelatedConcept> relatedConcepts(KnowledgeGraph graph, String query, int topN) {
        if (topN <= 0) {
            return List.of();
        }
        Set<String> queryKeys = new LinkedHashSet<>(tokenizer.normalize(query, QUERY_TOKEN_MIN_LENGTH));
        queryKeys.addAll(phraseKeywords(graph, query));
        if (queryKeys.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> aggregate = new HashMap<>();
        for (String token : queryKeys) {
            graph.neighbours(token).forEach((neighbour, weight) -> aggregate.merge(neighbour, weight, Integer::sum));
        }

        List<RelatedConcept> concepts = aggregate.entrySet().stream()
                .map(e -> new RelatedConcept(e.getKey(), e.getValue(), graph.kindOf(e.getKey())))
                .sorted(BY_WEIGHT_THEN_CONCEPT)
                .limit(topN)
                .collect(Collectors.toList());

        log.debug("Related concepts for {}: {} of {} neighbours", queryKeys, concepts.size(), aggregate.size());
        return concepts;
    }

    /**
     * Word runs of the normalized query that are keywords of the graph.
     */
    Set<String> phraseKeywords(KnowledgeGraph graph, String query) {
        String normalized = tokenizer.normalizeTerm(query);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        String[] words = normalized.split(" ");
        Set<String> found = new LinkedHashSet<>();
        for (int start = 0; start < words.length; start++) {
            StringBuilder phrase = new StringBuilder();
            for (int end = start; end < Math.min(words.length, start + MAX_PHRASE_WORDS); end++) {
                if (end > start) phrase.append(' ');
                phrase.append(words[end]);
                if (graph.hasKeyword(phrase.toString())) {
                    found.add(phrase.toString());
                }
            }
        }
        return found;
    }
}
