package com.naag.clinicalqa.search;

import com.naag.clinicalqa.dataset.DocumentStore;
import com.naag.clinicalqa.search.InvertedIndex.DocumentTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Token-overlap ranking over an {@link InvertedIndex}.
 *
 * Scoring:
 * score(d, q) = 2 * |q ∩ prompt(d)| + |q ∩ completion(d)|
 *
 * A document is a candidate when it shares any token with the query. Results are ordered by
 * score descending, then by ascending document id.
 */
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    static final int PROMPT_WEIGHT = 2;
    static final int COMPLETION_WEIGHT = 1;

    static final Comparator<ScoredResult> BY_SCORE_THEN_ID = Comparator
            .comparingInt(ScoredResult::score).reversed()
            .thenComparingInt(r -> r.document().id());

    public List<ScoredResult> search(String query, DocumentStore store, InvertedIndex index) {
        return search(query, store, index, 0);
    }

    /**
     * Truncating variant for callers that use the ranking as is. Callers that filter afterwards
     * should rank everything and truncate after filtering.
     *
     * @param topN maximum number of results, or 0 (or less) for all of them
     */
    public List<ScoredResult> search(String query, DocumentStore store, InvertedIndex index, int topN) {
        Set<String> queryTokens = index.tokenizer().normalize(query);
        if (queryTokens.isEmpty()) {
            return List.of();
        }

        // BitSet keeps the candidate union in id order without sorting
        BitSet candidates = new BitSet(index.documentCount());
        for (String token : queryTokens) {
            for (int docId : index.postings(token)) {
                candidates.set(docId);
            }
        }

        List<ScoredResult> results = new ArrayList<>(candidates.cardinality());
        for (int docId = candidates.nextSetBit(0); docId >= 0; docId = candidates.nextSetBit(docId + 1)) {
            ScoredResult result = score(queryTokens, store, index, docId);
            if (result.score() > 0) {
                results.add(result);
            }
        }

        results.sort(BY_SCORE_THEN_ID);

        if (topN > 0 && results.size() > topN) {
            results = results.subList(0, topN);
        }

        log.debug("Query tokens {} matched {} documents", queryTokens, results.size());
        return List.copyOf(results);
    }

    private ScoredResult score(Set<String> queryTokens, DocumentStore store, InvertedIndex index, int docId) {
        DocumentTokens tokens = index.tokensOf(docId);
        int promptMatches = 0;
        int completionMatches = 0;
        List<String> matched = new ArrayList<>();

        for (String token : queryTokens) {
            boolean inPrompt = tokens.promptTokens().contains(token);
            boolean inCompletion = tokens.completionTokens().contains(token);
            if (inPrompt) promptMatches++;
            if (inCompletion) completionMatches++;
            if (inPrompt || inCompletion) matched.add(token);
        }

        int score = PROMPT_WEIGHT * promptMatches + COMPLETION_WEIGHT * completionMatches;
        return new ScoredResult(store.get(docId), score, promptMatches, completionMatches, matched);
    }
}
