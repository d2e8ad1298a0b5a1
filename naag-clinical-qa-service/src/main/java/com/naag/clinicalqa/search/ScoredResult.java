package com.naag.clinicalqa.search;

import com.naag.clinicalqa.dataset.ClinicalDocument;

import java.util.List;

/**
 * One ranked hit. {@code score == 2 * promptMatches + completionMatches}.
 */
public record ScoredResult(
        ClinicalDocument document,
        int score,
        int promptMatches,
        int completionMatches,
        List<String> matchedTokens
) {
    public ScoredResult {
        matchedTokens = List.copyOf(matchedTokens);
    }
}
