package com.naag.clinicalqa.dto;

import com.naag.clinicalqa.dataset.ClinicalDocument;
import com.naag.clinicalqa.search.ScoredResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record SearchResultDto(
        int documentId,
        String prompt,
        String completion,
        Set<String> cancerTypes,
        Set<String> genes,
        Map<String, String> metadata,
        int score,
        int promptMatches,
        int completionMatches,
        List<String> matchedTokens
) {
    public static SearchResultDto from(ScoredResult result) {
        ClinicalDocument doc = result.document();
        return new SearchResultDto(
                doc.id(),
                doc.prompt(),
                doc.completion(),
                doc.cancerTypes(),
                doc.genes(),
                doc.metadata(),
                result.score(),
                result.promptMatches(),
                result.completionMatches(),
                result.matchedTokens()
        );
    }
}
