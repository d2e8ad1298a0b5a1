package com.naag.clinicalqa.dto;

import com.naag.clinicalqa.search.ClosestMatchRetriever.ClosestMatch;

import java.util.Optional;

public record ClosestMatchResponse(
        boolean success,
        String query,
        boolean found,
        Integer documentId,
        String prompt,
        String completion,
        Double similarity,
        String errorMessage
) {
    public static ClosestMatchResponse from(String query, Optional<ClosestMatch> match) {
        return match
                .map(m -> new ClosestMatchResponse(true, query, true, m.document().id(),
                        m.document().prompt(), m.document().completion(), m.similarity(), null))
                .orElseGet(() -> new ClosestMatchResponse(true, query, false, null, null, null, null, null));
    }

    public static ClosestMatchResponse error(String query, String errorMessage) {
        return new ClosestMatchResponse(false, query, false, null, null, null, null, errorMessage);
    }
}
