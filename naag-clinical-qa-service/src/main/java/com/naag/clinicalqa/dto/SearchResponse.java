package com.naag.clinicalqa.dto;

import java.util.List;

public record SearchResponse(
        boolean success,
        String query,
        int totalResults,
        List<SearchResultDto> results,
        String errorMessage
) {
    public static SearchResponse success(String query, List<SearchResultDto> results) {
        return new SearchResponse(true, query, results.size(), results, null);
    }

    public static SearchResponse error(String query, String errorMessage) {
        return new SearchResponse(false, query, 0, null, errorMessage);
    }
}
