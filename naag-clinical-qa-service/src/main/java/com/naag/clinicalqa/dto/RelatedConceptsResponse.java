package com.naag.clinicalqa.dto;

import com.naag.clinicalqa.graph.RelatedConcept;

import java.util.List;

public record RelatedConceptsResponse(
        boolean success,
        String query,
        List<RelatedConcept> concepts,
        String errorMessage
) {
    public static RelatedConceptsResponse success(String query, List<RelatedConcept> concepts) {
        return new RelatedConceptsResponse(true, query, concepts, null);
    }

    public static RelatedConceptsResponse error(String query, String errorMessage) {
        return new RelatedConceptsResponse(false, query, null, errorMessage);
    }
}
