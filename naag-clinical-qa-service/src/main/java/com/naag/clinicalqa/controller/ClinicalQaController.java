package com.naag.clinicalqa.controller;

import com.naag.clinicalqa.dto.*;
import com.naag.clinicalqa.exception.ClinicalQaException;
import com.naag.clinicalqa.exception.DatasetNotLoadedException;
import com.naag.clinicalqa.exception.DatasetParseException;
import com.naag.clinicalqa.exception.EmptyDatasetException;
import com.naag.clinicalqa.graph.RelatedConcept;
import com.naag.clinicalqa.search.ScoredResult;
import com.naag.clinicalqa.service.ClinicalCorpusService;
import com.naag.clinicalqa.service.ClinicalCorpusService.LoadOutcome;
import com.naag.clinicalqa.service.ClinicalSearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/clinical")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Clinical Q&A", description = "Keyword search and related concepts over the clinical Q&A dataset")
@CrossOrigin(origins = "*")
public class ClinicalQaController {

    private final ClinicalSearchService searchService;
    private final ClinicalCorpusService corpusService;

    @PostMapping("/search")
    @Operation(summary = "Rank records by token overlap and apply score, keyword and category filters")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        try {
            List<ScoredResult> results = searchService.search(request);
            List<SearchResultDto> dtos = results.stream()
                    .map(SearchResultDto::from)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(SearchResponse.success(request.query(), dtos));

        } catch (IllegalArgumentException e) {
            return ResponseEntity
                    .badRequest()
                    .body(SearchResponse.error(request.query(), "Validation error: " + e.getMessage()));

        } catch (DatasetNotLoadedException e) {
            return ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(SearchResponse.error(request.query(), e.getMessage()));

        } catch (Exception e) {
            log.error("Search failed for query='{}'", request.query(), e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(SearchResponse.error(request.query(), "Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/related")
    @Operation(summary = "Concepts that co-occur with the query terms, strongest first")
    public ResponseEntity<RelatedConceptsResponse> related(
            @RequestParam(defaultValue = "") String query,
            @RequestParam(required = false) Integer topN) {
        try {
            List<RelatedConcept> concepts = searchService.relatedConcepts(query, topN);
            return ResponseEntity.ok(RelatedConceptsResponse.success(query, concepts));

        } catch (IllegalArgumentException e) {
            return ResponseEntity
                    .badRequest()
                    .body(RelatedConceptsResponse.error(query, "Validation error: " + e.getMessage()));

        } catch (DatasetNotLoadedException e) {
            return ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(RelatedConceptsResponse.error(query, e.getMessage()));

        } catch (Exception e) {
            log.error("Related concept lookup failed for query='{}'", query, e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(RelatedConceptsResponse.error(query, "Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/closest")
    @Operation(summary = "Single stored question closest to the query by edit distance")
    public ResponseEntity<ClosestMatchResponse> closest(@RequestParam(defaultValue = "") String query) {
        try {
            return ResponseEntity.ok(ClosestMatchResponse.from(query, searchService.closestMatch(query)));

        } catch (DatasetNotLoadedException e) {
            return ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ClosestMatchResponse.error(query, e.getMessage()));

        } catch (Exception e) {
            log.error("Closest match failed for query='{}'", query, e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ClosestMatchResponse.error(query, "Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping("/reload")
    @Operation(summary = "Reload the configured dataset and rebuild index and graph if it changed")
    public ResponseEntity<ReloadResponse> reload() {
        try {
            LoadOutcome outcome = corpusService.reload();
            return ResponseEntity.ok(ReloadResponse.success(
                    outcome.snapshot().store().size(),
                    outcome.snapshot().store().rejectedRecords(),
                    outcome.snapshot().index().vocabularySize(),
                    outcome.snapshot().fingerprint(),
                    outcome.rebuilt()
            ));

        } catch (EmptyDatasetException | DatasetParseException e) {
            return ResponseEntity
                    .status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ReloadResponse.error(e.getMessage()));

        } catch (ClinicalQaException e) {
            log.error("Dataset reload failed: {}", e.getMessage(), e);
            return ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ReloadResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/facets")
    @Operation(summary = "Distinct cancer types and genes available for filtering")
    public ResponseEntity<Map<String, SortedSet<String>>> facets() {
        try {
            return ResponseEntity.ok(searchService.facetValues());
        } catch (DatasetNotLoadedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @GetMapping("/stats")
    @Operation(summary = "Size of the published dataset, index and graph")
    public ResponseEntity<Map<String, Object>> stats() {
        try {
            return ResponseEntity.ok(searchService.stats());
        } catch (DatasetNotLoadedException e) {
            return ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("loaded", false, "error", e.getMessage()));
        }
    }
}
