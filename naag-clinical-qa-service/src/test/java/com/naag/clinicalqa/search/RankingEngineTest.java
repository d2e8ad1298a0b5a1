package com.naag.clinicalqa.search;

import com.naag.clinicalqa.TestDocuments;
import com.naag.clinicalqa.dataset.DocumentStore;
import com.naag.clinicalqa.text.Tokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.naag.clinicalqa.TestDocuments.doc;
import static org.assertj.core.api.Assertions.assertThat;

class RankingEngineTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final RankingEngine engine = new RankingEngine();

    private List<ScoredResult> search(DocumentStore store, String query) {
        return engine.search(query, store, InvertedIndex.build(store, tokenizer));
    }

    @Test
    @DisplayName("Should weight prompt matches double for the dosing example")
    void shouldScoreDosingExample() {
        List<ScoredResult> results = search(TestDocuments.atezolizumabDose(), "atezolizumab dose");

        assertThat(results).hasSize(1);
        ScoredResult result = results.get(0);
        assertThat(result.document().id()).isZero();
        assertThat(result.promptMatches()).isEqualTo(2);
        assertThat(result.completionMatches()).isZero();
        assertThat(result.score()).isEqualTo(4);
        assertThat(result.matchedTokens()).containsExactly("atezolizumab", "dose");
    }

    @Nested
    @DisplayName("Empty results")
    class EmptyResultTests {

        @Test
        @DisplayName("Should return nothing for an empty query")
        void shouldReturnEmptyForEmptyQuery() {
            assertThat(search(TestDocuments.oncologyDataset(), "")).isEmpty();
            assertThat(search(TestDocuments.oncologyDataset(), null)).isEmpty();
        }

        @Test
        @DisplayName("Should return nothing when every query token is too short")
        void shouldReturnEmptyForShortTokens() {
            assertThat(search(TestDocuments.oncologyDataset(), "is of a ?")).isEmpty();
        }

        @Test
        @DisplayName("Should return nothing when no document shares a token")
        void shouldReturnEmptyWithoutCandidates() {
            assertThat(search(TestDocuments.oncologyDataset(), "pembrolizumab melanoma")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        private DocumentStore store;

        @BeforeEach
        void setUp() {
            store = TestDocuments.store(
                    doc(0, "Overall survival endpoints", "Atezolizumab improved survival", "", ""),
                    doc(1, "Atezolizumab survival data", "Reported in OAK", "", ""),
                    doc(2, "Atezolizumab survival benefit", "Seen across subgroups", "", ""),
                    doc(3, "Unrelated safety question", "Pneumonitis was rare", "", "")
            );
        }

        @Test
        @DisplayName("Should use OR semantics over query tokens")
        void shouldMatchAnyToken() {
            List<ScoredResult> results = search(store, "atezolizumab pneumonitis");

            assertThat(results).extracting(r -> r.document().id()).containsExactlyInAnyOrder(0, 1, 2, 3);
        }

        @Test
        @DisplayName("Should sort by score descending then by ascending id")
        void shouldSortByScoreThenId() {
            List<ScoredResult> results = search(store, "atezolizumab survival");

            // doc 1 and 2: 2 prompt matches = 4; doc 0: 1 prompt + 2 completion = 4
            assertThat(results).extracting(ScoredResult::score).containsExactly(4, 4, 4);
            assertThat(results).extracting(r -> r.document().id()).containsExactly(0, 1, 2);
        }

        @Test
        @DisplayName("Should rank a prompt match above a completion match")
        void shouldPreferPromptMatches() {
            List<ScoredResult> results = search(store, "pneumonitis unrelated");

            assertThat(results).hasSize(1);
            assertThat(results.get(0).promptMatches()).isEqualTo(1);
            assertThat(results.get(0).completionMatches()).isEqualTo(1);
            assertThat(results.get(0).score()).isEqualTo(3);

            List<ScoredResult> byField = search(TestDocuments.store(
                    doc(0, "Safety overview", "Pneumonitis is uncommon", "", ""),
                    doc(1, "Pneumonitis management", "Steroids are used", "", "")
            ), "pneumonitis");
            assertThat(byField).extracting(r -> r.document().id()).containsExactly(1, 0);
            assertThat(byField).extracting(ScoredResult::score).containsExactly(2, 1);
        }

        @Test
        @DisplayName("Should truncate to topN after sorting")
        void shouldTruncate() {
            InvertedIndex index = InvertedIndex.build(store, tokenizer);

            List<ScoredResult> results = engine.search("atezolizumab survival", store, index, 2);

            assertThat(results).extracting(r -> r.document().id()).containsExactly(0, 1);
        }
    }

    @Test
    @DisplayName("Should satisfy the score formula and never return a zero score")
    void shouldSatisfyScoreFormula() {
        DocumentStore store = TestDocuments.oncologyDataset();
        for (String query : List.of("atezolizumab", "PD-L1 blockade NSCLC", "breast cancer nab-paclitaxel",
                "adverse events colitis", "EGFR mutations immunotherapy benefit")) {
            List<ScoredResult> results = search(store, query);
            assertThat(results).isNotEmpty();
            for (ScoredResult r : results) {
                assertThat(r.score()).isEqualTo(2 * r.promptMatches() + r.completionMatches());
                assertThat(r.score()).isPositive();
            }
        }
    }
}
