package com.naag.clinicalqa.search;

import com.naag.clinicalqa.TestDocuments;
import com.naag.clinicalqa.dataset.ClinicalDocument;
import com.naag.clinicalqa.dataset.DocumentStore;
import com.naag.clinicalqa.text.Tokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.naag.clinicalqa.TestDocuments.doc;
import static org.assertj.core.api.Assertions.assertThat;

class InvertedIndexTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    @DisplayName("Should list every document containing a token exactly once")
    void shouldContainEachDocumentExactlyOnce() {
        DocumentStore store = TestDocuments.oncologyDataset();
        InvertedIndex index = InvertedIndex.build(store, tokenizer);

        for (ClinicalDocument doc : store.documents()) {
            Set<String> prompt = tokenizer.normalize(doc.prompt());
            Set<String> completion = tokenizer.normalize(doc.completion());
            for (String token : concat(prompt, completion)) {
                assertThat(Collections.frequency(index.postings(token), doc.id()))
                        .as("postings of '%s' for doc %d", token, doc.id())
                        .isEqualTo(1);
            }
        }
    }

    @Test
    @DisplayName("Should not list documents that do not contain the token")
    void shouldOnlyListContainingDocuments() {
        DocumentStore store = TestDocuments.oncologyDataset();
        InvertedIndex index = InvertedIndex.build(store, tokenizer);

        for (String token : index.vocabulary()) {
            for (int docId : index.postings(token)) {
                ClinicalDocument doc = store.get(docId);
                assertThat(tokenizer.normalize(doc.prompt()).contains(token)
                        || tokenizer.normalize(doc.completion()).contains(token)).isTrue();
            }
        }
    }

    @Test
    @DisplayName("Should add a document once when a token is in both prompt and completion")
    void shouldNotDuplicateAcrossFields() {
        DocumentStore store = TestDocuments.store(
                doc(0, "Atezolizumab dosing", "Atezolizumab is dosed every three weeks", "", ""));
        InvertedIndex index = InvertedIndex.build(store, tokenizer);

        assertThat(index.postings("atezolizumab")).containsExactly(0);
    }

    @Test
    @DisplayName("Should produce identical ascending postings when rebuilt")
    void shouldBeDeterministic() {
        DocumentStore store = TestDocuments.oncologyDataset();
        InvertedIndex first = InvertedIndex.build(store, tokenizer);
        InvertedIndex second = InvertedIndex.build(store, tokenizer);

        assertThat(second.vocabulary()).isEqualTo(first.vocabulary());
        for (String token : first.vocabulary()) {
            List<Integer> postings = first.postings(token);
            assertThat(second.postings(token)).isEqualTo(postings);
            assertThat(postings).isSorted().doesNotHaveDuplicates();
        }
    }

    @Test
    @DisplayName("Should answer empty postings for unknown tokens")
    void shouldHandleUnknownTokens() {
        InvertedIndex index = InvertedIndex.build(TestDocuments.atezolizumabDose(), tokenizer);

        assertThat(index.contains("pembrolizumab")).isFalse();
        assertThat(index.postings("pembrolizumab")).isEmpty();
        assertThat(index.contains("atezolizumab")).isTrue();
    }

    @Test
    @DisplayName("Should not index tokens below the minimum length")
    void shouldRespectMinimumLength() {
        InvertedIndex index = InvertedIndex.build(TestDocuments.atezolizumabDose(), tokenizer);

        assertThat(index.contains("is")).isFalse();
        assertThat(index.contains("of")).isFalse();
        assertThat(index.contains("the")).isTrue();
    }

    @Test
    @DisplayName("Should report stats")
    void shouldReportStats() {
        InvertedIndex index = InvertedIndex.build(TestDocuments.oncologyDataset(), tokenizer);

        assertThat(index.documentCount()).isEqualTo(5);
        assertThat(index.getStats())
                .containsEntry("totalDocuments", 5)
                .containsEntry("minTokenLength", 3)
                .containsEntry("vocabularySize", index.vocabularySize());
    }

    private static Set<String> concat(Set<String> a, Set<String> b) {
        Set<String> all = new java.util.LinkedHashSet<>(a);
        all.addAll(b);
        return all;
    }
}
