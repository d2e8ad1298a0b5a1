package com.naag.clinicalqa.search;

import com.naag.clinicalqa.dataset.ClinicalDocument;
import com.naag.clinicalqa.dataset.DocumentStore;
import com.naag.clinicalqa.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * In-memory inverted index for exact token retrieval.
 * Built once per dataset version and read-only afterwards, so concurrent reads need no locking.
 */
public final class InvertedIndex {

    private static final Logger log = LoggerFactory.getLogger(InvertedIndex.class);

    private final Tokenizer tokenizer;
    private final Map<String, List<Integer>> postings;
    private final List<DocumentTokens> documentTokens;

    /**
     * Token sets of one document, kept so ranking does not re-tokenize candidates.
     */
    public record DocumentTokens(Set<String> promptTokens, Set<String> completionTokens) {}

    private InvertedIndex(Tokenizer tokenizer, Map<String, List<Integer>> postings, List<DocumentTokens> documentTokens) {
        this.tokenizer = tokenizer;
        this.postings = postings;
        this.documentTokens = documentTokens;
    }

    public static InvertedIndex build(DocumentStore store, Tokenizer tokenizer) {
        return build(store.documents(), tokenizer);
    }

    /**
     * Documents are visited in id order, so every postings list comes out ascending and
     * free of duplicates.
     */
    public static InvertedIndex build(List<ClinicalDocument> documents, Tokenizer tokenizer) {
        Map<String, List<Integer>> building = new HashMap<>();
        List<DocumentTokens> tokens = new ArrayList<>(documents.size());

        for (ClinicalDocument doc : documents) {
            Set<String> promptTokens = tokenizer.normalize(doc.prompt());
            Set<String> completionTokens = tokenizer.normalize(doc.completion());
            tokens.add(new DocumentTokens(promptTokens, completionTokens));

            addPostings(building, promptTokens, doc.id());
            addPostings(building, completionTokens, doc.id());
        }

        Map<String, List<Integer>> frozen = new HashMap<>(building.size() * 2);
        building.forEach((token, ids) -> frozen.put(token, List.copyOf(ids)));

        log.debug("Built inverted index: {} documents, {} tokens", documents.size(), frozen.size());
        return new InvertedIndex(tokenizer, Collections.unmodifiableMap(frozen), List.copyOf(tokens));
    }

    private static void addPostings(Map<String, List<Integer>> index, Set<String> tokens, int docId) {
        for (String token : tokens) {
            List<Integer> ids = index.computeIfAbsent(token, k -> new ArrayList<>());
            // the same id may arrive from prompt and completion; ids arrive in order so the tail suffices
            if (ids.isEmpty() || ids.get(ids.size() - 1) != docId) {
                ids.add(docId);
            }
        }
    }

    /**
     * Ids of the documents containing {@code token}, ascending. Empty when unknown.
     */
    public List<Integer> postings(String token) {
        return postings.getOrDefault(token, List.of());
    }

    public boolean contains(String token) {
        return postings.containsKey(token);
    }

    public DocumentTokens tokensOf(int docId) {
        return documentTokens.get(docId);
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    public int documentCount() {
        return documentTokens.size();
    }

    public int vocabularySize() {
        return postings.size();
    }

    /**
     * Tokens in ascending order, for inspection and determinism checks.
     */
    public SortedSet<String> vocabulary() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(postings.keySet()));
    }

    public Map<String, Object> getStats() {
        return Map.of(
                "totalDocuments", documentCount(),
                "vocabularySize", vocabularySize(),
                "minTokenLength", tokenizer.getMinTokenLength()
        );
    }
}
