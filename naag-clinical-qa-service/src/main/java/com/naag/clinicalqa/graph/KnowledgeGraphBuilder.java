package com.naag.clinicalqa.graph;

import com.naag.clinicalqa.dataset.ClinicalDocument;
import com.naag.clinicalqa.dataset.DatasetFingerprint;
import com.naag.clinicalqa.graph.GraphNode.CancerTypeNode;
import com.naag.clinicalqa.graph.GraphNode.DocumentNode;
import com.naag.clinicalqa.graph.GraphNode.GeneNode;
import com.naag.clinicalqa.graph.GraphNode.TermNode;
import com.naag.clinicalqa.text.Stopwords;
import com.naag.clinicalqa.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Builds the {@link KnowledgeGraph} in a single pass over the documents.
 *
 * <p>Co-occurrence: each document contributes a keyword set made of its normalized cancer types,
 * its normalized genes and the significant terms of its prompt. Every unordered pair of distinct
 * keywords adds one to the edge between them. Pair generation is quadratic in the keyword count,
 * so the set is capped at {@code maxKeywordsPerDocument} (metadata keywords come first and are
 * kept preferentially).
 *
 * <p>Entity graph: a document node per document, linked to its cancer types (ABOUT), genes
 * (INVOLVES) and alphabetic terms of the prompt and completion (MENTIONS).
 */
@Slf4j
public class KnowledgeGraphBuilder {

    public static final int DEFAULT_MAX_KEYWORDS_PER_DOCUMENT = 25;

    static final int SIGNIFICANT_TERM_MIN_LENGTH = 4;

    private static final Pattern ALPHABETIC = Pattern.compile("\\p{L}+");

    private final Tokenizer tokenizer;
    private final int maxKeywordsPerDocument;

    public KnowledgeGraphBuilder(Tokenizer tokenizer) {
        this(tokenizer, DEFAULT_MAX_KEYWORDS_PER_DOCUMENT);
    }

    public KnowledgeGraphBuilder(Tokenizer tokenizer, int maxKeywordsPerDocument) {
        if (maxKeywordsPerDocument < 2) {
            throw new IllegalArgumentException("maxKeywordsPerDocument must be at least 2, got " + maxKeywordsPerDocument);
        }
        this.tokenizer = tokenizer;
        this.maxKeywordsPerDocument = maxKeywordsPerDocument;
    }

    public KnowledgeGraph build(List<ClinicalDocument> documents) {
        long start = System.currentTimeMillis();
        KnowledgeGraph.Builder graph = KnowledgeGraph.builder(DatasetFingerprint.of(documents));

        Map<String, Integer> occurrences = new HashMap<>();
        for (ClinicalDocument doc : documents) {
            addCooccurrences(graph, keywordsOf(doc));
            int occurrence = occurrences.merge(contentId(doc), 1, Integer::sum);
            addEntities(graph, doc, documentNode(doc, occurrence));
        }

        KnowledgeGraph built = graph.build();
        log.info("Built knowledge graph in {}ms: {} keywords, {} co-occurrence edges, {} entity nodes, {} relations",
                System.currentTimeMillis() - start, built.keywords().size(), built.cooccurrenceEdgeCount(),
                built.nodeCount(), built.relationCount());
        return built;
    }

    /**
     * Keyword set of one document in first-seen order, capped.
     */
    List<String> keywordsOf(ClinicalDocument doc) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String cancerType : doc.cancerTypes()) {
            addIfPresent(keywords, tokenizer.normalizeTerm(cancerType));
        }
        for (String gene : doc.genes()) {
            addIfPresent(keywords, tokenizer.normalizeTerm(gene));
        }
        for (String term : tokenizer.normalize(doc.prompt(), SIGNIFICANT_TERM_MIN_LENGTH)) {
            if (!Stopwords.isStopword(term)) {
                keywords.add(term);
            }
        }

        List<String> ordered = new ArrayList<>(keywords);
        if (ordered.size() > maxKeywordsPerDocument) {
            log.debug("Document {} has {} keywords, keeping the first {}", doc.id(), ordered.size(), maxKeywordsPerDocument);
            return ordered.subList(0, maxKeywordsPerDocument);
        }
        return ordered;
    }

    private static void addIfPresent(Set<String> keywords, String keyword) {
        if (!keyword.isEmpty()) {
            keywords.add(keyword);
        }
    }

    private static void addCooccurrences(KnowledgeGraph.Builder graph, List<String> keywords) {
        for (int i = 0; i < keywords.size(); i++) {
            for (int j = i + 1; j < keywords.size(); j++) {
                graph.incrementCooccurrence(keywords.get(i), keywords.get(j));
            }
        }
    }

    private void addEntities(KnowledgeGraph.Builder graph, ClinicalDocument doc, DocumentNode documentNode) {
        graph.addNode(documentNode);

        for (String cancerType : doc.cancerTypes()) {
            String value = tokenizer.normalizeTerm(cancerType);
            if (!value.isEmpty()) {
                graph.addRelation(documentNode, new CancerTypeNode(NodeType.CANCER_TYPE.keyFor(value), cancerType), Relation.ABOUT);
            }
        }
        for (String gene : doc.genes()) {
            String value = tokenizer.normalizeTerm(gene);
            if (!value.isEmpty()) {
                graph.addRelation(documentNode, new GeneNode(NodeType.GENE.keyFor(value), gene), Relation.INVOLVES);
            }
        }
        for (String term : mentionedTerms(doc)) {
            graph.addRelation(documentNode, new TermNode(NodeType.TERM.keyFor(term), term), Relation.MENTIONS);
        }
    }

    /**
     * Alphabetic, non-stopword terms longer than three characters from prompt and completion.
     */
    Set<String> mentionedTerms(ClinicalDocument doc) {
        Set<String> terms = new LinkedHashSet<>();
        collectMentions(terms, doc.prompt());
        collectMentions(terms, doc.completion());
        return terms;
    }

    private void collectMentions(Set<String> terms, String text) {
        for (String token : tokenizer.normalize(text, SIGNIFICANT_TERM_MIN_LENGTH)) {
            if (ALPHABETIC.matcher(token).matches() && !Stopwords.isStopword(token)) {
                terms.add(token);
            }
        }
    }

    static DocumentNode documentNode(ClinicalDocument doc) {
        return documentNode(doc, 1);
    }

    /**
     * Keyed by a hash of the question and answer so the key is the same on every rebuild.
     * The n-th document with the same text (n > 1) gets {@code #n} appended.
     */
    static DocumentNode documentNode(ClinicalDocument doc, int occurrence) {
        String key = NodeType.DOCUMENT.keyFor(contentId(doc));
        if (occurrence > 1) {
            key = key + "#" + occurrence;
        }
        return new DocumentNode(key, doc.prompt());
    }

    private static String contentId(ClinicalDocument doc) {
        return DatasetFingerprint.stableId(doc.prompt() + "\n" + doc.completion());
    }
}
