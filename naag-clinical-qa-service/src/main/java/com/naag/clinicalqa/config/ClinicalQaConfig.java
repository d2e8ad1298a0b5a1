package com.naag.clinicalqa.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.naag.clinicalqa.graph.GraphCacheStore;
import com.naag.clinicalqa.graph.KnowledgeGraphBuilder;
import com.naag.clinicalqa.graph.RelatedConceptRetriever;
import com.naag.clinicalqa.search.ClosestMatchRetriever;
import com.naag.clinicalqa.search.FacetFilter;
import com.naag.clinicalqa.search.RankingEngine;
import com.naag.clinicalqa.text.Tokenizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the retrieval core. One {@link Tokenizer} bean is shared by the index, the ranking engine
 * and the graph so indexing and querying always agree on token rules.
 */
@Configuration
public class ClinicalQaConfig {

    @Bean
    public Tokenizer tokenizer(ClinicalQaProperties properties) {
        return new Tokenizer(properties.getTokenizer().getMinTokenLength());
    }

    @Bean
    public RankingEngine rankingEngine() {
        return new RankingEngine();
    }

    @Bean
    public FacetFilter facetFilter() {
        return new FacetFilter();
    }

    @Bean
    public ClosestMatchRetriever closestMatchRetriever(ClinicalQaProperties properties) {
        return new ClosestMatchRetriever(properties.getClosestMatch().getCutoff());
    }

    @Bean
    public KnowledgeGraphBuilder knowledgeGraphBuilder(Tokenizer tokenizer, ClinicalQaProperties properties) {
        return new KnowledgeGraphBuilder(tokenizer, properties.getGraph().getMaxKeywordsPerDocument());
    }

    @Bean
    public RelatedConceptRetriever relatedConceptRetriever(Tokenizer tokenizer) {
        return new RelatedConceptRetriever(tokenizer);
    }

    @Bean
    public GraphCacheStore graphCacheStore(ObjectMapper objectMapper) {
        return new GraphCacheStore(objectMapper);
    }
}
