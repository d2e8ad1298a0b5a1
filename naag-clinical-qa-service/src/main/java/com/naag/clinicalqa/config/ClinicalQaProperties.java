package com.naag.clinicalqa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "naag.clinical")
public class ClinicalQaProperties {

    private DatasetConfig dataset = new DatasetConfig();
    private TokenizerConfig tokenizer = new TokenizerConfig();
    private SearchConfig search = new SearchConfig();
    private GraphConfig graph = new GraphConfig();
    private RelatedConfig related = new RelatedConfig();
    private ClosestMatchConfig closestMatch = new ClosestMatchConfig();

    @Data
    public static class DatasetConfig {
        /** Spring resource location of the JSON array of records. */
        private String location = "classpath:data/cancer_clinical_dataset.json";
        private boolean loadOnStartup = true;
    }

    @Data
    public static class TokenizerConfig {
        private int minTokenLength = 3;
    }

    @Data
    public static class SearchConfig {
        private int defaultTopN = 0;  // 0 = no limit
    }

    @Data
    public static class GraphConfig {
        /** File used to persist the graph between restarts. Blank disables the cache. */
        private String cacheLocation = "";
        private int maxKeywordsPerDocument = 25;
    }

    @Data
    public static class RelatedConfig {
        private int defaultTopN = 10;
    }

    @Data
    public static class ClosestMatchConfig {
        private double cutoff = 0.4;
    }
}
