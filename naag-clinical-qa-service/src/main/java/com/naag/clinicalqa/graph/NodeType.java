package com.naag.clinicalqa.graph;

import java.util.Arrays;
import java.util.Optional;

public enum NodeType {
    DOCUMENT("doc"),
    CANCER_TYPE("cancer"),
    GENE("gene"),
    TERM("term");

    private final String keyPrefix;

    NodeType(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String keyFor(String value) {
        return keyPrefix + ":" + value;
    }

    public static Optional<NodeType> fromKey(String key) {
        int colon = key.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        String prefix = key.substring(0, colon);
        return Arrays.stream(values()).filter(t -> t.keyPrefix.equals(prefix)).findFirst();
    }
}
