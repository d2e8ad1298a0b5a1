package com.naag.clinicalqa.dataset;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * SHA-256 content hashes for documents and whole document sets.
 */
public final class DatasetFingerprint {

    private DatasetFingerprint() {
    }

    /**
     * Hash over every document field, in id order. Metadata is included so a reload that only
     * changes display fields still publishes a new snapshot.
     */
    public static String of(Collection<ClinicalDocument> documents) {
        MessageDigest md = sha256();
        for (ClinicalDocument doc : documents) {
            update(md, Integer.toString(doc.id()));
            update(md, doc.prompt());
            update(md, doc.completion());
            update(md, String.join(",", new TreeSet<>(doc.cancerTypes())));
            update(md, String.join(",", new TreeSet<>(doc.genes())));
            new TreeMap<>(doc.metadata()).forEach((key, value) -> update(md, key + "=" + value));
            update(md, "");
        }
        return hex(md.digest(), 32);
    }

    /**
     * Short stable id for a single piece of content.
     */
    public static String stableId(String content) {
        MessageDigest md = sha256();
        return hex(md.digest(content.getBytes(StandardCharsets.UTF_8)), 16);
    }

    private static void update(MessageDigest md, String value) {
        md.update(value.getBytes(StandardCharsets.UTF_8));
        md.update((byte) 0);
    }

    private static String hex(byte[] digest, int bytes) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < bytes; i++) sb.append(String.format("%02x", digest[i]));
        return sb.toString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
