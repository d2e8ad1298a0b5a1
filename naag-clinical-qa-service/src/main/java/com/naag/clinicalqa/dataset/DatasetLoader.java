package com.naag.clinicalqa.dataset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.naag.clinicalqa.exception.DatasetLoadException;
import com.naag.clinicalqa.exception.DatasetParseException;
import com.naag.clinicalqa.exception.EmptyDatasetException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads a JSON array of prompt/completion records into a {@link DocumentStore}.
 *
 * Each element is decoded on its own: an element that is not an object, or that lacks a scalar
 * {@code prompt} or {@code completion}, is skipped and counted rather than failing the batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatasetLoader {

    public static final String FIELD_PROMPT = "prompt";
    public static final String FIELD_COMPLETION = "completion";
    public static final String FIELD_CANCER_TYPE = "cancer_type";
    public static final String FIELD_GENES = "genes";

    private static final Set<String> CORE_FIELDS = Set.of(FIELD_PROMPT, FIELD_COMPLETION, FIELD_CANCER_TYPE, FIELD_GENES);

    private final ObjectMapper objectMapper;

    public DocumentStore load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new DatasetLoadException("Dataset resource not found: " + resource, null);
        }
        try (InputStream in = resource.getInputStream()) {
            return load(in, resource.getDescription());
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read dataset " + resource.getDescription(), e);
        }
    }

    public DocumentStore load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read dataset " + path, e);
        }
    }

    public DocumentStore load(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new DatasetParseException("Dataset " + sourceName + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read dataset " + sourceName, e);
        }

        if (root == null || root.isMissingNode() || !root.isArray()) {
            throw new DatasetParseException("Dataset " + sourceName + " must be a JSON array of records");
        }

        List<ClinicalDocument> documents = new ArrayList<>(root.size());
        int rejected = 0;
        int position = 0;
        for (JsonNode record : root) {
            Optional<ClinicalDocument> decoded = decode(record, documents.size());
            if (decoded.isPresent()) {
                documents.add(decoded.get());
            } else {
                rejected++;
                log.debug("Skipping record {} of {}: missing prompt/completion", position, sourceName);
            }
            position++;
        }

        if (documents.isEmpty()) {
            throw new EmptyDatasetException(rejected);
        }

        log.info("Loaded {} records from {} ({} rejected)", documents.size(), sourceName, rejected);
        return new DocumentStore(documents, rejected);
    }

    /**
     * Decodes one element, or returns empty when it is not an acceptable record.
     */
    Optional<ClinicalDocument> decode(JsonNode record, int id) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }
        String prompt = scalarText(record.get(FIELD_PROMPT));
        String completion = scalarText(record.get(FIELD_COMPLETION));
        if (prompt == null || completion == null) {
            return Optional.empty();
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (CORE_FIELDS.contains(field.getKey())) {
                continue;
            }
            String value = scalarText(field.getValue());
            if (value != null) {
                metadata.put(field.getKey(), value);
            }
        }

        return Optional.of(new ClinicalDocument(
                id,
                prompt.trim(),
                completion.trim(),
                splitList(record.get(FIELD_CANCER_TYPE)),
                splitList(record.get(FIELD_GENES)),
                metadata
        ));
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }

    /**
     * "NSCLC, SCLC" becomes [NSCLC, SCLC]. Arrays of scalars are accepted as well.
     * Values are trimmed but keep their case.
     */
    static Set<String> splitList(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String text = scalarText(element);
                if (text != null) {
                    addSplit(values, text);
                }
            }
            return values;
        }
        String text = scalarText(node);
        if (text != null) {
            addSplit(values, text);
        }
        return values;
    }

    private static void addSplit(Set<String> values, String text) {
        for (String part : text.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
    }
}
