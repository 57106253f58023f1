package ai.doctables.reconstructor.io;

import ai.doctables.reconstructor.model.Fragment;
import ai.doctables.reconstructor.model.FragmentDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON hand-off written by the ingestion layer:
 * <pre>
 * {"page_texts": [...], "context": {...},
 *  "fragments": [{"page": 1, "table_index": 0, "data": [[...]], "source": "..."}]}
 * </pre>
 * Null cells become empty strings and numeric cells keep their textual form.
 */
public class FragmentDocumentReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> CONTEXT_TYPE = new TypeReference<>() {
    };

    public FragmentDocument read(Path path) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new FragmentReadException("Failed to read fragment document: " + path, ex);
        }
        return parse(documentName(path), json);
    }

    public FragmentDocument parse(String name, String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new FragmentReadException("Malformed fragment document " + name + ": " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new FragmentReadException("Fragment document " + name + " must be a JSON object");
        }
        try {
            return new FragmentDocument(name, readFragments(root.path("fragments")), readPageTexts(root.path("page_texts")),
                    readContext(root.path("context")));
        } catch (IllegalArgumentException ex) {
            throw new FragmentReadException("Invalid fragment document " + name + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * File name without its last extension.
     */
    public static String documentName(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? path.toString() : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private List<Fragment> readFragments(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("fragments must be an array");
        }
        List<Fragment> fragments = new ArrayList<>(node.size());
        for (JsonNode fragment : node) {
            int page = fragment.path("page").asInt(1);
            int tableIndex = fragment.path("table_index").asInt(0);
            String source = fragment.path("source").isTextual() ? fragment.path("source").asText() : null;
            fragments.add(new Fragment(page, tableIndex, readRows(fragment.path("data")), source));
        }
        return fragments;
    }

    private List<List<String>> readRows(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("fragment data must be an array of rows");
        }
        List<List<String>> rows = new ArrayList<>(node.size());
        for (JsonNode row : node) {
            if (!row.isArray()) {
                throw new IllegalArgumentException("fragment row must be an array of cells");
            }
            List<String> cells = new ArrayList<>(row.size());
            row.forEach(cell -> cells.add(cell.isNull() ? "" : cell.asText()));
            rows.add(cells);
        }
        return rows;
    }

    private List<String> readPageTexts(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("page_texts must be an array");
        }
        List<String> texts = new ArrayList<>(node.size());
        node.forEach(text -> texts.add(text.isNull() ? "" : text.asText()));
        return texts;
    }

    private Map<String, Object> readContext(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("context must be an object");
        }
        return MAPPER.convertValue(node, CONTEXT_TYPE);
    }

    /**
     * Raised when a hand-off file cannot be read or does not have the expected shape.
     */
    public static class FragmentReadException extends RuntimeException {

        public FragmentReadException(String message) {
            super(message);
        }

        public FragmentReadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
