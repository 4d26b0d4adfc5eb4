package com.etcd.coordination.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.SortedMap;

/**
 * Jackson-based encoding of stored values.
 * Values are written as JSON text and read back as {@link JsonNode} trees.
 */
public class JsonCodec {

    private final ObjectMapper mapper;

    public JsonCodec() {
        this(new ObjectMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serializes any Jackson-serializable value.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a stored value.
     *
     * @throws StoreException with {@link StoreException#MALFORMED_VALUE} if the text is not JSON
     */
    public JsonNode decode(String key, String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.MALFORMED_VALUE,
                    "Value at " + key + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode toTree(Object value) {
        if (value instanceof JsonNode node) {
            return node;
        }
        return mapper.valueToTree(value);
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        if (type.isInstance(node)) {
            return type.cast(node);
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot convert value to " + type.getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    public ObjectNode emptyObject() {
        return mapper.createObjectNode();
    }

    /**
     * Folds the entries of a subtree read into a nested object.
     *
     * <p>The result has a single field named after the root key (without its leading
     * {@code /}). A root holding a plain value maps to that value; otherwise every
     * path segment below the root becomes a nested object and every entry a leaf.
     * When an entry both holds a value and has children, the children win.</p>
     *
     * @param root    the key the subtree was read from
     * @param entries the subtree entries, keyed by full key
     */
    public ObjectNode assembleTree(String root, SortedMap<String, String> entries) {
        ObjectNode result = mapper.createObjectNode();
        String rootName = stripSlashes(root);

        if (entries.size() == 1 && entries.containsKey(root)) {
            result.set(rootName, decode(root, entries.get(root)));
            return result;
        }

        ObjectNode rootNode = result.putObject(rootName);
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            String relative = stripSlashes(entry.getKey().substring(root.length()));
            if (relative.isEmpty()) {
                continue;
            }
            String[] segments = relative.split("/");
            ObjectNode parent = rootNode;
            for (int i = 0; i < segments.length - 1; i++) {
                JsonNode child = parent.get(segments[i]);
                parent = child instanceof ObjectNode objectNode ? objectNode : parent.putObject(segments[i]);
            }
            String leaf = segments[segments.length - 1];
            if (!(parent.get(leaf) instanceof ObjectNode)) {
                parent.set(leaf, decode(entry.getKey(), entry.getValue()));
            }
        }
        return result;
    }

    private static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;
        return path.substring(start, end);
    }
}
