package com.github.k8soperators.secretsync.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.k8soperators.secretsync.SyncException;
import io.fabric8.kubernetes.client.utils.Serialization;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers shared by provider adapters for structured (JSON) secret values.
 */
public final class SecretValues {

    private SecretValues() {
    }

    static ObjectMapper mapper() {
        return Serialization.jsonMapper();
    }

    public static JsonNode parse(byte[] value) {
        try {
            return mapper().readTree(value);
        } catch (IOException e) {
            throw SyncException.validation("value is not valid JSON: %s", e.getMessage());
        }
    }

    /**
     * Selects {@code property} inside a JSON value. A property containing dots
     * is first looked up literally, then as a path.
     *
     * @throws SyncException NOT_FOUND when the property does not exist
     */
    public static byte[] property(String key, byte[] value, String property) {
        if (property == null || property.isEmpty()) {
            return value;
        }

        JsonNode node = findProperty(parse(value), property);

        if (node == null || node.isMissingNode() || node.isNull()) {
            throw SyncException.notFound("property %s not found in %s", property, key);
        }

        return toBytes(node);
    }

    static JsonNode findProperty(JsonNode root, String property) {
        if (root.has(property)) {
            return root.get(property);
        }

        JsonNode current = root;

        for (String part : property.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }

        return current;
    }

    /**
     * Expands a JSON object into key/value pairs; textual members keep their
     * text, other members are serialized as JSON.
     */
    public static Map<String, byte[]> toMap(String key, byte[] value) {
        JsonNode root = parse(value);

        if (!root.isObject()) {
            throw SyncException.validation("value of %s is not a JSON object", key);
        }

        Map<String, byte[]> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();

        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), toBytes(field.getValue()));
        }

        return result;
    }

    public static byte[] toBytes(JsonNode node) {
        if (node.isTextual()) {
            return node.asText().getBytes(StandardCharsets.UTF_8);
        }

        try {
            return mapper().writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw SyncException.validation("cannot serialize value: %s", e.getMessage());
        }
    }
}
