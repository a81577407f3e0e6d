package br.edu.ifba.socialgraph.source;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-tolerant accessors for source API payloads.
 */
public final class JsonPayloads {

    private JsonPayloads() {
    }

    /**
     * @return the field as text, or {@code null} when absent, JSON null or blank
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Copies a scalar field into {@code target} under {@code key}, keeping its JSON type.
     * Absent and null fields are skipped.
     */
    public static void copy(JsonNode node, String field, Map<String, Object> target, String key) {
        if (node == null) {
            return;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return;
        }
        if (value.isBoolean()) {
            target.put(key, value.booleanValue());
        } else if (value.isIntegralNumber()) {
            target.put(key, value.longValue());
        } else if (value.isNumber()) {
            target.put(key, value.doubleValue());
        } else {
            target.put(key, value.asText());
        }
    }

    public static void copy(JsonNode node, String field, Map<String, Object> target) {
        copy(node, field, target, field);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static boolean isArray(JsonNode node) {
        return node != null && node.isArray();
    }
}
