package com.decisiontree.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Map;

/**
 * Factory for creating DecisionContext from a JSON payload.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 */
public final class DecisionContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private DecisionContextFactory() {
    }

    /**
     * Create a DecisionContext from a JSON object.
     *
     * @param jsonPayload JSON object; null or blank yields an empty context
     * @return Context holding the flattened facts
     * @throws IllegalArgumentException if the payload is not a JSON object
     */
    public static DecisionContext fromJson(String jsonPayload) {
        return fromJson(jsonPayload, null);
    }

    /**
     * Create a DecisionContext from a JSON object plus extra facts.
     * Extra facts override values parsed from the payload.
     *
     * @param jsonPayload JSON object; null or blank yields no parsed facts
     * @param extraFacts  Additional facts, can be null
     */
    public static DecisionContext fromJson(String jsonPayload, Map<String, ?> extraFacts) {
        DecisionContext.Builder builder = DecisionContext.builder();

        if (jsonPayload != null && !jsonPayload.isBlank()) {
            builder.putAll(flatten(parseJson(jsonPayload)));
        }
        if (extraFacts != null) {
            builder.putAll(extraFacts);
        }
        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else {
                // Arrays are kept as-is
                result.put(key, value);
            }
        }
    }
}
