package com.prism.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.core.support.ScalarValues;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of event property bags for the {@code jsonb} column. Numbers are written in normalised form so
 * that {@code properties->>'x'} yields the same text the in-process readers produce.
 */
final class PropertiesJson {

    private static final ObjectMapper M = new ObjectMapper()
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    private PropertiesJson() {}

    static String toJson(Map<String, Object> properties) {
        Map<String, Object> out = new LinkedHashMap<>();
        properties.forEach((name, value) ->
                out.put(name, value instanceof Number ? ScalarValues.normalize(ScalarValues.toNumber(value)) : value));
        try {
            return M.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }

    static Map<String, Object> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return M.readValue(json, MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON decode failed", e);
        }
    }
}
