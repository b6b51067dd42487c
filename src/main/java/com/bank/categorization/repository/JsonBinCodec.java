package com.bank.categorization.repository;

import com.bank.categorization.model.CategoryValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of structured bins. Writes fail loudly so an audit record is never
 * stored with a silently blanked value; reads degrade to empty values.
 */
final class JsonBinCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonBinCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonBinCodec() {
    }

    static String write(Object value) {
        if (value == null) return null;
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    static CategoryValue readCategory(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return MAPPER.readValue(json, CategoryValue.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable category value: {}", e.getMessage());
            return null;
        }
    }

    static List<String> readList(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return MAPPER.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            return new ArrayList<>();
        }
    }

    static float[] readVector(String json) {
        if (json == null || json.isEmpty()) return new float[0];
        try {
            return MAPPER.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            return new float[0];
        }
    }
}
