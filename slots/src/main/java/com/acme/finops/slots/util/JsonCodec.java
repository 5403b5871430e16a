package com.acme.finops.slots.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared JSON codec for metrics output.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /** Like {@link #writeString} but degrades to {@code toString()} instead of throwing. */
    public static String render(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
