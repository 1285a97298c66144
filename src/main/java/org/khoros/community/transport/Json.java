package org.khoros.community.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * JSON encoder/decoder for the SDK wire format, backed by a shared Jackson
 * {@link ObjectMapper}.
 *
 * <p>Decoded values are plain Java trees: {@code Map}, {@code List}, {@code String},
 * {@code Number}, {@code Boolean} and {@code null}.
 */
public final class Json {

    /** Maximum nesting depth for JSON parsing. */
    static final int MAX_DEPTH = 128;

    /** Maximum input length for JSON parsing (10 MB). */
    static final int MAX_INPUT_LENGTH = 10 * 1024 * 1024;

    private static final ObjectMapper MAPPER;

    static {
        var mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.getFactory().setStreamReadConstraints(StreamReadConstraints.builder()
                .maxNestingDepth(MAX_DEPTH)
                .build());
        MAPPER = mapper;
    }

    private Json() {}

    /** The shared mapper, for callers that need tree or typed binding. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Encode an object to a JSON string.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode the value as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode a JSON string to Java objects (Map, List, String, Number, Boolean, null).
     *
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    public static Object decode(String json) {
        if (json.length() > MAX_INPUT_LENGTH) {
            throw new IllegalArgumentException(
                    "JSON input exceeds maximum length of " + MAX_INPUT_LENGTH + " bytes");
        }
        if (json.isBlank()) {
            throw new IllegalArgumentException("JSON input is empty");
        }
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Decode a JSON string, expecting a JSON object (map). */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> decodeObject(String json) {
        var result = decode(json);
        if (result instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("Expected JSON object, got: " + result);
    }
}
