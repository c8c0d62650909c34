package com.ietfdata.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ietfdata.model.error.DecodeException;

/**
 * JSON decoding of Datatracker documents into entity records and list pages.
 *
 * <p>Unknown fields are ignored because the service adds fields over time. Missing required fields,
 * malformed URIs and malformed timestamps all surface as {@link DecodeException}.
 */
public final class DatatrackerJson {

    private static final ObjectMapper MAPPER = createMapper();

    private DatatrackerJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(DatatrackerTime.module())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Decodes a single document.
     *
     * @param json   the raw document
     * @param type   the record type to decode into
     * @param source where the document came from, used in error messages
     * @throws DecodeException if the document is empty, malformed or does not match {@code type}
     */
    public static <T> T decode(String json, Class<T> type, String source) {
        return read(json, MAPPER.getTypeFactory().constructType(type), type, source);
    }

    /**
     * Decodes a list response into a {@link Page} of the given element type.
     *
     * @throws DecodeException if the document is not a well-formed page of {@code elementType}
     */
    public static <T> Page<T> decodePage(String json, Class<T> elementType, String source) {
        JavaType type = MAPPER.getTypeFactory().constructParametricType(Page.class, elementType);
        return read(json, type, elementType, source);
    }

    /** Encodes a record in the service's wire format. */
    public static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static <T> T read(String json, JavaType type, Class<?> reported, String source) {
        if (json == null || json.isBlank()) {
            throw new DecodeException(source, reported, new IllegalArgumentException("empty document"));
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DecodeException(source, reported, e);
        }
    }
}
