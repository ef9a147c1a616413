package com.meterline.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for Kafka payloads and Redis-stored documents.
 * <p>
 * Unknown properties are ignored so producers can add fields without breaking consumers.
 * Failures are rethrown unchecked; callers on reactive paths turn them into error signals.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + clazz.getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper().readValue(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + type.getType(), e);
        }
    }
}
