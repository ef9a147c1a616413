package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Persistence behaviour of a metric at flush boundaries.
 */
public enum MetricKind {
    /**
     * Zeroed (back to its initial value) at every flush boundary, persisted with a plain insert.
     */
    RESET,
    /**
     * Lifetime counter: never reset by a flush, persisted as an atomic increment of the delta.
     */
    CHECKPOINT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MetricKind parse(String name) {
        if (name == null || name.isBlank()) {
            return RESET;
        }
        return "checkpoint".equalsIgnoreCase(name.trim()) ? CHECKPOINT : RESET;
    }
}
