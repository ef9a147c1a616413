package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BreachAction {
    DENY,
    ALLOW_OVERAGE,
    WEBHOOK,
    ALLOW;

    /**
     * Whether crossing the limit should be announced on the breach topic.
     */
    public boolean notifies() {
        return this == WEBHOOK || this == ALLOW_OVERAGE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BreachAction parse(String name) {
        if (name == null || name.isBlank()) {
            return DENY;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
