package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task lifecycle. {@link #COMPLETED} and {@link #DEAD_LETTER} are terminal.
 */
public enum ProvisioningStatus {
    PENDING,
    COMPLETED,
    DEAD_LETTER;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProvisioningStatus parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
