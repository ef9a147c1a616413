package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProvisioningAction {
    PROVISION,
    SUSPEND,
    RESUME,
    TERMINATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProvisioningAction parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
