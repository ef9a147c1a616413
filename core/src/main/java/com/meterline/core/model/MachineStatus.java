package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MachineStatus {
    PROVISIONING,
    RUNNING,
    SUSPENDED,
    GRACE_PERIOD,
    TERMINATED;

    public boolean isTerminated() {
        return this == TERMINATED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MachineStatus parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
