package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BreachOperator {
    GTE,
    GT,
    LTE,
    LT;

    public boolean isBreached(double value, double limit) {
        switch (this) {
            case GT:
                return value > limit;
            case LTE:
                return value <= limit;
            case LT:
                return value < limit;
            case GTE:
            default:
                return value >= limit;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BreachOperator parse(String name) {
        if (name == null || name.isBlank()) {
            return GTE;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
