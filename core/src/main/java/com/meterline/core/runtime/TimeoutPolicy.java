package com.meterline.core.runtime;

import java.util.Locale;

/**
 * Outcome applied when a request/reply call to a worker times out.
 */
public enum TimeoutPolicy {
    /**
     * Treat the call as allowed; availability over strict enforcement.
     */
    FAIL_OPEN,

    /**
     * Treat the call as denied.
     */
    FAIL_CLOSED;

    public boolean allows() {
        return this == FAIL_OPEN;
    }

    public static TimeoutPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return FAIL_OPEN;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
