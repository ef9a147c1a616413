package com.meterline.core.error;

/**
 * Root of the engine's unchecked failures.
 */
public class MeterException extends RuntimeException {
    public MeterException(String message) {
        super(message);
    }

    public MeterException(String message, Throwable cause) {
        super(message, cause);
    }
}
