package com.meterline.core.error;

/**
 * A store write failed; the data is kept for the next attempt.
 */
public class PersistenceWriteException extends MeterException {
    public PersistenceWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
