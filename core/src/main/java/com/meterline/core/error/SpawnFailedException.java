package com.meterline.core.error;

/**
 * A worker factory threw while creating the actor for {@code key}.
 */
public class SpawnFailedException extends MeterException {
    private final String key;

    public SpawnFailedException(String key, Throwable cause) {
        super("Failed to spawn worker " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
