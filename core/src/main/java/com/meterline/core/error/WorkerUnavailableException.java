package com.meterline.core.error;

/**
 * No live worker could accept the message (stopped, or mailbox full).
 */
public class WorkerUnavailableException extends MeterException {
    private final String key;

    public WorkerUnavailableException(String key, String reason) {
        super("Worker " + key + " unavailable: " + reason);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
