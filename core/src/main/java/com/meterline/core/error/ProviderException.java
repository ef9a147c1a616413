package com.meterline.core.error;

/**
 * A call to the machine provider failed or returned an unexpected status.
 */
public class ProviderException extends MeterException {
    private final int status;

    public ProviderException(String message) {
        this(message, 0);
    }

    public ProviderException(String message, int status) {
        super(message);
        this.status = status;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int getStatus() {
        return status;
    }
}
