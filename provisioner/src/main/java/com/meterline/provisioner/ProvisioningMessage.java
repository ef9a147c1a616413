package com.meterline.provisioner;

/**
 * Mailbox messages of {@link ProvisioningProcessor}.
 */
public interface ProvisioningMessage {

    /**
     * Process due tasks.
     */
    record Poll() implements ProvisioningMessage {
    }

    record PollFinished(long processed) implements ProvisioningMessage {
    }

    /**
     * Move expired machines into grace and schedule termination of those past grace.
     */
    record ExpirySweep() implements ProvisioningMessage {
    }

    record SweepFinished(long swept) implements ProvisioningMessage {
    }
}
