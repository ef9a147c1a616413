package com.meterline.provisioner;

import com.meterline.core.msg.ControlMessages.DeadLetterNotice;

/**
 * Receives provisioning tasks that exhausted their attempts.
 */
@FunctionalInterface
public interface DeadLetterSink {
    void accept(DeadLetterNotice notice);

    DeadLetterSink NOOP = notice -> {
    };
}
