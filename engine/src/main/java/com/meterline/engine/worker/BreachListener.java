package com.meterline.engine.worker;

import com.meterline.core.msg.ControlMessages.LimitBreached;

/**
 * Receives breach notifications for limits whose action is {@code webhook} or {@code allow_overage}.
 */
@FunctionalInterface
public interface BreachListener {
    void onBreach(LimitBreached event);

    BreachListener NOOP = event -> {
    };
}
