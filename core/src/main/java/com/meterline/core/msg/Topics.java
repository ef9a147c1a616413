package com.meterline.core.msg;

import com.meterline.core.model.FlushInterval;

/**
 * Kafka topic names and in-process bus topic names.
 */
public final class Topics {
    private Topics() {
    }

    /**
     * Inbound metric samples ({@link ControlMessages.RecordMetric}).
     */
    public static final String METRICS_RECORD = "meter.metrics.record";

    /**
     * Inbound plan-limit edits ({@link ControlMessages.PlanLimitChanged}).
     */
    public static final String CONTROL_PLAN_LIMITS = "meter.control.plan-limits";

    /**
     * Inbound plan subscription changes ({@link ControlMessages.PlanChanged}).
     */
    public static final String CONTROL_PLANS = "meter.control.plans";

    /**
     * Inbound billing-period rollovers ({@link ControlMessages.BillingCycleReset}).
     */
    public static final String CONTROL_BILLING = "meter.control.billing";

    /**
     * Inbound provisioning requests ({@link ControlMessages.ProvisioningRequest}).
     */
    public static final String CONTROL_PROVISIONING = "meter.control.provisioning";

    /**
     * Outbound limit breach notifications ({@link ControlMessages.LimitBreached}).
     */
    public static final String EVENTS_BREACH = "meter.events.breach";

    /**
     * Outbound dead-lettered provisioning tasks ({@link ControlMessages.DeadLetterNotice}).
     */
    public static final String EVENTS_DEAD_LETTER = "meter.events.dead-letter";

    // In-process bus topics

    public static final String TICK_PREFIX = "tick:";

    /**
     * Receives every tick regardless of interval.
     */
    public static final String TICK_ALL = TICK_PREFIX + "all";

    /**
     * Plan-limit broadcast to live tenant workers.
     */
    public static final String PLAN_LIMITS = "plan-limits";

    public static String tick(FlushInterval interval) {
        return TICK_PREFIX + interval.label();
    }
}
