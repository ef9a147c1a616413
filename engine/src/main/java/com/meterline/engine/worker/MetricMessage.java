package com.meterline.engine.worker;

import com.meterline.core.model.CheckResult;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.LimitStatus;
import com.meterline.core.model.PlanLimit;
import reactor.core.publisher.MonoSink;

import java.util.Map;

/**
 * Mailbox messages of {@link MetricWorker}.
 */
public interface MetricMessage {

    record Sample(double value, Map<String, String> tags) implements MetricMessage {
    }

    /**
     * Atomic add-and-check; replies with the decision.
     */
    record CheckAndAdd(double delta, Map<String, String> tags, MonoSink<CheckResult> reply) implements MetricMessage {
    }

    record FlushTick(FlushInterval interval) implements MetricMessage {
    }

    record ResetToInitial() implements MetricMessage {
    }

    /**
     * New billing period: resets reset-kind and plan-linked metrics.
     */
    record BillingReset() implements MetricMessage {
    }

    /**
     * Replaces the limit; {@code null} removes it.
     */
    record UpdatePlanLimit(PlanLimit limit) implements MetricMessage {
    }

    record GetValue(MonoSink<Double> reply) implements MetricMessage {
    }

    record GetLimitStatus(MonoSink<LimitStatus> reply) implements MetricMessage {
    }

    record CleanupTick(long timestamp) implements MetricMessage {
    }

    /**
     * Submits the pending window as a final batch, then stops.
     */
    record Shutdown() implements MetricMessage {
    }
}
