package com.meterline.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Map;

/**
 * Spawn-time configuration of a metric worker. Immutable once the worker is running;
 * only the plan limit can be replaced afterwards.
 */
@Value
@Builder(toBuilder = true)
@With
public class MetricSpec {
    String metricName;
    @Builder.Default
    Operation operation = Operation.SUM;
    @Builder.Default
    MetricKind kind = MetricKind.RESET;
    @Builder.Default
    FlushInterval flushInterval = FlushInterval.ONE_MINUTE;
    double initialValue;
    @Singular
    Map<String, String> tags;
    PlanLimit planLimit;

    /**
     * Metric-level inactivity window; {@code null} leaves reaping to the owning tenant.
     */
    Duration idleTimeout;

    /**
     * Non-persistent metrics (rate-limit counters) never produce flush batches.
     */
    @Builder.Default
    boolean persistent = true;

    /**
     * Materialized from a plan limit; billing-cycle resets apply to it regardless of kind.
     */
    boolean planLinked;

    /**
     * Aggregate restored from the persisted checkpoint. The worker starts from it; resets
     * still return to {@link #initialValue}.
     */
    Double restoredValue;

    public double startingValue() {
        return restoredValue != null ? restoredValue : initialValue;
    }

    public static MetricSpec fromLimit(PlanLimit limit, FlushInterval interval) {
        return MetricSpec.builder()
            .metricName(limit.getMetricName())
            .kind(limit.getMetricKind())
            .flushInterval(interval)
            .planLimit(limit)
            .planLinked(true)
            .build();
    }
}
