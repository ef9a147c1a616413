package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of a metric against its plan limit.
 */
@Value
@Builder
public class LimitStatus {
    String metricName;
    double value;
    PlanLimit limit;
    boolean breached;

    /**
     * Headroom before the limit value; {@code Double.POSITIVE_INFINITY} when unlimited.
     */
    public double getRemaining() {
        if (limit == null) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, limit.getLimitValue() - value);
    }

    public boolean hasLimit() {
        return limit != null;
    }
}
