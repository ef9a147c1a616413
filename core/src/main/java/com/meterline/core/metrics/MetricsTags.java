package com.meterline.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Worker kind: business, customer, metric or ip.
     */
    public static final String KIND = "kind";

    public static final String SCOPE = "scope";

    public static final String INTERVAL = "interval";

    /**
     * Flush write strategy: checkpoint or insert.
     */
    public static final String STRATEGY = "strategy";

    public static final String OUTCOME = "outcome";

    public static final String ACTION = "action";

    public static final String POLICY = "policy";

    public static final String TOPIC = "topic";
}
