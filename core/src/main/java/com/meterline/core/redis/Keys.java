package com.meterline.core.redis;

/**
 * Redis keyspace definitions for metric persistence, plan limits and provisioning.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (ckpt:, metrics:, limits:, prov:, machines:)</li>
 *   <li>Hashes for structured data, streams for append-only history</li>
 *   <li>Sorted sets scored by epoch millis for time-driven scans</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Placeholder customer segment for business-scoped keys.
     */
    public static final String NO_CUSTOMER = "_";

    /**
     * Checkpoint total: {@code ckpt:{businessId}:{customerId|_}:{scope}:{metricName}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b>
     * <ul>
     *   <li>{@code value}: running total, incremented with HINCRBYFLOAT</li>
     *   <li>{@code operations}: operation count, incremented with HINCRBY</li>
     *   <li>{@code updatedAt}: last increment (epoch millis)</li>
     *   <li>{@code tags}: JSON map of the latest tags</li>
     * </ul>
     * </p>
     */
    public static String checkpoint(String businessId, String customerId, String scope, String metricName) {
        return "ckpt:" + businessId + ":" + (customerId == null ? NO_CUSTOMER : customerId)
            + ":" + scope + ":" + metricName;
    }

    public static final String CKPT_VALUE = "value";
    public static final String CKPT_OPERATIONS = "operations";
    public static final String CKPT_UPDATED_AT = "updatedAt";
    public static final String CKPT_TAGS = "tags";

    /**
     * Metric history of a business: {@code metrics:{businessId}}
     * <p>
     * <b>Type:</b> Stream; one entry per flushed record or checkpoint increment.
     * </p>
     */
    public static String metricsStream(String businessId) {
        return "metrics:" + businessId;
    }

    /**
     * Limits of a plan: {@code limits:plan:{planId}}, hash of metricName to PlanLimit JSON.
     */
    public static String planLimits(String planId) {
        return "limits:plan:" + planId;
    }

    /**
     * Business-scoped limits: {@code limits:business:{businessId}}.
     */
    public static String businessLimits(String businessId) {
        return "limits:business:" + businessId;
    }

    /**
     * Limits pinned to one customer: {@code limits:customer:{businessId}:{customerId}}.
     */
    public static String customerLimits(String businessId, String customerId) {
        return "limits:customer:" + businessId + ":" + customerId;
    }

    /**
     * Stripe price to plan index: hash of priceId to planId.
     */
    public static String planByPrice() {
        return "plans:by-price";
    }

    /**
     * Customer document (JSON string): {@code cust:{businessId}:{customerId}}.
     */
    public static String customer(String businessId, String customerId) {
        return "cust:" + businessId + ":" + customerId;
    }

    /**
     * Business document (JSON string): {@code biz:{businessId}}.
     */
    public static String business(String businessId) {
        return "biz:" + businessId;
    }

    /**
     * Provisioning task document (JSON string): {@code prov:task:{taskId}}.
     */
    public static String task(String taskId) {
        return "prov:task:" + taskId;
    }

    /**
     * Pending task ids scored by {@code nextRetryAt}.
     */
    public static String pendingTasks() {
        return "prov:pending";
    }

    /**
     * Dead-lettered task ids scored by {@code deadLetterAt}.
     */
    public static String deadLetterTasks() {
        return "prov:dead";
    }

    /**
     * Idempotency claim: {@code prov:idem:{key}}, value is the owning task id (SETNX).
     */
    public static String idempotency(String idempotencyKey) {
        return "prov:idem:" + idempotencyKey;
    }

    /**
     * Machines of a customer: {@code machines:{businessId}:{customerId}}, hash of machineId to JSON.
     */
    public static String machines(String businessId, String customerId) {
        return "machines:" + businessId + ":" + customerId;
    }

    /**
     * Machines with an expiry, scored by the next expiry-relevant timestamp.
     * Members are {@code {businessId}:{customerId}:{machineId}}.
     */
    public static String machineExpiry() {
        return "machines:expiry";
    }

    public static String machineExpiryMember(String businessId, String customerId, String machineId) {
        return businessId + ":" + customerId + ":" + machineId;
    }
}
