package com.meterline.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code meter.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: live workers in the process registry.
     * <p>
     * Tags: kind (business/customer/metric/ip)
     * </p>
     */
    public static final String WORKERS_LIVE = "meter.workers.live";

    /**
     * Counter: workers spawned.
     * <p>
     * Tags: kind
     * </p>
     */
    public static final String WORKERS_SPAWNED_TOTAL = "meter.workers.spawned.total";

    /**
     * Counter: workers stopped after inactivity.
     * <p>
     * Tags: kind
     * </p>
     */
    public static final String WORKERS_REAPED_TOTAL = "meter.workers.reaped.total";

    /**
     * Counter: messages rejected by a full mailbox.
     * <p>
     * Tags: kind
     * </p>
     */
    public static final String MAILBOX_OVERFLOW_TOTAL = "meter.mailbox.overflow.total";

    public static final String SPAWN_FAILURES_TOTAL = "meter.workers.spawn.failures.total";

    /**
     * Counter: metric samples accepted by the router.
     * <p>
     * Tags: scope (business/customer)
     * </p>
     */
    public static final String RECORDS_TOTAL = "meter.metrics.records.total";

    /**
     * Counter: add-and-check calls rejected by a deny limit.
     */
    public static final String LIMIT_DENIED_TOTAL = "meter.limits.denied.total";

    /**
     * Counter: transitions into breach for notifying limits.
     * <p>
     * Tags: action
     * </p>
     */
    public static final String LIMIT_BREACHED_TOTAL = "meter.limits.breached.total";

    /**
     * Counter: request/reply calls decided by the timeout policy.
     * <p>
     * Tags: policy
     * </p>
     */
    public static final String ASK_TIMEOUTS_TOTAL = "meter.ask.timeouts.total";

    /**
     * Counter: batches written by the flush pipeline.
     * <p>
     * Tags: interval, strategy (checkpoint/insert)
     * </p>
     */
    public static final String FLUSH_BATCHES_TOTAL = "meter.flush.batches.total";

    /**
     * Counter: drains that failed and retained their batches.
     * <p>
     * Tags: interval
     * </p>
     */
    public static final String FLUSH_FAILURES_TOTAL = "meter.flush.failures.total";

    /**
     * Timer: duration of one interval drain.
     * <p>
     * Tags: interval
     * </p>
     */
    public static final String FLUSH_LATENCY = "meter.flush.latency";

    /**
     * Gauge: batches waiting in the flush pipeline.
     */
    public static final String FLUSH_PENDING = "meter.flush.pending";

    /**
     * Counter: rate limiter decisions.
     * <p>
     * Tags: outcome (allowed/limited)
     * </p>
     */
    public static final String RATE_LIMIT_DECISIONS_TOTAL = "meter.ratelimit.decisions.total";

    /**
     * Counter: provisioning task attempts.
     * <p>
     * Tags: action, outcome (completed/retry/dead_letter)
     * </p>
     */
    public static final String PROVISIONING_ATTEMPTS_TOTAL = "meter.provisioning.attempts.total";

    /**
     * Counter: tasks moved to dead letter.
     * <p>
     * Tags: action
     * </p>
     */
    public static final String PROVISIONING_DEAD_LETTER_TOTAL = "meter.provisioning.dead_letter.total";

    /**
     * Counter: machines moved into their grace period by the expiry sweep.
     */
    public static final String MACHINES_EXPIRED_TOTAL = "meter.provisioning.machines.expired.total";

    /**
     * Timer: Kafka publish latency.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String KAFKA_PUBLISH_LATENCY = "meter.kafka.publish.latency";

    /**
     * Counter: inbound Kafka records that could not be handled.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String KAFKA_CONSUME_ERRORS_TOTAL = "meter.kafka.consume.errors.total";
}
