package com.meterline.engine.worker;

import com.meterline.core.model.CheckResult;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.LimitStatus;
import com.meterline.core.model.MetricBatch;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.MetricSpec;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.model.TenantKey;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.ControlMessages.LimitBreached;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Owns the aggregate of one named metric of one tenant.
 * <p>
 * <b>Window:</b> samples accumulate until the tick of the metric's flush interval. A window
 * that saw operations is handed to the flush pipeline as a {@link MetricBatch}; afterwards
 * reset metrics return to their initial value while checkpoint metrics keep the aggregate
 * and only move the flushed baseline forward.
 * </p>
 * <p>
 * <b>Limits:</b> {@link MetricMessage.CheckAndAdd} applies the delta and, when a deny limit is
 * breached, restores the previous state before replying. Notifying limits emit one
 * {@link LimitBreached} per transition into breach.
 * </p>
 */
public class MetricWorker extends Actor<MetricMessage> {
    private static final Logger log = LoggerFactory.getLogger(MetricWorker.class);

    private static final String IP_SCOPE = "ip";

    private final WorkerContext ctx;
    private final TenantKey tenant;
    private final MetricSpec spec;

    private PlanLimit planLimit;
    private double value;
    private long sampleCount;
    private long operationCount;
    private long windowStart;
    private double lastFlushedValue;
    private boolean breached;
    private long lastActivity;
    private final Map<String, String> tags;

    /**
     * @param tenant owning tenant, {@code null} for rate-limit counters
     */
    public MetricWorker(String key, WorkerContext ctx, TenantKey tenant, MetricSpec spec) {
        super(key, MetricMessage.class, ctx.getSystem());
        this.ctx = ctx;
        this.tenant = tenant;
        this.spec = spec;
        this.planLimit = spec.getPlanLimit();
        this.value = spec.startingValue();
        this.lastFlushedValue = value;
        this.tags = new HashMap<>(spec.getTags() != null ? spec.getTags() : Map.of());
        this.windowStart = now();
        this.lastActivity = windowStart;
        this.breached = planLimit != null && planLimit.isBreached(value);
    }

    public static Function<String, MetricWorker> factory(WorkerContext ctx, TenantKey tenant, MetricSpec spec) {
        return key -> new MetricWorker(key, ctx, tenant, spec);
    }

    @Override
    public String kind() {
        return tenant == null ? IP_SCOPE : "metric";
    }

    @Override
    protected boolean isTerminal(MetricMessage message) {
        return message instanceof MetricMessage.Shutdown;
    }

    @Override
    protected boolean forwardsAfterStop(MetricMessage message) {
        return message instanceof MetricMessage.Sample
            || message instanceof MetricMessage.CheckAndAdd
            || message instanceof MetricMessage.GetValue
            || message instanceof MetricMessage.GetLimitStatus;
    }

    /**
     * Continues from the current aggregate and limit. Checkpoint totals were persisted by the
     * final flush, so the successor's deltas start from there.
     */
    @Override
    protected Function<String, MetricWorker> successor() {
        MetricSpec next = spec.withPlanLimit(planLimit);
        if (spec.getKind() == MetricKind.CHECKPOINT) {
            next = next.withRestoredValue(value);
        }
        return factory(ctx, tenant, next);
    }

    @Override
    protected void preStart() {
        subscribe(Topics.tick(spec.getFlushInterval()), TickEvent.class,
            tick -> new MetricMessage.FlushTick(tick.interval()));
        if (spec.getIdleTimeout() != null) {
            subscribe(Topics.tick(ctx.getConfig().getCleanupInterval()), TickEvent.class,
                tick -> new MetricMessage.CleanupTick(tick.timestamp()));
        }
    }

    @Override
    protected void onMessage(MetricMessage message) {
        if (message instanceof MetricMessage.Sample sample) {
            apply(sample.value());
            mergeTags(sample.tags());
            checkBreachTransition();
        } else if (message instanceof MetricMessage.CheckAndAdd check) {
            checkAndAdd(check);
        } else if (message instanceof MetricMessage.FlushTick tick) {
            if (tick.interval() == spec.getFlushInterval() && operationCount > 0) {
                flush();
            }
        } else if (message instanceof MetricMessage.ResetToInitial) {
            resetToInitial();
        } else if (message instanceof MetricMessage.BillingReset) {
            if (spec.getKind() == MetricKind.RESET || spec.isPlanLinked()) {
                if (operationCount > 0) {
                    flush();
                }
                resetToInitial();
                if (spec.getKind() == MetricKind.CHECKPOINT && spec.isPersistent()) {
                    submitReset();
                }
                log.debug("Billing reset of {}", key());
            }
        } else if (message instanceof MetricMessage.UpdatePlanLimit update) {
            planLimit = update.limit();
            log.debug("Limit of {} updated: {}", key(), planLimit);
            checkBreachTransition();
        } else if (message instanceof MetricMessage.GetValue get) {
            get.reply().success(value);
        } else if (message instanceof MetricMessage.GetLimitStatus get) {
            get.reply().success(limitStatus());
        } else if (message instanceof MetricMessage.CleanupTick cleanup) {
            if (spec.getIdleTimeout() != null && cleanup.timestamp() - lastActivity > spec.getIdleTimeout().toMillis()) {
                log.debug("Metric {} idle for {} ms, stopping", key(), cleanup.timestamp() - lastActivity);
                ctx.getMetrics().recordReaped(kind());
                shutdown();
            }
        } else if (message instanceof MetricMessage.Shutdown) {
            shutdown();
        }
    }

    private void checkAndAdd(MetricMessage.CheckAndAdd check) {
        double previousValue = value;
        long previousSamples = sampleCount;
        long previousOperations = operationCount;
        long previousActivity = lastActivity;

        apply(check.delta());
        if (planLimit != null && planLimit.denies(value)) {
            double attempted = value;
            value = previousValue;
            sampleCount = previousSamples;
            operationCount = previousOperations;
            lastActivity = previousActivity;
            ctx.getMetrics().recordDenied();
            log.debug("Denied {} on {}: {} would breach {} {}", check.delta(), key(), attempted,
                planLimit.getBreachOperator().wireName(), planLimit.getLimitValue());
            check.reply().success(CheckResult.denied(value, attempted, planLimit));
            return;
        }
        mergeTags(check.tags());
        checkBreachTransition();
        check.reply().success(CheckResult.allowed(value, planLimit));
    }

    private void apply(double sample) {
        sampleCount++;
        value = spec.getOperation().apply(value, sample, sampleCount);
        operationCount++;
        lastActivity = now();
    }

    private void mergeTags(Map<String, String> incoming) {
        if (incoming != null && !incoming.isEmpty()) {
            tags.putAll(incoming);
        }
    }

    private void checkBreachTransition() {
        boolean nowBreached = planLimit != null && planLimit.isBreached(value);
        if (nowBreached && !breached && planLimit.getBreachAction().notifies() && tenant != null) {
            ctx.getMetrics().recordBreach(planLimit.getBreachAction());
            log.info("Limit breached on {}: {} {} {}", key(), value,
                planLimit.getBreachOperator().wireName(), planLimit.getLimitValue());
            try {
                ctx.getBreachListener().onBreach(LimitBreached.builder()
                    .businessId(tenant.getBusinessId())
                    .customerId(tenant.getCustomerId())
                    .metricName(spec.getMetricName())
                    .value(value)
                    .limitValue(planLimit.getLimitValue())
                    .breachOperator(planLimit.getBreachOperator())
                    .breachAction(planLimit.getBreachAction())
                    .planId(planLimit.getPlanId())
                    .webhookUrls(planLimit.getWebhookUrls())
                    .ts(now())
                    .build());
            } catch (RuntimeException e) {
                log.warn("Breach listener failed for {}", key(), e);
            }
        }
        breached = nowBreached;
    }

    private void flush() {
        long at = now();
        if (spec.isPersistent()) {
            ctx.getBatchSink().submit(MetricBatch.builder()
                .businessId(tenant != null ? tenant.getBusinessId() : null)
                .customerId(tenant != null ? tenant.getCustomerId() : null)
                .scope(tenant != null ? tenant.scope() : IP_SCOPE)
                .metricName(spec.getMetricName())
                .kind(spec.getKind())
                .operation(spec.getOperation())
                .flushInterval(spec.getFlushInterval())
                .aggregatedValue(value)
                .delta(value - lastFlushedValue)
                .operationCount(operationCount)
                .windowStart(windowStart)
                .windowEnd(at)
                .tags(Map.copyOf(tags))
                .build());
        }
        if (spec.getKind() == MetricKind.RESET) {
            value = spec.getInitialValue();
            sampleCount = 0;
            breached = planLimit != null && planLimit.isBreached(value);
        }
        lastFlushedValue = value;
        operationCount = 0;
        windowStart = at;
    }

    private void submitReset() {
        long at = now();
        ctx.getBatchSink().submit(MetricBatch.builder()
            .businessId(tenant.getBusinessId())
            .customerId(tenant.getCustomerId())
            .scope(tenant.scope())
            .metricName(spec.getMetricName())
            .kind(MetricKind.CHECKPOINT)
            .operation(spec.getOperation())
            .flushInterval(spec.getFlushInterval())
            .aggregatedValue(value)
            .reset(true)
            .windowStart(at)
            .windowEnd(at)
            .tags(Map.copyOf(tags))
            .build());
    }

    private void resetToInitial() {
        value = spec.getInitialValue();
        sampleCount = 0;
        operationCount = 0;
        lastFlushedValue = value;
        windowStart = now();
        breached = planLimit != null && planLimit.isBreached(value);
    }

    private void shutdown() {
        if (operationCount > 0) {
            flush();
        }
        stop();
    }

    private LimitStatus limitStatus() {
        return LimitStatus.builder()
            .metricName(spec.getMetricName())
            .value(value)
            .limit(planLimit)
            .breached(planLimit != null && planLimit.isBreached(value))
            .build();
    }

    public FlushInterval flushInterval() {
        return spec.getFlushInterval();
    }
}
