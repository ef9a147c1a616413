package com.meterline.engine.metrics;

import com.meterline.core.metrics.MetricsNames;
import com.meterline.core.metrics.MetricsTags;
import com.meterline.core.model.BreachAction;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.runtime.ProcessRegistry;
import com.meterline.core.runtime.TimeoutPolicy;
import com.meterline.engine.worker.WorkerKeys;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for an engine node.
 */
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter limitDenied;
    private final Counter rateLimitAllowed;
    private final Counter rateLimitLimited;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        limitDenied = Counter.builder(MetricsNames.LIMIT_DENIED_TOTAL)
            .description("Add-and-check calls rejected by a deny limit")
            .register(registry);

        rateLimitAllowed = Counter.builder(MetricsNames.RATE_LIMIT_DECISIONS_TOTAL)
            .tag(MetricsTags.OUTCOME, "allowed")
            .description("Requests admitted by the IP rate limiter")
            .register(registry);

        rateLimitLimited = Counter.builder(MetricsNames.RATE_LIMIT_DECISIONS_TOTAL)
            .tag(MetricsTags.OUTCOME, "limited")
            .description("Requests rejected by the IP rate limiter")
            .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void bindJvmMetrics() {
        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
    }

    /**
     * Live worker gauges, one per worker kind, read from the process registry.
     */
    public void bindWorkerGauges(ProcessRegistry processes) {
        liveGauge(processes, "business", WorkerKeys.BUSINESS_PREFIX);
        liveGauge(processes, "customer", WorkerKeys.CUSTOMER_PREFIX);
        liveGauge(processes, "metric", WorkerKeys.METRIC_PREFIX);
        liveGauge(processes, "ip", WorkerKeys.IP_PREFIX);
    }

    public void bindPendingBatches(Supplier<Number> pending) {
        Gauge.builder(MetricsNames.FLUSH_PENDING, pending)
            .description("Batches waiting in the flush pipeline")
            .register(registry);
    }

    private void liveGauge(ProcessRegistry processes, String kind, String prefix) {
        Gauge.builder(MetricsNames.WORKERS_LIVE, processes, p -> p.countWithPrefix(prefix))
            .tag(MetricsTags.KIND, kind)
            .description("Live workers")
            .register(registry);
    }

    public void recordSample(String scope) {
        Counter.builder(MetricsNames.RECORDS_TOTAL)
            .tag(MetricsTags.SCOPE, scope)
            .register(registry)
            .increment();
    }

    public void recordDenied() {
        limitDenied.increment();
    }

    public void recordBreach(BreachAction action) {
        Counter.builder(MetricsNames.LIMIT_BREACHED_TOTAL)
            .tag(MetricsTags.ACTION, action.wireName())
            .register(registry)
            .increment();
    }

    public void recordReaped(String kind) {
        Counter.builder(MetricsNames.WORKERS_REAPED_TOTAL)
            .tag(MetricsTags.KIND, kind)
            .register(registry)
            .increment();
    }

    public void recordAskTimeout(TimeoutPolicy policy) {
        Counter.builder(MetricsNames.ASK_TIMEOUTS_TOTAL)
            .tag(MetricsTags.POLICY, policy.name().toLowerCase(Locale.ROOT))
            .register(registry)
            .increment();
    }

    public void recordRateLimit(boolean allowed) {
        (allowed ? rateLimitAllowed : rateLimitLimited).increment();
    }

    public void recordFlushed(FlushInterval interval, String strategy, int batches) {
        if (batches == 0) {
            return;
        }
        Counter.builder(MetricsNames.FLUSH_BATCHES_TOTAL)
            .tag(MetricsTags.INTERVAL, interval.label())
            .tag(MetricsTags.STRATEGY, strategy)
            .register(registry)
            .increment(batches);
    }

    public void recordFlushFailure(FlushInterval interval) {
        Counter.builder(MetricsNames.FLUSH_FAILURES_TOTAL)
            .tag(MetricsTags.INTERVAL, interval.label())
            .register(registry)
            .increment();
    }

    public void recordFlushLatency(FlushInterval interval, long startNanos) {
        Timer.builder(MetricsNames.FLUSH_LATENCY)
            .tag(MetricsTags.INTERVAL, interval.label())
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(200),
                Duration.ofMillis(1000)
            )
            .register(registry)
            .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    public void recordKafkaPublishLatency(String topic, long startNanos) {
        Timer.builder(MetricsNames.KAFKA_PUBLISH_LATENCY)
            .tag(MetricsTags.TOPIC, topic)
            .register(registry)
            .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    public void recordConsumeError(String topic) {
        Counter.builder(MetricsNames.KAFKA_CONSUME_ERRORS_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .register(registry)
            .increment();
    }
}
