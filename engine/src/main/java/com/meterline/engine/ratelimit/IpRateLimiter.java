package com.meterline.engine.ratelimit;

import com.meterline.core.model.BreachAction;
import com.meterline.core.model.BreachOperator;
import com.meterline.core.model.CheckResult;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.MetricSpec;
import com.meterline.core.model.Operation;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.runtime.Actor;
import com.meterline.core.runtime.TickScheduler;
import com.meterline.core.runtime.TimeoutPolicy;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.worker.MetricMessage;
import com.meterline.engine.worker.MetricWorker;
import com.meterline.engine.worker.WorkerContext;
import com.meterline.engine.worker.WorkerKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * Fixed-window request counter per source IP, built on metric workers keyed {@code ip:{addr}}.
 * <p>
 * Each counter sums requests, resets on its window's tick, is never persisted and is reaped
 * after the configured idle time. A request that would push the count past the maximum is
 * rejected and not counted.
 * </p>
 */
public class IpRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(IpRateLimiter.class);

    static final String METRIC_NAME = "requests";

    private final WorkerContext ctx;
    private final TickScheduler ticks;
    private final FlushInterval window;
    private final int maxRequests;
    private final TimeoutPolicy policy;
    private final EngineMetrics metrics;
    private final Function<String, ? extends Actor<MetricMessage>> workerFactory;

    public IpRateLimiter(WorkerContext ctx, TickScheduler ticks) {
        this(ctx, ticks, null);
    }

    /**
     * @param workerFactory overrides the counter factory; {@code null} uses metric workers
     */
    IpRateLimiter(WorkerContext ctx, TickScheduler ticks, Function<String, ? extends Actor<MetricMessage>> workerFactory) {
        EngineConfig config = ctx.getConfig();
        this.ctx = ctx;
        this.ticks = ticks;
        this.window = config.getIpRateLimitWindow();
        this.maxRequests = config.getIpRateLimitMax();
        this.policy = config.getTimeoutPolicy();
        this.metrics = ctx.getMetrics();
        this.workerFactory = workerFactory != null
            ? workerFactory
            : MetricWorker.factory(ctx, null, counterSpec(config));
    }

    static MetricSpec counterSpec(EngineConfig config) {
        return MetricSpec.builder()
            .metricName(METRIC_NAME)
            .operation(Operation.SUM)
            .kind(MetricKind.RESET)
            .flushInterval(config.getIpRateLimitWindow())
            .persistent(false)
            .idleTimeout(config.getIpIdleTimeout())
            .planLimit(PlanLimit.builder()
                .metricName(METRIC_NAME)
                .limitValue(config.getIpRateLimitMax())
                .breachOperator(BreachOperator.GT)
                .breachAction(BreachAction.DENY)
                .metricKind(MetricKind.RESET)
                .build())
            .build();
    }

    /**
     * Counts one request from {@code address} unless the window is exhausted.
     * <p>
     * When the counter does not answer in time the configured {@link TimeoutPolicy} decides.
     * </p>
     */
    public Mono<RateLimitDecision> checkAndIncrement(String address) {
        String key = WorkerKeys.ip(address);
        return ctx.getSystem().getSupervisor()
            .<MetricMessage, CheckResult>ask(key, workerFactory,
                reply -> new MetricMessage.CheckAndAdd(1, Map.of(), reply),
                ctx.getConfig().getAskTimeout())
            .map(this::decide)
            .onErrorResume(e -> {
                log.warn("Rate limit check for {} failed, applying {}: {}", address, policy, e.toString());
                metrics.recordAskTimeout(policy);
                return Mono.just(policy.allows()
                    ? new RateLimitDecision.Allowed(0, maxRequests)
                    : new RateLimitDecision.RateLimited(0, maxRequests, ticks.secondsUntilNext(window)));
            })
            .doOnNext(decision -> metrics.recordRateLimit(decision.allowed()));
    }

    private RateLimitDecision decide(CheckResult result) {
        long count = (long) result.value();
        if (result.allowed()) {
            return new RateLimitDecision.Allowed(count, Math.max(0, maxRequests - count));
        }
        log.debug("Rate limited at {} of {}", count, maxRequests);
        return new RateLimitDecision.RateLimited(count, maxRequests, ticks.secondsUntilNext(window));
    }
}
