package com.meterline.engine.worker;

import com.meterline.core.error.SpawnFailedException;
import com.meterline.core.error.WorkerUnavailableException;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.MetricSpec;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.model.TenantKey;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.core.msg.ControlMessages.PlanLimitChanged;
import com.meterline.core.msg.ControlMessages.RecordMetric;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.Actor;
import com.meterline.core.runtime.ActorRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Common behaviour of business and customer workers.
 * <p>
 * <b>Startup:</b> plan limits load asynchronously; the result comes back through the mailbox as
 * {@link TenantMessage.LimitsLoaded}. Until then the tenant's own metric commands and limit
 * changes are stashed and replayed in arrival order. A failed load leaves the tenant running
 * without cached limits.
 * </p>
 * <p>
 * <b>Children:</b> one metric worker per metric name, spawned through the supervisor on the first
 * command or when a limit is materialized. Idle tenants cascade {@code Shutdown} to their children
 * before stopping.
 * </p>
 */
public abstract class TenantWorker extends Actor<TenantMessage> {
    private static final Logger log = LoggerFactory.getLogger(TenantWorker.class);

    private static final int PLAN_PRECEDENCE = 0;
    private static final int BUSINESS_PRECEDENCE = 1;
    private static final int CUSTOMER_PRECEDENCE = 2;

    protected final WorkerContext ctx;
    protected final TenantKey tenant;
    protected final Map<String, PlanLimit> limits = new HashMap<>();
    protected final Set<String> metrics = new HashSet<>();
    protected String planId;

    private final List<TenantMessage> stash = new ArrayList<>();
    private boolean limitsLoaded;
    private long lastActivity;

    protected TenantWorker(String key, WorkerContext ctx, TenantKey tenant) {
        super(key, TenantMessage.class, ctx.getSystem());
        this.ctx = ctx;
        this.tenant = tenant;
        this.lastActivity = now();
    }

    /**
     * Loads the tenant's limits.
     *
     * @param hint plan change that triggered a reload, {@code null} at spawn
     */
    protected abstract Mono<TenantMessage.LimitsLoaded> loadLimits(PlanChanged hint);

    protected abstract Duration idleTimeout();

    /**
     * Handles a command addressed to another tenant. Rejected by default.
     */
    protected void routeForeign(TenantMessage.MetricCommand command) {
        log.warn("Tenant {} received a command for {}", tenant, command.tenant());
        reject(command, "misrouted");
    }

    /**
     * Subclass messages not handled here.
     */
    protected void handleOther(TenantMessage message) {
        log.debug("Tenant {} ignoring {}", tenant, message.getClass().getSimpleName());
    }

    /**
     * Stops child tenants. Metric children are handled here.
     */
    protected void cascadeShutdown() {
    }

    protected void describe(TenantSnapshot.TenantSnapshotBuilder snapshot) {
    }

    @Override
    protected boolean isTerminal(TenantMessage message) {
        return message instanceof TenantMessage.Shutdown;
    }

    @Override
    protected boolean forwardsAfterStop(TenantMessage message) {
        return message instanceof TenantMessage.MetricCommand;
    }

    @Override
    protected abstract Function<String, ? extends TenantWorker> successor();

    @Override
    protected void preStart() {
        subscribe(Topics.tick(ctx.getConfig().getCleanupInterval()), TickEvent.class,
            tick -> new TenantMessage.CleanupTick(tick.timestamp()));
        subscribe(Topics.PLAN_LIMITS, PlanLimitChanged.class, TenantMessage.ApplyPlanLimit::new);
        startLoad(null);
    }

    private void startLoad(PlanChanged hint) {
        track(Mono.defer(() -> loadLimits(hint))
            .timeout(ctx.getConfig().getLimitLoadTimeout())
            .subscribe(
                this::tell,
                err -> tell(new TenantMessage.LimitsLoadFailed(err))
            ));
    }

    @Override
    protected void onMessage(TenantMessage message) {
        if (message instanceof TenantMessage.MetricCommand command) {
            lastActivity = now();
            if (!tenant.equals(command.tenant())) {
                routeForeign(command);
            } else if (!limitsLoaded) {
                stash(command);
            } else {
                handleCommand(command);
            }
        } else if (message instanceof TenantMessage.LimitsLoaded loaded) {
            applyLoaded(loaded);
            if (!limitsLoaded) {
                limitsLoaded = true;
                unstash();
            }
        } else if (message instanceof TenantMessage.LimitsLoadFailed failed) {
            log.warn("Tenant {} failed to load limits, running with cached limits only: {}",
                tenant, failed.error().toString());
            if (!limitsLoaded) {
                limitsLoaded = true;
                unstash();
            }
        } else if (message instanceof TenantMessage.ApplyPlanLimit apply) {
            if (!limitsLoaded) {
                stash(apply);
            } else {
                applyChange(apply.change());
            }
        } else if (message instanceof TenantMessage.ChangePlan change) {
            lastActivity = now();
            if (!limitsLoaded) {
                stash(change);
            } else {
                changePlan(change.change());
            }
        } else if (message instanceof TenantMessage.Describe describe) {
            describe.reply().success(snapshot());
        } else if (message instanceof TenantMessage.CleanupTick cleanup) {
            metrics.removeIf(name -> liveMetric(name).isEmpty());
            long idle = cleanup.timestamp() - lastActivity;
            if (idle > idleTimeout().toMillis()) {
                log.info("Tenant {} idle for {} ms, shutting down", tenant, idle);
                ctx.getMetrics().recordReaped(kind());
                shutdown();
            }
        } else if (message instanceof TenantMessage.Shutdown) {
            shutdown();
        } else {
            handleOther(message);
        }
    }

    private void handleCommand(TenantMessage.MetricCommand command) {
        if (command instanceof TenantMessage.RecordSample sample) {
            RecordMetric cmd = sample.command();
            MetricMessage.Sample message = new MetricMessage.Sample(cmd.getValue(), cmd.getTags());
            if (deliverToMetric(cmd.getMetricName(), specFor(cmd), message)) {
                ctx.getMetrics().recordSample(tenant.scope());
            }
        } else if (command instanceof TenantMessage.CheckMetric check) {
            RecordMetric cmd = check.command();
            MetricMessage.CheckAndAdd message = new MetricMessage.CheckAndAdd(cmd.getValue(), cmd.getTags(), check.reply());
            if (!deliverToMetric(cmd.getMetricName(), specFor(cmd), message)) {
                reject(check, "metric worker unavailable");
            }
        } else if (command instanceof TenantMessage.ResetBillingCycle reset) {
            log.info("Billing cycle reset for {} (period start {})", tenant, reset.reset().getPeriodStart());
            resetBillingCycle();
        } else if (command instanceof TenantMessage.QueryMetric query) {
            MetricSpec spec = Optional.ofNullable(limits.get(query.metricName()))
                .map(limit -> MetricSpec.fromLimit(limit, ctx.getConfig().getPlanMetricFlushInterval()))
                .orElseGet(() -> MetricSpec.builder().metricName(query.metricName()).build());
            if (!deliverToMetric(query.metricName(), spec, new MetricMessage.GetLimitStatus(query.reply()))) {
                reject(query, "metric worker unavailable");
            }
        }
    }

    /**
     * Plan limits are delivered through the supervisor so a worker that is gone or shutting down
     * is replaced and the reset still reaches the stored total. Other live metrics are told directly.
     */
    private void resetBillingCycle() {
        for (Map.Entry<String, PlanLimit> entry : limits.entrySet()) {
            MetricSpec spec = MetricSpec.fromLimit(entry.getValue(), ctx.getConfig().getPlanMetricFlushInterval());
            if (!deliverToMetric(entry.getKey(), spec, new MetricMessage.BillingReset())) {
                log.warn("Billing reset of {} on {} was not delivered", entry.getKey(), tenant);
            }
        }
        for (String metricName : metrics) {
            if (!limits.containsKey(metricName)) {
                liveMetric(metricName).ifPresent(ref -> ref.offer(new MetricMessage.BillingReset()));
            }
        }
    }

    private MetricSpec specFor(RecordMetric cmd) {
        PlanLimit cached = limits.get(cmd.getMetricName());
        return MetricSpec.builder()
            .metricName(cmd.getMetricName())
            .operation(cmd.getOperation())
            .kind(cmd.getMetricKind())
            .flushInterval(cmd.getFlushInterval())
            .tags(cmd.getTags() != null ? cmd.getTags() : Map.of())
            .planLimit(cached != null ? cached : cmd.getPlanLimit())
            .planLinked(cached != null)
            .build();
    }

    /**
     * @return false when the child could not be spawned or its mailbox is full
     */
    protected boolean deliverToMetric(String metricName, MetricSpec spec, MetricMessage message) {
        try {
            boolean delivered = ctx.getSystem().getSupervisor().deliver(
                WorkerKeys.metric(tenant, metricName), MetricWorker.factory(ctx, tenant, spec), message);
            metrics.add(metricName);
            return delivered;
        } catch (SpawnFailedException e) {
            log.error("Tenant {} could not spawn metric {}", tenant, metricName, e);
            return false;
        }
    }

    private void materialize(String metricName, PlanLimit limit, Double restoredValue) {
        MetricSpec spec = MetricSpec.fromLimit(limit, ctx.getConfig().getPlanMetricFlushInterval())
            .withRestoredValue(restoredValue);
        try {
            ctx.getSystem().getSupervisor().startChild(
                WorkerKeys.metric(tenant, metricName), MetricWorker.factory(ctx, tenant, spec));
            metrics.add(metricName);
        } catch (SpawnFailedException e) {
            log.error("Tenant {} could not materialize limit on {}", tenant, metricName, e);
        }
    }

    private void updateChild(String metricName, PlanLimit limit, Double restoredValue) {
        Optional<ActorRef<?>> live = liveMetric(metricName);
        if (live.isPresent()) {
            live.get().offer(new MetricMessage.UpdatePlanLimit(limit));
        } else if (limit != null) {
            materialize(metricName, limit, restoredValue);
        }
    }

    protected Optional<ActorRef<?>> liveMetric(String metricName) {
        return ctx.getSystem().getRegistry().lookup(WorkerKeys.metric(tenant, metricName))
            .filter(ActorRef::isAlive);
    }

    private void applyLoaded(TenantMessage.LimitsLoaded loaded) {
        planId = loaded.planId();
        Map<String, PlanLimit> next = new HashMap<>();
        Map<String, Double> restored = new HashMap<>();
        for (TenantMessage.LoadedLimit entry : loaded.limits()) {
            PlanLimit limit = entry.limit();
            PlanLimit current = next.get(limit.getMetricName());
            if (current == null || precedence(limit) >= precedence(current)) {
                next.put(limit.getMetricName(), limit);
                if (entry.restoredValue() != null) {
                    restored.put(limit.getMetricName(), entry.restoredValue());
                }
            }
        }
        replaceLimits(next, restored);
        log.debug("Tenant {} loaded {} limits (plan {})", tenant, next.size(), planId);
    }

    private void replaceLimits(Map<String, PlanLimit> next, Map<String, Double> restored) {
        for (String metricName : new ArrayList<>(limits.keySet())) {
            if (!next.containsKey(metricName)) {
                limits.remove(metricName);
                updateChild(metricName, null, null);
            }
        }
        next.forEach((metricName, limit) -> {
            if (!limit.equals(limits.get(metricName)) || liveMetric(metricName).isEmpty()) {
                limits.put(metricName, limit);
                updateChild(metricName, limit, restored.get(metricName));
            }
        });
    }

    private void applyChange(PlanLimitChanged change) {
        PlanLimit limit = change.getLimit();
        if (limit == null || !limit.appliesTo(tenant, planId)) {
            return;
        }
        String metricName = limit.getMetricName();
        PlanLimit current = limits.get(metricName);
        if (change.isRemoved()) {
            if (current != null && precedence(current) == precedence(limit)) {
                limits.remove(metricName);
                updateChild(metricName, null, null);
                log.info("Tenant {} dropped limit on {}", tenant, metricName);
            }
        } else if (current == null || precedence(limit) >= precedence(current)) {
            limits.put(metricName, limit);
            updateChild(metricName, limit, null);
            log.info("Tenant {} applied limit on {}: {} {}", tenant, metricName,
                limit.getBreachOperator().wireName(), limit.getLimitValue());
        }
    }

    private void changePlan(PlanChanged change) {
        log.info("Tenant {} moving from plan {} to {}", tenant, planId, change.getPlanId());
        if (change.getPlanId() != null) {
            planId = change.getPlanId();
        }
        onPlanChanged(change);
        if (change.getLimits() == null) {
            startLoad(change);
            return;
        }
        Map<String, PlanLimit> next = new HashMap<>();
        limits.forEach((metricName, limit) -> {
            if (precedence(limit) > PLAN_PRECEDENCE) {
                next.put(metricName, limit);
            }
        });
        for (PlanLimit limit : change.getLimits()) {
            PlanLimit current = next.get(limit.getMetricName());
            if (current == null || precedence(limit) >= precedence(current)) {
                next.put(limit.getMetricName(), limit);
            }
        }
        replaceLimits(next, Map.of());
    }

    /**
     * Updates cached subscription fields. Runs before the plan's limits are replaced.
     */
    protected void onPlanChanged(PlanChanged change) {
    }

    /**
     * Restores the persisted total of checkpoint limits so enforcement survives a respawn.
     */
    protected Mono<TenantMessage.LoadedLimit> restore(PlanLimit limit) {
        if (limit.getMetricKind() != MetricKind.CHECKPOINT) {
            return Mono.just(new TenantMessage.LoadedLimit(limit, null));
        }
        return ctx.getStore()
            .checkpointValue(tenant.getBusinessId(), tenant.getCustomerId(), tenant.scope(), limit.getMetricName())
            .map(value -> new TenantMessage.LoadedLimit(limit, value))
            .defaultIfEmpty(new TenantMessage.LoadedLimit(limit, null))
            .onErrorResume(e -> {
                log.warn("Tenant {} could not restore {}: {}", tenant, limit.getMetricName(), e.toString());
                return Mono.just(new TenantMessage.LoadedLimit(limit, null));
            });
    }

    private void stash(TenantMessage message) {
        if (stash.size() >= ctx.getSystem().getMailboxCapacity()) {
            log.warn("Tenant {} stash is full, rejecting {}", tenant, message.getClass().getSimpleName());
            if (message instanceof TenantMessage.MetricCommand command) {
                reject(command, "limits still loading");
            }
            return;
        }
        stash.add(message);
    }

    private void unstash() {
        List<TenantMessage> pending = new ArrayList<>(stash);
        stash.clear();
        pending.forEach(this::onMessage);
    }

    protected void reject(TenantMessage.MetricCommand command, String reason) {
        String target = WorkerKeys.tenant(command.tenant());
        if (command instanceof TenantMessage.CheckMetric check) {
            check.reply().error(new WorkerUnavailableException(target, reason));
        } else if (command instanceof TenantMessage.QueryMetric query) {
            query.reply().error(new WorkerUnavailableException(target, reason));
        } else {
            log.warn("Dropping {} for {}: {}", command.getClass().getSimpleName(), target, reason);
        }
    }

    private void shutdown() {
        if (isStopped()) {
            return;
        }
        if (!limitsLoaded) {
            limitsLoaded = true;
            unstash();
        }
        for (String metricName : metrics) {
            liveMetric(metricName).ifPresent(ref -> ref.offer(new MetricMessage.Shutdown()));
        }
        cascadeShutdown();
        stop();
    }

    private TenantSnapshot snapshot() {
        TenantSnapshot.TenantSnapshotBuilder snapshot = TenantSnapshot.builder()
            .tenant(tenant)
            .planId(planId)
            .limitsLoaded(limitsLoaded)
            .limits(limits)
            .metrics(metrics)
            .lastActivity(lastActivity);
        describe(snapshot);
        return snapshot.build();
    }

    private static int precedence(PlanLimit limit) {
        if (limit.getCustomerId() != null) {
            return CUSTOMER_PRECEDENCE;
        }
        return limit.getPlanId() == null ? BUSINESS_PRECEDENCE : PLAN_PRECEDENCE;
    }
}
