package com.meterline.engine;

import com.meterline.core.model.CheckResult;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.LimitStatus;
import com.meterline.core.model.TenantKey;
import com.meterline.core.msg.ControlMessages.BillingCycleReset;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.core.msg.ControlMessages.PlanLimitChanged;
import com.meterline.core.msg.ControlMessages.RecordMetric;
import com.meterline.core.msg.Topics;
import com.meterline.core.error.SpawnFailedException;
import com.meterline.core.error.WorkerUnavailableException;
import com.meterline.core.runtime.ActorRef;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.core.runtime.TimeoutPolicy;
import com.meterline.engine.worker.BusinessWorker;
import com.meterline.engine.worker.TenantMessage;
import com.meterline.engine.worker.TenantSnapshot;
import com.meterline.engine.worker.WorkerContext;
import com.meterline.engine.worker.WorkerKeys;
import com.meterline.provisioner.MachineListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for metric commands and tenant lifecycle changes.
 * <p>
 * Metric commands and billing resets always enter through the business worker of their tenant,
 * which spawns lazily and forwards customer-scoped commands. Plan and machine changes only reach
 * tenants that are live; a tenant spawned later reads its state from the store.
 * </p>
 */
public class MeterRouter implements MachineListener {
    private static final Logger log = LoggerFactory.getLogger(MeterRouter.class);

    private final WorkerContext ctx;
    private final ActorSystem system;
    private final Duration askTimeout;
    private final TimeoutPolicy policy;

    public MeterRouter(WorkerContext ctx) {
        this.ctx = ctx;
        this.system = ctx.getSystem();
        this.askTimeout = ctx.getConfig().getAskTimeout();
        this.policy = ctx.getConfig().getTimeoutPolicy();
    }

    /**
     * Fire-and-forget sample.
     *
     * @return false when the sample could not be enqueued
     */
    public boolean record(RecordMetric command) {
        TenantKey tenant = command.tenantKey();
        try {
            return system.getSupervisor().deliver(businessKey(tenant), BusinessWorker.factory(ctx, tenant),
                new TenantMessage.RecordSample(command));
        } catch (SpawnFailedException e) {
            log.error("Dropping {} for {}: {}", command.getMetricName(), tenant, e.getMessage());
            return false;
        }
    }

    /**
     * Atomic add-and-check. A request the metric worker does not answer in time is decided
     * by the configured timeout policy.
     */
    public Mono<CheckResult> checkAndAdd(RecordMetric command) {
        TenantKey tenant = command.tenantKey();
        return system.getSupervisor()
            .<TenantMessage, CheckResult>ask(businessKey(tenant), BusinessWorker.factory(ctx, tenant),
                reply -> new TenantMessage.CheckMetric(command, reply), askTimeout)
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("Check of {} for {} timed out after {} ms, applying {}",
                    command.getMetricName(), tenant, askTimeout.toMillis(), policy);
                ctx.getMetrics().recordAskTimeout(policy);
                return Mono.just(CheckResult.timedOut(policy.allows()));
            });
    }

    public Mono<LimitStatus> query(TenantKey tenant, String metricName) {
        return system.getSupervisor()
            .ask(businessKey(tenant), BusinessWorker.factory(ctx, tenant),
                reply -> new TenantMessage.QueryMetric(tenant, metricName, reply), askTimeout);
    }

    /**
     * Broadcasts a limit change to every live tenant; each applies it when it matches.
     */
    public void applyPlanLimit(PlanLimitChanged change) {
        system.getPubSub().publish(Topics.PLAN_LIMITS, change);
    }

    public boolean planChanged(PlanChanged change) {
        return tellLive(change.tenantKey(), new TenantMessage.ChangePlan(change));
    }

    /**
     * Starts a new billing period. The tenant is spawned when not live so that persisted
     * checkpoint totals of its limits are reset too.
     *
     * @return false when the reset could not be enqueued
     */
    public boolean billingReset(BillingCycleReset reset) {
        TenantKey tenant = reset.tenantKey();
        try {
            return system.getSupervisor().deliver(businessKey(tenant), BusinessWorker.factory(ctx, tenant),
                new TenantMessage.ResetBillingCycle(reset));
        } catch (SpawnFailedException e) {
            log.error("Dropping billing reset for {}: {}", tenant, e.getMessage());
            return false;
        }
    }

    @Override
    public void onMachinesChanged(String businessId, String customerId, List<CustomerMachine> machines) {
        tellLive(TenantKey.customer(businessId, customerId), new TenantMessage.UpdateMachines(machines));
    }

    /**
     * Snapshot of a live tenant; empty when the tenant is not running.
     */
    public Mono<TenantSnapshot> describe(TenantKey tenant) {
        Optional<ActorRef<?>> ref = liveTenant(tenant);
        if (ref.isEmpty()) {
            return Mono.empty();
        }
        return Mono.<TenantSnapshot>create(sink -> {
            if (!ref.get().offer(new TenantMessage.Describe(sink))) {
                sink.error(new WorkerUnavailableException(ref.get().key(), "stopped"));
            }
        }).timeout(askTimeout);
    }

    private boolean tellLive(TenantKey tenant, TenantMessage message) {
        Optional<ActorRef<?>> ref = liveTenant(tenant);
        if (ref.isEmpty()) {
            log.debug("Tenant {} not live, skipping {}", tenant, message.getClass().getSimpleName());
            return false;
        }
        return ref.get().offer(message);
    }

    private Optional<ActorRef<?>> liveTenant(TenantKey tenant) {
        return system.getRegistry().lookup(WorkerKeys.tenant(tenant))
            .filter(ActorRef::isAlive);
    }

    private static String businessKey(TenantKey tenant) {
        return WorkerKeys.tenant(tenant.businessKey());
    }
}
