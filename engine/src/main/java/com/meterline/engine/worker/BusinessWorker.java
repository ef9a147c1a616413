package com.meterline.engine.worker;

import com.meterline.core.error.SpawnFailedException;
import com.meterline.core.model.TenantKey;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.engine.store.IMetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Root of a business's worker tree. Owns the business-scoped metrics and routes
 * customer-scoped commands to child customer workers.
 */
public class BusinessWorker extends TenantWorker {
    private static final Logger log = LoggerFactory.getLogger(BusinessWorker.class);

    private final Set<String> customers = new HashSet<>();

    public BusinessWorker(String key, WorkerContext ctx, TenantKey tenant) {
        super(key, ctx, tenant);
    }

    public static Function<String, BusinessWorker> factory(WorkerContext ctx, TenantKey tenant) {
        return key -> new BusinessWorker(key, ctx, tenant.businessKey());
    }

    @Override
    protected Function<String, BusinessWorker> successor() {
        return factory(ctx, tenant);
    }

    @Override
    public String kind() {
        return TenantKey.BUSINESS_SCOPE;
    }

    @Override
    protected Duration idleTimeout() {
        return ctx.getConfig().getBusinessIdleTimeout();
    }

    @Override
    protected Mono<TenantMessage.LimitsLoaded> loadLimits(PlanChanged hint) {
        IMetricStore store = ctx.getStore();
        Mono<Optional<String>> plan = hint != null && hint.getPlanId() != null
            ? Mono.just(Optional.of(hint.getPlanId()))
            : store.getBusiness(tenant.getBusinessId())
                .map(business -> Optional.ofNullable(business.getCurrentPlanId()))
                .defaultIfEmpty(Optional.empty());
        return plan.flatMap(planId -> Flux.concat(
                    planId.map(store::planLimits).orElseGet(Flux::empty),
                    store.businessLimits(tenant.getBusinessId()))
                .concatMap(this::restore)
                .collectList()
                .map(list -> new TenantMessage.LimitsLoaded(planId.orElse(null), list)));
    }

    @Override
    protected void routeForeign(TenantMessage.MetricCommand command) {
        TenantKey target = command.tenant();
        if (!target.isCustomer() || !target.getBusinessId().equals(tenant.getBusinessId())) {
            super.routeForeign(command);
            return;
        }
        String key = WorkerKeys.tenant(target);
        try {
            if (!ctx.getSystem().getSupervisor().deliver(key, CustomerWorker.factory(ctx, target), command)) {
                reject(command, "customer worker unavailable");
            }
            customers.add(key);
        } catch (SpawnFailedException e) {
            log.error("Business {} could not spawn customer {}", tenant, target.getCustomerId(), e);
            reject(command, "spawn failed");
        }
    }

    @Override
    protected void cascadeShutdown() {
        for (String key : customers) {
            ctx.getSystem().getRegistry().lookup(key)
                .ifPresent(ref -> ref.offer(new TenantMessage.Shutdown()));
        }
        log.debug("Business {} cascaded shutdown to {} customers", tenant, customers.size());
    }

    @Override
    protected void describe(TenantSnapshot.TenantSnapshotBuilder snapshot) {
        customers.removeIf(key -> ctx.getSystem().getRegistry().lookup(key).isEmpty());
        snapshot.customers(customers);
    }
}
