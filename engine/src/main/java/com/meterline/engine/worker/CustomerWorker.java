package com.meterline.engine.worker;

import com.meterline.core.model.Customer;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.TenantKey;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.engine.store.IMetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Owns one customer's metrics, its cached subscription and its machine list.
 */
public class CustomerWorker extends TenantWorker {
    private static final Logger log = LoggerFactory.getLogger(CustomerWorker.class);

    private String stripePriceId;
    private List<CustomerMachine> machines = List.of();

    public CustomerWorker(String key, WorkerContext ctx, TenantKey tenant) {
        super(key, ctx, tenant);
    }

    public static Function<String, CustomerWorker> factory(WorkerContext ctx, TenantKey tenant) {
        return key -> new CustomerWorker(key, ctx, tenant);
    }

    @Override
    protected Function<String, CustomerWorker> successor() {
        return factory(ctx, tenant);
    }

    @Override
    public String kind() {
        return TenantKey.CUSTOMER_SCOPE;
    }

    @Override
    protected Duration idleTimeout() {
        return ctx.getConfig().getCustomerIdleTimeout();
    }

    /**
     * Plan id comes from the hint, then the customer record, then the Stripe price index.
     */
    @Override
    protected Mono<TenantMessage.LimitsLoaded> loadLimits(PlanChanged hint) {
        IMetricStore store = ctx.getStore();
        Mono<Optional<String>> plan;
        if (hint != null && hint.getPlanId() != null) {
            plan = Mono.just(Optional.of(hint.getPlanId()));
        } else if (hint != null && hint.getStripePriceId() != null) {
            plan = planForPrice(hint.getStripePriceId());
        } else {
            plan = store.getCustomer(tenant.getBusinessId(), tenant.getCustomerId())
                .flatMap(this::planOf)
                .defaultIfEmpty(Optional.empty());
        }
        return plan.flatMap(planId -> Flux.concat(
                    planId.map(store::planLimits).orElseGet(Flux::empty),
                    store.customerLimits(tenant.getBusinessId(), tenant.getCustomerId()))
                .concatMap(this::restore)
                .collectList()
                .map(list -> new TenantMessage.LimitsLoaded(planId.orElse(null), list)));
    }

    private Mono<Optional<String>> planOf(Customer customer) {
        if (customer.getPlanId() != null) {
            return Mono.just(Optional.of(customer.getPlanId()));
        }
        if (customer.getStripePriceId() != null) {
            return planForPrice(customer.getStripePriceId());
        }
        return Mono.just(Optional.empty());
    }

    private Mono<Optional<String>> planForPrice(String priceId) {
        return ctx.getStore().planIdForPrice(priceId)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    @Override
    protected void onPlanChanged(PlanChanged change) {
        if (change.getStripePriceId() != null) {
            stripePriceId = change.getStripePriceId();
        }
    }

    @Override
    protected void handleOther(TenantMessage message) {
        if (message instanceof TenantMessage.UpdateMachines update) {
            machines = List.copyOf(update.machines());
            log.info("Customer {} now has {} machines", tenant, machines.size());
        } else {
            super.handleOther(message);
        }
    }

    @Override
    protected void describe(TenantSnapshot.TenantSnapshotBuilder snapshot) {
        snapshot.stripePriceId(stripePriceId).machines(machines);
    }
}
