package com.meterline.engine.store;

import com.meterline.core.model.Business;
import com.meterline.core.model.Customer;
import com.meterline.core.model.MetricRecord;
import com.meterline.core.model.PlanLimit;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Persistence used by the engine: metric writes and the tenant reads needed at worker spawn.
 * <p>
 * Write failures surface as {@link com.meterline.core.error.PersistenceWriteException}.
 * </p>
 */
public interface IMetricStore {

    /**
     * Adds {@code delta} to the stored checkpoint total in one atomic upsert.
     */
    Mono<Void> atomicIncrement(String businessId, String customerId, String metricName,
                               double delta, String scope, Map<String, String> tags);

    /**
     * Overwrites the stored checkpoint total, used when a billing period starts over.
     */
    Mono<Void> resetCheckpoint(String businessId, String customerId, String metricName,
                               double value, String scope);

    /**
     * Appends plain metric rows.
     */
    Mono<Void> batchInsert(List<MetricRecord> records);

    /**
     * Current checkpoint total, empty when never incremented.
     */
    Mono<Double> checkpointValue(String businessId, String customerId, String scope, String metricName);

    Mono<Customer> getCustomer(String businessId, String customerId);

    Mono<Business> getBusiness(String businessId);

    Flux<PlanLimit> planLimits(String planId);

    /**
     * Plan id sold under a Stripe price, empty when unknown.
     */
    Mono<String> planIdForPrice(String stripePriceId);

    Flux<PlanLimit> businessLimits(String businessId);

    Flux<PlanLimit> customerLimits(String businessId, String customerId);

    default void close() {
    }
}
