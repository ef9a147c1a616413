package com.meterline.core.msg;

import com.meterline.core.model.BreachAction;
import com.meterline.core.model.BreachOperator;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.Operation;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.model.ProvisioningAction;
import com.meterline.core.model.TenantKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Messages carried on the Kafka topics listed in {@link Topics}.
 * <p>
 * Inbound messages trigger metric recording and tenant lifecycle changes; outbound
 * messages announce breaches and dead-lettered provisioning work.
 * </p>
 */
public final class ControlMessages {
    private ControlMessages() {
    }

    /**
     * One metric sample for a business or customer tenant.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class RecordMetric {
        String businessId;

        /**
         * Absent for business-scoped metrics.
         */
        String customerId;

        String metricName;
        double value;

        @Builder.Default
        FlushInterval flushInterval = FlushInterval.ONE_MINUTE;

        @Builder.Default
        Operation operation = Operation.SUM;

        @Builder.Default
        MetricKind metricKind = MetricKind.RESET;

        @Singular
        Map<String, String> tags;

        /**
         * Inline limit, used when the tenant has no plan limit cached for this metric.
         */
        PlanLimit planLimit;

        public TenantKey tenantKey() {
            return new TenantKey(businessId, customerId);
        }
    }

    /**
     * A plan limit was created, edited or removed.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class PlanLimitChanged {
        PlanLimit limit;

        /**
         * When set, tenants drop the limit instead of applying it.
         */
        boolean removed;

        long ts;
    }

    /**
     * A customer (or business) moved to another plan.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class PlanChanged {
        String businessId;
        String customerId;
        String planId;
        String stripePriceId;

        /**
         * Limits of the new plan; {@code null} means the tenant reloads them from storage.
         */
        List<PlanLimit> limits;

        long ts;

        public TenantKey tenantKey() {
            return new TenantKey(businessId, customerId);
        }
    }

    /**
     * Start of a new billing period for a customer.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class BillingCycleReset {
        String businessId;
        String customerId;
        long periodStart;
        long ts;

        public TenantKey tenantKey() {
            return TenantKey.customer(businessId, customerId);
        }
    }

    /**
     * The machine list of a customer changed after provisioning work.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class MachinesChanged {
        String businessId;
        String customerId;
        @Singular
        List<CustomerMachine> machines;
        long ts;
    }

    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class ProvisioningRequest {
        String businessId;
        String customerId;
        ProvisioningAction action;
        String idempotencyKey;
        @Singular("payloadEntry")
        Map<String, String> payload;
        Integer maxAttempts;
    }

    /**
     * Emitted once per transition into breach, for limits whose action is
     * {@code webhook} or {@code allow_overage}.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class LimitBreached {
        String businessId;
        String customerId;
        String metricName;
        double value;
        double limitValue;
        BreachOperator breachOperator;
        BreachAction breachAction;
        String planId;
        List<String> webhookUrls;
        long ts;
    }

    /**
     * Emitted when a provisioning task exhausts its attempts.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class DeadLetterNotice {
        String taskId;
        String businessId;
        String customerId;
        ProvisioningAction action;
        int attemptCount;
        String errorMessage;
        long ts;
    }
}
