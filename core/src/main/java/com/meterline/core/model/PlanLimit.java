package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A limit on one metric, scoped to a plan, a business or a single customer.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class PlanLimit {
    String metricName;
    double limitValue;
    @Builder.Default
    BreachOperator breachOperator = BreachOperator.GTE;
    @Builder.Default
    BreachAction breachAction = BreachAction.DENY;
    @Builder.Default
    MetricKind metricKind = MetricKind.CHECKPOINT;

    String planId;
    String businessId;
    String customerId;
    String stripePriceId;
    List<String> webhookUrls;

    public boolean isBreached(double value) {
        return breachOperator.isBreached(value, limitValue);
    }

    /**
     * Whether a value that breaches this limit must be rejected.
     */
    public boolean denies(double value) {
        return breachAction == BreachAction.DENY && isBreached(value);
    }

    /**
     * Whether this limit applies to the given tenant on the given plan.
     */
    public boolean appliesTo(TenantKey tenant, String tenantPlanId) {
        if (customerId != null) {
            return customerId.equals(tenant.getCustomerId())
                && (businessId == null || businessId.equals(tenant.getBusinessId()));
        }
        if (planId != null) {
            return planId.equals(tenantPlanId);
        }
        return !tenant.isCustomer() && tenant.getBusinessId().equals(businessId);
    }
}
