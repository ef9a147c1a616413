package com.meterline.engine.worker;

import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.model.TenantKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of a tenant worker's cached state.
 */
@Value
@Builder
public class TenantSnapshot {
    TenantKey tenant;
    String planId;
    String stripePriceId;
    boolean limitsLoaded;
    @Singular
    Map<String, PlanLimit> limits;
    @Singular
    Set<String> metrics;
    @Singular
    Set<String> customers;
    @Singular
    List<CustomerMachine> machines;
    long lastActivity;
}
