package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class Customer {
    String businessId;
    String customerId;
    String planId;
    String stripePriceId;
    String email;

    public TenantKey tenantKey() {
        return TenantKey.customer(businessId, customerId);
    }
}
