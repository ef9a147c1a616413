package com.meterline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifies a tenant worker: a business, or a (business, customer) pair.
 * <p>
 * The rendering ({@link #render()}) is the registry key of the tenant worker and the
 * scope key of every metric the tenant owns.
 * </p>
 */
@Value
@Builder
@Jacksonized
public class TenantKey {
    public static final String BUSINESS_SCOPE = "business";
    public static final String CUSTOMER_SCOPE = "customer";

    String businessId;
    String customerId;

    public TenantKey(String businessId, String customerId) {
        if (businessId == null || businessId.isBlank()) {
            throw new IllegalArgumentException("businessId is required");
        }
        this.businessId = businessId;
        this.customerId = customerId == null || customerId.isBlank() ? null : customerId;
    }

    public static TenantKey business(String businessId) {
        return new TenantKey(businessId, null);
    }

    public static TenantKey customer(String businessId, String customerId) {
        return new TenantKey(businessId, Objects.requireNonNull(customerId, "customerId"));
    }

    @JsonIgnore
    public boolean isCustomer() {
        return customerId != null;
    }

    @JsonIgnore
    public Optional<String> customer() {
        return Optional.ofNullable(customerId);
    }

    /**
     * The owning business tenant; for a business key this is the key itself.
     */
    @JsonIgnore
    public TenantKey businessKey() {
        return isCustomer() ? business(businessId) : this;
    }

    @JsonIgnore
    public String scope() {
        return isCustomer() ? CUSTOMER_SCOPE : BUSINESS_SCOPE;
    }

    public String render() {
        return isCustomer()
            ? CUSTOMER_SCOPE + ":" + businessId + ":" + customerId
            : BUSINESS_SCOPE + ":" + businessId;
    }

    @Override
    public String toString() {
        return render();
    }
}
