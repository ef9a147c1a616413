package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

/**
 * A business tenant together with the machine defaults used when provisioning
 * machines for its customers.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class Business {
    public static final String DEFAULT_MACHINE_SIZE = "shared-cpu-1x";
    public static final String DEFAULT_REGION = "iad";
    public static final int DEFAULT_GRACE_PERIOD_DAYS = 7;

    String businessId;
    String name;

    /**
     * Platform plan the business itself is subscribed to.
     */
    String currentPlanId;

    String defaultDockerImage;
    @Builder.Default
    String defaultMachineSize = DEFAULT_MACHINE_SIZE;
    @Builder.Default
    String defaultRegion = DEFAULT_REGION;
    @Builder.Default
    int machineGracePeriodDays = DEFAULT_GRACE_PERIOD_DAYS;

    String flyOrgSlug;
    String flyApiToken;
    String flyAppPrefix;

    public TenantKey tenantKey() {
        return TenantKey.business(businessId);
    }

    /**
     * Name of the per-customer Fly app: {@code {prefix}-{customerId}}, lowercased.
     */
    public String appNameFor(String customerId) {
        String prefix = flyAppPrefix == null || flyAppPrefix.isBlank() ? "mt-" + businessId : flyAppPrefix;
        return (prefix + "-" + customerId).toLowerCase(Locale.ROOT);
    }
}
