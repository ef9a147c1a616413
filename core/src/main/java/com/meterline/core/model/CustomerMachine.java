package com.meterline.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A VM owned by a customer. {@code terminated} is terminal.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class CustomerMachine {
    String machineId;
    String businessId;
    String customerId;
    String appName;
    @Builder.Default
    String provider = ProvisioningTask.DEFAULT_PROVIDER;
    MachineStatus status;
    String ipAddress;
    String region;
    String size;
    String dockerImage;
    Long expiresAt;
    Long gracePeriodEnds;
    long createdAt;
    Long terminatedAt;

    public boolean isLive() {
        return status != null && !status.isTerminated();
    }
}
