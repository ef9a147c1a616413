package com.meterline.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Durable unit of provisioning work. Tasks are never deleted, only transitioned
 * from {@code pending} to {@code completed} or {@code dead_letter}.
 * <p>
 * Timestamps are epoch milliseconds; optional ones are {@code null} until set.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class ProvisioningTask {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final String DEFAULT_PROVIDER = "fly";

    String id;
    String businessId;
    String customerId;
    ProvisioningAction action;
    @Builder.Default
    String provider = DEFAULT_PROVIDER;
    @Builder.Default
    ProvisioningStatus status = ProvisioningStatus.PENDING;
    int attemptCount;
    @Builder.Default
    int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    long nextRetryAt;
    Long lastAttemptAt;
    String errorMessage;
    String idempotencyKey;
    @Singular("payloadEntry")
    Map<String, String> payload;
    long createdAt;
    Long completedAt;
    Long deadLetterAt;

    public String payloadValue(String key) {
        return payload == null ? null : payload.get(key);
    }

    public boolean isDue(long now) {
        return status == ProvisioningStatus.PENDING && nextRetryAt <= now;
    }
}
