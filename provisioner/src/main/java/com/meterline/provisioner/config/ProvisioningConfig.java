package com.meterline.provisioner.config;

import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.ProvisioningTask;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the provisioning processor, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ProvisioningConfig {

    @Builder.Default
    String flyApiBaseUrl = "https://api.machines.dev";

    /**
     * Used when the business has no API token of its own.
     */
    String defaultFlyApiToken;

    @Builder.Default
    String defaultFlyOrg = "personal";

    @Builder.Default
    FlushInterval pollInterval = FlushInterval.THIRTY_SECONDS;

    @Builder.Default
    int pollBatchSize = 10;

    @Builder.Default
    FlushInterval expirySweepInterval = FlushInterval.ONE_HOUR;

    @Builder.Default
    int expirySweepBatchSize = 100;

    @Builder.Default
    Duration retryStep = Duration.ofSeconds(300);

    @Builder.Default
    int maxAttempts = ProvisioningTask.DEFAULT_MAX_ATTEMPTS;

    /**
     * How long a provisioned machine runs before the expiry sweep picks it up.
     * {@link Duration#ZERO} disables expiry.
     */
    @Builder.Default
    Duration machineLifetime = Duration.ofDays(30);

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    public static ProvisioningConfig fromEnv() {
        return ProvisioningConfig.builder()
                .flyApiBaseUrl(getEnv("FLY_API_BASE_URL", "https://api.machines.dev"))
                .defaultFlyApiToken(System.getenv("FLY_API_TOKEN"))
                .defaultFlyOrg(getEnv("FLY_ORG", "personal"))
                .pollInterval(FlushInterval.fromLabel(getEnv("PROVISIONING_POLL_INTERVAL", "30s")))
                .pollBatchSize(Integer.parseInt(getEnv("PROVISIONING_POLL_BATCH", "10")))
                .expirySweepInterval(FlushInterval.fromLabel(getEnv("PROVISIONING_EXPIRY_INTERVAL", "1h")))
                .expirySweepBatchSize(Integer.parseInt(getEnv("PROVISIONING_EXPIRY_BATCH", "100")))
                .retryStep(Duration.ofSeconds(Long.parseLong(getEnv("PROVISIONING_RETRY_STEP_SEC", "300"))))
                .maxAttempts(Integer.parseInt(getEnv("PROVISIONING_MAX_ATTEMPTS", "3")))
                .machineLifetime(Duration.ofDays(Long.parseLong(getEnv("MACHINE_LIFETIME_DAYS", "30"))))
                .requestTimeout(Duration.ofSeconds(Long.parseLong(getEnv("FLY_REQUEST_TIMEOUT_SEC", "30"))))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
