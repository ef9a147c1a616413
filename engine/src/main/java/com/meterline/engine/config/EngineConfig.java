package com.meterline.engine.config;

import com.meterline.core.model.FlushInterval;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.core.runtime.TimeoutPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for an engine node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    @Builder.Default
    String nodeId = "meter-node-1";
    @Builder.Default
    int httpPort = 8080;
    @Builder.Default
    String kafkaBootstrap = "localhost:9092";
    @Builder.Default
    String kafkaGroupId = "meterline-engine";
    @Builder.Default
    String redisUrl = "redis://localhost:6379";

    /**
     * Bound on every request/reply call into a worker.
     */
    @Builder.Default
    Duration askTimeout = Duration.ofMillis(1000);

    /**
     * Bound on the plan-limit load a tenant worker runs at spawn.
     */
    @Builder.Default
    Duration limitLoadTimeout = Duration.ofSeconds(5);

    @Builder.Default
    TimeoutPolicy timeoutPolicy = TimeoutPolicy.FAIL_OPEN;

    /**
     * Flush interval of metric workers materialized from plan limits.
     */
    @Builder.Default
    FlushInterval planMetricFlushInterval = FlushInterval.ONE_MINUTE;

    @Builder.Default
    Duration customerIdleTimeout = Duration.ofMinutes(30);

    @Builder.Default
    Duration businessIdleTimeout = Duration.ofHours(1);

    /**
     * Tick driving idle checks of tenant workers.
     */
    @Builder.Default
    FlushInterval cleanupInterval = FlushInterval.FIVE_SECONDS;

    /**
     * Wait between a flush tick and the drain of its interval, so batches produced
     * by the same tick are included.
     */
    @Builder.Default
    Duration flushSettleDelay = Duration.ofSeconds(1);

    @Builder.Default
    int mailboxCapacity = ActorSystem.DEFAULT_MAILBOX_CAPACITY;

    @Builder.Default
    Duration tickResolution = Duration.ofMillis(250);

    @Builder.Default
    int ipRateLimitMax = 100;

    @Builder.Default
    FlushInterval ipRateLimitWindow = FlushInterval.ONE_MINUTE;

    @Builder.Default
    Duration ipIdleTimeout = Duration.ofHours(1);

    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    public static EngineConfig fromEnv() {
        return EngineConfig.builder()
                .nodeId(getEnv("NODE_ID", "meter-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .kafkaGroupId(getEnv("KAFKA_GROUP_ID", "meterline-engine"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .askTimeout(Duration.ofMillis(Long.parseLong(getEnv("ASK_TIMEOUT_MS", "1000"))))
                .limitLoadTimeout(Duration.ofMillis(Long.parseLong(getEnv("LIMIT_LOAD_TIMEOUT_MS", "5000"))))
                .timeoutPolicy(TimeoutPolicy.parse(getEnv("TIMEOUT_POLICY", "fail_open")))
                .planMetricFlushInterval(FlushInterval.fromLabel(getEnv("PLAN_METRIC_FLUSH_INTERVAL", "1m")))
                .customerIdleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("CUSTOMER_IDLE_TIMEOUT_SEC", "1800"))))
                .businessIdleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("BUSINESS_IDLE_TIMEOUT_SEC", "3600"))))
                .flushSettleDelay(Duration.ofMillis(Long.parseLong(getEnv("FLUSH_SETTLE_DELAY_MS", "1000"))))
                .mailboxCapacity(Integer.parseInt(getEnv("MAILBOX_CAPACITY", "1024")))
                .tickResolution(Duration.ofMillis(Long.parseLong(getEnv("TICK_RESOLUTION_MS", "250"))))
                .ipRateLimitMax(Integer.parseInt(getEnv("IP_RATE_LIMIT_MAX", "100")))
                .ipRateLimitWindow(FlushInterval.fromLabel(getEnv("IP_RATE_LIMIT_WINDOW", "1m")))
                .ipIdleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("IP_IDLE_TIMEOUT_SEC", "3600"))))
                .shutdownTimeout(Duration.ofSeconds(Long.parseLong(getEnv("SHUTDOWN_TIMEOUT_SEC", "30"))))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
