package com.meterline.engine;

import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.http.HttpServer;
import com.meterline.engine.kafka.KafkaService;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.metrics.PrometheusMetricsExporter;
import com.meterline.engine.store.RedisMetricStore;
import com.meterline.provisioner.config.ProvisioningConfig;
import com.meterline.provisioner.fly.FlyMachinesClient;
import com.meterline.provisioner.store.RedisProvisioningStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Main entry point for an engine node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Consume metric samples and control messages from Kafka</li>
 *   <li>Aggregate metrics per tenant and enforce plan limits</li>
 *   <li>Flush aggregates to Redis on tick boundaries</li>
 *   <li>Process machine provisioning work and expire machines</li>
 *   <li>Publish breach and dead-letter events</li>
 *   <li>Expose /healthz, /readyz, /metrics and /status</li>
 * </ul>
 * </p>
 */
public class EngineApp {
    private static final Logger log = LoggerFactory.getLogger(EngineApp.class);

    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromEnv();
        ProvisioningConfig provisioningConfig = ProvisioningConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting engine node: {}", config.getNodeId());
        log.info("  Kafka: {}", config.getKafkaBootstrap());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Timeout policy: {} ({} ms)", config.getTimeoutPolicy(), config.getAskTimeout().toMillis());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        EngineMetrics metrics = new EngineMetrics(metricsExporter.getRegistry());
        metrics.bindJvmMetrics();

        RedisMetricStore metricStore = new RedisMetricStore(config.getRedisUrl());
        RedisProvisioningStore provisioningStore = new RedisProvisioningStore(config.getRedisUrl());
        KafkaService kafkaService = new KafkaService(config, metrics);

        MeterEngine engine = MeterEngine.builder()
            .config(config)
            .provisioningConfig(provisioningConfig)
            .metricStore(metricStore)
            .provisioningStore(provisioningStore)
            .machineProvider(new FlyMachinesClient(provisioningConfig))
            .metrics(metrics)
            .breachListener(event -> kafkaService.publishBreach(event).subscribe())
            .deadLetterSink(notice -> kafkaService.publishDeadLetter(notice).subscribe())
            .build();
        engine.start();

        kafkaService.start(engine.getRouter(), engine.getProvisioningQueue()).block();

        HttpServer httpServer = new HttpServer(config, engine, metricsExporter);
        httpServer.start();

        log.info("Engine node {} is ready", config.getNodeId());

        handleShutdown(config, engine, kafkaService, httpServer, metricStore, provisioningStore);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(EngineConfig config,
                                       MeterEngine engine,
                                       KafkaService kafkaService,
                                       HttpServer httpServer,
                                       RedisMetricStore metricStore,
                                       RedisProvisioningStore provisioningStore) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            kafkaService.stop().block(Duration.ofSeconds(10));

            // Flushes every pending window before the stores close
            engine.shutdown().block(config.getShutdownTimeout().multipliedBy(3));

            httpServer.stop();
            metricStore.close();
            provisioningStore.close();

            log.info("Shutdown complete");
        }));
    }
}
