package com.meterline.engine.metrics;

import com.meterline.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the process-wide registry (shared with reactor-netty) in Prometheus text format.
 * Engine, actor and provisioning meters all land in this registry.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Shared registry is not a composite, /metrics only shows meters bound directly");
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
