package com.meterline.engine.http;

import com.meterline.core.util.JsonUtils;
import com.meterline.engine.MeterEngine;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.metrics.PrometheusMetricsExporter;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, Prometheus metrics and node status.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final EngineConfig config;
    private final MeterEngine engine;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Not ready before start completes and once shutdown began
                .get("/readyz", (req, res) -> {
                    if (!engine.isReady()) {
                        return res.status(503).sendString(Mono.just("Not Ready"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/status", (req, res) ->
                    res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(engine.status())))
                )
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
