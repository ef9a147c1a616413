package com.meterline.provisioner.fly;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.meterline.core.error.ProviderException;
import com.meterline.core.util.JsonUtils;
import com.meterline.provisioner.config.ProvisioningConfig;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fly Machines REST client on reactor-netty {@link HttpClient}.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /v1/apps}: create app (an existing app is accepted)</li>
 *   <li>{@code POST /v1/apps/{app}/machines}: create machine</li>
 *   <li>{@code DELETE /v1/apps/{app}/machines/{id}?force=true}: destroy machine</li>
 *   <li>{@code POST /v1/apps/{app}/machines/{id}/stop|start}</li>
 * </ul>
 * </p>
 */
public class FlyMachinesClient implements IMachineProvider {
    private static final Logger log = LoggerFactory.getLogger(FlyMachinesClient.class);

    private final HttpClient httpClient;

    public FlyMachinesClient(ProvisioningConfig config) {
        this.httpClient = HttpClient.create()
                .baseUrl(config.getFlyApiBaseUrl())
                .headers(h -> h
                        .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
                        .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(config.getRequestTimeout());

        log.info("FlyMachinesClient initialized with {}", config.getFlyApiBaseUrl());
    }

    @Override
    public Mono<MachineInfo> createMachine(String apiToken, String orgSlug, String appName,
                                           String region, String size, String image) {
        MachineSize guest = MachineSize.parse(size);

        Map<String, Object> guestConfig = new LinkedHashMap<>();
        guestConfig.put("cpu_kind", guest.cpuKind());
        guestConfig.put("cpus", guest.cpus());
        guestConfig.put("memory_mb", guest.memoryMb());

        Map<String, Object> machineRequest = new LinkedHashMap<>();
        machineRequest.put("region", region);
        machineRequest.put("config", Map.of("image", image, "guest", guestConfig));

        return ensureApp(apiToken, orgSlug, appName)
                .then(post(apiToken, "/v1/apps/" + appName + "/machines", machineRequest))
                .flatMap(response -> {
                    if (!response.isSuccess()) {
                        return Mono.error(new ProviderException(
                                "Create machine in " + appName + " failed: " + response.body, response.status));
                    }
                    MachineResponse machine = JsonUtils.readValue(response.body, MachineResponse.class);
                    log.info("Created machine {} in app {} ({}, {})", machine.getId(), appName, region, size);
                    return Mono.just(new MachineInfo(machine.getId(), machine.getPrivateIp(),
                            machine.getState(), machine.getRegion() != null ? machine.getRegion() : region));
                });
    }

    @Override
    public Mono<Void> terminateMachine(String apiToken, String appName, String machineId) {
        return Mono.defer(() -> authorized(apiToken)
                        .delete()
                        .uri("/v1/apps/" + appName + "/machines/" + machineId + "?force=true")
                        .responseSingle((response, body) -> body.asString().defaultIfEmpty("")
                                .map(text -> new Response(response.status().code(), text))))
                .onErrorMap(e -> !(e instanceof ProviderException),
                        e -> new ProviderException("Terminate " + machineId + " failed", e))
                .flatMap(response -> {
                    // already gone counts as terminated
                    if (response.isSuccess() || response.status == 404) {
                        log.info("Terminated machine {} in app {}", machineId, appName);
                        return Mono.<Void>empty();
                    }
                    return Mono.error(new ProviderException(
                            "Terminate " + machineId + " failed: " + response.body, response.status));
                });
    }

    @Override
    public Mono<Void> stopMachine(String apiToken, String appName, String machineId) {
        return machineAction(apiToken, appName, machineId, "stop");
    }

    @Override
    public Mono<Void> startMachine(String apiToken, String appName, String machineId) {
        return machineAction(apiToken, appName, machineId, "start");
    }

    private Mono<Void> machineAction(String apiToken, String appName, String machineId, String action) {
        return post(apiToken, "/v1/apps/" + appName + "/machines/" + machineId + "/" + action, Map.of())
                .flatMap(response -> {
                    if (!response.isSuccess()) {
                        return Mono.error(new ProviderException(
                                action + " " + machineId + " failed: " + response.body, response.status));
                    }
                    log.info("Machine {} in app {}: {}", machineId, appName, action);
                    return Mono.<Void>empty();
                });
    }

    private Mono<Void> ensureApp(String apiToken, String orgSlug, String appName) {
        return post(apiToken, "/v1/apps", Map.of("app_name", appName, "org_slug", orgSlug))
                .flatMap(response -> {
                    if (response.isSuccess()) {
                        log.info("Created app {} in org {}", appName, orgSlug);
                        return Mono.<Void>empty();
                    }
                    if (response.body.toLowerCase(Locale.ROOT).contains("already")) {
                        log.debug("App {} already exists", appName);
                        return Mono.<Void>empty();
                    }
                    return Mono.error(new ProviderException(
                            "Create app " + appName + " failed: " + response.body, response.status));
                });
    }

    private Mono<Response> post(String apiToken, String uri, Object payload) {
        return Mono.defer(() -> authorized(apiToken)
                        .post()
                        .uri(uri)
                        .send(ByteBufFlux.fromString(Mono.just(JsonUtils.writeValueAsString(payload))))
                        .responseSingle((response, body) -> body.asString().defaultIfEmpty("")
                                .map(text -> new Response(response.status().code(), text))))
                .onErrorMap(e -> !(e instanceof ProviderException),
                        e -> new ProviderException("POST " + uri + " failed: " + e.getMessage(), e));
    }

    private HttpClient authorized(String apiToken) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new ProviderException("No Fly API token configured");
        }
        return httpClient.headers(h -> h.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + apiToken));
    }

    private record Response(int status, String body) {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MachineResponse {
        private String id;
        private String state;
        private String region;
        @JsonProperty("private_ip")
        private String privateIp;
    }
}
