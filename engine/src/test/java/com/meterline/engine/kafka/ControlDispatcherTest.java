package com.meterline.engine.kafka;

import com.meterline.core.model.ProvisioningAction;
import com.meterline.core.model.TenantKey;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.engine.MeterRouter;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.support.InMemoryMetricStore;
import com.meterline.engine.support.RecordingProvisioningStore;
import com.meterline.engine.worker.WorkerContext;
import com.meterline.provisioner.ProvisioningQueue;
import com.meterline.provisioner.config.ProvisioningConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControlDispatcherTest {

    private ActorSystem system;
    private MeterRouter router;
    private RecordingProvisioningStore provisioningStore;
    private ControlDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        system = ActorSystem.builder().meterRegistry(meterRegistry).build();
        router = new MeterRouter(WorkerContext.builder()
            .system(system)
            .config(EngineConfig.builder().build())
            .store(new InMemoryMetricStore())
            .batchSink(batch -> {
            })
            .metrics(new EngineMetrics(meterRegistry))
            .build());
        provisioningStore = new RecordingProvisioningStore();
        ProvisioningQueue queue = new ProvisioningQueue(provisioningStore,
            ProvisioningConfig.builder().build(), Clock.systemUTC());
        dispatcher = new ControlDispatcher(router, queue);
    }

    @Test
    void testMetricRecordReachesTenant() {
        String json = "{\"businessId\":\"b1\",\"customerId\":\"c1\",\"metricName\":\"api_calls\","
            + "\"value\":4,\"flushInterval\":\"5s\",\"operation\":\"sum\",\"tags\":{\"route\":\"/v1\"}}";

        StepVerifier.create(dispatcher.dispatch(Topics.METRICS_RECORD, json)).verifyComplete();

        assertEquals(4.0, router.query(TenantKey.customer("b1", "c1"), "api_calls")
            .block(Duration.ofSeconds(5)).getValue());
    }

    @Test
    void testMalformedPayloadFails() {
        StepVerifier.create(dispatcher.dispatch(Topics.METRICS_RECORD, "{not json"))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    void testLimitChangeWithoutLimitFails() {
        StepVerifier.create(dispatcher.dispatch(Topics.CONTROL_PLAN_LIMITS, "{\"removed\":true}"))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    void testLimitChangeIsBroadcast() {
        List<Object> seen = new CopyOnWriteArrayList<>();
        system.getPubSub().subscribe(Topics.PLAN_LIMITS, Object.class).subscribe(seen::add);

        StepVerifier.create(dispatcher.dispatch(Topics.CONTROL_PLAN_LIMITS,
                "{\"limit\":{\"metricName\":\"api_calls\",\"limitValue\":10,\"planId\":\"pro\"}}"))
            .verifyComplete();

        assertEquals(1, seen.size());
    }

    @Test
    void testProvisioningRequestIsQueued() {
        String json = "{\"businessId\":\"b1\",\"customerId\":\"c1\",\"action\":\"provision\","
            + "\"idempotencyKey\":\"signup:c1\",\"payload\":{\"region\":\"ams\"}}";

        StepVerifier.create(dispatcher.dispatch(Topics.CONTROL_PROVISIONING, json)).verifyComplete();

        assertEquals(1, provisioningStore.inserted.size());
        assertEquals(ProvisioningAction.PROVISION, provisioningStore.inserted.get(0).getAction());
        assertEquals("signup:c1", provisioningStore.inserted.get(0).getIdempotencyKey());
        assertEquals("ams", provisioningStore.inserted.get(0).payloadValue("region"));
    }

    @Test
    void testLifecycleForUnknownTenantAndUnknownTopicComplete() {
        StepVerifier.create(dispatcher.dispatch(Topics.CONTROL_BILLING,
            "{\"businessId\":\"b1\",\"customerId\":\"c1\",\"periodStart\":0}")).verifyComplete();
        StepVerifier.create(dispatcher.dispatch(Topics.CONTROL_PLANS,
            "{\"businessId\":\"b1\",\"planId\":\"pro\"}")).verifyComplete();
        StepVerifier.create(dispatcher.dispatch("meter.unknown", "{}")).verifyComplete();

        assertTrue(system.getRegistry().size() == 0);
    }
}
