package com.meterline.engine;

import com.meterline.core.model.Business;
import com.meterline.core.model.CheckResult;
import com.meterline.core.model.Customer;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.FlushInterval;
import com.meterline.core.model.LimitStatus;
import com.meterline.core.model.MachineStatus;
import com.meterline.core.model.MetricBatch;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.model.TenantKey;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.ControlMessages.BillingCycleReset;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.core.msg.ControlMessages.PlanLimitChanged;
import com.meterline.core.msg.ControlMessages.RecordMetric;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.core.runtime.TimeoutPolicy;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.flush.BatchSink;
import com.meterline.engine.flush.FlushPipeline;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.engine.support.Await;
import com.meterline.engine.support.InMemoryMetricStore;
import com.meterline.engine.support.MutableClock;
import com.meterline.engine.worker.TenantSnapshot;
import com.meterline.engine.worker.WorkerContext;
import com.meterline.engine.worker.WorkerKeys;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MeterRouterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final TenantKey BUSINESS = TenantKey.business("b1");
    private static final TenantKey CUSTOMER = TenantKey.customer("b1", "c1");

    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private ActorSystem system;
    private InMemoryMetricStore store;
    private List<MetricBatch> batches;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(1_700_000_000_000L);
        system = ActorSystem.builder().clock(clock).meterRegistry(meterRegistry).build();
        store = new InMemoryMetricStore();
        batches = new CopyOnWriteArrayList<>();

        store.businesses.put("b1", Business.builder().businessId("b1").currentPlanId("pro").build());
        store.addCustomer(Customer.builder().businessId("b1").customerId("c1").planId("pro").build());
        store.planLimits.put("pro", List.of(
            PlanLimit.builder().metricName("api_calls").limitValue(100).metricKind(MetricKind.RESET).planId("pro").build(),
            PlanLimit.builder().metricName("storage_gb").limitValue(10).planId("pro").build()
        ));
    }

    private MeterRouter router(EngineConfig config) {
        return router(config, batches::add);
    }

    private MeterRouter router(EngineConfig config, BatchSink sink) {
        WorkerContext ctx = WorkerContext.builder()
            .system(system)
            .config(config)
            .store(store)
            .batchSink(sink)
            .metrics(new EngineMetrics(meterRegistry))
            .build();
        return new MeterRouter(ctx);
    }

    private MeterRouter router() {
        return router(EngineConfig.builder().build());
    }

    private static RecordMetric sample(TenantKey tenant, String metric, double value) {
        return RecordMetric.builder()
            .businessId(tenant.getBusinessId())
            .customerId(tenant.getCustomerId())
            .metricName(metric)
            .value(value)
            .build();
    }

    private static CheckResult check(MeterRouter router, TenantKey tenant, String metric, double value) {
        return router.checkAndAdd(sample(tenant, metric, value)).block(TIMEOUT);
    }

    private static TenantSnapshot describe(MeterRouter router, TenantKey tenant) {
        return router.describe(tenant).block(TIMEOUT);
    }

    @Test
    void testPlanLimitsLoadAndMaterializeOnSpawn() {
        MeterRouter router = router();

        assertTrue(check(router, BUSINESS, "api_calls", 60).allowed());
        CheckResult denied = check(router, BUSINESS, "api_calls", 60);

        assertFalse(denied.allowed());
        assertEquals(60.0, denied.value());
        TenantSnapshot snapshot = describe(router, BUSINESS);
        assertTrue(snapshot.isLimitsLoaded());
        assertEquals("pro", snapshot.getPlanId());
        assertEquals(100.0, snapshot.getLimits().get("api_calls").getLimitValue());
        assertTrue(system.getRegistry().lookup(WorkerKeys.metric(BUSINESS, "storage_gb")).isPresent());
    }

    @Test
    void testCustomerCommandsAreForwardedThroughBusiness() {
        MeterRouter router = router();

        assertTrue(check(router, CUSTOMER, "api_calls", 99).allowed());
        assertFalse(check(router, CUSTOMER, "api_calls", 1).allowed());
        assertTrue(check(router, BUSINESS, "api_calls", 1).allowed());

        assertTrue(describe(router, BUSINESS).getCustomers().contains(CUSTOMER.render()));
        assertEquals("pro", describe(router, CUSTOMER).getPlanId());
    }

    @Test
    void testCheckpointLimitResumesFromPersistedTotal() {
        store.checkpoints.put(InMemoryMetricStore.checkpointKey("b1", "c1", "customer", "storage_gb"), 9.0);
        MeterRouter router = router();

        LimitStatus status = router.query(CUSTOMER, "storage_gb").block(TIMEOUT);

        assertEquals(9.0, status.getValue());
        assertEquals(1.0, status.getRemaining());
        assertFalse(check(router, CUSTOMER, "storage_gb", 1).allowed());
    }

    @Test
    void testCustomerLimitOverridesPlanLimit() {
        store.customerLimits.put("b1:c1", List.of(PlanLimit.builder()
            .metricName("api_calls").limitValue(5).metricKind(MetricKind.RESET)
            .businessId("b1").customerId("c1").build()));
        MeterRouter router = router();

        assertTrue(check(router, CUSTOMER, "api_calls", 4).allowed());
        assertFalse(check(router, CUSTOMER, "api_calls", 1).allowed());
        assertEquals(5.0, describe(router, CUSTOMER).getLimits().get("api_calls").getLimitValue());
    }

    @Test
    void testLimitWithoutPlanUsesInlineLimit() {
        store.businesses.put("b2", Business.builder().businessId("b2").build());
        MeterRouter router = router();
        TenantKey tenant = TenantKey.business("b2");
        RecordMetric command = sample(tenant, "exports", 3).withPlanLimit(
            PlanLimit.builder().metricName("exports").limitValue(3).build());

        CheckResult result = router.checkAndAdd(command).block(TIMEOUT);

        assertFalse(result.allowed());
        assertTrue(describe(router, tenant).getLimits().isEmpty());
    }

    @Test
    void testBroadcastLimitChangeReachesMatchingTenants() {
        MeterRouter router = router();
        check(router, BUSINESS, "api_calls", 10);

        router.applyPlanLimit(PlanLimitChanged.builder()
            .limit(PlanLimit.builder().metricName("api_calls").limitValue(11).metricKind(MetricKind.RESET)
                .planId("pro").build())
            .build());
        router.applyPlanLimit(PlanLimitChanged.builder()
            .limit(PlanLimit.builder().metricName("api_calls").limitValue(1).planId("free").build())
            .build());

        assertEquals(11.0, describe(router, BUSINESS).getLimits().get("api_calls").getLimitValue());
        assertFalse(check(router, BUSINESS, "api_calls", 1).allowed());
    }

    @Test
    void testRemovedLimitIsDropped() {
        MeterRouter router = router();
        check(router, BUSINESS, "api_calls", 10);

        router.applyPlanLimit(PlanLimitChanged.builder()
            .limit(PlanLimit.builder().metricName("api_calls").limitValue(100).planId("pro").build())
            .removed(true)
            .build());

        assertFalse(describe(router, BUSINESS).getLimits().containsKey("api_calls"));
        assertTrue(check(router, BUSINESS, "api_calls", 1_000).allowed());
    }

    @Test
    void testPlanChangeWithInlineLimits() {
        MeterRouter router = router();
        check(router, CUSTOMER, "api_calls", 1);

        assertTrue(router.planChanged(PlanChanged.builder()
            .businessId("b1").customerId("c1").planId("enterprise").stripePriceId("price_ent")
            .limits(List.of(PlanLimit.builder().metricName("api_calls").limitValue(1_000)
                .metricKind(MetricKind.RESET).planId("enterprise").build()))
            .build()));

        TenantSnapshot snapshot = describe(router, CUSTOMER);
        assertEquals("enterprise", snapshot.getPlanId());
        assertEquals("price_ent", snapshot.getStripePriceId());
        assertEquals(1_000.0, snapshot.getLimits().get("api_calls").getLimitValue());
        assertFalse(snapshot.getLimits().containsKey("storage_gb"));
        assertTrue(check(router, CUSTOMER, "api_calls", 500).allowed());
    }

    @Test
    void testPlanChangeByPriceReloadsFromStore() {
        store.pricePlans.put("price_team", "team");
        store.planLimits.put("team", List.of(PlanLimit.builder().metricName("api_calls").limitValue(7)
            .metricKind(MetricKind.RESET).planId("team").build()));
        MeterRouter router = router();
        check(router, CUSTOMER, "api_calls", 1);

        router.planChanged(PlanChanged.builder()
            .businessId("b1").customerId("c1").stripePriceId("price_team").build());

        Await.until(() -> "team".equals(describe(router, CUSTOMER).getPlanId()));
        assertEquals(7.0, describe(router, CUSTOMER).getLimits().get("api_calls").getLimitValue());
    }

    @Test
    void testLifecycleMessagesSkipTenantsThatAreNotLive() {
        MeterRouter router = router();

        assertFalse(router.planChanged(PlanChanged.builder().businessId("b1").planId("pro").build()));
        assertTrue(router.describe(BUSINESS).blockOptional(TIMEOUT).isEmpty());
        assertEquals(0, system.getRegistry().size());
    }

    @Test
    void testBillingResetFlushesAndClearsResetMetrics() {
        MeterRouter router = router();
        router.record(sample(CUSTOMER, "api_calls", 5));
        assertEquals(5.0, router.query(CUSTOMER, "api_calls").block(TIMEOUT).getValue());

        assertTrue(router.billingReset(BillingCycleReset.builder().businessId("b1").customerId("c1")
            .periodStart(clock.millis()).build()));

        assertEquals(0.0, router.query(CUSTOMER, "api_calls").block(TIMEOUT).getValue());
        List<MetricBatch> windows = batches.stream().filter(batch -> !batch.isReset()).collect(Collectors.toList());
        assertEquals(1, windows.size());
        assertEquals(5.0, windows.get(0).getAggregatedValue());
    }

    @Test
    void testBillingResetSpawnsTenantThatIsNotLive() {
        String key = InMemoryMetricStore.checkpointKey("b1", "c1", "customer", "storage_gb");
        store.checkpoints.put(key, 9.0);
        FlushPipeline pipeline = new FlushPipeline(system, store, new EngineMetrics(meterRegistry), Duration.ZERO);
        pipeline.start();
        MeterRouter router = router(EngineConfig.builder().build(), pipeline);

        assertTrue(router.billingReset(BillingCycleReset.builder().businessId("b1").customerId("c1")
            .periodStart(clock.millis()).build()));

        Await.until(() -> Double.valueOf(0.0).equals(store.checkpoints.get(key)));
        assertEquals(0.0, router.query(CUSTOMER, "storage_gb").block(TIMEOUT).getValue());
        pipeline.stop();
    }

    @Test
    void testBillingResetSurvivesIdleShutdownAndRespawn() {
        String key = InMemoryMetricStore.checkpointKey("b1", "c1", "customer", "storage_gb");
        store.checkpoints.put(key, 9.0);
        FlushPipeline pipeline = new FlushPipeline(system, store, new EngineMetrics(meterRegistry), Duration.ZERO);
        pipeline.start();
        MeterRouter router = router(EngineConfig.builder().build(), pipeline);
        assertEquals(9.0, router.query(CUSTOMER, "storage_gb").block(TIMEOUT).getValue());

        assertTrue(router.billingReset(BillingCycleReset.builder().businessId("b1").customerId("c1")
            .periodStart(clock.millis()).build()));
        Await.until(() -> Double.valueOf(0.0).equals(store.checkpoints.get(key)));

        FlushInterval cleanup = EngineConfig.builder().build().getCleanupInterval();
        long later = clock.millis() + Duration.ofHours(2).toMillis();
        system.getPubSub().publish(Topics.tick(cleanup), new TickEvent(cleanup, later));
        Await.until(() -> system.getRegistry().lookup(WorkerKeys.tenant(CUSTOMER)).isEmpty()
            && system.getRegistry().lookup(WorkerKeys.metric(CUSTOMER, "storage_gb")).isEmpty());

        assertEquals(0.0, router.query(CUSTOMER, "storage_gb").block(TIMEOUT).getValue());
        assertEquals(0.0, store.checkpoints.get(key));
        pipeline.stop();
    }

    @Test
    void testMachineUpdatesReachLiveCustomer() {
        MeterRouter router = router();
        router.record(sample(CUSTOMER, "api_calls", 1));
        describe(router, BUSINESS);

        router.onMachinesChanged("b1", "c1", List.of(CustomerMachine.builder()
            .machineId("m1").businessId("b1").customerId("c1").status(MachineStatus.RUNNING).build()));

        assertEquals(1, describe(router, CUSTOMER).getMachines().size());
    }

    @Test
    void testSlowLimitLoadAppliesTimeoutPolicy() {
        store = new InMemoryMetricStore() {
            @Override
            public Mono<Business> getBusiness(String businessId) {
                return Mono.never();
            }
        };
        MeterRouter router = router(EngineConfig.builder()
            .askTimeout(Duration.ofMillis(100))
            .limitLoadTimeout(Duration.ofSeconds(2))
            .timeoutPolicy(TimeoutPolicy.FAIL_CLOSED)
            .build());

        CheckResult result = check(router, BUSINESS, "api_calls", 1);

        assertTrue(result.timedOut());
        assertFalse(result.allowed());
    }

    @Test
    void testIdleTenantsCascadeShutdownAndFlush() {
        MeterRouter router = router();
        router.record(sample(BUSINESS, "api_calls", 2));
        router.record(sample(CUSTOMER, "api_calls", 3));
        assertEquals(2.0, router.query(BUSINESS, "api_calls").block(TIMEOUT).getValue());
        assertEquals(3.0, router.query(CUSTOMER, "api_calls").block(TIMEOUT).getValue());

        FlushInterval cleanup = EngineConfig.builder().build().getCleanupInterval();
        long later = clock.millis() + Duration.ofHours(2).toMillis();
        system.getPubSub().publish(Topics.tick(cleanup), new TickEvent(cleanup, later));

        Await.until(() -> system.getRegistry().size() == 0);
        assertEquals(2, batches.size());
    }
}
