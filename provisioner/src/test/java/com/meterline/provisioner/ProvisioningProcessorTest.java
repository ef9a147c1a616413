package com.meterline.provisioner;

import com.meterline.core.metrics.MetricsNames;
import com.meterline.core.metrics.MetricsTags;
import com.meterline.core.model.Business;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.MachineStatus;
import com.meterline.core.model.ProvisioningAction;
import com.meterline.core.model.ProvisioningStatus;
import com.meterline.core.model.ProvisioningTask;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.ControlMessages.DeadLetterNotice;
import com.meterline.core.msg.ControlMessages.ProvisioningRequest;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.provisioner.config.ProvisioningConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProvisioningProcessorTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final long DAY = 86_400_000L;

    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private ActorSystem system;
    private InMemoryProvisioningStore store;
    private FakeMachineProvider provider;
    private ProvisioningConfig config;
    private ProvisioningQueue queue;
    private List<DeadLetterNotice> deadLetters;
    private List<List<CustomerMachine>> machineUpdates;
    private ProvisioningProcessor processor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(NOW);
        system = ActorSystem.builder().clock(clock).meterRegistry(meterRegistry).build();
        store = new InMemoryProvisioningStore();
        provider = new FakeMachineProvider();
        config = ProvisioningConfig.builder().defaultFlyApiToken("platform-token").build();
        queue = new ProvisioningQueue(store, config, clock);
        deadLetters = new CopyOnWriteArrayList<>();
        machineUpdates = new CopyOnWriteArrayList<>();
        processor = new ProvisioningProcessor(system, store, provider, queue, config,
            (businessId, customerId, machines) -> machineUpdates.add(machines), deadLetters::add);

        store.businesses.put("b1", Business.builder()
            .businessId("b1")
            .defaultDockerImage("registry.fly.io/app:latest")
            .build());
    }

    private ProvisioningTask enqueue(ProvisioningAction action, String key) {
        return queue.enqueue("b1", "c1", action, key, Map.of()).block();
    }

    private long processDue() {
        return processor.processDue().block();
    }

    private CustomerMachine machine(String id, MachineStatus status, Long expiresAt) {
        return CustomerMachine.builder()
            .machineId(id)
            .businessId("b1")
            .customerId("c1")
            .appName("mt-b1-c1")
            .status(status)
            .expiresAt(expiresAt)
            .createdAt(NOW - 31 * DAY)
            .build();
    }

    @Test
    void testProvisionCreatesMachineWithBusinessDefaults() {
        ProvisioningTask task = enqueue(ProvisioningAction.PROVISION, "signup:c1");

        assertEquals(1, processDue());

        ProvisioningTask done = store.tasks.get(task.getId());
        assertEquals(ProvisioningStatus.COMPLETED, done.getStatus());
        assertEquals(1, done.getAttemptCount());
        assertEquals(NOW, done.getCompletedAt());
        assertEquals(List.of("mt-b1-c1|iad|shared-cpu-1x|registry.fly.io/app:latest"), provider.created);
        assertEquals(List.of("platform-token"), provider.tokens);

        CustomerMachine machine = store.machines.get("m1");
        assertEquals(MachineStatus.RUNNING, machine.getStatus());
        assertEquals(NOW + 30 * DAY, machine.getExpiresAt());
        assertEquals(1, machineUpdates.size());
        assertEquals(1, machineUpdates.get(0).size());
    }

    @Test
    void testPayloadOverridesBusinessDefaults() {
        queue.enqueue("b1", "c1", ProvisioningAction.PROVISION, "signup:c1",
            Map.of(ProvisioningProcessor.PAYLOAD_REGION, "ams", ProvisioningProcessor.PAYLOAD_SIZE, "performance-2x"))
            .block();

        processDue();

        assertEquals(List.of("mt-b1-c1|ams|performance-2x|registry.fly.io/app:latest"), provider.created);
    }

    @Test
    void testFailingTaskIsRetriedThenDeadLettered() {
        provider.failing.set(true);
        ProvisioningTask task = enqueue(ProvisioningAction.PROVISION, "signup:c1");

        assertEquals(1, processDue());
        ProvisioningTask first = store.tasks.get(task.getId());
        assertEquals(ProvisioningStatus.PENDING, first.getStatus());
        assertEquals(1, first.getAttemptCount());
        assertEquals(NOW + 300_000, first.getNextRetryAt());
        assertEquals("Service Unavailable", first.getErrorMessage());

        assertEquals(0, processDue());
        clock.advance(300_000);
        assertEquals(1, processDue());
        ProvisioningTask second = store.tasks.get(task.getId());
        assertEquals(2, second.getAttemptCount());
        assertEquals(clock.millis() + 600_000, second.getNextRetryAt());

        clock.advance(600_000);
        assertEquals(1, processDue());
        ProvisioningTask dead = store.tasks.get(task.getId());
        assertEquals(ProvisioningStatus.DEAD_LETTER, dead.getStatus());
        assertEquals(3, dead.getAttemptCount());
        assertEquals(clock.millis(), dead.getDeadLetterAt());

        assertEquals(1, deadLetters.size());
        assertEquals(task.getId(), deadLetters.get(0).getTaskId());
        assertEquals(3, deadLetters.get(0).getAttemptCount());
        assertEquals(1.0, meterRegistry.counter(MetricsNames.PROVISIONING_DEAD_LETTER_TOTAL,
            MetricsTags.ACTION, "provision").count());

        clock.advance(DAY);
        assertEquals(0, processDue());
    }

    @Test
    void testMissingImageCountsAsFailedAttempt() {
        store.businesses.put("b1", Business.builder().businessId("b1").build());
        ProvisioningTask task = enqueue(ProvisioningAction.PROVISION, "signup:c1");

        processDue();

        ProvisioningTask failed = store.tasks.get(task.getId());
        assertEquals(1, failed.getAttemptCount());
        assertTrue(failed.getErrorMessage().contains("No docker image"));
        assertTrue(provider.created.isEmpty());
    }

    @Test
    void testEnqueueIsIdempotentOnKey() {
        ProvisioningTask first = enqueue(ProvisioningAction.SUSPEND, "suspend:c1:2024-05");
        ProvisioningTask second = enqueue(ProvisioningAction.SUSPEND, "suspend:c1:2024-05");

        assertEquals(first.getId(), second.getId());
        assertEquals(1, store.tasks.size());
    }

    @Test
    void testFailedEnqueueLeavesKeyFreeForRetry() {
        store.failTaskWrites.set(true);
        StepVerifier.create(queue.enqueue("b1", "c1", ProvisioningAction.SUSPEND, "suspend:c1:2024-06", Map.of()))
            .expectError(IllegalStateException.class)
            .verify();
        assertTrue(store.idempotencyKeys.isEmpty());

        store.failTaskWrites.set(false);
        ProvisioningTask retried = enqueue(ProvisioningAction.SUSPEND, "suspend:c1:2024-06");

        assertEquals(retried.getId(), store.idempotencyKeys.get("suspend:c1:2024-06"));
        assertEquals(retried, store.getTask(retried.getId()).block());
        assertEquals(1, processDue());
    }

    @Test
    void testClaimWithoutTaskIsTakenOver() {
        store.idempotencyKeys.put("suspend:c1:2024-07", "lost-task");

        ProvisioningTask task = enqueue(ProvisioningAction.SUSPEND, "suspend:c1:2024-07");

        assertEquals(task.getId(), store.idempotencyKeys.get("suspend:c1:2024-07"));
        assertEquals(1, store.tasks.size());
    }

    @Test
    void testEnqueueRejectsIncompleteRequest() {
        StepVerifier.create(queue.enqueue(ProvisioningRequest.builder().businessId("b1").customerId("c1").build()))
            .expectError(IllegalArgumentException.class)
            .verify();
        assertTrue(store.tasks.isEmpty());
    }

    @Test
    void testSuspendAndResumeRunningMachines() {
        store.saveMachine(machine("m7", MachineStatus.RUNNING, NOW + DAY)).block();
        store.saveMachine(machine("m8", MachineStatus.TERMINATED, null)).block();

        enqueue(ProvisioningAction.SUSPEND, "suspend:c1");
        processDue();
        assertEquals(List.of("m7"), provider.stopped);
        assertEquals(MachineStatus.SUSPENDED, store.machines.get("m7").getStatus());

        enqueue(ProvisioningAction.RESUME, "resume:c1");
        processDue();
        assertEquals(List.of("m7"), provider.started);
        assertEquals(MachineStatus.RUNNING, store.machines.get("m7").getStatus());
        assertEquals(MachineStatus.TERMINATED, store.machines.get("m8").getStatus());
    }

    @Test
    void testExpiredMachineEntersGraceThenTerminates() {
        long expiresAt = NOW - 1_000;
        store.saveMachine(machine("m7", MachineStatus.RUNNING, expiresAt)).block();

        assertEquals(1, processor.sweepExpired().block());
        CustomerMachine inGrace = store.machines.get("m7");
        assertEquals(MachineStatus.GRACE_PERIOD, inGrace.getStatus());
        assertEquals(expiresAt + 7 * DAY, inGrace.getGracePeriodEnds());
        assertTrue(store.tasks.isEmpty());

        clock.advance(8 * DAY);
        processor.sweepExpired().block();
        processor.sweepExpired().block();
        ProvisioningTask terminate = store.onlyTask();
        assertEquals(ProvisioningAction.TERMINATE, terminate.getAction());
        assertEquals("expire:m7", terminate.getIdempotencyKey());

        processDue();
        assertEquals(List.of("m7"), provider.terminated);
        CustomerMachine gone = store.machines.get("m7");
        assertEquals(MachineStatus.TERMINATED, gone.getStatus());
        assertEquals(clock.millis(), gone.getTerminatedAt());
    }

    @Test
    void testResumeFromGraceRestartsLifetime() {
        CustomerMachine inGrace = machine("m7", MachineStatus.GRACE_PERIOD, NOW - DAY).withGracePeriodEnds(NOW + 6 * DAY);
        store.saveMachine(inGrace).block();

        enqueue(ProvisioningAction.RESUME, "resume:c1");
        processDue();

        CustomerMachine resumed = store.machines.get("m7");
        assertEquals(MachineStatus.RUNNING, resumed.getStatus());
        assertNull(resumed.getGracePeriodEnds());
        assertEquals(NOW + 30 * DAY, resumed.getExpiresAt());
        assertTrue(provider.started.isEmpty());
    }

    @Test
    void testPollTickProcessesQueue() throws InterruptedException {
        processor.start();
        ProvisioningTask task = enqueue(ProvisioningAction.PROVISION, "signup:c1");

        system.getPubSub().publish(Topics.tick(config.getPollInterval()),
            new TickEvent(config.getPollInterval(), NOW));

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (store.tasks.get(task.getId()).getStatus() != ProvisioningStatus.COMPLETED) {
            assertTrue(System.nanoTime() < deadline, "poll did not complete the task");
            Thread.sleep(10);
        }
        processor.stop();
        processor.whenTerminated().block(Duration.ofSeconds(5));
    }
}
