package com.meterline.core.runtime;

import com.meterline.core.metrics.MetricsNames;
import com.meterline.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActorTest {

    private SimpleMeterRegistry meterRegistry;
    private ActorSystem system;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        system = ActorSystem.builder()
            .meterRegistry(meterRegistry)
            .mailboxCapacity(8)
            .build();
    }

    @Test
    void testMessagesAreHandledInArrivalOrder() {
        TestActor actor = new TestActor("a", system);
        actor.start();

        actor.tell("one");
        actor.tell("two");
        actor.tell("three");
        actor.stop();
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(List.of("one", "two", "three"), actor.received);
    }

    @Test
    void testMessagesToldBeforeStartAreBuffered() {
        TestActor actor = new TestActor("a", system);
        actor.tell("early");
        actor.start();
        actor.stop();
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(List.of("early"), actor.received);
    }

    @Test
    void testHandlerFailureOnlyAffectsThatMessage() {
        TestActor actor = new TestActor("a", system);
        actor.start();

        actor.tell("before");
        actor.tell("boom");
        actor.tell("after");
        actor.stop();
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(List.of("before", "after"), actor.received);
    }

    @Test
    void testOfferFromRegistryHandleChecksMessageType() {
        TestActor actor = new TestActor("worker:1", system);
        system.getRegistry().register(actor.key(), actor);
        ActorRef<?> handle = system.getRegistry().lookup("worker:1").orElseThrow();
        actor.start();

        assertFalse(handle.offer(42));
        assertTrue(handle.offer("typed"));
        actor.stop();
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(List.of("typed"), actor.received);
    }

    @Test
    void testStopDrainsMailboxRunsPostStopAndUnregisters() {
        TestActor actor = new TestActor("worker:1", system);
        assertTrue(system.getRegistry().register(actor.key(), actor));
        actor.start();

        actor.tell("queued");
        actor.stop();
        assertFalse(actor.tell("late"));
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(List.of("queued"), actor.received);
        assertTrue(actor.postStopped);
        assertFalse(actor.isAlive());
        assertTrue(system.getRegistry().lookup("worker:1").isEmpty());
    }

    @Test
    void testTerminationDoesNotEvictSuccessor() {
        TestActor first = new TestActor("worker:1", system);
        system.getRegistry().register(first.key(), first);
        first.start();

        TestActor successor = new TestActor("worker:1", system);
        system.getRegistry().unregister("worker:1");
        system.getRegistry().register(successor.key(), successor);

        first.stop();
        first.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(successor, system.getRegistry().lookup("worker:1").orElse(null));
    }

    @Test
    void testFullMailboxRejectsAndCountsOverflow() {
        TestActor actor = new TestActor("busy", system);
        actor.start();
        actor.tell("block");

        int accepted = 0;
        int rejected = 0;
        for (int i = 0; i < 64; i++) {
            if (actor.tell("m" + i)) {
                accepted++;
            } else {
                rejected++;
            }
        }
        actor.release();
        actor.stop();
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertTrue(rejected > 0, "expected overflow with a blocked mailbox");
        assertEquals(accepted + 1, actor.received.size());
        Counter overflow = meterRegistry.find(MetricsNames.MAILBOX_OVERFLOW_TOTAL)
            .tag(MetricsTags.KIND, "actor")
            .counter();
        assertNotNull(overflow);
        assertEquals(rejected, (int) overflow.count());
    }

    @Test
    void testTerminalMessageSealsMailbox() {
        TestActor actor = new TestActor("worker:1", system);
        assertTrue(system.getRegistry().register(actor.key(), actor));

        assertTrue(actor.tell("one"));
        assertTrue(actor.tell("last"));
        assertFalse(actor.isAlive());
        assertFalse(actor.tell("after"));

        actor.start();
        actor.whenTerminated().block(Duration.ofSeconds(5));

        assertEquals(List.of("one", "last"), actor.received);
        assertTrue(system.getRegistry().lookup(actor.key()).isEmpty());
    }
}
