package com.meterline.core.runtime;

import com.meterline.core.error.SpawnFailedException;
import com.meterline.core.metrics.MetricsNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.MonoSink;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SupervisorTest {

    private SimpleMeterRegistry meterRegistry;
    private ActorSystem system;
    private Supervisor supervisor;
    private AtomicInteger spawned;
    private Function<String, TestActor> factory;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        system = ActorSystem.builder().meterRegistry(meterRegistry).build();
        supervisor = system.getSupervisor();
        spawned = new AtomicInteger();
        factory = key -> {
            spawned.incrementAndGet();
            return new TestActor(key, system);
        };
    }

    @Test
    void testStartChildIsIdempotent() {
        ActorRef<?> first = supervisor.startChild("child", factory);
        ActorRef<?> second = supervisor.startChild("child", factory);

        assertSame(first, second);
        assertEquals(1, spawned.get());
        assertEquals(1, meterRegistry.counter(MetricsNames.WORKERS_SPAWNED_TOTAL, "kind", "actor").count());
    }

    @Test
    void testConcurrentSpawnsYieldSingleHandle() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        Set<ActorRef<?>> handles = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    go.await();
                    handles.add(supervisor.startChild("shared", factory));
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, handles.size());
        assertEquals(1, spawned.get());
    }

    @Test
    void testDeliverRespawnsStoppedChild() {
        ActorRef<?> first = supervisor.startChild("child", factory);
        first.stop();
        first.whenTerminated().block(Duration.ofSeconds(5));

        assertTrue(supervisor.deliver("child", factory, "hello"));

        TestActor second = (TestActor) system.getRegistry().lookup("child").orElseThrow();
        assertNotSame(first, second);
        second.stop();
        second.whenTerminated().block(Duration.ofSeconds(5));
        assertEquals(List.of("hello"), second.received);
        assertEquals(2, spawned.get());
    }

    @Test
    void testDeliverRefusesMessageOfAnotherType() {
        supervisor.startChild("echo", key -> new ReplyingActor(key, system, true));

        assertFalse(supervisor.deliver("echo", factory, "hello"));
        assertEquals(0, spawned.get());
        assertFalse(system.getRegistry().lookup("echo").orElseThrow().offer("hello"));
    }

    @Test
    void testFactoryFailureRaisesSpawnFailed() {
        Function<String, TestActor> failing = key -> {
            throw new IllegalStateException("no capacity");
        };

        SpawnFailedException error = assertThrows(SpawnFailedException.class,
            () -> supervisor.startChild("broken", failing));

        assertEquals("broken", error.getKey());
        assertEquals(1, meterRegistry.counter(MetricsNames.SPAWN_FAILURES_TOTAL).count());
        assertTrue(system.getRegistry().lookup("broken").isEmpty());
    }

    @Test
    void testAskReturnsReply() {
        StepVerifier.create(supervisor.<Ping, String>ask("echo", key -> new ReplyingActor(key, system, true),
                Ping::new, Duration.ofSeconds(1)))
            .expectNext("pong")
            .verifyComplete();
    }

    @Test
    void testAskTimesOutWhenChildNeverReplies() {
        StepVerifier.create(supervisor.<Ping, String>ask("silent", key -> new ReplyingActor(key, system, false),
                Ping::new, Duration.ofMillis(100)))
            .expectError(TimeoutException.class)
            .verify(Duration.ofSeconds(5));
    }

    private record Ping(MonoSink<String> reply) {
    }

    private static class ReplyingActor extends Actor<Ping> {
        private final boolean replies;

        ReplyingActor(String key, ActorSystem system, boolean replies) {
            super(key, Ping.class, system);
            this.replies = replies;
        }

        @Override
        protected void onMessage(Ping ping) {
            if (replies) {
                ping.reply().success("pong");
            }
        }
    }
}
