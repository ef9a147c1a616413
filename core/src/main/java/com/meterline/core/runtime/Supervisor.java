package com.meterline.core.runtime;

import com.meterline.core.error.SpawnFailedException;
import com.meterline.core.error.WorkerUnavailableException;
import com.meterline.core.metrics.MetricsNames;
import com.meterline.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Spawns workers on demand and delivers messages to them.
 * <p>
 * Spawning is idempotent per key: concurrent callers observe a single handle, and
 * the message that triggered a spawn is always enqueued into the new worker's mailbox.
 * </p>
 */
public class Supervisor {
    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    static final int MAX_DELIVERY_ATTEMPTS = 3;

    private final ProcessRegistry registry;
    private final MeterRegistry meterRegistry;

    public Supervisor(ProcessRegistry registry, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the live child for {@code key}, creating and starting it when absent or dead.
     *
     * @throws SpawnFailedException when the factory throws
     */
    public <M> ActorRef<?> startChild(String key, Function<String, ? extends Actor<M>> factory) {
        AtomicReference<Actor<M>> created = new AtomicReference<>();
        ActorRef<?> ref;
        try {
            ref = registry.spawnIfAbsent(key, k -> {
                Actor<M> actor = factory.apply(k);
                created.set(actor);
                return actor;
            });
        } catch (SpawnFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to spawn worker {}", key, e);
            meterRegistry.counter(MetricsNames.SPAWN_FAILURES_TOTAL).increment();
            throw new SpawnFailedException(key, e);
        }

        Actor<M> actor = created.get();
        if (actor != null) {
            actor.start();
            Counter.builder(MetricsNames.WORKERS_SPAWNED_TOTAL)
                .tag(MetricsTags.KIND, actor.kind())
                .register(meterRegistry)
                .increment();
            log.debug("Spawned worker {}", key);
        }
        return ref;
    }

    /**
     * Finds or spawns the child and enqueues {@code message}. When the handle dies between
     * lookup and enqueue the delivery is retried against a fresh spawn.
     *
     * @return false when the live child's mailbox is full or the key is owned by an actor
     *     of another message type
     * @throws SpawnFailedException when the factory throws
     */
    public <M> boolean deliver(String key, Function<String, ? extends Actor<M>> factory, M message) {
        for (int attempt = 1; attempt <= MAX_DELIVERY_ATTEMPTS; attempt++) {
            ActorRef<?> ref = startChild(key, factory);
            if (!ref.messageType().isInstance(message)) {
                log.error("Worker {} accepts {}, not {}", key, ref.messageType().getSimpleName(),
                    message.getClass().getSimpleName());
                return false;
            }
            if (ref.offer(message)) {
                return true;
            }
            if (ref.isAlive()) {
                log.warn("Dropping {} for {}: mailbox full", message.getClass().getSimpleName(), key);
                return false;
            }
            log.debug("Worker {} stopped before delivery, respawning (attempt {})", key, attempt);
        }
        log.warn("Giving up delivering {} to {} after {} attempts",
            message.getClass().getSimpleName(), key, MAX_DELIVERY_ATTEMPTS);
        return false;
    }

    /**
     * Request/reply against a lazily spawned child.
     */
    public <M, R> Mono<R> ask(String key, Function<String, ? extends Actor<M>> factory,
                              Function<MonoSink<R>, ? extends M> request, Duration timeout) {
        return Mono.<R>create(sink -> {
            if (!deliver(key, factory, request.apply(sink))) {
                sink.error(new WorkerUnavailableException(key, "delivery failed"));
            }
        }).timeout(timeout);
    }

    public ProcessRegistry registry() {
        return registry;
    }
}
