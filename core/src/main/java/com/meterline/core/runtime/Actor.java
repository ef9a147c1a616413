package com.meterline.core.runtime;

import com.meterline.core.error.SpawnFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Base class of every worker: one bounded mailbox drained sequentially on the
 * system scheduler.
 * <p>
 * <b>Lifecycle:</b>
 * <ul>
 *   <li>The mailbox exists from construction, so messages told before {@link #start()} are buffered</li>
 *   <li>{@link #onMessage} is never invoked concurrently; subclass state needs no locking</li>
 *   <li>A handler exception is logged and affects only that message</li>
 *   <li>{@link #stop()} seals the mailbox; queued messages are processed, then {@link #postStop()}
 *       runs, bus subscriptions are disposed and the registry entry is removed</li>
 *   <li>Accepting a {@linkplain #isTerminal terminal} message seals the mailbox as well, so later
 *       deliveries fail and the supervisor spawns a successor</li>
 *   <li>Messages still queued when the handler stops the actor go to the
 *       {@linkplain #successor() successor} when {@link #forwardsAfterStop} says so</li>
 * </ul>
 * </p>
 *
 * @param <M> message type
 */
public abstract class Actor<M> implements ActorRef<M> {
    private static final Logger log = LoggerFactory.getLogger(Actor.class);

    private final String key;
    private final Class<M> messageType;
    protected final ActorSystem system;
    private final Sinks.Many<M> mailbox;
    private final Sinks.Empty<Void> terminated = Sinks.empty();
    private final Disposable.Composite subscriptions = Disposables.composite();
    private final AtomicBoolean started = new AtomicBoolean();
    // no new messages are accepted
    private volatile boolean sealed;
    // stop() was called; remaining messages are leftovers
    private volatile boolean stopped;

    protected Actor(String key, Class<M> messageType, ActorSystem system) {
        this.key = key;
        this.messageType = messageType;
        this.system = system;
        this.mailbox = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<M>get(system.getMailboxCapacity()).get());
    }

    /**
     * Handles one message. Runs on the system scheduler, one message at a time.
     */
    protected abstract void onMessage(M message);

    /**
     * Runs on the caller of {@link #start()}, after the mailbox is being drained.
     * Bus subscriptions belong here.
     */
    protected void preStart() {
    }

    /**
     * Runs on the mailbox thread after the last message.
     */
    protected void postStop() {
    }

    /**
     * A message after which the actor accepts nothing else, such as its shutdown command.
     */
    protected boolean isTerminal(M message) {
        return false;
    }

    /**
     * Whether a message still queued after {@link #stop()} is handed to a successor instead of
     * being handled here.
     */
    protected boolean forwardsAfterStop(M message) {
        return false;
    }

    /**
     * Factory for the actor that takes over this key; {@code null} when nothing may take over.
     */
    protected Function<String, ? extends Actor<M>> successor() {
        return null;
    }

    /**
     * Worker kind used as a metrics tag.
     */
    public String kind() {
        return "actor";
    }

    public final void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        mailbox.asFlux()
            .publishOn(system.getScheduler(), 1)
            .subscribe(this::dispatch, this::onMailboxError, this::onMailboxClosed);
        try {
            preStart();
        } catch (RuntimeException e) {
            log.error("Actor {} failed to start, stopping", key, e);
            stop();
        }
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Class<M> messageType() {
        return messageType;
    }

    @Override
    public boolean tell(M message) {
        Sinks.EmitResult result;
        synchronized (mailbox) {
            if (sealed) {
                return false;
            }
            result = mailbox.tryEmitNext(message);
            if (result.isSuccess() && isTerminal(message)) {
                sealed = true;
            }
        }
        if (result.isSuccess()) {
            return true;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.warn("Mailbox of {} is full, rejecting {}", key, message.getClass().getSimpleName());
            system.recordOverflow(kind());
        } else {
            log.debug("Mailbox of {} rejected {}: {}", key, message.getClass().getSimpleName(), result);
        }
        return false;
    }

    @Override
    public boolean isAlive() {
        return !sealed;
    }

    @Override
    public void stop() {
        synchronized (mailbox) {
            if (stopped) {
                return;
            }
            stopped = true;
            sealed = true;
            mailbox.tryEmitComplete();
        }
        log.debug("Actor {} stopping", key);
    }

    @Override
    public Mono<Void> whenTerminated() {
        return terminated.asMono();
    }

    /**
     * Forwards every event of a bus topic into this actor's mailbox until it stops.
     */
    protected <E> void subscribe(String topic, Class<E> type, Function<? super E, ? extends M> adapter) {
        subscriptions.add(system.getPubSub().subscribe(topic, type)
            .subscribe(
                event -> tell(adapter.apply(event)),
                err -> log.warn("Actor {} lost subscription to {}", key, topic, err)
            ));
    }

    /**
     * Keeps a disposable alive until the actor stops.
     */
    protected void track(Disposable disposable) {
        subscriptions.add(disposable);
    }

    /**
     * True once {@link #stop()} was called; the mailbox may still hold leftovers.
     */
    protected boolean isStopped() {
        return stopped;
    }

    protected long now() {
        return system.getClock().millis();
    }

    private void dispatch(M message) {
        if (stopped && forwardsAfterStop(message)) {
            Function<String, ? extends Actor<M>> factory = successor();
            if (factory != null) {
                forward(factory, message);
                return;
            }
        }
        try {
            onMessage(message);
        } catch (RuntimeException e) {
            log.warn("Actor {} failed to handle {}: {}", key, message.getClass().getSimpleName(), e.toString(), e);
        }
    }

    private void forward(Function<String, ? extends Actor<M>> factory, M message) {
        try {
            if (!system.getSupervisor().deliver(key, factory, message)) {
                log.warn("Actor {} could not hand {} to its successor", key, message.getClass().getSimpleName());
            }
        } catch (SpawnFailedException e) {
            log.error("Actor {} could not spawn a successor for {}", key, message.getClass().getSimpleName(), e);
        }
    }

    private void onMailboxError(Throwable error) {
        log.error("Mailbox of {} terminated with error", key, error);
        onMailboxClosed();
    }

    private void onMailboxClosed() {
        stopped = true;
        sealed = true;
        try {
            postStop();
        } catch (RuntimeException e) {
            log.warn("Actor {} failed in postStop", key, e);
        } finally {
            subscriptions.dispose();
            system.getRegistry().unregister(key, this);
            terminated.tryEmitEmpty();
            log.debug("Actor {} terminated", key);
        }
    }
}
