package com.meterline.core.runtime;

import com.meterline.core.error.WorkerUnavailableException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.time.Duration;
import java.util.function.Function;

/**
 * Handle to a running actor. Safe to share across threads.
 *
 * @param <M> message type accepted by the actor
 */
public interface ActorRef<M> {

    /**
     * Registry key of the actor.
     */
    String key();

    /**
     * Enqueues a message without waiting.
     *
     * @return false when the actor is stopped or its mailbox is full
     */
    boolean tell(M message);

    /**
     * Type of the messages this actor accepts.
     */
    Class<M> messageType();

    /**
     * Enqueues a message obtained from an untyped handle, such as a registry lookup.
     *
     * @return false when the message is not of {@link #messageType()} or was rejected
     */
    default boolean offer(Object message) {
        Class<M> type = messageType();
        return type.isInstance(message) && tell(type.cast(message));
    }

    boolean isAlive();

    /**
     * Seals the mailbox. Messages already queued are still processed.
     */
    void stop();

    /**
     * Completes once the actor has drained its mailbox and unregistered.
     */
    Mono<Void> whenTerminated();

    /**
     * Request/reply: the actor completes the {@link MonoSink} carried in the message.
     * Fails with {@link WorkerUnavailableException} when the message is rejected and
     * with {@link java.util.concurrent.TimeoutException} after {@code timeout}.
     */
    default <R> Mono<R> ask(Function<MonoSink<R>, ? extends M> request, Duration timeout) {
        return Mono.<R>create(sink -> {
            if (!tell(request.apply(sink))) {
                sink.error(new WorkerUnavailableException(key(), isAlive() ? "mailbox full" : "stopped"));
            }
        }).timeout(timeout);
    }
}
