package com.meterline.core.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process topic fan-out.
 * <p>
 * <b>Delivery:</b> at most once per subscriber, no replay; subscribers that join late
 * miss earlier events. Ordering holds within one topic only.
 * </p>
 */
public class PubSub {
    private static final Logger log = LoggerFactory.getLogger(PubSub.class);

    private final Map<String, Sinks.Many<Object>> topics = new ConcurrentHashMap<>();

    public void publish(String topic, Object event) {
        Sinks.Many<Object> sink = topics.get(topic);
        if (sink == null) {
            return;
        }
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Failed to publish {} on {}: {}", event.getClass().getSimpleName(), topic, result);
        }
    }

    public <T> Flux<T> subscribe(String topic, Class<T> type) {
        return topic(topic).asFlux().ofType(type);
    }

    public int subscriberCount(String topic) {
        Sinks.Many<Object> sink = topics.get(topic);
        return sink == null ? 0 : sink.currentSubscriberCount();
    }

    private Sinks.Many<Object> topic(String name) {
        return topics.computeIfAbsent(name, k -> Sinks.many().multicast().directBestEffort());
    }
}
