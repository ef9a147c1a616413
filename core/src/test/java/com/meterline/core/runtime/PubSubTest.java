package com.meterline.core.runtime;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PubSubTest {

    private final PubSub pubSub = new PubSub();

    @Test
    void testEverySubscriberReceivesEventsInOrder() {
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        pubSub.subscribe("topic", String.class).subscribe(first::add);
        pubSub.subscribe("topic", String.class).subscribe(second::add);

        pubSub.publish("topic", "a");
        pubSub.publish("topic", "b");

        assertEquals(List.of("a", "b"), first);
        assertEquals(List.of("a", "b"), second);
        assertEquals(2, pubSub.subscriberCount("topic"));
    }

    @Test
    void testLateSubscriberMissesEarlierEvents() {
        pubSub.publish("topic", "lost");
        List<String> received = new CopyOnWriteArrayList<>();
        pubSub.subscribe("topic", String.class).subscribe(received::add);

        pubSub.publish("topic", "seen");

        assertEquals(List.of("seen"), received);
    }

    @Test
    void testTopicsAreIsolatedAndTyped() {
        List<String> strings = new CopyOnWriteArrayList<>();
        pubSub.subscribe("a", String.class).subscribe(strings::add);

        pubSub.publish("b", "other topic");
        pubSub.publish("a", 42);
        pubSub.publish("a", "match");

        assertEquals(List.of("match"), strings);
    }

    @Test
    void testDisposedSubscriberStopsReceiving() {
        List<String> received = new CopyOnWriteArrayList<>();
        Disposable subscription = pubSub.subscribe("topic", String.class).subscribe(received::add);
        pubSub.publish("topic", "one");

        subscription.dispose();
        pubSub.publish("topic", "two");

        assertEquals(List.of("one"), received);
        assertTrue(pubSub.subscriberCount("topic") == 0);
    }
}
