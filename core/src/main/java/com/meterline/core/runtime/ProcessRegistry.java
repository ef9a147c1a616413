package com.meterline.core.runtime;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keyed table of live actors. At most one handle is registered per key, whatever its message type.
 */
public class ProcessRegistry {
    private final Map<String, ActorRef<?>> processes = new ConcurrentHashMap<>();

    /**
     * @return false when the key is already owned; the existing owner is kept
     */
    public boolean register(String key, ActorRef<?> ref) {
        return processes.putIfAbsent(key, ref) == null;
    }

    /**
     * Handles are untyped here; tell them through {@link ActorRef#offer(Object)}.
     */
    public Optional<ActorRef<?>> lookup(String key) {
        return Optional.ofNullable(processes.get(key));
    }

    public void unregister(String key) {
        processes.remove(key);
    }

    /**
     * Removes the entry only while it still points at {@code ref}, so a successor is never evicted.
     */
    public boolean unregister(String key, ActorRef<?> ref) {
        return processes.remove(key, ref);
    }

    /**
     * Returns the live handle for {@code key}, creating it atomically when absent or dead.
     * The factory runs at most once per call and only for the winning caller.
     */
    public ActorRef<?> spawnIfAbsent(String key, Function<String, ? extends ActorRef<?>> factory) {
        return processes.compute(key, (k, existing) ->
            existing != null && existing.isAlive() ? existing : factory.apply(k));
    }

    public int size() {
        return processes.size();
    }

    public List<ActorRef<?>> withPrefix(String prefix) {
        return processes.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix))
            .map(Map.Entry::getValue)
            .collect(Collectors.toList());
    }

    public long countWithPrefix(String prefix) {
        return processes.keySet().stream().filter(k -> k.startsWith(prefix)).count();
    }
}
