package io.sigmatics.core.engine;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store of compiled models keyed by {@link CacheKeys cache key}. Constructed and passed around
 * explicitly; tests call {@link #clear()} for isolation.
 *
 * <p>Thread-safe. Two compilations racing on one key both store value-equal artifacts, and the last
 * write wins.
 */
public final class ModelCache {

    private final Map<String, CompiledModel> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /** Snapshot of cache counters. */
    public record Stats(int size, long hits, long misses) {}

    public Optional<CompiledModel> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        CompiledModel model = entries.get(key);
        (model != null ? hits : misses).incrementAndGet();
        return Optional.ofNullable(model);
    }

    public void put(String key, CompiledModel model) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(model, "model must not be null");
        entries.put(key, model);
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    /** @return {@code true} if an entry was removed */
    public boolean remove(String key) {
        return entries.remove(key) != null;
    }

    /** Drops every entry and resets the counters. */
    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }

    public int size() {
        return entries.size();
    }

    public Stats stats() {
        return new Stats(entries.size(), hits.get(), misses.get());
    }
}
