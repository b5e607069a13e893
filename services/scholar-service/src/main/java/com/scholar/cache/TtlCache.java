package com.scholar.cache;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded LRU cache with per-entry TTL and single-flight loading.
 *
 * <p>All lookups, inserts and evictions happen under one lock. The loader itself runs outside the lock on
 * the thread of the first caller for a key; callers arriving while that load is running wait for its result
 * instead of starting their own. The in-flight handle is dropped before the entry is stored, and a failed load
 * is never stored: every waiter sees the same failure and the next caller loads again.
 */
public class TtlCache<V> {
    private final LinkedHashMap<String, Entry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<String, CompletableFuture<V>> inFlight = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Lookup<V> getOrLoad(String key, long ttlMs, Supplier<V> loader) {
        if (key == null) {
            return new Lookup<>(loader.get(), Source.LOADED, clock.millis());
        }
        CompletableFuture<V> pending;
        boolean leader = false;
        lock.lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry != null) {
                if (clock.millis() < entry.expiresAt()) {
                    return new Lookup<>(entry.value(), Source.HIT, entry.createdAt());
                }
                entries.remove(key);
            }
            pending = inFlight.get(key);
            if (pending == null) {
                pending = new CompletableFuture<>();
                inFlight.put(key, pending);
                leader = true;
            }
        } finally {
            lock.unlock();
        }

        if (!leader) {
            return new Lookup<>(await(pending), Source.JOINED, clock.millis());
        }
        return load(key, ttlMs, loader, pending);
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    /** Drops stored entries. Loads already running still complete for their waiters. */
    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private Lookup<V> load(String key, long ttlMs, Supplier<V> loader, CompletableFuture<V> pending) {
        V value;
        try {
            value = loader.get();
        } catch (RuntimeException | Error e) {
            lock.lock();
            try {
                inFlight.remove(key);
            } finally {
                lock.unlock();
            }
            pending.completeExceptionally(e);
            throw e;
        }

        long now;
        lock.lock();
        try {
            inFlight.remove(key);
            now = clock.millis();
            if (value != null && ttlMs > 0) {
                entries.put(key, new Entry<>(value, now, now + ttlMs));
                evictIfNeeded();
            }
        } finally {
            lock.unlock();
        }
        pending.complete(value);
        return new Lookup<>(value, Source.LOADED, now);
    }

    private void evictIfNeeded() {
        Iterator<String> eldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    private static <V> V await(CompletableFuture<V> pending) {
        try {
            return pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private record Entry<V>(V value, long createdAt, long expiresAt) {}

    public enum Source {
        HIT,
        JOINED,
        LOADED
    }

    public record Lookup<V>(V value, Source source, long createdAt) {
        public boolean fromCache() {
            return source != Source.LOADED;
        }
    }
}
