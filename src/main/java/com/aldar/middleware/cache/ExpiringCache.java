package com.aldar.middleware.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Small TTL cache with an injected clock. Entries are evicted lazily on read and, once
 * {@code maxEntries} is reached, oldest-written first.
 */
public class ExpiringCache<K, V> {

    public interface Store<K, V> {

        Entry<V> get(K key);

        void put(K key, Entry<V> entry);

        void remove(K key);

        int size();

        /**
         * Keys in write order, oldest first.
         */
        Iterator<K> keys();

        void clear();
    }

    public record Entry<V>(V value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }

    private final Store<K, V> store;
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;

    public ExpiringCache(Clock clock, Duration ttl, int maxEntries) {
        this(new InMemoryStore<>(), clock, ttl, maxEntries);
    }

    public ExpiringCache(Store<K, V> store, Clock clock, Duration ttl, int maxEntries) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.store = store;
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        synchronized (store) {
            Entry<V> entry = store.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                store.remove(key);
                return Optional.empty();
            }
            return Optional.ofNullable(entry.value());
        }
    }

    public void put(K key, V value) {
        if (key == null || value == null) {
            return;
        }
        synchronized (store) {
            store.remove(key);
            evictIfFull();
            store.put(key, new Entry<>(value, clock.instant().plus(ttl)));
        }
    }

    public void invalidate(K key) {
        if (key == null) {
            return;
        }
        synchronized (store) {
            store.remove(key);
        }
    }

    public void clear() {
        synchronized (store) {
            store.clear();
        }
    }

    public int size() {
        synchronized (store) {
            return store.size();
        }
    }

    private void evictIfFull() {
        if (store.size() < maxEntries) {
            return;
        }
        Instant now = clock.instant();
        Iterator<K> keys = store.keys();
        K oldest = null;
        int expired = 0;
        while (keys.hasNext()) {
            K key = keys.next();
            if (oldest == null) {
                oldest = key;
            }
            Entry<V> entry = store.get(key);
            if (entry != null && entry.isExpired(now)) {
                keys.remove();
                expired++;
            }
        }
        if (expired == 0 && oldest != null) {
            store.remove(oldest);
        }
    }

    /**
     * Insertion-ordered map store. Callers synchronize on the store instance.
     */
    public static class InMemoryStore<K, V> implements Store<K, V> {

        private final Map<K, Entry<V>> entries = new LinkedHashMap<>();

        @Override
        public Entry<V> get(K key) {
            return entries.get(key);
        }

        @Override
        public void put(K key, Entry<V> entry) {
            entries.put(key, entry);
        }

        @Override
        public void remove(K key) {
            entries.remove(key);
        }

        @Override
        public int size() {
            return entries.size();
        }

        @Override
        public Iterator<K> keys() {
            return entries.keySet().iterator();
        }

        @Override
        public void clear() {
            entries.clear();
        }
    }
}
