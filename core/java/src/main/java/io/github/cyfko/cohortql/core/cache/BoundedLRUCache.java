package io.github.cyfko.cohortql.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Entries live in an access-ordered {@link LinkedHashMap}: every hit moves the entry to the most
 * recently used end, and inserting beyond {@code maxSize} evicts the eldest entry. Because a read
 * reorders the map, reads and writes share one lock.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, List<FieldCandidate>> cache = new BoundedLRUCache<>(1000);
 * List<FieldCandidate> candidates = cache.computeIfAbsent("gender", index::search);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * @param key the key to look up
     * @return the cached value, or null if absent; a hit marks the entry most recently used
     */
    public V get(K key) {
        lock.lock();
        try {
            V value = entries.get(key);
            (value == null ? misses : hits).incrementAndGet();
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry when full.
     *
     * @param key   the key
     * @param value the value, not null
     */
    public void put(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("Cached values cannot be null");
        }
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value or computes, stores and returns it. The mapping function runs under
     * the cache lock, so concurrent callers for the same key compute it once. A {@code null} result
     * is returned but not cached.
     *
     * @param key             the key
     * @param mappingFunction computes the value on a miss
     * @return the cached or computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits.incrementAndGet();
                return value;
            }
            misses.incrementAndGet();
            value = mappingFunction.apply(key);
            if (value != null) {
                entries.put(key, value);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    public V remove(K key) {
        lock.lock();
        try {
            return entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all entries. Hit and miss counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }

    /**
     * @return statistics string
     */
    public String getStats() {
        return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
                size(), maxSize, hits.get(), misses.get());
    }
}
