package io.github.cyfko.cohortql.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedLRUCache Tests")
class BoundedLRUCacheTest {

    @Test
    @DisplayName("Should reject a non-positive size")
    void shouldRejectInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedLRUCache<String, String>(0));
    }

    @Test
    @DisplayName("Should evict the least recently used entry")
    void shouldEvictLeastRecentlyUsed() {
        // Given
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(2);
        cache.put("a", 1);
        cache.put("b", 2);

        // When
        cache.get("a");
        cache.put("c", 3);

        // Then
        assertEquals(2, cache.size());
        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
    }

    @Test
    @DisplayName("Should count hits and misses")
    void shouldCountHitsAndMisses() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(4);
        cache.put("a", 1);

        cache.get("a");
        cache.get("a");
        cache.get("missing");

        assertEquals(2, cache.getHitCount());
        assertEquals(1, cache.getMissCount());
        assertTrue(cache.getStats().contains("hits=2"));
    }

    @Test
    @DisplayName("Should compute a missing value once")
    void shouldComputeOnce() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(4);
        AtomicInteger calls = new AtomicInteger();

        cache.computeIfAbsent("a", k -> calls.incrementAndGet());
        Integer second = cache.computeIfAbsent("a", k -> calls.incrementAndGet());

        assertEquals(1, second);
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should not cache null computations")
    void shouldNotCacheNull() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(4);

        assertNull(cache.computeIfAbsent("a", k -> null));
        assertFalse(cache.containsKey("a"));
        assertThrows(IllegalArgumentException.class, () -> cache.put("a", null));
    }

    @Test
    @DisplayName("Should remove and clear entries")
    void shouldRemoveAndClear() {
        BoundedLRUCache<String, Integer> cache = new BoundedLRUCache<>(4);
        cache.put("a", 1);
        cache.put("b", 2);

        assertEquals(1, cache.remove("a"));
        assertNull(cache.remove("a"));
        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(4, cache.getMaxSize());
    }
}
