/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.trafficlyt.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.trafficlyt.MutableClock;

@DisplayName("LruTtlStore Tests")
class LruTtlStoreTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T12:00:00Z"));

    @Test
    @DisplayName("get within TTL returns the stored value")
    void getWithinTtl() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 4, clock, null);

        store.put("a", "value", TTL, EntryMeta.none());
        clock.advance(Duration.ofSeconds(59));

        assertEquals("value", store.get("a").orElseThrow());
        assertEquals(1, store.stats().hits());
    }

    @Test
    @DisplayName("expired entry is absent and counted as eviction and miss")
    void expiredEntry() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 4, clock, null);

        store.put("a", "value", Duration.ofMillis(100), EntryMeta.none());
        clock.advance(Duration.ofMillis(150));

        assertTrue(store.get("a").isEmpty());
        CacheStats stats = store.stats();
        assertEquals(1, stats.evictions());
        assertEquals(1, stats.misses());
        assertEquals(0, stats.keysCount());
    }

    @Test
    @DisplayName("non-positive TTL never expires")
    void nonPositiveTtlNeverExpires() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 4, clock, null);

        store.put("a", "value", Duration.ZERO, EntryMeta.none());
        clock.advance(Duration.ofDays(30));

        assertTrue(store.get("a").isPresent());
    }

    @Test
    @DisplayName("inserting beyond capacity evicts the least recently used entry")
    void lruEviction() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 3, clock, null);
        store.put("a", "1", TTL, EntryMeta.none());
        store.put("b", "2", TTL, EntryMeta.none());
        store.put("c", "3", TTL, EntryMeta.none());
        store.get("a");

        store.put("d", "4", TTL, EntryMeta.none());

        assertFalse(store.get("b").isPresent(), "b was least recently used");
        assertTrue(store.get("a").isPresent());
        assertTrue(store.get("c").isPresent());
        assertTrue(store.get("d").isPresent());
        assertEquals(3, store.size());
        assertEquals(1, store.stats().evictions());
    }

    @Test
    @DisplayName("expired entries are swept before evicting live ones")
    void sweepBeforeEvict() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 2, clock, null);
        store.put("short", "1", Duration.ofSeconds(1), EntryMeta.none());
        store.put("long", "2", TTL, EntryMeta.none());
        clock.advance(Duration.ofSeconds(2));

        store.put("new", "3", TTL, EntryMeta.none());

        assertTrue(store.get("long").isPresent());
        assertTrue(store.get("new").isPresent());
        assertEquals(1, store.stats().evictions());
    }

    @Test
    @DisplayName("overwriting a key at capacity does not evict others")
    void overwriteAtCapacity() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 2, clock, null);
        store.put("a", "1", TTL, EntryMeta.none());
        store.put("b", "2", TTL, EntryMeta.none());

        store.put("a", "updated", TTL, EntryMeta.none());

        assertEquals(2, store.size());
        assertEquals(0, store.stats().evictions());
        assertEquals("updated", store.get("a").orElseThrow());
        assertTrue(store.get("b").isPresent());
    }

    @Test
    @DisplayName("a hit records the access time, a miss does not")
    void lastAccessTracking() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 4, clock, null);
        Instant created = clock.instant();
        store.put("a", "1", TTL, EntryMeta.none());

        assertEquals(created, store.lastAccessOf("a").orElseThrow());

        clock.advance(Duration.ofSeconds(10));
        store.get("a");
        assertEquals(created.plusSeconds(10), store.lastAccessOf("a").orElseThrow());

        clock.advance(Duration.ofSeconds(5));
        store.get("a", Integer.class);
        assertEquals(created.plusSeconds(10), store.lastAccessOf("a").orElseThrow());
        assertTrue(store.lastAccessOf("missing").isEmpty());
    }

    @Test
    @DisplayName("typed get of a value with another type is a miss")
    void typedGetWrongType() {
        LruTtlStore<Object> store = new LruTtlStore<>("test", 4, clock, null);
        store.put("a", "text", TTL, EntryMeta.none());

        assertTrue(store.get("a", Integer.class).isEmpty());
        CacheStats stats = store.stats();
        assertEquals(0, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.keysCount(), "the entry itself stays cached");

        assertEquals("text", store.get("a", String.class).orElseThrow());
        assertEquals(1, store.stats().hits());
    }

    @Test
    @DisplayName("concurrent puts and gets never exceed capacity")
    void concurrentAccessStaysBounded() throws Exception {
        int capacity = 8;
        int threads = 8;
        int opsPerThread = 500;
        LruTtlStore<Integer> store = new LruTtlStore<>("test", capacity, clock, null);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < opsPerThread; i++) {
                        String key = "k" + ((thread * 31 + i) % 40);
                        store.put(key, i, TTL, EntryMeta.none());
                        store.get("k" + (i % 40));
                        assertTrue(store.size() <= capacity);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        CacheStats stats = store.stats();
        assertTrue(stats.keysCount() <= capacity);
        assertEquals(threads * opsPerThread, stats.hits() + stats.misses());
    }

    @Test
    @DisplayName("prefix invalidation returns the removed count without counting evictions")
    void prefixInvalidation() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 10, clock, null);
        store.put("resp:stats:1", "a", TTL, EntryMeta.none());
        store.put("resp:stats:2", "b", TTL, EntryMeta.none());
        store.put("resp:risk:1", "c", TTL, EntryMeta.none());

        assertEquals(2, store.invalidatePrefix("resp:stats"));
        assertEquals(0, store.invalidatePrefix("resp:stats"));
        assertEquals(1, store.size());
        assertEquals(0, store.stats().evictions());
    }

    @Test
    @DisplayName("cleanup removes only expired entries")
    void cleanupExpired() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 10, clock, null);
        store.put("a", "1", Duration.ofSeconds(1), EntryMeta.none());
        store.put("b", "2", TTL, EntryMeta.none());
        clock.advance(Duration.ofSeconds(5));

        assertEquals(1, store.cleanupExpired());
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("size estimates are summed in stats")
    void sizeEstimates() {
        LruTtlStore<String> store = new LruTtlStore<>("test", 10, clock, (key, value) -> ((String) value).length());
        store.put("a", "abc", TTL, EntryMeta.none());
        store.put("b", "de", TTL, EntryMeta.none());

        assertEquals(5, store.stats().size());
        store.invalidatePrefix("a");
        assertEquals(2, store.stats().size());
    }

    @Test
    @DisplayName("capacity below one is rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LruTtlStore<String>("test", 0, clock, null));
    }
}
