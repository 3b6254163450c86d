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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded in-memory store with per-entry TTL and least-recently-used eviction.
 * <p>
 * Expired entries are removed lazily: on access, and in a full sweep before every insert.
 * All operations run under one monitor and never perform I/O while holding it.
 */
public class LruTtlStore<V> {
    private static final Logger logger = LoggerFactory.getLogger(LruTtlStore.class);

    private final String name;
    private final int maxItems;
    private final Clock clock;
    private final SizeEstimator sizeEstimator;
    private final Object lock = new Object();
    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long hits;
    private long misses;
    private long evictions;
    private long totalSize;

    public LruTtlStore(String name, int maxItems, Clock clock, SizeEstimator sizeEstimator) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be positive: " + maxItems);
        }
        this.name = name;
        this.maxItems = maxItems;
        this.clock = clock;
        this.sizeEstimator = sizeEstimator == null ? SizeEstimator.CONSTANT : sizeEstimator;
    }

    public Optional<V> get(String key) {
        return get(key, null);
    }

    /**
     * Typed lookup: a live value of another type counts as a miss and is reported as absent.
     *
     * @param type expected value type, or null to accept any value
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Instant now = clock.instant();
        synchronized (lock) {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                remove(key);
                evictions++;
                misses++;
                return Optional.empty();
            }
            V value = entry.value();
            if (type != null && !type.isInstance(value)) {
                misses++;
                return Optional.empty();
            }
            entry.touch(now);
            hits++;
            @SuppressWarnings("unchecked")
            T result = type == null ? (T) value : type.cast(value);
            return Optional.ofNullable(result);
        }
    }

    public void put(String key, V value, Duration ttl, EntryMeta meta) {
        Instant now = clock.instant();
        long size = sizeEstimator.estimate(key, value);
        CacheEntry<V> entry = new CacheEntry<>(value, now, ttl == null ? Duration.ZERO : ttl,
                meta == null ? EntryMeta.none() : meta, size);
        synchronized (lock) {
            evictIfNeeded(key, now);
            CacheEntry<V> previous = entries.put(key, entry);
            if (previous != null) {
                totalSize -= previous.sizeEstimate();
            }
            totalSize += size;
        }
    }

    public int invalidatePrefix(String prefix) {
        return invalidate(key -> key.startsWith(prefix));
    }

    public int invalidate(Predicate<String> predicate) {
        int removed = 0;
        synchronized (lock) {
            Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry<V>> candidate = it.next();
                if (predicate.test(candidate.getKey())) {
                    totalSize -= candidate.getValue().sizeEstimate();
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.debug("{}: invalidated {} entries", name, removed);
        }
        return removed;
    }

    public int cleanupExpired() {
        Instant now = clock.instant();
        synchronized (lock) {
            return sweepExpired(null, now);
        }
    }

    public CacheStats stats() {
        synchronized (lock) {
            return new CacheStats(hits, misses, evictions, entries.size(), totalSize);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int getMaxItems() {
        return maxItems;
    }

    // iterates instead of get() so the recency order stays untouched
    Optional<Instant> lastAccessOf(String key) {
        synchronized (lock) {
            for (Map.Entry<String, CacheEntry<V>> candidate : entries.entrySet()) {
                if (candidate.getKey().equals(key)) {
                    return Optional.of(candidate.getValue().lastAccess());
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Makes room for {@code incomingKey}. Overwriting a present key does not grow the store.
     */
    private void evictIfNeeded(String incomingKey, Instant now) {
        sweepExpired(incomingKey, now);
        int incoming = entries.containsKey(incomingKey) ? 0 : 1;
        while (entries.size() + incoming > maxItems) {
            String lruKey = leastRecentlyUsed(incomingKey);
            if (lruKey == null) {
                break;
            }
            CacheEntry<V> evicted = entries.remove(lruKey);
            totalSize -= evicted.sizeEstimate();
            evictions++;
            logger.debug("{}: evicted least recently used entry {} (endpoint={}, idle {})", name,
                    CacheKeys.shortHash(lruKey), evicted.meta().endpoint(),
                    Duration.between(evicted.lastAccess(), now));
        }
    }

    private int sweepExpired(String excludeKey, Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry<V>> candidate = it.next();
            if (candidate.getKey().equals(excludeKey)) {
                continue;
            }
            if (candidate.getValue().isExpired(now)) {
                totalSize -= candidate.getValue().sizeEstimate();
                it.remove();
                evictions++;
                removed++;
            }
        }
        return removed;
    }

    private String leastRecentlyUsed(String excludeKey) {
        for (String key : entries.keySet()) {
            if (!key.equals(excludeKey)) {
                return key;
            }
        }
        return null;
    }

    private void remove(String key) {
        CacheEntry<V> removed = entries.remove(key);
        if (removed != null) {
            totalSize -= removed.sizeEstimate();
        }
    }
}
