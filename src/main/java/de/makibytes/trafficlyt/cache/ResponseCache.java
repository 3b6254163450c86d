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
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.config.TrafficLytProperties;

/**
 * Cache of complete response payloads, consulted before any store or model work.
 * Keys live under the {@code resp:} namespace, separate from {@link ModelRegistry}.
 */
@Component
public class ResponseCache {

    private final LruTtlStore<Object> store;

    @Autowired
    public ResponseCache(TrafficLytProperties properties, Clock clock) {
        this(ModelRegistry.resolveMaxItems(properties.getCache().getResponseMaxItems()), clock);
    }

    public ResponseCache(int maxItems, Clock clock) {
        this.store = new LruTtlStore<>("response-cache", maxItems, clock, SizeEstimator.CONSTANT);
    }

    public Optional<Object> get(String key) {
        return store.get(key);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return store.get(key, type);
    }

    public void set(String key, Object payload, Duration ttl) {
        set(key, payload, ttl, EntryMeta.none());
    }

    public void set(String key, Object payload, Duration ttl, EntryMeta meta) {
        store.put(key, payload, ttl, meta);
    }

    public int invalidatePrefix(String prefix) {
        return store.invalidatePrefix(prefix);
    }

    public int cleanupExpired() {
        return store.cleanupExpired();
    }

    public CacheStats stats() {
        return store.stats();
    }
}
