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
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.config.TrafficLytProperties;

/**
 * Artifact cache for expensive intermediate results such as fitted forecast models.
 * Keys come from {@link CacheKeys#modelKey} and are prefixed with the endpoint name.
 */
@Component
public class ModelRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ModelRegistry.class);

    private final LruTtlStore<Object> store;

    @Autowired
    public ModelRegistry(TrafficLytProperties properties, Clock clock) {
        this(resolveMaxItems(properties.getCache().getModelMaxItems()), clock, SizeEstimator.CONSTANT);
    }

    public ModelRegistry(int maxItems, Clock clock, SizeEstimator sizeEstimator) {
        this.store = new LruTtlStore<>("model-registry", maxItems, clock, sizeEstimator);
    }

    public Optional<Object> get(String key) {
        return store.get(key);
    }

    /**
     * Typed lookup; a value of another type is reported as absent and counted as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return store.get(key, type);
    }

    public void set(String key, Object value, Duration ttl, EntryMeta meta) {
        store.put(key, value, ttl, meta);
    }

    public int invalidatePrefix(String prefix) {
        return store.invalidatePrefix(prefix);
    }

    public int invalidate(Predicate<String> predicate) {
        return store.invalidate(predicate);
    }

    public int cleanupExpired() {
        return store.cleanupExpired();
    }

    public CacheStats stats() {
        return store.stats();
    }

    static int resolveMaxItems(int configured) {
        if (configured < 1) {
            logger.warn("Invalid cache capacity {}, using {}", configured, TrafficLytProperties.Cache.DEFAULT_MAX_ITEMS);
            return TrafficLytProperties.Cache.DEFAULT_MAX_ITEMS;
        }
        return configured;
    }
}
