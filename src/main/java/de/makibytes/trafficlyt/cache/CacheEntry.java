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

/**
 * Entry owned by one {@link LruTtlStore}; only the store updates the last access time, under its lock.
 */
final class CacheEntry<V> {

    private final V value;
    private final Instant createdAt;
    private final Duration ttl;
    private final EntryMeta meta;
    private final long sizeEstimate;
    private Instant lastAccess;

    CacheEntry(V value, Instant createdAt, Duration ttl, EntryMeta meta, long sizeEstimate) {
        this.value = value;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.meta = meta;
        this.sizeEstimate = sizeEstimate;
        this.lastAccess = createdAt;
    }

    /**
     * A non-positive TTL never expires.
     */
    boolean isExpired(Instant now) {
        return !ttl.isZero() && !ttl.isNegative() && createdAt.plus(ttl).isBefore(now);
    }

    void touch(Instant now) {
        lastAccess = now;
    }

    Instant lastAccess() {
        return lastAccess;
    }

    V value() {
        return value;
    }

    EntryMeta meta() {
        return meta;
    }

    long sizeEstimate() {
        return sizeEstimate;
    }
}
