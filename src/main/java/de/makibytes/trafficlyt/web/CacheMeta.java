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
package de.makibytes.trafficlyt.web;

import java.time.Duration;

import de.makibytes.trafficlyt.cache.CacheKeys;

public record CacheMeta(boolean hit, String keyHash, long ttlSeconds) {

    public static CacheMeta miss(String key, Duration ttl) {
        return new CacheMeta(false, CacheKeys.shortHash(key), ttl.toSeconds());
    }

    public static CacheMeta hit(String key, Duration ttl) {
        return new CacheMeta(true, CacheKeys.shortHash(key), ttl.toSeconds());
    }

    public CacheMeta asHit() {
        return new CacheMeta(true, keyHash, ttlSeconds);
    }
}
