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
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.trafficlyt.MutableClock;
import de.makibytes.trafficlyt.anchor.TimeAnchor;
import de.makibytes.trafficlyt.cache.CachePolicy;
import de.makibytes.trafficlyt.cache.ResponseCache;
import de.makibytes.trafficlyt.config.TrafficLytProperties;
import de.makibytes.trafficlyt.model.Violation;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.model.WindowSource;
import de.makibytes.trafficlyt.store.InMemoryViolationStore;

@DisplayName("StatsService Tests")
class StatsServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
    private InMemoryViolationStore store;
    private StatsService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryViolationStore();
        store.add(new Violation(1, Instant.parse("2024-01-10T08:00:00Z"), 40.75, -73.95, "speeding"));
        store.add(new Violation(2, Instant.parse("2024-01-12T09:00:00Z"), 40.75, -73.95, "parking"));
        store.add(new Violation(3, Instant.parse("2024-01-15T12:00:00Z"), 40.75, -73.95, "speeding"));
        service = new StatsService(store, new TimeAnchor(), new ResponseCache(8, clock),
                new CachePolicy(new TrafficLytProperties()));
    }

    @Test
    @DisplayName("repeated request hits the response cache until the TTL passes")
    void cachedUntilTtl() {
        StatsResponse first = service.getStats(ViolationFilters.none(), "a");
        StatsResponse second = service.getStats(ViolationFilters.none(), "b");
        clock.advance(Duration.ofSeconds(61));
        StatsResponse third = service.getStats(ViolationFilters.none(), "c");

        assertEquals(3, first.total());
        assertFalse(first.meta().responseCacheHit());
        assertTrue(second.meta().responseCacheHit());
        assertFalse(third.meta().responseCacheHit());
        assertEquals(60, first.meta().responseCache().ttlSeconds());
    }

    @Test
    @DisplayName("absolute windows restrict the counted violations")
    void absoluteWindow() {
        ViolationFilters filters = new ViolationFilters(Instant.parse("2024-01-11T00:00:00Z"),
                Instant.parse("2024-01-13T00:00:00Z"), null, null, null, null);

        StatsResponse response = service.getStats(filters, "a");

        assertEquals(1, response.total());
        assertEquals("parking", response.topTypes().get(0).violationType());
        assertEquals(WindowSource.ABSOLUTE, response.meta().window().windowSource());
    }

    @Test
    @DisplayName("new data moves the anchor and therefore the cache key")
    void newDataChangesKey() {
        StatsResponse before = service.getStats(ViolationFilters.none(), "a");
        store.add(new Violation(4, Instant.parse("2024-01-16T00:00:00Z"), 40.75, -73.95, "parking"));
        StatsResponse after = service.getStats(ViolationFilters.none(), "b");

        assertFalse(after.meta().responseCacheHit());
        assertEquals(4, after.total());
        assertNotEquals(before.meta().responseCache().keyHash(), after.meta().responseCache().keyHash());
    }
}
