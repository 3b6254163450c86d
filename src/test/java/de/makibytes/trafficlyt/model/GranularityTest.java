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
package de.makibytes.trafficlyt.model;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Granularity Tests")
class GranularityTest {

    @Test
    @DisplayName("fromKey resolves known keys case-insensitively")
    void fromKeyResolvesKnownKeys() {
        assertEquals(Granularity.HOUR, Granularity.fromKey("hour"));
        assertEquals(Granularity.DAY, Granularity.fromKey(" DAY "));
    }

    @Test
    @DisplayName("fromKey defaults to hour when blank and rejects unknown keys")
    void fromKeyDefaultsAndRejects() {
        assertEquals(Granularity.HOUR, Granularity.fromKey(null));
        assertEquals(Granularity.HOUR, Granularity.fromKey(""));
        assertNull(Granularity.fromKey("week"));
    }

    @Test
    @DisplayName("truncate floors to the bucket start in UTC")
    void truncateFloorsToBucket() {
        Instant ts = Instant.parse("2024-01-15T12:34:56Z");

        assertEquals(Instant.parse("2024-01-15T12:00:00Z"), Granularity.HOUR.truncate(ts));
        assertEquals(Instant.parse("2024-01-15T00:00:00Z"), Granularity.DAY.truncate(ts));
        assertEquals(Duration.ofDays(1), Granularity.DAY.getStep());
    }
}
