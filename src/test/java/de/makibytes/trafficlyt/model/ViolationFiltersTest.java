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

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ViolationFilters Tests")
class ViolationFiltersTest {

    private static Violation at(String ts, double lon, double lat, String type) {
        return new Violation(1, Instant.parse(ts), lat, lon, type);
    }

    @Test
    @DisplayName("hour range wraps past midnight")
    void hourRangeWrapsMidnight() {
        ViolationFilters night = new ViolationFilters(null, null, 22, 2, null, null);

        assertTrue(night.matches(at("2024-01-15T23:10:00Z", 0, 0, "speeding")));
        assertTrue(night.matches(at("2024-01-15T01:59:00Z", 0, 0, "speeding")));
        assertFalse(night.matches(at("2024-01-15T12:00:00Z", 0, 0, "speeding")));
    }

    @Test
    @DisplayName("a single hour bound matches that hour only")
    void singleHourBound() {
        ViolationFilters eight = new ViolationFilters(null, null, 8, null, null, null);

        assertTrue(eight.matches(at("2024-01-15T08:30:00Z", 0, 0, "x")));
        assertFalse(eight.matches(at("2024-01-15T09:30:00Z", 0, 0, "x")));
    }

    @Test
    @DisplayName("type is compared after trimming and bbox limits the area")
    void typeAndBbox() {
        ViolationFilters filters = new ViolationFilters(null, null, null, null, " speeding ", "-74.0,40.7,-73.9,40.8");

        assertTrue(filters.matches(at("2024-01-15T08:30:00Z", -73.95, 40.75, "speeding")));
        assertFalse(filters.matches(at("2024-01-15T08:30:00Z", -73.95, 40.75, "parking")));
        assertFalse(filters.matches(at("2024-01-15T08:30:00Z", -73.5, 40.75, "speeding")));
    }

    @Test
    @DisplayName("withoutTime keeps the non-temporal scope")
    void withoutTimeKeepsScope() {
        ViolationFilters filters = new ViolationFilters(Instant.EPOCH, Instant.EPOCH.plusSeconds(60), 1, 2, "x", "0,0,1,1");
        ViolationFilters scope = filters.withoutTime();

        assertNull(scope.start());
        assertNull(scope.end());
        assertEquals("0,0,1,1", scope.bbox());
        assertFalse(scope.hasAbsoluteWindow());
        assertTrue(filters.hasAbsoluteWindow());
    }

    @Test
    @DisplayName("malformed bounding boxes parse to null")
    void malformedBoundingBox() {
        assertNull(BoundingBox.parse("1,2,3"));
        assertNull(BoundingBox.parse("a,b,c,d"));
        assertNull(BoundingBox.parse("1,2,3,NaN"));
        assertNull(BoundingBox.parse(" "));
        assertEquals(new BoundingBox(1, 2, 3, 4), BoundingBox.parse(" 1, 2 ,3,4"));
    }
}
