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
package de.makibytes.trafficlyt.anchor;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.trafficlyt.model.AnchoredWindow;
import de.makibytes.trafficlyt.model.DataTimeRange;
import de.makibytes.trafficlyt.model.Violation;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.model.WindowSource;
import de.makibytes.trafficlyt.store.InMemoryViolationStore;

@DisplayName("TimeAnchor Tests")
class TimeAnchorTest {

    private static final Instant DATA_MIN = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant DATA_MAX = Instant.parse("2024-01-15T12:00:00Z");
    private static final DataTimeRange OBSERVED = new DataTimeRange(DATA_MIN, DATA_MAX);

    private final TimeAnchor timeAnchor = new TimeAnchor();

    @Test
    @DisplayName("relative window ends at the freshest observed data")
    void anchorsToDataMax() {
        AnchoredWindow window = timeAnchor.anchorWindow(ViolationFilters.none(), OBSERVED);

        assertEquals(DATA_MAX, window.anchorTs());
        assertEquals(DATA_MAX, window.effectiveEndTs());
        assertEquals(DATA_MIN, window.effectiveStartTs());
        assertEquals(WindowSource.ANCHORED, window.windowSource());
        assertEquals("UTC", window.getTimezone());
        assertNull(window.message());
    }

    @Test
    @DisplayName("same filters and data produce the same window")
    void deterministic() {
        AnchoredWindow first = timeAnchor.anchorWindow(ViolationFilters.none(), OBSERVED, Duration.ofDays(7));
        AnchoredWindow second = timeAnchor.anchorWindow(ViolationFilters.none(), OBSERVED, Duration.ofDays(7));

        assertEquals(first, second);
    }

    @Test
    @DisplayName("lookback is clamped to the first observed data")
    void lookbackClampedToDataMin() {
        AnchoredWindow week = timeAnchor.anchorWindow(ViolationFilters.none(), OBSERVED, Duration.ofDays(7));
        AnchoredWindow year = timeAnchor.anchorWindow(ViolationFilters.none(), OBSERVED, Duration.ofDays(365));

        assertEquals(DATA_MAX.minus(Duration.ofDays(7)), week.effectiveStartTs());
        assertEquals(DATA_MIN, year.effectiveStartTs());
    }

    @Test
    @DisplayName("a lone caller start narrows the anchored window")
    void loneStartNarrows() {
        Instant start = Instant.parse("2024-01-10T00:00:00Z");
        ViolationFilters filters = new ViolationFilters(start, null, null, null, null, null);

        AnchoredWindow window = timeAnchor.anchorWindow(filters, OBSERVED);

        assertEquals(start, window.effectiveStartTs());
        assertEquals(DATA_MAX, window.effectiveEndTs());
        assertEquals(WindowSource.ANCHORED, window.windowSource());
    }

    @Test
    @DisplayName("a caller start after the data collapses the window to the anchor")
    void startAfterDataCollapses() {
        ViolationFilters filters = new ViolationFilters(Instant.parse("2025-01-01T00:00:00Z"), null, null, null, null, null);

        AnchoredWindow window = timeAnchor.anchorWindow(filters, OBSERVED);

        assertEquals(DATA_MAX, window.effectiveStartTs());
        assertEquals(DATA_MAX, window.effectiveEndTs());
    }

    @Test
    @DisplayName("absolute bounds are kept and the anchor stays at data max")
    void absoluteWindow() {
        Instant start = Instant.parse("2023-06-01T00:00:00Z");
        Instant end = Instant.parse("2023-07-01T00:00:00Z");
        ViolationFilters filters = new ViolationFilters(start, end, null, null, null, null);

        AnchoredWindow window = timeAnchor.anchorWindow(filters, OBSERVED, Duration.ofDays(1));

        assertEquals(WindowSource.ABSOLUTE, window.windowSource());
        assertEquals(start, window.effectiveStartTs());
        assertEquals(end, window.effectiveEndTs());
        assertEquals(DATA_MAX, window.anchorTs());
    }

    @Test
    @DisplayName("no data yields null timestamps and a message")
    void noData() {
        AnchoredWindow window = timeAnchor.anchorWindow(ViolationFilters.none(), DataTimeRange.empty());

        assertNull(window.anchorTs());
        assertNull(window.effectiveStartTs());
        assertNull(window.effectiveEndTs());
        assertEquals(AnchoredWindow.NO_DATA_MESSAGE, window.message());
        assertEquals(WindowSource.ANCHORED, window.windowSource());
    }

    @Test
    @DisplayName("anchor ignores caller time bounds when querying the store")
    void storeRangeIgnoresTimeBounds() {
        InMemoryViolationStore store = new InMemoryViolationStore();
        store.add(new Violation(1, DATA_MIN, 40.7, -73.9, "speeding"));
        store.add(new Violation(2, DATA_MAX, 40.7, -73.9, "speeding"));
        store.add(new Violation(3, DATA_MAX.plusSeconds(3600), 40.7, -73.9, "parking"));
        ViolationFilters filters = new ViolationFilters(DATA_MIN.plusSeconds(60), null, null, null, "speeding", null);

        AnchoredWindow window = timeAnchor.anchorWindow(filters, store, null);

        assertNotNull(window.anchorTs());
        assertEquals(DATA_MAX, window.anchorTs());
        assertEquals(DATA_MIN, window.dataMinTs());
        assertTrue(window.hasData());
    }
}
