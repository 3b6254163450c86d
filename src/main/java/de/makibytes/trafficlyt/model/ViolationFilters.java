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
import java.time.ZoneOffset;

/**
 * Request filter scope shared by the stats and predict endpoints.
 * Hour bounds are 0..23; {@code hourStart > hourEnd} wraps past midnight.
 */
public record ViolationFilters(Instant start,
                               Instant end,
                               Integer hourStart,
                               Integer hourEnd,
                               String violationType,
                               String bbox) {

    public static ViolationFilters none() {
        return new ViolationFilters(null, null, null, null, null, null);
    }

    public ViolationFilters withoutTime() {
        return new ViolationFilters(null, null, hourStart, hourEnd, violationType, bbox);
    }

    public ViolationFilters withWindow(Instant windowStart, Instant windowEnd) {
        return new ViolationFilters(windowStart, windowEnd, hourStart, hourEnd, violationType, bbox);
    }

    public boolean hasAbsoluteWindow() {
        return start != null && end != null;
    }

    public boolean matches(Violation violation) {
        Instant ts = violation.occurredAt();
        if (start != null && ts.isBefore(start)) {
            return false;
        }
        if (end != null && ts.isAfter(end)) {
            return false;
        }
        if (violationType != null && !violationType.isBlank()
                && !violationType.trim().equals(violation.violationType())) {
            return false;
        }
        BoundingBox box = BoundingBox.parse(bbox);
        if (box != null && !box.contains(violation.lon(), violation.lat())) {
            return false;
        }
        return matchesHour(ts.atZone(ZoneOffset.UTC).getHour());
    }

    private boolean matchesHour(int hour) {
        if (hourStart != null && hourEnd != null) {
            if (hourStart <= hourEnd) {
                return hour >= hourStart && hour <= hourEnd;
            }
            return hour >= hourStart || hour <= hourEnd;
        }
        if (hourStart != null) {
            return hour == hourStart;
        }
        if (hourEnd != null) {
            return hour == hourEnd;
        }
        return true;
    }
}
