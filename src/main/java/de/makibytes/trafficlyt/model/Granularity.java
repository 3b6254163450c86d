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
import java.util.Locale;

public enum Granularity {
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1));

    private final String key;
    private final Duration step;

    Granularity(String key, Duration step) {
        this.key = key;
        this.step = step;
    }

    public String getKey() {
        return key;
    }

    public Duration getStep() {
        return step;
    }

    /**
     * Floors the timestamp to the start of its bucket (UTC).
     */
    public Instant truncate(Instant timestamp) {
        long stepSeconds = step.toSeconds();
        long epochSeconds = Math.floorDiv(timestamp.getEpochSecond(), stepSeconds) * stepSeconds;
        return Instant.ofEpochSecond(epochSeconds);
    }

    /**
     * Resolves a request parameter; returns null for unknown keys so callers can reject them.
     */
    public static Granularity fromKey(String key) {
        if (key == null || key.isBlank()) {
            return HOUR;
        }
        String normalized = key.toLowerCase(Locale.ROOT).trim();
        for (Granularity granularity : values()) {
            if (granularity.key.equals(normalized)) {
                return granularity;
            }
        }
        return null;
    }
}
