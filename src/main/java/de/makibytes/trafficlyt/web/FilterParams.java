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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import de.makibytes.trafficlyt.model.ViolationFilters;

/**
 * Request-parameter validation for the shared violation filters.
 */
final class FilterParams {

    private FilterParams() {
    }

    static ViolationFilters parse(String start,
                                  String end,
                                  Integer hourStart,
                                  Integer hourEnd,
                                  String violationType,
                                  String bbox) {
        Instant startTs = parseTimestamp("start", start);
        Instant endTs = parseTimestamp("end", end);
        if (startTs != null && endTs != null && startTs.isAfter(endTs)) {
            throw new InvalidRequestException("start must be <= end");
        }
        checkHour("hour_start", hourStart);
        checkHour("hour_end", hourEnd);
        String type = violationType == null || violationType.isBlank() ? null : violationType.trim();
        return new ViolationFilters(startTs, endTs, hourStart, hourEnd, type, bbox);
    }

    /**
     * Accepts ISO instants and offsets; timestamps without an offset are read as UTC.
     */
    static Instant parseTimestamp(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to local date-time
        }
        try {
            return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new InvalidRequestException(name + " is not a valid ISO-8601 timestamp: " + value);
        }
    }

    static int checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidRequestException(name + " must be between " + min + " and " + max);
        }
        return value;
    }

    private static void checkHour(String name, Integer hour) {
        if (hour != null) {
            checkRange(name, hour, 0, 23);
        }
    }
}
