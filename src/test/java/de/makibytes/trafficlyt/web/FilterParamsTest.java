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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.predict.ForecastMethod;

@DisplayName("Request parameter validation Tests")
class FilterParamsTest {

    @Test
    @DisplayName("timestamps without offset are read as UTC")
    void timestampsParsed() {
        assertEquals(Instant.parse("2024-01-15T12:00:00Z"), FilterParams.parseTimestamp("start", "2024-01-15T12:00:00"));
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), FilterParams.parseTimestamp("start", "2024-01-15T12:00:00+02:00"));
        assertNull(FilterParams.parseTimestamp("start", " "));
        assertThrows(InvalidRequestException.class, () -> FilterParams.parseTimestamp("start", "yesterday"));
    }

    @Test
    @DisplayName("start after end and out of range hours are rejected")
    void invalidFilters() {
        assertThrows(InvalidRequestException.class,
                () -> FilterParams.parse("2024-01-15T12:00:00Z", "2024-01-14T12:00:00Z", null, null, null, null));
        assertThrows(InvalidRequestException.class, () -> FilterParams.parse(null, null, 24, null, null, null));
        assertThrows(InvalidRequestException.class, () -> FilterParams.parse(null, null, null, -1, null, null));
    }

    @Test
    @DisplayName("blank violation type is dropped")
    void blankTypeDropped() {
        ViolationFilters filters = FilterParams.parse(null, null, 0, 23, "  ", "1,2,3,4");

        assertNull(filters.violationType());
        assertEquals(0, filters.hourStart());
    }

    @Test
    @DisplayName("predict parameters default by granularity and are validated")
    void predictParameters() {
        PredictRequest hourly = PredictController.toRequest(null, null, null, 6, 0.3, 500, ViolationFilters.none());
        PredictRequest daily = PredictController.toRequest("day", null, "ewm", 6, 0.3, 500, ViolationFilters.none());

        assertEquals(Granularity.HOUR, hourly.granularity());
        assertEquals(24, hourly.horizon());
        assertEquals(ForecastMethod.MOVING_AVERAGE, hourly.method());
        assertEquals(7, daily.horizon());
        assertThrows(InvalidRequestException.class,
                () -> PredictController.toRequest("week", null, null, 6, 0.3, 500, ViolationFilters.none()));
        assertThrows(InvalidRequestException.class,
                () -> PredictController.toRequest(null, null, "arima", 6, 0.3, 500, ViolationFilters.none()));
        assertThrows(InvalidRequestException.class,
                () -> PredictController.toRequest(null, 0, null, 6, 0.3, 500, ViolationFilters.none()));
        assertThrows(InvalidRequestException.class,
                () -> PredictController.toRequest(null, null, null, 6, 1.5, 500, ViolationFilters.none()));
    }
}
