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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The as-of window a request is evaluated over. Computed per request, never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnchoredWindow(Instant dataMinTs,
                             Instant dataMaxTs,
                             Instant anchorTs,
                             Instant effectiveStartTs,
                             Instant effectiveEndTs,
                             WindowSource windowSource,
                             String message) {

    public static final String TIMEZONE = "UTC";
    public static final String NO_DATA_MESSAGE = "No data for the selected filters";

    public AnchoredWindow {
        if (effectiveStartTs != null && effectiveEndTs != null && effectiveStartTs.isAfter(effectiveEndTs)) {
            throw new IllegalArgumentException("effective start " + effectiveStartTs
                    + " is after effective end " + effectiveEndTs);
        }
    }

    public static AnchoredWindow noData() {
        return new AnchoredWindow(null, null, null, null, null, WindowSource.ANCHORED, NO_DATA_MESSAGE);
    }

    public boolean hasData() {
        return dataMaxTs != null;
    }

    public String getTimezone() {
        return TIMEZONE;
    }
}
