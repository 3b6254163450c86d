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
import java.util.LinkedHashMap;
import java.util.Map;

import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.ViolationFilters;

public record HeatmapRequest(ViolationFilters filters,
                             Granularity granularity,
                             int days,
                             String method,
                             double threshold,
                             int topN) {

    Duration lookback() {
        return Duration.ofDays(days);
    }

    /**
     * Parameters that change the grid aggregate. Lookback only applies to anchored windows.
     */
    Map<String, Object> aggregateParams(double gridSizeDeg) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (!filters.hasAbsoluteWindow()) {
            params.put("days", days);
        }
        params.put("grid", gridSizeDeg);
        return params;
    }

    Map<String, Object> signatureParams(double gridSizeDeg) {
        Map<String, Object> params = aggregateParams(gridSizeDeg);
        // echoed in the payload
        params.put("days", days);
        params.put("method", method);
        params.put("threshold", threshold);
        params.put("top_n", topN);
        return params;
    }
}
