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

import java.util.Locale;

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.ratelimit.RateLimited;
import jakarta.servlet.http.HttpServletRequest;

@Controller
@RequestMapping("/anomalies")
public class AnomaliesController {

    static final int MAX_DAYS = 365;
    static final int MAX_TOP_N = 2000;
    static final String ZSCORE = "zscore";

    private final AnomalyService anomalyService;

    public AnomaliesController(AnomalyService anomalyService) {
        this.anomalyService = anomalyService;
    }

    @GetMapping("/heatmap")
    @ResponseBody
    @RateLimited("stats")
    public ResponseEntity<HeatmapResponse> heatmap(@RequestParam(name = "granularity", defaultValue = "day") String granularity,
                                                   @RequestParam(name = "days", defaultValue = "30") int days,
                                                   @RequestParam(name = "method", defaultValue = ZSCORE) String method,
                                                   @RequestParam(name = "threshold", defaultValue = "3.0") double threshold,
                                                   @RequestParam(name = "top_n", defaultValue = "500") int topN,
                                                   @RequestParam(name = "start", required = false) String start,
                                                   @RequestParam(name = "end", required = false) String end,
                                                   @RequestParam(name = "hour_start", required = false) Integer hourStart,
                                                   @RequestParam(name = "hour_end", required = false) Integer hourEnd,
                                                   @RequestParam(name = "violation_type", required = false) String violationType,
                                                   @RequestParam(name = "bbox", required = false) String bbox,
                                                   HttpServletRequest request) {
        HeatmapRequest heatmapRequest = toRequest(granularity, days, method, threshold, topN,
                FilterParams.parse(start, end, hourStart, hourEnd, violationType, bbox));
        HeatmapResponse response = anomalyService.heatmap(heatmapRequest, RequestAttributes.requestId(request));
        RequestAttributes.recordCacheMeta(request, response.meta());
        return ResponseEntity.ok(response);
    }

    static HeatmapRequest toRequest(String granularityKey,
                                    int days,
                                    String method,
                                    double threshold,
                                    int topN,
                                    ViolationFilters filters) {
        Granularity granularity = Granularity.fromKey(granularityKey);
        if (granularity == null) {
            throw new InvalidRequestException("granularity must be 'hour' or 'day'");
        }
        String normalizedMethod = method == null ? ZSCORE : method.toLowerCase(Locale.ROOT).trim();
        if (!ZSCORE.equals(normalizedMethod)) {
            throw new InvalidRequestException("method must be 'zscore'");
        }
        FilterParams.checkRange("days", days, 1, MAX_DAYS);
        FilterParams.checkRange("top_n", topN, 1, MAX_TOP_N);
        if (!(threshold >= 0.0) || Double.isInfinite(threshold)) {
            throw new InvalidRequestException("threshold must be a finite number >= 0");
        }
        return new HeatmapRequest(filters, granularity, days, normalizedMethod, threshold, topN);
    }
}
