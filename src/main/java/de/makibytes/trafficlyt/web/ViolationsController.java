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

import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.ratelimit.RateLimited;
import jakarta.servlet.http.HttpServletRequest;

@Controller
public class ViolationsController {

    private final StatsService statsService;

    public ViolationsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/violations/stats")
    @ResponseBody
    @RateLimited("stats")
    public ResponseEntity<StatsResponse> stats(@RequestParam(name = "start", required = false) String start,
                                               @RequestParam(name = "end", required = false) String end,
                                               @RequestParam(name = "hour_start", required = false) Integer hourStart,
                                               @RequestParam(name = "hour_end", required = false) Integer hourEnd,
                                               @RequestParam(name = "violation_type", required = false) String violationType,
                                               @RequestParam(name = "bbox", required = false) String bbox,
                                               HttpServletRequest request) {
        ViolationFilters filters = FilterParams.parse(start, end, hourStart, hourEnd, violationType, bbox);
        StatsResponse response = statsService.getStats(filters, RequestAttributes.requestId(request));
        RequestAttributes.recordCacheMeta(request, response.meta());
        return ResponseEntity.ok(response);
    }
}
