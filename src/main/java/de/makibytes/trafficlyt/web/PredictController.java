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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.predict.ForecastMethod;
import de.makibytes.trafficlyt.ratelimit.RateLimited;
import jakarta.servlet.http.HttpServletRequest;

@Controller
@RequestMapping("/predict")
@RateLimited("predict")
public class PredictController {

    static final int MAX_HORIZON = 365;
    static final int MAX_HISTORY = 5000;

    private final PredictionService predictionService;

    public PredictController(PredictionService predictionService) {
        this.predictionService = predictionService;
    }

    @GetMapping("/forecast")
    @ResponseBody
    public ResponseEntity<ForecastResponse> forecast(@RequestParam(name = "granularity", required = false) String granularity,
                                                     @RequestParam(name = "horizon", required = false) Integer horizon,
                                                     @RequestParam(name = "model", required = false) String model,
                                                     @RequestParam(name = "window", defaultValue = "6") int window,
                                                     @RequestParam(name = "alpha", defaultValue = "0.3") double alpha,
                                                     @RequestParam(name = "limit_history", defaultValue = "500") int limitHistory,
                                                     @RequestParam(name = "start", required = false) String start,
                                                     @RequestParam(name = "end", required = false) String end,
                                                     @RequestParam(name = "hour_start", required = false) Integer hourStart,
                                                     @RequestParam(name = "hour_end", required = false) Integer hourEnd,
                                                     @RequestParam(name = "violation_type", required = false) String violationType,
                                                     @RequestParam(name = "bbox", required = false) String bbox,
                                                     HttpServletRequest request) {
        PredictRequest predictRequest = toRequest(granularity, horizon, model, window, alpha, limitHistory,
                FilterParams.parse(start, end, hourStart, hourEnd, violationType, bbox));
        ForecastResponse response = predictionService.forecast(predictRequest, RequestAttributes.requestId(request));
        RequestAttributes.recordCacheMeta(request, response.meta());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/risk")
    @ResponseBody
    public ResponseEntity<RiskResponse> risk(@RequestParam(name = "granularity", required = false) String granularity,
                                             @RequestParam(name = "horizon", required = false) Integer horizon,
                                             @RequestParam(name = "model", required = false) String model,
                                             @RequestParam(name = "window", defaultValue = "6") int window,
                                             @RequestParam(name = "alpha", defaultValue = "0.3") double alpha,
                                             @RequestParam(name = "limit_history", defaultValue = "500") int limitHistory,
                                             @RequestParam(name = "start", required = false) String start,
                                             @RequestParam(name = "end", required = false) String end,
                                             @RequestParam(name = "hour_start", required = false) Integer hourStart,
                                             @RequestParam(name = "hour_end", required = false) Integer hourEnd,
                                             @RequestParam(name = "violation_type", required = false) String violationType,
                                             @RequestParam(name = "bbox", required = false) String bbox,
                                             HttpServletRequest request) {
        PredictRequest predictRequest = toRequest(granularity, horizon, model, window, alpha, limitHistory,
                FilterParams.parse(start, end, hourStart, hourEnd, violationType, bbox));
        RiskResponse response = predictionService.risk(predictRequest, RequestAttributes.requestId(request));
        RequestAttributes.recordCacheMeta(request, response.meta());
        return ResponseEntity.ok(response);
    }

    static PredictRequest toRequest(String granularityKey,
                                    Integer horizon,
                                    String modelKey,
                                    int window,
                                    double alpha,
                                    int limitHistory,
                                    ViolationFilters filters) {
        Granularity granularity = Granularity.fromKey(granularityKey);
        if (granularity == null) {
            throw new InvalidRequestException("granularity must be 'hour' or 'day'");
        }
        ForecastMethod method = ForecastMethod.fromKey(modelKey);
        if (method == null) {
            throw new InvalidRequestException("model must be one of naive, ma, ewm");
        }
        int effectiveHorizon = horizon != null ? horizon : (granularity == Granularity.HOUR ? 24 : 7);
        FilterParams.checkRange("horizon", effectiveHorizon, 1, MAX_HORIZON);
        FilterParams.checkRange("window", window, 1, Integer.MAX_VALUE);
        FilterParams.checkRange("limit_history", limitHistory, 1, MAX_HISTORY);
        if (!(alpha >= 0.0 && alpha <= 1.0)) {
            throw new InvalidRequestException("alpha must be between 0 and 1");
        }
        return new PredictRequest(filters, granularity, effectiveHorizon, method, window, alpha, limitHistory);
    }
}
