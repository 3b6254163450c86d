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

import java.util.LinkedHashMap;
import java.util.Map;

import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.predict.ForecastMethod;

public record PredictRequest(ViolationFilters filters,
                             Granularity granularity,
                             int horizon,
                             ForecastMethod method,
                             int window,
                             double alpha,
                             int limitHistory) {

    /**
     * Parameters that change the fitted model. Horizon only shapes the output.
     */
    Map<String, Object> fitParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("model", method.getKey());
        params.put("window", window);
        params.put("alpha", alpha);
        params.put("limit_history", limitHistory);
        return params;
    }

    Map<String, Object> signatureParams() {
        Map<String, Object> params = fitParams();
        params.put("horizon", horizon);
        return params;
    }
}
