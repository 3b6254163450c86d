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
package de.makibytes.trafficlyt.predict;

import java.util.List;

import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.model.BucketCount;
import de.makibytes.trafficlyt.model.Granularity;

/**
 * Deterministic, explainable forecast of violation counts. Side-effect free.
 */
@Component
public class CountForecaster {

    public FittedForecast fit(List<BucketCount> history,
                              Granularity granularity,
                              ForecastMethod method,
                              int window,
                              double alpha) {
        if (history == null || history.isEmpty()) {
            return new FittedForecast(method, granularity, 0, 0, 0, null);
        }
        double predicted = switch (method) {
            case NAIVE -> history.get(history.size() - 1).count();
            case MOVING_AVERAGE -> movingAverage(history, window);
            case EWM -> exponentiallyWeighted(history, alpha);
        };
        double mean = history.stream().mapToLong(BucketCount::count).average().orElse(0);
        return new FittedForecast(method, granularity, Math.max(0, Math.round(predicted)), mean,
                history.size(), history.get(history.size() - 1).ts());
    }

    private static double movingAverage(List<BucketCount> history, int window) {
        int n = Math.max(1, Math.min(window, history.size()));
        return history.subList(history.size() - n, history.size()).stream()
                .mapToLong(BucketCount::count)
                .average()
                .orElse(0);
    }

    private static double exponentiallyWeighted(List<BucketCount> history, double alpha) {
        double ewm = history.get(0).count();
        for (int i = 1; i < history.size(); i++) {
            ewm = alpha * history.get(i).count() + (1.0 - alpha) * ewm;
        }
        return ewm;
    }
}
