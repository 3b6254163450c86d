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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import de.makibytes.trafficlyt.model.BucketCount;
import de.makibytes.trafficlyt.model.Granularity;

/**
 * A fitted count model plus the metadata of the history it was trained on.
 */
public record FittedForecast(ForecastMethod method,
                             Granularity granularity,
                             long predictedCount,
                             double historyMean,
                             int historyPoints,
                             Instant lastBucket) {

    public List<BucketCount> forecast(int horizon) {
        if (lastBucket == null || horizon <= 0) {
            return List.of();
        }
        List<BucketCount> points = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            points.add(new BucketCount(lastBucket.plus(granularity.getStep().multipliedBy(step)), predictedCount));
        }
        return points;
    }
}
