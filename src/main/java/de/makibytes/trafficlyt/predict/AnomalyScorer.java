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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.model.CellSeries;

/**
 * Z-score spike detection per grid cell. A bucket is anomalous when
 * {@code (count - mean) / stddev >= threshold}; the cell weight is its number of anomalous buckets.
 */
@Component
public class AnomalyScorer {

    public List<AnomalyPoint> score(GridAggregate aggregate, double threshold, int topN) {
        List<AnomalyPoint> points = new ArrayList<>();
        for (CellSeries cell : aggregate.cells()) {
            int hits = anomalyHits(cell.counts(), threshold);
            if (hits > 0) {
                points.add(new AnomalyPoint(cell.lat(), cell.lon(), hits));
            }
        }
        // stable: equal weights keep cell order
        points.sort(Comparator.comparingInt(AnomalyPoint::weight).reversed());
        return List.copyOf(points.subList(0, Math.min(Math.max(topN, 0), points.size())));
    }

    /**
     * Population standard deviation; fewer than two buckets or a flat series never count as anomalous.
     */
    static int anomalyHits(List<Long> counts, double threshold) {
        int n = counts.size();
        if (n < 2) {
            return 0;
        }
        double mean = counts.stream().mapToLong(Long::longValue).average().orElse(0);
        double variance = counts.stream()
                .mapToDouble(count -> (count - mean) * (count - mean))
                .sum() / n;
        double stddev = Math.sqrt(variance);
        if (stddev <= 0) {
            return 0;
        }
        int hits = 0;
        for (long count : counts) {
            if ((count - mean) / stddev >= threshold) {
                hits++;
            }
        }
        return hits;
    }
}
