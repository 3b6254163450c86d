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

import de.makibytes.trafficlyt.model.CellSeries;
import de.makibytes.trafficlyt.model.Granularity;

/**
 * What the model registry memoizes for the anomaly heatmap: per-cell bucket counts of one window.
 * Scoring parameters are applied on top, so one aggregate serves every threshold.
 */
public record GridAggregate(Granularity granularity, double gridSizeDeg, List<CellSeries> cells) {

    public GridAggregate {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }
}
