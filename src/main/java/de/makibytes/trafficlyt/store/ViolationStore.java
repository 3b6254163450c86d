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
package de.makibytes.trafficlyt.store;

import java.util.List;

import de.makibytes.trafficlyt.model.BucketCount;
import de.makibytes.trafficlyt.model.CellSeries;
import de.makibytes.trafficlyt.model.DataTimeRange;
import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.ViolationFilters;

/**
 * Query layer over stored violations. Calls are synchronous and may block; callers must not
 * hold cache or limiter locks while invoking them.
 */
public interface ViolationStore {

    DataTimeRange observedRange(ViolationFilters scope);

    /**
     * Continuous per-bucket counts (zero-filled) for the filters, limited to the most recent {@code limit} buckets.
     */
    List<BucketCount> countsByBucket(ViolationFilters filters, Granularity granularity, int limit);

    ViolationStats stats(ViolationFilters filters, int topTypes);

    /**
     * Counts per grid cell and bucket. Locations snap to the nearest multiple of {@code gridSizeDeg};
     * buckets without violations are omitted.
     */
    List<CellSeries> cellSeries(ViolationFilters filters, Granularity granularity, double gridSizeDeg);
}
