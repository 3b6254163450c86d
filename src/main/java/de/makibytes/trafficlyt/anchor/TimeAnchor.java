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
package de.makibytes.trafficlyt.anchor;

import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.model.AnchoredWindow;
import de.makibytes.trafficlyt.model.DataTimeRange;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.model.WindowSource;
import de.makibytes.trafficlyt.store.ViolationStore;

/**
 * Resolves the as-of window of a request from the freshest observed data instead of the wall clock.
 * <p>
 * Relative windows end at {@code MAX(occurred_at)} of the same non-temporal filter scope (bbox,
 * violation type, hours), so two calls over unchanged data always produce the same window and
 * therefore the same cache keys.
 */
@Component
public class TimeAnchor {

    /**
     * Fetches the observed range for {@code filters} without their time bounds, then anchors.
     */
    public AnchoredWindow anchorWindow(ViolationFilters filters, ViolationStore store, Duration lookback) {
        DataTimeRange observed = store.observedRange(filters.withoutTime());
        return anchorWindow(filters, observed, lookback);
    }

    public AnchoredWindow anchorWindow(ViolationFilters filters, DataTimeRange observed) {
        return anchorWindow(filters, observed, null);
    }

    /**
     * Pure computation over the caller's filters and the observed data range.
     *
     * @param lookback optional fixed window length for anchored requests; ignored for absolute ones
     */
    public AnchoredWindow anchorWindow(ViolationFilters filters, DataTimeRange observed, Duration lookback) {
        DataTimeRange range = observed == null ? DataTimeRange.empty() : observed;
        Instant dataMin = range.min();
        Instant dataMax = range.max();

        if (filters.hasAbsoluteWindow()) {
            return new AnchoredWindow(dataMin, dataMax, dataMax,
                    filters.start(), filters.end(), WindowSource.ABSOLUTE,
                    dataMax == null ? AnchoredWindow.NO_DATA_MESSAGE : null);
        }
        if (dataMax == null) {
            return AnchoredWindow.noData();
        }

        Instant end = dataMax;
        Instant start = dataMin != null ? dataMin : end;
        if (lookback != null && !lookback.isNegative()) {
            start = latest(end.minus(lookback), dataMin);
        }
        start = latest(start, filters.start());
        if (start.isAfter(end)) {
            // caller start lies beyond the freshest data
            start = end;
        }
        return new AnchoredWindow(dataMin, dataMax, dataMax, start, end, WindowSource.ANCHORED, null);
    }

    private static Instant latest(Instant candidate, Instant floor) {
        if (floor == null) {
            return candidate;
        }
        return candidate.isBefore(floor) ? floor : candidate;
    }
}
