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
package de.makibytes.trafficlyt.cache;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import de.makibytes.trafficlyt.anchor.TimeFormats;
import de.makibytes.trafficlyt.model.AnchoredWindow;
import de.makibytes.trafficlyt.model.BoundingBox;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.model.WindowSource;

/**
 * Builds the deterministic request signature that cache keys are derived from.
 * <p>
 * Fields are emitted in a fixed order and joined with {@value #DELIMITER}. Normalization never
 * throws: malformed filters collapse to the empty string, i.e. "filter absent".
 */
public final class RequestSignature {

    public static final String DELIMITER = "|";
    static final int BBOX_SCALE = 5;

    private RequestSignature() {
    }

    public static String build(String endpoint,
                               String version,
                               String granularity,
                               AnchoredWindow window,
                               ViolationFilters filters,
                               Map<String, ?> modelParams) {
        Instant anchor = window == null ? null : window.anchorTs();
        boolean absolute = window != null && window.windowSource() == WindowSource.ABSOLUTE;
        Instant start = absolute ? window.effectiveStartTs() : null;
        Instant end = absolute ? window.effectiveEndTs() : null;
        return build(endpoint, version, granularity, TimeFormats.toUtcIso(anchor), filters,
                TimeFormats.toUtcIso(start), TimeFormats.toUtcIso(end), modelParams);
    }

    public static String build(String endpoint,
                               String version,
                               String granularity,
                               String anchorTs,
                               ViolationFilters filters,
                               String startIso,
                               String endIso,
                               Map<String, ?> modelParams) {
        ViolationFilters scope = filters == null ? ViolationFilters.none() : filters;
        List<String> parts = new ArrayList<>();
        parts.add("ep=" + nullToEmpty(endpoint));
        parts.add("fv=" + nullToEmpty(version));
        parts.add("gran=" + nullToEmpty(granularity));
        parts.add("anchor=" + nullToEmpty(anchorTs));
        parts.add("bbox=" + normalizeBbox(scope.bbox()));
        parts.add("vt=" + normalizeCategory(scope.violationType()));
        parts.add("h_start=" + normalizeNumber(scope.hourStart()));
        parts.add("h_end=" + normalizeNumber(scope.hourEnd()));
        parts.add("start=" + nullToEmpty(startIso));
        parts.add("end=" + nullToEmpty(endIso));
        if (modelParams != null && !modelParams.isEmpty()) {
            new TreeMap<String, Object>(modelParams).forEach((key, value) -> {
                if (value != null) {
                    parts.add(key + "=" + value);
                }
            });
        }
        return String.join(DELIMITER, parts);
    }

    /**
     * Rounds each coordinate to five decimals in {@code minLon,minLat,maxLon,maxLat} order.
     */
    public static String normalizeBbox(String bbox) {
        BoundingBox box = BoundingBox.parse(bbox);
        if (box == null) {
            return "";
        }
        return String.join(",",
                round(box.minLon()), round(box.minLat()), round(box.maxLon()), round(box.maxLat()));
    }

    public static String normalizeCategory(String value) {
        return value == null ? "" : value.trim();
    }

    public static String normalizeNumber(Number value) {
        return value == null ? "" : value.toString();
    }

    private static String round(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(BBOX_SCALE, RoundingMode.HALF_EVEN).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
