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

import java.util.Locale;

public enum ForecastMethod {
    /** Repeats the last observed bucket. */
    NAIVE("naive"),
    /** Mean of the last {@code window} buckets. */
    MOVING_AVERAGE("ma"),
    /** Exponentially weighted mean with smoothing factor {@code alpha}. */
    EWM("ewm");

    private final String key;

    ForecastMethod(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ForecastMethod fromKey(String key) {
        if (key == null || key.isBlank()) {
            return MOVING_AVERAGE;
        }
        String normalized = key.toLowerCase(Locale.ROOT).trim();
        for (ForecastMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        return null;
    }
}
