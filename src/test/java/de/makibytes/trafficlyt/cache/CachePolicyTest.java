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

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.trafficlyt.config.TrafficLytProperties;

@DisplayName("CachePolicy Tests")
class CachePolicyTest {

    @Test
    @DisplayName("configured TTLs are used per endpoint")
    void configuredTtls() {
        CachePolicy policy = new CachePolicy(new TrafficLytProperties());

        assertEquals(Duration.ofSeconds(60), policy.responseTtl("stats"));
        assertEquals(Duration.ofSeconds(90), policy.responseTtl("risk"));
        assertEquals(Duration.ofSeconds(900), policy.modelTtl());
    }

    @Test
    @DisplayName("unknown endpoints and invalid values fall back to defaults")
    void fallbacks() {
        TrafficLytProperties properties = new TrafficLytProperties();
        properties.getCache().getResponseTtlSeconds().put("stats", -5L);
        properties.getCache().setModelTtlSeconds(0);
        properties.getCache().setFeatureVersion(" ");
        CachePolicy policy = new CachePolicy(properties);

        assertEquals(Duration.ofSeconds(90), policy.responseTtl("stats"));
        assertEquals(Duration.ofSeconds(90), policy.responseTtl("unknown"));
        assertEquals(Duration.ofSeconds(900), policy.modelTtl());
        assertEquals("v1", policy.featureVersion());
    }
}
