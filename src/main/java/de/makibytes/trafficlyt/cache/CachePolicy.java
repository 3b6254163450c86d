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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.config.TrafficLytProperties;

/**
 * Resolves TTLs and version tags from configuration. Invalid values fall back to defaults.
 */
@Component
public class CachePolicy {
    private static final Logger logger = LoggerFactory.getLogger(CachePolicy.class);

    private final TrafficLytProperties.Cache cache;

    public CachePolicy(TrafficLytProperties properties) {
        this.cache = properties.getCache();
    }

    public Duration responseTtl(String endpoint) {
        Map<String, Long> ttls = cache.getResponseTtlSeconds();
        Long seconds = ttls == null ? null : ttls.get(endpoint);
        if (seconds == null) {
            return Duration.ofSeconds(TrafficLytProperties.Cache.DEFAULT_RESPONSE_TTL_SECONDS);
        }
        return positiveOrDefault(seconds, TrafficLytProperties.Cache.DEFAULT_RESPONSE_TTL_SECONDS, endpoint);
    }

    public Duration modelTtl() {
        return positiveOrDefault(cache.getModelTtlSeconds(), TrafficLytProperties.Cache.DEFAULT_MODEL_TTL_SECONDS, "model");
    }

    public String featureVersion() {
        return versionOrDefault(cache.getFeatureVersion());
    }

    public String responseVersion() {
        return versionOrDefault(cache.getResponseVersion());
    }

    private static Duration positiveOrDefault(long seconds, long fallback, String name) {
        if (seconds <= 0) {
            logger.warn("Invalid TTL {}s for {}, using {}s", seconds, name, fallback);
            return Duration.ofSeconds(fallback);
        }
        return Duration.ofSeconds(seconds);
    }

    private static String versionOrDefault(String version) {
        return version == null || version.isBlank() ? "v1" : version.trim();
    }
}
