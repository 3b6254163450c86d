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
package de.makibytes.trafficlyt.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "trafficlyt")
public class TrafficLytProperties {

    private long slowThresholdMs = 300;
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Data data = new Data();

    public long getSlowThresholdMs() {
        return slowThresholdMs;
    }

    public void setSlowThresholdMs(long slowThresholdMs) {
        this.slowThresholdMs = slowThresholdMs;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public static class Cache {
        public static final int DEFAULT_MAX_ITEMS = 256;
        public static final long DEFAULT_RESPONSE_TTL_SECONDS = 90;
        public static final long DEFAULT_MODEL_TTL_SECONDS = 900;

        private int modelMaxItems = DEFAULT_MAX_ITEMS;
        private int responseMaxItems = DEFAULT_MAX_ITEMS;
        private String featureVersion = "v1";
        private String responseVersion = "v1";
        private long modelTtlSeconds = DEFAULT_MODEL_TTL_SECONDS;
        private Map<String, Long> responseTtlSeconds = defaultResponseTtls();

        private static Map<String, Long> defaultResponseTtls() {
            Map<String, Long> ttls = new HashMap<>();
            ttls.put("stats", 60L);
            ttls.put("forecast", DEFAULT_RESPONSE_TTL_SECONDS);
            ttls.put("risk", DEFAULT_RESPONSE_TTL_SECONDS);
            ttls.put("anomaly_heatmap", DEFAULT_RESPONSE_TTL_SECONDS);
            return ttls;
        }

        public int getModelMaxItems() {
            return modelMaxItems;
        }

        public void setModelMaxItems(int modelMaxItems) {
            this.modelMaxItems = modelMaxItems;
        }

        public int getResponseMaxItems() {
            return responseMaxItems;
        }

        public void setResponseMaxItems(int responseMaxItems) {
            this.responseMaxItems = responseMaxItems;
        }

        public String getFeatureVersion() {
            return featureVersion;
        }

        public void setFeatureVersion(String featureVersion) {
            this.featureVersion = featureVersion;
        }

        public String getResponseVersion() {
            return responseVersion;
        }

        public void setResponseVersion(String responseVersion) {
            this.responseVersion = responseVersion;
        }

        public long getModelTtlSeconds() {
            return modelTtlSeconds;
        }

        public void setModelTtlSeconds(long modelTtlSeconds) {
            this.modelTtlSeconds = modelTtlSeconds;
        }

        public Map<String, Long> getResponseTtlSeconds() {
            return responseTtlSeconds;
        }

        public void setResponseTtlSeconds(Map<String, Long> responseTtlSeconds) {
            this.responseTtlSeconds = responseTtlSeconds;
        }
    }

    public static class RateLimit {
        public static final String DEFAULT_GROUP = "other";
        public static final long DEFAULT_WINDOW_SECONDS = 60;

        private boolean enabled = true;
        private long windowSeconds = DEFAULT_WINDOW_SECONDS;
        private boolean trustForwardedFor = false;
        private Map<String, Integer> limits = defaultLimits();

        private static Map<String, Integer> defaultLimits() {
            Map<String, Integer> limits = new HashMap<>();
            limits.put("predict", 30);
            limits.put("stats", 60);
            limits.put(DEFAULT_GROUP, 60);
            return limits;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(long windowSeconds) {
            this.windowSeconds = windowSeconds;
        }

        public boolean isTrustForwardedFor() {
            return trustForwardedFor;
        }

        public void setTrustForwardedFor(boolean trustForwardedFor) {
            this.trustForwardedFor = trustForwardedFor;
        }

        public Map<String, Integer> getLimits() {
            return limits;
        }

        public void setLimits(Map<String, Integer> limits) {
            this.limits = limits;
        }
    }

    public static class Data {
        private String seedFile;

        public String getSeedFile() {
            return seedFile;
        }

        public void setSeedFile(String seedFile) {
            this.seedFile = seedFile;
        }
    }
}
