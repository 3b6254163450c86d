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
package de.makibytes.trafficlyt.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.trafficlyt.config.TrafficLytProperties;

/**
 * Fixed-window request counter per (client, group).
 * <p>
 * Counters reset at window boundaries rather than sliding, so a burst straddling a boundary can
 * reach twice the nominal rate. Stale windows are purged at most once per grace period.
 */
@Component
public class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final boolean enabled;
    private final Map<String, Integer> limits;
    private final Duration window;
    private final Duration purgeAfter;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<WindowKey, WindowEntry> windows = new HashMap<>();
    private final Map<String, Long> allowedByGroup = new HashMap<>();
    private final Map<String, Long> blockedByGroup = new HashMap<>();
    private Instant lastPurge;

    @Autowired
    public RateLimiter(TrafficLytProperties properties, Clock clock) {
        this(properties.getRateLimit().isEnabled(),
                properties.getRateLimit().getLimits(),
                resolveWindow(properties.getRateLimit().getWindowSeconds()),
                clock);
    }

    public RateLimiter(boolean enabled, Map<String, Integer> limits, Duration window, Clock clock) {
        this.enabled = enabled;
        this.limits = sanitizeLimits(limits);
        this.window = window;
        this.purgeAfter = window.multipliedBy(2);
        this.clock = clock;
        this.lastPurge = clock.instant();
    }

    public RateLimitDecision check(String clientId, String requestedGroup) {
        String group = Objects.requireNonNullElse(requestedGroup, TrafficLytProperties.RateLimit.DEFAULT_GROUP);
        if (!enabled) {
            return RateLimitDecision.allow();
        }
        int limit = limitFor(group);
        if (limit <= 0) {
            return RateLimitDecision.allow();
        }
        WindowKey key = new WindowKey(Objects.requireNonNullElse(clientId, "unknown"), group);
        Instant now = clock.instant();
        synchronized (lock) {
            purgeIfNeeded(now);
            WindowEntry entry = windows.get(key);
            if (entry == null) {
                windows.put(key, new WindowEntry(now));
                return allowed(group);
            }
            Duration elapsed = Duration.between(entry.windowStart, now);
            if (elapsed.compareTo(window) >= 0) {
                entry.reset(now);
                return allowed(group);
            }
            entry.count++;
            if (entry.count <= limit) {
                return allowed(group);
            }
            blockedByGroup.merge(group, 1L, Long::sum);
            return RateLimitDecision.deny(retryAfterSeconds(elapsed));
        }
    }

    public RateLimitStats stats() {
        synchronized (lock) {
            return new RateLimitStats(new TreeMap<>(allowedByGroup), new TreeMap<>(blockedByGroup));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int limitFor(String group) {
        Integer limit = group == null ? null : limits.get(group);
        if (limit == null) {
            limit = limits.getOrDefault(TrafficLytProperties.RateLimit.DEFAULT_GROUP, 60);
        }
        return limit;
    }

    int trackedWindows() {
        synchronized (lock) {
            return windows.size();
        }
    }

    private RateLimitDecision allowed(String group) {
        allowedByGroup.merge(group, 1L, Long::sum);
        return RateLimitDecision.allow();
    }

    private long retryAfterSeconds(Duration elapsed) {
        long remainingMillis = window.minus(elapsed).toMillis();
        return Math.max(1, (remainingMillis + 999) / 1000);
    }

    private void purgeIfNeeded(Instant now) {
        if (Duration.between(lastPurge, now).compareTo(purgeAfter) < 0) {
            return;
        }
        lastPurge = now;
        int before = windows.size();
        windows.values().removeIf(entry -> Duration.between(entry.windowStart, now).compareTo(purgeAfter) > 0);
        if (before != windows.size()) {
            logger.debug("Purged {} stale rate limit windows", before - windows.size());
        }
    }

    private static Map<String, Integer> sanitizeLimits(Map<String, Integer> configured) {
        Map<String, Integer> result = new HashMap<>();
        if (configured != null) {
            configured.forEach((group, limit) -> {
                if (group != null && limit != null) {
                    result.put(group, limit);
                }
            });
        }
        return Map.copyOf(result);
    }

    private static Duration resolveWindow(long windowSeconds) {
        if (windowSeconds <= 0) {
            logger.warn("Invalid rate limit window {}s, using {}s", windowSeconds,
                    TrafficLytProperties.RateLimit.DEFAULT_WINDOW_SECONDS);
            return Duration.ofSeconds(TrafficLytProperties.RateLimit.DEFAULT_WINDOW_SECONDS);
        }
        return Duration.ofSeconds(windowSeconds);
    }

    private record WindowKey(String clientId, String group) {
    }

    private static final class WindowEntry {
        private int count;
        private Instant windowStart;

        private WindowEntry(Instant windowStart) {
            reset(windowStart);
        }

        private void reset(Instant start) {
            this.count = 1;
            this.windowStart = start;
        }
    }
}
