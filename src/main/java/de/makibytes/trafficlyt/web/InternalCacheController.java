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
package de.makibytes.trafficlyt.web;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import de.makibytes.trafficlyt.cache.ModelRegistry;
import de.makibytes.trafficlyt.cache.ResponseCache;
import de.makibytes.trafficlyt.ratelimit.RateLimiter;

/**
 * Operator view of the process-local caches. Not rate limited.
 */
@Controller
@RequestMapping("/internal/cache")
public class InternalCacheController {
    private static final Logger logger = LoggerFactory.getLogger(InternalCacheController.class);

    private final ModelRegistry modelRegistry;
    private final ResponseCache responseCache;
    private final RateLimiter rateLimiter;

    public InternalCacheController(ModelRegistry modelRegistry, ResponseCache responseCache, RateLimiter rateLimiter) {
        this.modelRegistry = modelRegistry;
        this.responseCache = responseCache;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping
    @ResponseBody
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model_cache", modelRegistry.stats());
        body.put("response_cache", responseCache.stats());
        body.put("rate_limit", rateLimiter.stats());
        return ResponseEntity.ok(body);
    }

    /**
     * Removes entries whose key starts with {@code prefix} (all entries when absent).
     */
    @PostMapping("/invalidate")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> invalidate(@RequestParam(name = "cache", defaultValue = "all") String cache,
                                                          @RequestParam(name = "prefix", defaultValue = "") String prefix) {
        String target = cache.toLowerCase(Locale.ROOT).trim();
        if (!target.equals("model") && !target.equals("response") && !target.equals("all")) {
            throw new InvalidRequestException("cache must be one of model, response, all");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        if (!target.equals("response")) {
            body.put("model_cache", modelRegistry.invalidatePrefix(prefix));
        }
        if (!target.equals("model")) {
            body.put("response_cache", responseCache.invalidatePrefix(prefix));
        }
        logger.info("Invalidated cache={} prefix='{}' removed={}", target, prefix, body);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/cleanup")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> cleanup() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model_cache", modelRegistry.cleanupExpired());
        body.put("response_cache", responseCache.cleanupExpired());
        return ResponseEntity.ok(body);
    }
}
