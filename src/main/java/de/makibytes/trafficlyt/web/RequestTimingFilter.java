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

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.trafficlyt.config.TrafficLytProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Assigns the request id and writes one structured log line per request.
 */
@Component
public class RequestTimingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestTimingFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final int MAX_REQUEST_ID_LENGTH = 128;

    private final ObjectMapper objectMapper;
    private final long slowThresholdMs;

    public RequestTimingFilter(ObjectMapper objectMapper, TrafficLytProperties properties) {
        this.objectMapper = objectMapper;
        this.slowThresholdMs = properties.getSlowThresholdMs();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        request.setAttribute(RequestAttributes.REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        long startNanos = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            Map<String, Object> event = baseEvent("request_error", request, requestId, startNanos);
            event.put("error", ex.getClass().getSimpleName());
            putIfPresent(event, "message", ex.getMessage());
            logger.error(toJson(event));
            throw ex;
        }

        long elapsedMs = elapsedMs(startNanos);
        Map<String, Object> event = baseEvent("request_complete", request, requestId, startNanos);
        event.put("status", response.getStatus());
        putIfPresent(event, "client_ip", request.getRemoteAddr());
        putIfPresent(event, "response_cache_hit", request.getAttribute(RequestAttributes.RESPONSE_CACHE_HIT));
        putIfPresent(event, "model_cache_hit", request.getAttribute(RequestAttributes.MODEL_CACHE_HIT));
        putIfPresent(event, "rate_limited", request.getAttribute(RequestAttributes.RATE_LIMITED));
        putIfPresent(event, "retry_after_seconds", request.getAttribute(RequestAttributes.RETRY_AFTER_SECONDS));
        if (slowThresholdMs > 0 && elapsedMs > slowThresholdMs) {
            event.put("slow", true);
            logger.warn(toJson(event));
        } else {
            logger.info(toJson(event));
        }
    }

    /**
     * Echoes a caller-supplied id when it is usable, otherwise generates a fresh one.
     */
    static String resolveRequestId(String header) {
        if (header != null) {
            String trimmed = header.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_REQUEST_ID_LENGTH) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private Map<String, Object> baseEvent(String name, HttpServletRequest request, String requestId, long startNanos) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", name);
        event.put("request_id", requestId);
        event.put("method", request.getMethod());
        event.put("path", request.getRequestURI());
        event.put("elapsed_ms", elapsedMs(startNanos));
        return event;
    }

    private String toJson(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            return event.toString();
        }
    }

    private static void putIfPresent(Map<String, Object> event, String key, Object value) {
        if (value != null) {
            event.put(key, value);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
