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

import jakarta.servlet.http.HttpServletRequest;

/**
 * Servlet request attributes shared between handlers and the request log.
 */
public final class RequestAttributes {

    public static final String REQUEST_ID = "trafficlyt.request_id";
    public static final String CLIENT_ID = "trafficlyt.client_id";
    public static final String RESPONSE_CACHE_HIT = "trafficlyt.response_cache_hit";
    public static final String MODEL_CACHE_HIT = "trafficlyt.model_cache_hit";
    public static final String RATE_LIMITED = "trafficlyt.rate_limited";
    public static final String RETRY_AFTER_SECONDS = "trafficlyt.retry_after_seconds";

    private RequestAttributes() {
    }

    public static String requestId(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ID);
        return value == null ? null : value.toString();
    }

    static void recordCacheMeta(HttpServletRequest request, ResponseMeta meta) {
        if (meta == null) {
            return;
        }
        if (meta.responseCache() != null) {
            request.setAttribute(RESPONSE_CACHE_HIT, meta.responseCacheHit());
        }
        if (meta.modelCache() != null) {
            request.setAttribute(MODEL_CACHE_HIT, meta.modelCacheHit());
        }
    }
}
