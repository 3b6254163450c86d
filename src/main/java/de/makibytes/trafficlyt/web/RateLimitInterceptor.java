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

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import de.makibytes.trafficlyt.ratelimit.RateLimitDecision;
import de.makibytes.trafficlyt.ratelimit.RateLimitExceededException;
import de.makibytes.trafficlyt.ratelimit.RateLimited;
import de.makibytes.trafficlyt.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Admits or rejects requests to handlers annotated with {@link RateLimited}. Runs before the
 * handler, so rejected requests never reach the caches or the store.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final ClientIdResolver clientIdResolver;

    public RateLimitInterceptor(RateLimiter rateLimiter, ClientIdResolver clientIdResolver) {
        this.rateLimiter = rateLimiter;
        this.clientIdResolver = clientIdResolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!rateLimiter.isEnabled() || !(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RateLimited annotation = findAnnotation(handlerMethod);
        if (annotation == null) {
            return true;
        }
        String clientId = clientIdResolver.resolve(request);
        request.setAttribute(RequestAttributes.CLIENT_ID, clientId);
        RateLimitDecision decision = rateLimiter.check(clientId, annotation.value());
        if (decision.allowed()) {
            return true;
        }
        request.setAttribute(RequestAttributes.RATE_LIMITED, true);
        request.setAttribute(RequestAttributes.RETRY_AFTER_SECONDS, decision.retryAfterSeconds());
        throw new RateLimitExceededException(annotation.value(), decision.retryAfterSeconds());
    }

    private static RateLimited findAnnotation(HandlerMethod handlerMethod) {
        RateLimited onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), RateLimited.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RateLimited.class);
    }
}
