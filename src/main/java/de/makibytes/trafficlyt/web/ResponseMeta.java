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

import com.fasterxml.jackson.annotation.JsonInclude;

import de.makibytes.trafficlyt.model.AnchoredWindow;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseMeta(String requestId,
                           AnchoredWindow window,
                           CacheMeta responseCache,
                           CacheMeta modelCache) {

    /**
     * The metadata a cached payload is served with: current request id, response cache marked as hit.
     */
    public ResponseMeta servedFromCache(String currentRequestId) {
        return new ResponseMeta(currentRequestId, window,
                responseCache == null ? null : responseCache.asHit(), modelCache);
    }

    public boolean responseCacheHit() {
        return responseCache != null && responseCache.hit();
    }

    public boolean modelCacheHit() {
        return modelCache != null && modelCache.hit();
    }
}
