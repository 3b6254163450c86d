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

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.trafficlyt.anchor.TimeAnchor;
import de.makibytes.trafficlyt.cache.CacheKeys;
import de.makibytes.trafficlyt.cache.CachePolicy;
import de.makibytes.trafficlyt.cache.EntryMeta;
import de.makibytes.trafficlyt.cache.RequestSignature;
import de.makibytes.trafficlyt.cache.ResponseCache;
import de.makibytes.trafficlyt.model.AnchoredWindow;
import de.makibytes.trafficlyt.model.ViolationFilters;
import de.makibytes.trafficlyt.store.ViolationStats;
import de.makibytes.trafficlyt.store.ViolationStore;

@Service
public class StatsService {
    private static final Logger logger = LoggerFactory.getLogger(StatsService.class);

    static final String ENDPOINT = "stats";
    private static final int TOP_TYPES = 10;

    private final ViolationStore store;
    private final TimeAnchor timeAnchor;
    private final ResponseCache responseCache;
    private final CachePolicy cachePolicy;

    public StatsService(ViolationStore store,
                        TimeAnchor timeAnchor,
                        ResponseCache responseCache,
                        CachePolicy cachePolicy) {
        this.store = store;
        this.timeAnchor = timeAnchor;
        this.responseCache = responseCache;
        this.cachePolicy = cachePolicy;
    }

    public StatsResponse getStats(ViolationFilters filters, String requestId) {
        AnchoredWindow window = timeAnchor.anchorWindow(filters, store, null);
        if (!window.hasData()) {
            return StatsResponse.of(ViolationStats.empty(), new ResponseMeta(requestId, window, null, null));
        }

        String signature = RequestSignature.build(ENDPOINT, cachePolicy.responseVersion(), "", window, filters, null);
        String responseKey = CacheKeys.responseKey(ENDPOINT, signature, window, cachePolicy.responseVersion());
        Duration ttl = cachePolicy.responseTtl(ENDPOINT);

        Optional<StatsResponse> cached = responseCache.get(responseKey, StatsResponse.class);
        if (cached.isPresent()) {
            logger.debug("stats response cache hit {}", CacheKeys.shortHash(responseKey));
            return cached.get().withMeta(cached.get().meta().servedFromCache(requestId));
        }

        ViolationStats stats = store.stats(filters.withWindow(window.effectiveStartTs(), window.effectiveEndTs()), TOP_TYPES);
        StatsResponse response = StatsResponse.of(stats,
                new ResponseMeta(requestId, window, CacheMeta.miss(responseKey, ttl), null));
        responseCache.set(responseKey, response, ttl, EntryMeta.of(ENDPOINT));
        return response;
    }
}
