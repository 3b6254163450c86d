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
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.trafficlyt.anchor.TimeAnchor;
import de.makibytes.trafficlyt.anchor.TimeFormats;
import de.makibytes.trafficlyt.cache.CacheKeys;
import de.makibytes.trafficlyt.cache.CachePolicy;
import de.makibytes.trafficlyt.cache.EntryMeta;
import de.makibytes.trafficlyt.cache.ModelRegistry;
import de.makibytes.trafficlyt.cache.RequestSignature;
import de.makibytes.trafficlyt.cache.ResponseCache;
import de.makibytes.trafficlyt.model.AnchoredWindow;
import de.makibytes.trafficlyt.model.CellSeries;
import de.makibytes.trafficlyt.predict.AnomalyPoint;
import de.makibytes.trafficlyt.predict.AnomalyScorer;
import de.makibytes.trafficlyt.predict.GridAggregate;
import de.makibytes.trafficlyt.store.ViolationStore;

/**
 * Anomaly heatmap over the last {@code days} of observed data. The grid aggregate is shared by
 * every threshold and result size; the scored payload is cached per full request.
 */
@Service
public class AnomalyService {
    private static final Logger logger = LoggerFactory.getLogger(AnomalyService.class);

    static final String ENDPOINT = "anomaly_heatmap";
    // roughly 100 m
    static final double GRID_SIZE_DEG = 0.001;

    private final ViolationStore store;
    private final TimeAnchor timeAnchor;
    private final AnomalyScorer scorer;
    private final ModelRegistry modelRegistry;
    private final ResponseCache responseCache;
    private final CachePolicy cachePolicy;

    public AnomalyService(ViolationStore store,
                          TimeAnchor timeAnchor,
                          AnomalyScorer scorer,
                          ModelRegistry modelRegistry,
                          ResponseCache responseCache,
                          CachePolicy cachePolicy) {
        this.store = store;
        this.timeAnchor = timeAnchor;
        this.scorer = scorer;
        this.modelRegistry = modelRegistry;
        this.responseCache = responseCache;
        this.cachePolicy = cachePolicy;
    }

    public HeatmapResponse heatmap(HeatmapRequest request, String requestId) {
        AnchoredWindow window = timeAnchor.anchorWindow(request.filters(), store, request.lookback());
        if (!window.hasData()) {
            return response(request, List.of(), new ResponseMeta(requestId, window, null, null));
        }

        String granularity = request.granularity().getKey();
        String featureVersion = cachePolicy.featureVersion();
        String responseSignature = RequestSignature.build(ENDPOINT, featureVersion, granularity, window,
                request.filters(), request.signatureParams(GRID_SIZE_DEG));
        String responseKey = CacheKeys.responseKey(ENDPOINT, responseSignature, window, cachePolicy.responseVersion());
        Duration responseTtl = cachePolicy.responseTtl(ENDPOINT);

        Optional<HeatmapResponse> cached = responseCache.get(responseKey, HeatmapResponse.class);
        if (cached.isPresent()) {
            logger.debug("anomaly heatmap response cache hit {}", CacheKeys.shortHash(responseKey));
            return cached.get().withMeta(cached.get().meta().servedFromCache(requestId));
        }

        String aggregateSignature = RequestSignature.build(ENDPOINT, featureVersion, granularity, window,
                request.filters(), request.aggregateParams(GRID_SIZE_DEG));
        String modelKey = CacheKeys.modelKey(ENDPOINT, aggregateSignature, TimeFormats.toUtcIso(window.anchorTs()),
                granularity, request.aggregateParams(GRID_SIZE_DEG), featureVersion);
        Duration modelTtl = cachePolicy.modelTtl();
        CacheMeta modelMeta;
        GridAggregate aggregate;
        Optional<GridAggregate> cachedAggregate = modelRegistry.get(modelKey, GridAggregate.class);
        if (cachedAggregate.isPresent()) {
            aggregate = cachedAggregate.get();
            modelMeta = CacheMeta.hit(modelKey, modelTtl);
        } else {
            List<CellSeries> cells = store.cellSeries(
                    request.filters().withWindow(window.effectiveStartTs(), window.effectiveEndTs()),
                    request.granularity(), GRID_SIZE_DEG);
            aggregate = new GridAggregate(request.granularity(), GRID_SIZE_DEG, cells);
            modelRegistry.set(modelKey, aggregate, modelTtl, new EntryMeta(ENDPOINT, granularity));
            modelMeta = CacheMeta.miss(modelKey, modelTtl);
            logger.debug("anomaly grid aggregated over {} cells, key {}", cells.size(), CacheKeys.shortHash(modelKey));
        }

        List<AnomalyPoint> points = scorer.score(aggregate, request.threshold(), request.topN());
        HeatmapResponse response = response(request, points,
                new ResponseMeta(requestId, window, CacheMeta.miss(responseKey, responseTtl), modelMeta));
        responseCache.set(responseKey, response, responseTtl, new EntryMeta(ENDPOINT, granularity));
        return response;
    }

    private static HeatmapResponse response(HeatmapRequest request, List<AnomalyPoint> points, ResponseMeta meta) {
        return new HeatmapResponse(request.granularity().getKey(), request.days(), request.method(),
                request.threshold(), points, meta);
    }
}
