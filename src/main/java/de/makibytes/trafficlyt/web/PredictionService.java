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
import java.util.ArrayList;
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
import de.makibytes.trafficlyt.model.BucketCount;
import de.makibytes.trafficlyt.predict.CountForecaster;
import de.makibytes.trafficlyt.predict.FittedForecast;
import de.makibytes.trafficlyt.predict.ModelArtifact;
import de.makibytes.trafficlyt.store.ViolationStore;

@Service
public class PredictionService {
    private static final Logger logger = LoggerFactory.getLogger(PredictionService.class);

    static final String FORECAST = "forecast";
    static final String RISK = "risk";

    static final double MEDIUM_RISK_SCORE = 0.8;
    static final double HIGH_RISK_SCORE = 1.25;

    private final ViolationStore store;
    private final TimeAnchor timeAnchor;
    private final CountForecaster forecaster;
    private final ModelRegistry modelRegistry;
    private final ResponseCache responseCache;
    private final CachePolicy cachePolicy;

    public PredictionService(ViolationStore store,
                             TimeAnchor timeAnchor,
                             CountForecaster forecaster,
                             ModelRegistry modelRegistry,
                             ResponseCache responseCache,
                             CachePolicy cachePolicy) {
        this.store = store;
        this.timeAnchor = timeAnchor;
        this.forecaster = forecaster;
        this.modelRegistry = modelRegistry;
        this.responseCache = responseCache;
        this.cachePolicy = cachePolicy;
    }

    public ForecastResponse forecast(PredictRequest request, String requestId) {
        AnchoredWindow window = timeAnchor.anchorWindow(request.filters(), store, null);
        ForecastResponse.ModelInfo info = new ForecastResponse.ModelInfo(request.method().getKey(),
                request.window(), request.alpha(), request.horizon());
        if (!window.hasData()) {
            return new ForecastResponse(request.granularity().getKey(), info, List.of(), List.of(),
                    new ResponseMeta(requestId, window, null, null));
        }

        Keys keys = keys(FORECAST, request, window);
        Optional<ForecastResponse> cached = responseCache.get(keys.response(), ForecastResponse.class);
        if (cached.isPresent()) {
            logger.debug("forecast response cache hit {}", CacheKeys.shortHash(keys.response()));
            return cached.get().withMeta(cached.get().meta().servedFromCache(requestId));
        }

        Fit fit = fit(FORECAST, request, window, keys.model());
        ForecastResponse response = new ForecastResponse(request.granularity().getKey(), info,
                fit.artifact().history(), fit.artifact().model().forecast(request.horizon()),
                new ResponseMeta(requestId, window, CacheMeta.miss(keys.response(), keys.responseTtl()), fit.cacheMeta()));
        responseCache.set(keys.response(), response, keys.responseTtl(), entryMeta(FORECAST, request));
        return response;
    }

    public RiskResponse risk(PredictRequest request, String requestId) {
        AnchoredWindow window = timeAnchor.anchorWindow(request.filters(), store, null);
        if (!window.hasData()) {
            return new RiskResponse(request.granularity().getKey(), request.horizon(), 0, List.of(),
                    new ResponseMeta(requestId, window, null, null));
        }

        Keys keys = keys(RISK, request, window);
        Optional<RiskResponse> cached = responseCache.get(keys.response(), RiskResponse.class);
        if (cached.isPresent()) {
            logger.debug("risk response cache hit {}", CacheKeys.shortHash(keys.response()));
            return cached.get().withMeta(cached.get().meta().servedFromCache(requestId));
        }

        Fit fit = fit(RISK, request, window, keys.model());
        FittedForecast model = fit.artifact().model();
        double baseline = model.historyMean();
        List<RiskResponse.RiskPoint> points = new ArrayList<>();
        for (BucketCount point : model.forecast(request.horizon())) {
            double score = baseline > 0 ? round3(point.count() / baseline) : 0.0;
            points.add(new RiskResponse.RiskPoint(point.ts(), point.count(), score, riskLevel(score)));
        }
        RiskResponse response = new RiskResponse(request.granularity().getKey(), request.horizon(), round3(baseline),
                points, new ResponseMeta(requestId, window, CacheMeta.miss(keys.response(), keys.responseTtl()), fit.cacheMeta()));
        responseCache.set(keys.response(), response, keys.responseTtl(), entryMeta(RISK, request));
        return response;
    }

    static String riskLevel(double score) {
        if (score < MEDIUM_RISK_SCORE) {
            return "low";
        }
        if (score < HIGH_RISK_SCORE) {
            return "medium";
        }
        return "high";
    }

    private Keys keys(String endpoint, PredictRequest request, AnchoredWindow window) {
        String granularity = request.granularity().getKey();
        String featureVersion = cachePolicy.featureVersion();
        String responseSignature = RequestSignature.build(endpoint, featureVersion, granularity, window,
                request.filters(), request.signatureParams());
        String responseKey = CacheKeys.responseKey(endpoint, responseSignature, window, cachePolicy.responseVersion());

        // horizon only changes how far a fitted model is projected
        String modelSignature = RequestSignature.build(endpoint, featureVersion, granularity, window,
                request.filters(), request.fitParams());
        String modelKey = CacheKeys.modelKey(endpoint, modelSignature, TimeFormats.toUtcIso(window.anchorTs()),
                granularity, request.fitParams(), featureVersion);
        return new Keys(responseKey, modelKey, cachePolicy.responseTtl(endpoint));
    }

    private Fit fit(String endpoint, PredictRequest request, AnchoredWindow window, String modelKey) {
        Duration modelTtl = cachePolicy.modelTtl();
        Optional<ModelArtifact> cached = modelRegistry.get(modelKey, ModelArtifact.class);
        if (cached.isPresent()) {
            logger.debug("{} model cache hit {}", endpoint, CacheKeys.shortHash(modelKey));
            return new Fit(cached.get(), CacheMeta.hit(modelKey, modelTtl));
        }

        List<BucketCount> history = store.countsByBucket(
                request.filters().withWindow(window.effectiveStartTs(), window.effectiveEndTs()),
                request.granularity(), request.limitHistory());
        FittedForecast model = forecaster.fit(history, request.granularity(), request.method(),
                request.window(), request.alpha());
        ModelArtifact artifact = new ModelArtifact(model, List.copyOf(history));
        modelRegistry.set(modelKey, artifact, modelTtl, entryMeta(endpoint, request));
        logger.debug("{} model fitted on {} buckets, key {}", endpoint, history.size(), CacheKeys.shortHash(modelKey));
        return new Fit(artifact, CacheMeta.miss(modelKey, modelTtl));
    }

    private static EntryMeta entryMeta(String endpoint, PredictRequest request) {
        return new EntryMeta(endpoint, request.granularity().getKey());
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private record Keys(String response, String model, Duration responseTtl) {
    }

    private record Fit(ModelArtifact artifact, CacheMeta cacheMeta) {
    }
}
