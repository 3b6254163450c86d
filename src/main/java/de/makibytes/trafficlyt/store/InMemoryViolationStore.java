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
package de.makibytes.trafficlyt.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.trafficlyt.config.TrafficLytProperties;
import de.makibytes.trafficlyt.model.BucketCount;
import de.makibytes.trafficlyt.model.CellSeries;
import de.makibytes.trafficlyt.model.DataTimeRange;
import de.makibytes.trafficlyt.model.Granularity;
import de.makibytes.trafficlyt.model.Violation;
import de.makibytes.trafficlyt.model.ViolationFilters;

@Component
public class InMemoryViolationStore implements ViolationStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryViolationStore.class);

    private final NavigableMap<Long, Violation> violationsById = new ConcurrentSkipListMap<>();
    private final AtomicLong queryCount = new AtomicLong();
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public InMemoryViolationStore() {
    }

    @Autowired
    public InMemoryViolationStore(TrafficLytProperties properties) {
        String seedFile = properties.getData().getSeedFile();
        if (seedFile != null && !seedFile.isBlank()) {
            loadSnapshot(Path.of(seedFile));
        }
    }

    public void add(Violation violation) {
        violationsById.put(violation.id(), violation);
    }

    public void addAll(Collection<Violation> violations) {
        violations.forEach(this::add);
    }

    public int size() {
        return violationsById.size();
    }

    /**
     * Number of queries answered so far; lets callers verify that cached paths skip the store.
     */
    public long getQueryCount() {
        return queryCount.get();
    }

    @Override
    public DataTimeRange observedRange(ViolationFilters scope) {
        queryCount.incrementAndGet();
        Instant min = null;
        Instant max = null;
        for (Violation violation : violationsById.values()) {
            if (!scope.matches(violation)) {
                continue;
            }
            Instant ts = violation.occurredAt();
            if (min == null || ts.isBefore(min)) {
                min = ts;
            }
            if (max == null || ts.isAfter(max)) {
                max = ts;
            }
        }
        return min == null ? DataTimeRange.empty() : new DataTimeRange(min, max);
    }

    @Override
    public List<BucketCount> countsByBucket(ViolationFilters filters, Granularity granularity, int limit) {
        queryCount.incrementAndGet();
        NavigableMap<Instant, Long> buckets = new TreeMap<>();
        for (Violation violation : violationsById.values()) {
            if (filters.matches(violation)) {
                buckets.merge(granularity.truncate(violation.occurredAt()), 1L, Long::sum);
            }
        }
        if (buckets.isEmpty()) {
            return List.of();
        }
        List<BucketCount> series = new ArrayList<>();
        Instant last = buckets.lastKey();
        for (Instant ts = buckets.firstKey(); !ts.isAfter(last); ts = ts.plus(granularity.getStep())) {
            series.add(new BucketCount(ts, buckets.getOrDefault(ts, 0L)));
        }
        int from = Math.max(0, series.size() - Math.max(1, limit));
        return List.copyOf(series.subList(from, series.size()));
    }

    @Override
    public ViolationStats stats(ViolationFilters filters, int topTypes) {
        queryCount.incrementAndGet();
        List<Violation> matching = violationsById.values().stream()
                .filter(filters::matches)
                .toList();
        if (matching.isEmpty()) {
            return ViolationStats.empty();
        }
        Instant min = matching.stream().map(Violation::occurredAt).min(Comparator.naturalOrder()).orElse(null);
        Instant max = matching.stream().map(Violation::occurredAt).max(Comparator.naturalOrder()).orElse(null);
        Map<String, Long> byType = matching.stream()
                .collect(Collectors.groupingBy(v -> v.violationType() == null ? "" : v.violationType(),
                        Collectors.counting()));
        List<ViolationStats.TypeCount> top = byType.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topTypes)
                .map(entry -> new ViolationStats.TypeCount(entry.getKey(), entry.getValue()))
                .toList();
        return new ViolationStats(matching.size(), min, max, top);
    }

    @Override
    public List<CellSeries> cellSeries(ViolationFilters filters, Granularity granularity, double gridSizeDeg) {
        if (!(gridSizeDeg > 0)) {
            throw new IllegalArgumentException("gridSizeDeg must be positive: " + gridSizeDeg);
        }
        queryCount.incrementAndGet();
        Map<GridCell, NavigableMap<Instant, Long>> byCell = new TreeMap<>();
        for (Violation violation : violationsById.values()) {
            if (filters.matches(violation)) {
                GridCell cell = new GridCell(snap(violation.lon(), gridSizeDeg), snap(violation.lat(), gridSizeDeg));
                byCell.computeIfAbsent(cell, key -> new TreeMap<>())
                        .merge(granularity.truncate(violation.occurredAt()), 1L, Long::sum);
            }
        }
        return byCell.entrySet().stream()
                .map(entry -> new CellSeries(entry.getKey().lon(), entry.getKey().lat(),
                        List.copyOf(entry.getValue().values())))
                .toList();
    }

    static double snap(double coordinate, double gridSizeDeg) {
        double snapped = Math.round(coordinate / gridSizeDeg) * gridSizeDeg;
        return Math.round(snapped * 1_000_000d) / 1_000_000d;
    }

    private void loadSnapshot(Path file) {
        try {
            if (!Files.exists(file)) {
                logger.warn("Seed file {} does not exist, starting with an empty store", file);
                return;
            }
            Snapshot snapshot = objectMapper.readValue(Files.readAllBytes(file), Snapshot.class);
            if (snapshot.violations() != null) {
                violationsById.putAll(snapshot.violations().stream()
                        .collect(Collectors.toMap(Violation::id, Function.identity(), (a, b) -> b)));
            }
            logger.info("Loaded {} violations from {}", violationsById.size(), file);
        } catch (IOException ex) {
            logger.warn("Failed to load seed file {}: {}", file, ex.getMessage());
        }
    }

    record Snapshot(List<Violation> violations) {
    }

    private record GridCell(double lon, double lat) implements Comparable<GridCell> {

        @Override
        public int compareTo(GridCell other) {
            int byLon = Double.compare(lon, other.lon);
            return byLon != 0 ? byLon : Double.compare(lat, other.lat);
        }
    }
}
