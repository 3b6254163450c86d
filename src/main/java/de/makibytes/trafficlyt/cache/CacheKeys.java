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
package de.makibytes.trafficlyt.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import de.makibytes.trafficlyt.anchor.TimeFormats;
import de.makibytes.trafficlyt.model.AnchoredWindow;

/**
 * Derives opaque, prefixed cache keys from request signatures.
 * <p>
 * Keys are {@code prefix:sha256-hex}; the prefix is the endpoint (or {@code resp:endpoint} for the
 * response cache) so whole endpoints can be invalidated without decoding the hash.
 */
public final class CacheKeys {

    public static final String RESPONSE_PREFIX = "resp:";
    public static final int SHORT_HASH_LENGTH = 12;

    private CacheKeys() {
    }

    /**
     * Base derivation every key goes through: {@code endpoint:sha256(endpoint|signature|version)}.
     */
    public static String deriveKey(String endpoint, String signature, String version) {
        return endpoint + ":" + sha256Hex(String.join("|", endpoint, signature, version));
    }

    public static String modelKey(String endpoint,
                                  String signature,
                                  String anchorTs,
                                  String granularity,
                                  Map<String, ?> modelParams,
                                  String featureVersion) {
        List<String> parts = new ArrayList<>();
        parts.add(signature);
        parts.add(nullToEmpty(anchorTs));
        parts.add(nullToEmpty(granularity));
        if (modelParams != null) {
            new TreeMap<String, Object>(modelParams).forEach((key, value) -> parts.add(key + "=" + value));
        }
        return deriveKey(endpoint, String.join("|", parts), featureVersion);
    }

    public static String responseKey(String endpoint, String signature, AnchoredWindow window, String responseVersion) {
        String anchor = window == null ? "" : nullToEmpty(TimeFormats.toUtcIso(window.anchorTs()));
        String start = window == null ? "" : nullToEmpty(TimeFormats.toUtcIso(window.effectiveStartTs()));
        String end = window == null ? "" : nullToEmpty(TimeFormats.toUtcIso(window.effectiveEndTs()));
        return deriveKey(responsePrefix(endpoint), String.join("|", signature, anchor, start, end), responseVersion);
    }

    public static String responsePrefix(String endpoint) {
        return RESPONSE_PREFIX + endpoint;
    }

    /**
     * First twelve hex characters of the key's SHA-256, for logs and response metadata.
     */
    public static String shortHash(String key) {
        return sha256Hex(key).substring(0, SHORT_HASH_LENGTH);
    }

    static String sha256Hex(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
