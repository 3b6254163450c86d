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
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the packaged build version; falls back to "unknown" when running from sources.
 */
@Component
public class AppVersionProvider {
    private static final Logger logger = LoggerFactory.getLogger(AppVersionProvider.class);

    static final String POM_PROPERTIES_PATH = "META-INF/maven/de.makibytes/traffic-lyt/pom.properties";
    static final String UNKNOWN = "unknown";

    private final String version;

    public AppVersionProvider() {
        this(POM_PROPERTIES_PATH);
    }

    AppVersionProvider(String propertiesPath) {
        String resolved = loadVersion(propertiesPath);
        this.version = resolved == null || resolved.isBlank() ? UNKNOWN : resolved.trim();
    }

    public String getVersion() {
        return version;
    }

    private String loadVersion(String propertiesPath) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(propertiesPath)) {
            if (input == null) {
                return null;
            }
            Properties props = new Properties();
            props.load(input);
            return props.getProperty("version");
        } catch (IOException ex) {
            logger.warn("Could not read {}: {}", propertiesPath, ex.getMessage());
            return null;
        }
    }
}
