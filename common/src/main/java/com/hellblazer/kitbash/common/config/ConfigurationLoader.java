/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kitbash Viewer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kitbash.common.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads JSON configuration records.
 * <p>
 * Lookup order, later sources overriding earlier ones field by field:
 * <ol>
 *   <li>classpath defaults resource (required)</li>
 *   <li>optional JSON file supplied by the user</li>
 * </ol>
 * Command-line overrides are applied by the caller on the resulting record.
 *
 * @author hal.hildebrand
 */
public class ConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigurationLoader() {
        this(new ObjectMapper());
    }

    public ConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load a configuration from the defaults resource only.
     */
    public <T> T load(Class<T> type, String defaultsResource) throws IOException {
        return load(type, defaultsResource, null);
    }

    /**
     * Load a configuration from the defaults resource, overlaid by an optional file.
     *
     * @param type             configuration record type
     * @param defaultsResource absolute classpath resource name, e.g. {@code /kitbash-portal.json}
     * @param overlay          JSON file whose fields override the defaults, or null
     * @return the bound configuration
     * @throws IOException if a source is missing or does not bind to {@code type}
     */
    public <T> T load(Class<T> type, String defaultsResource, Path overlay) throws IOException {
        var merged = readDefaults(type, defaultsResource);
        if (overlay != null) {
            if (!Files.isRegularFile(overlay)) {
                throw new FileNotFoundException("Configuration file not found: " + overlay);
            }
            var overrides = objectMapper.readTree(overlay.toFile());
            if (!(overrides instanceof ObjectNode overrideFields)) {
                throw new IOException("Configuration file is not a JSON object: " + overlay);
            }
            merged.setAll(overrideFields);
            log.info("Applied configuration overrides from {}", overlay);
        }
        return objectMapper.treeToValue(merged, type);
    }

    private ObjectNode readDefaults(Class<?> type, String resource) throws IOException {
        try (var in = type.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Configuration resource not found: " + resource);
            }
            JsonNode node = objectMapper.readTree(in);
            if (!(node instanceof ObjectNode defaults)) {
                throw new IOException("Configuration resource is not a JSON object: " + resource);
            }
            log.debug("Loaded configuration defaults from {}", resource);
            return defaults;
        }
    }
}
