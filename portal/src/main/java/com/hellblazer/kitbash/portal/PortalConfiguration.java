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
package com.hellblazer.kitbash.portal;

import com.hellblazer.kitbash.common.config.ConfigurationLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the portal process.
 * <p>
 * Defaults come from the {@value #DEFAULTS_RESOURCE} classpath resource, optionally overridden by a JSON file and then
 * by command-line flags.
 *
 * @param host           bind address
 * @param port           HTTP port, 0 for any free port
 * @param sceneDir       watched directory
 * @param extensions     accepted scene file extensions
 * @param debounceMillis quiet period before a change settles
 * @param queueCapacity  per-viewer outbound queue bound
 * @param digestContent  attach a SHA-256 content digest to every entry
 * @param openBrowser    open the viewer in a browser after startup
 * @param exitOnQuit     stop the portal when a viewer sends quit
 * @author hal.hildebrand
 */
public record PortalConfiguration(String host, int port, String sceneDir, List<String> extensions,
                                  long debounceMillis, int queueCapacity, boolean digestContent,
                                  boolean openBrowser, boolean exitOnQuit) {

    public static final String DEFAULTS_RESOURCE = "/kitbash-portal.json";

    public PortalConfiguration {
        extensions = extensions == null ? List.of(".obj") : List.copyOf(extensions);
    }

    /**
     * @return the packaged defaults
     */
    public static PortalConfiguration defaults() throws IOException {
        return load(null);
    }

    /**
     * @param overlay optional JSON file overriding the packaged defaults
     */
    public static PortalConfiguration load(Path overlay) throws IOException {
        return new ConfigurationLoader().load(PortalConfiguration.class, DEFAULTS_RESOURCE, overlay);
    }

    public Path scenePath() {
        return Path.of(sceneDir);
    }

    public Duration debounce() {
        return Duration.ofMillis(debounceMillis);
    }

    public PortalConfiguration withPort(int port) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withHost(String host) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withSceneDir(String sceneDir) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withExtensions(List<String> extensions) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withDebounceMillis(long debounceMillis) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withQueueCapacity(int queueCapacity) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withDigestContent(boolean digestContent) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withOpenBrowser(boolean openBrowser) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public PortalConfiguration withExitOnQuit(boolean exitOnQuit) {
        return new PortalConfiguration(host, port, sceneDir, extensions, debounceMillis, queueCapacity, digestContent,
                                       openBrowser, exitOnQuit);
    }

    public List<String> getValidationErrors() {
        var errors = new ArrayList<String>();
        if (host == null || host.isBlank()) {
            errors.add("Host must not be empty");
        }
        if (port < 0 || port > 65535) {
            errors.add("Port must be between 0 and 65535");
        }
        if (sceneDir == null || sceneDir.isBlank()) {
            errors.add("Scene directory must not be empty");
        }
        if (extensions.isEmpty()) {
            errors.add("At least one file extension is required");
        }
        if (debounceMillis < 1 || debounceMillis > 10_000) {
            errors.add("Debounce must be between 1 and 10000 ms");
        }
        if (queueCapacity < 1) {
            errors.add("Queue capacity must be positive");
        }
        return errors;
    }
}
