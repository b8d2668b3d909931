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
package com.hellblazer.kitbash.viewer;

import com.hellblazer.kitbash.common.config.ConfigurationLoader;
import com.hellblazer.kitbash.viewer.connect.BackoffPolicy;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of a viewer client, loaded from {@value #DEFAULTS_RESOURCE} with an optional JSON overlay.
 *
 * @param serverUri            portal base address
 * @param initialBackoffMillis first reconnect delay
 * @param maxBackoffMillis     reconnect delay cap
 * @param backoffMultiplier    growth between consecutive failures
 * @param pingIntervalMillis   liveness ping interval, 0 disables pings
 * @param fetchTimeoutMillis   whole-call timeout of a content fetch
 * @author hal.hildebrand
 */
public record ViewerConfiguration(String serverUri, long initialBackoffMillis, long maxBackoffMillis,
                                  double backoffMultiplier, long pingIntervalMillis, long fetchTimeoutMillis) {

    public static final String DEFAULTS_RESOURCE = "/kitbash-viewer.json";

    public static ViewerConfiguration defaults() throws IOException {
        return load(null);
    }

    public static ViewerConfiguration load(Path overlay) throws IOException {
        return new ConfigurationLoader().load(ViewerConfiguration.class, DEFAULTS_RESOURCE, overlay);
    }

    public ViewerConfiguration withServerUri(String serverUri) {
        return new ViewerConfiguration(serverUri, initialBackoffMillis, maxBackoffMillis, backoffMultiplier,
                                       pingIntervalMillis, fetchTimeoutMillis);
    }

    public ViewerConfiguration withBackoff(long initialMillis, long maxMillis) {
        return new ViewerConfiguration(serverUri, initialMillis, maxMillis, backoffMultiplier, pingIntervalMillis,
                                       fetchTimeoutMillis);
    }

    public URI server() {
        var uri = URI.create(serverUri);
        if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
            throw new IllegalArgumentException("Server address must be http or https: " + serverUri);
        }
        return uri;
    }

    /**
     * @return the WebSocket address of the portal's event stream
     */
    public URI eventsUri() {
        var server = server();
        var scheme = "https".equals(server.getScheme()) ? "wss" : "ws";
        return URI.create(scheme + "://" + server.getRawAuthority() + "/events");
    }

    public BackoffPolicy backoff() {
        return new BackoffPolicy(Duration.ofMillis(initialBackoffMillis), backoffMultiplier,
                                 Duration.ofMillis(maxBackoffMillis));
    }

    public Duration pingInterval() {
        return Duration.ofMillis(pingIntervalMillis);
    }

    public Duration fetchTimeout() {
        return Duration.ofMillis(fetchTimeoutMillis);
    }
}
