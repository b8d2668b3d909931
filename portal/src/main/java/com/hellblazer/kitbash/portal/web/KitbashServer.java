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
package com.hellblazer.kitbash.portal.web;

import com.hellblazer.kitbash.common.wire.EventCodec;
import com.hellblazer.kitbash.portal.PortalConfiguration;
import com.hellblazer.kitbash.portal.hub.SubscriptionHub;
import com.hellblazer.kitbash.portal.registry.FileRegistry;
import com.hellblazer.kitbash.portal.watch.SceneDirectory;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.websocket.WsConfig;
import io.javalin.websocket.WsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.BindException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP and WebSocket surface of the portal.
 *
 * <ul>
 *   <li>{@code GET /api/files}: the registry snapshot, newest first</li>
 *   <li>{@code GET /content/{name}}: raw bytes of one scene file</li>
 *   <li>{@code WS /events}: the live event stream, one {@link SubscriptionHub} subscription per socket</li>
 *   <li>{@code GET /api/health}, {@code GET /api/info}: liveness and status</li>
 *   <li>{@code GET /}: a file list page that follows the event stream</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class KitbashServer {
    private static final Logger log = LoggerFactory.getLogger(KitbashServer.class);

    public static final String NAME    = "Kitbash Viewer Portal";
    public static final String VERSION = "0.0.1-SNAPSHOT";

    private final PortalConfiguration                   configuration;
    private final SceneDirectory                        directory;
    private final FileRegistry                          registry;
    private final SubscriptionHub                       hub;
    private final EventCodec                            codec;
    private final Map<String, JavalinEventChannel>      channels = new ConcurrentHashMap<>();
    private final Javalin                               app;

    public KitbashServer(PortalConfiguration configuration, SceneDirectory directory, FileRegistry registry,
                         SubscriptionHub hub, EventCodec codec) {
        this.configuration = Objects.requireNonNull(configuration);
        this.directory = Objects.requireNonNull(directory);
        this.registry = Objects.requireNonNull(registry);
        this.hub = Objects.requireNonNull(hub);
        this.codec = Objects.requireNonNull(codec);
        this.app = createApp();
    }

    private Javalin createApp() {
        var javalin = Javalin.create(config -> {
            config.staticFiles.add("/web");
            config.http.defaultContentType = "application/json";
            config.showJavalinBanner = false;
        });

        javalin.exception(Exception.class, (e, ctx) -> {
            log.error("Request failed: {}", ctx.path(), e);
            error(ctx, 500, e.getClass().getSimpleName(), e);
        });
        javalin.exception(NoSuchElementException.class, (e, ctx) -> error(ctx, 404, "NotFound", e));
        javalin.exception(IllegalArgumentException.class, (e, ctx) -> error(ctx, 400, "BadRequest", e));
        javalin.exception(IllegalStateException.class, (e, ctx) -> error(ctx, 409, "Conflict", e));

        javalin.get("/api/health", this::healthCheck);
        javalin.get("/api/info", this::serverInfo);
        javalin.get("/api/files", this::listFiles);
        javalin.get("/content/{name}", this::content);
        javalin.ws("/events", this::events);

        return javalin;
    }

    private static void error(Context ctx, int status, String type, Exception e) {
        ctx.status(status).json(Map.of(
            "error", Objects.toString(e.getMessage(), type),
            "type", type,
            "timestamp", Instant.now().toString()
        ));
    }

    // ========== Status Endpoints ==========

    private void healthCheck(Context ctx) {
        ctx.json(Map.of(
            "status", "ok",
            "timestamp", Instant.now().toString()
        ));
    }

    private void serverInfo(Context ctx) {
        var connections = hub.stats().stream().map(s -> {
            var connection = new LinkedHashMap<String, Object>();
            connection.put("id", s.id());
            connection.put("state", s.state().name());
            connection.put("queued", s.queued());
            connection.put("delivered", s.delivered());
            connection.put("overflows", s.overflows());
            connection.put("lastSeen", s.lastSeen().toString());
            return connection;
        }).toList();
        ctx.json(Map.of(
            "name", NAME,
            "version", VERSION,
            "directory", directory.root().toString(),
            "epoch", registry.epoch(),
            "files", registry.size(),
            "activeConnections", connections.size(),
            "connections", connections,
            "settings", Map.of(
                "extensions", directory.extensions(),
                "debounceMillis", configuration.debounceMillis(),
                "queueCapacity", hub.capacity(),
                "digestContent", configuration.digestContent()
            ),
            "timestamp", Instant.now().toString()
        ));
    }

    // ========== Scene Endpoints ==========

    private void listFiles(Context ctx) {
        var snapshot = registry.snapshot();
        ctx.json(Map.of(
            "files", codec.toNodes(snapshot),
            "count", snapshot.size(),
            "directory", directory.root().toString()
        ));
    }

    private void content(Context ctx) throws IOException {
        var name = ctx.pathParam("name");
        directory.resolve(name);
        var entry = registry.get(name).orElseThrow(() -> new NoSuchElementException("File not found: " + name));
        byte[] bytes;
        try {
            bytes = directory.read(name);
        } catch (NoSuchFileException e) {
            throw new NoSuchElementException("File not found: " + name);
        }
        ctx.header("Cache-Control", "no-store");
        ctx.header("X-Kitbash-Version", Long.toString(entry.version()));
        ctx.contentType("application/octet-stream");
        ctx.result(bytes);
    }

    // ========== Event Stream ==========

    private void events(WsConfig ws) {
        ws.onConnect(ctx -> {
            var channel = new JavalinEventChannel(ctx);
            channels.put(channel.id(), channel);
            hub.register(channel);
        });
        ws.onMessage(ctx -> hub.onMessage(ctx.sessionId(), ctx.message()));
        ws.onClose(ctx -> {
            log.debug("Viewer {} closed: {} {}", ctx.sessionId(), ctx.status(), ctx.reason());
            disconnected(ctx);
        });
        ws.onError(ctx -> {
            log.warn("Viewer {} connection error: {}", ctx.sessionId(),
                     ctx.error() == null ? "unknown" : ctx.error().getMessage());
            disconnected(ctx);
        });
    }

    private void disconnected(WsContext ctx) {
        var channel = channels.remove(ctx.sessionId());
        if (channel != null) {
            channel.peerClosed();
        }
        hub.unregister(ctx.sessionId());
    }

    // ========== Server Lifecycle ==========

    /**
     * Start the server.
     *
     * @throws PortBindException if the address is already in use or cannot be bound
     */
    public void start() {
        try {
            app.start(configuration.host(), configuration.port());
        } catch (RuntimeException e) {
            if (isBindFailure(e)) {
                throw new PortBindException(configuration.host(), configuration.port(), e);
            }
            throw e;
        }
        var actualPort = app.port();
        log.info("=".repeat(70));
        log.info("{} started on http://{}:{}", NAME, configuration.host(), actualPort);
        log.info("Scene directory: {}", directory.root());
        log.info("Endpoints:");
        log.info("  - Health:    GET  /api/health");
        log.info("  - Info:      GET  /api/info");
        log.info("  - Files:     GET  /api/files");
        log.info("  - Content:   GET  /content/{{name}}");
        log.info("  - Events:    WS   /events");
        log.info("  - Web UI:    {}/index.html", url());
        log.info("=".repeat(70));
    }

    /**
     * Stop the server, flushing and closing every viewer connection first.
     */
    public void stop() {
        log.info("Stopping {}...", NAME);
        hub.close();
        channels.clear();
        app.stop();
        log.info("Server stopped");
    }

    /**
     * Get the actual port the server is running on.
     * Useful when started with port 0 for dynamic assignment.
     */
    public int port() {
        return app.port();
    }

    /**
     * @return the base URL viewers connect to
     */
    public String url() {
        return "http://" + configuration.host() + ":" + port();
    }

    /**
     * Get the Javalin app instance (for testing).
     */
    public Javalin app() {
        return app;
    }

    private static boolean isBindFailure(Throwable e) {
        for (var cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof BindException || cause.getClass().getSimpleName().contains("BindException")) {
                return true;
            }
        }
        return false;
    }
}
