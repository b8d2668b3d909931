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

import com.hellblazer.kitbash.common.ConnectionState;
import com.hellblazer.kitbash.common.wire.EventCodec;
import com.hellblazer.kitbash.viewer.connect.OkHttpEventConnector;
import com.hellblazer.kitbash.viewer.connect.ReconnectSupervisor;
import com.hellblazer.kitbash.viewer.scene.LoadResult;
import com.hellblazer.kitbash.viewer.scene.OkHttpContentFetcher;
import com.hellblazer.kitbash.viewer.scene.SceneObjectState;
import com.hellblazer.kitbash.viewer.scene.SceneOverlay;
import com.hellblazer.kitbash.viewer.scene.SceneReconciler;
import com.hellblazer.kitbash.viewer.scene.SceneRenderer;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * A viewer's connection to one portal: keeps the event channel alive and feeds the scene reconciler.
 *
 * @param <R> renderer representation
 * @author hal.hildebrand
 */
public class ViewerClient<R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ViewerClient.class);

    private final OkHttpClient             http;
    private final ExecutorService          loop;
    private final ScheduledExecutorService timers;
    private final SceneReconciler<R>       reconciler;
    private final ReconnectSupervisor      supervisor;
    private final ViewerConfiguration      configuration;

    public ViewerClient(ViewerConfiguration configuration, SceneRenderer<R> renderer, SceneOverlay overlay) {
        this.configuration = configuration;
        this.http = new OkHttpClient.Builder().callTimeout(configuration.fetchTimeout()).build();
        this.loop = Executors.newSingleThreadExecutor(daemon("kitbash-scene"));
        this.timers = Executors.newSingleThreadScheduledExecutor(daemon("kitbash-reconnect"));
        this.reconciler = new SceneReconciler<>(new OkHttpContentFetcher(http, configuration.server()), renderer,
                                                overlay, loop);
        this.supervisor = new ReconnectSupervisor(new OkHttpEventConnector(http, configuration.eventsUri()),
                                                  configuration.backoff(), configuration.pingInterval(), timers,
                                                  new EventCodec(), reconciler, overlay::connectionChanged);
    }

    public void start() {
        log.info("Viewer connecting to {}", configuration.server());
        supervisor.start();
    }

    public SceneReconciler<R> scene() {
        return reconciler;
    }

    public ConnectionState connectionState() {
        return supervisor.state();
    }

    /**
     * Refetch every object and, if disconnected, reconnect without waiting for the backoff timer.
     */
    public void reloadAll() {
        reconciler.reloadAll();
        supervisor.reloadNow();
    }

    /**
     * Send quit and stop reconnecting; the client stays usable for reading the last replica.
     */
    public void quit() {
        supervisor.shutdown();
    }

    @Override
    public void close() {
        supervisor.close();
        timers.shutdownNow();
        loop.shutdown();
        try {
            if (!loop.awaitTermination(1, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
        log.debug("Viewer client closed");
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            var thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Headless viewer that logs the replica as it changes. Takes an optional configuration file argument.
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        var configuration = ViewerConfiguration.load(args.length > 0 ? Path.of(args[0]) : null);
        var renderer = new SceneRenderer<Integer>() {
            @Override
            public LoadResult<Integer> load(String name, byte[] content) {
                return LoadResult.loaded(content.length);
            }

            @Override
            public void swap(String name, Integer bytes, SceneObjectState state) {
                log.info("{} v{}: {} bytes", name, state.lastAppliedVersion(), bytes);
            }

            @Override
            public void applyFlags(String name, SceneObjectState state) {
            }

            @Override
            public void unload(String name) {
                log.info("{} removed", name);
            }
        };
        var overlay = new SceneOverlay() {
            @Override
            public void sceneChanged(List<SceneObjectState> objects) {
                log.info("Scene: {} objects", objects.size());
            }

            @Override
            public void connectionChanged(ConnectionState state) {
                log.info("Connection: {}", state);
            }
        };
        var done = new CountDownLatch(1);
        try (var client = new ViewerClient<>(configuration, renderer, overlay)) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                client.quit();
                done.countDown();
            }, "kitbash-viewer-shutdown"));
            client.start();
            done.await();
        }
    }
}
