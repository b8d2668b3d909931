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

import com.hellblazer.kitbash.common.wire.EventCodec;
import com.hellblazer.kitbash.portal.hub.SubscriptionHub;
import com.hellblazer.kitbash.portal.registry.FileRegistry;
import com.hellblazer.kitbash.portal.sync.ChangeDebouncer;
import com.hellblazer.kitbash.portal.sync.EventSequencer;
import com.hellblazer.kitbash.portal.watch.DirectoryWatcher;
import com.hellblazer.kitbash.portal.watch.SceneDirectory;
import com.hellblazer.kitbash.portal.watch.WatchLostException;
import com.hellblazer.kitbash.portal.web.KitbashServer;
import com.hellblazer.kitbash.portal.web.PortBindException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.util.HashSet;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The portal process: watches the scene directory and serves its live state to viewers.
 * <p>
 * Pipeline: {@link DirectoryWatcher} → {@link ChangeDebouncer} → {@link EventSequencer} (sole writer of the
 * {@link FileRegistry}) → {@link SubscriptionHub} → {@link KitbashServer} WebSocket connections.
 * <p>
 * Startup binds the HTTP port before watching begins, so a bind failure is reported before any filesystem work. A lost
 * watch stops the portal with {@link #EXIT_WATCH_LOST}.
 *
 * @author hal.hildebrand
 */
public class KitbashPortal implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KitbashPortal.class);

    public static final int EXIT_OK           = 0;
    public static final int EXIT_BAD_ARGS     = 1;
    public static final int EXIT_BIND_FAILURE = 2;
    public static final int EXIT_WATCH_LOST   = 3;

    private final PortalConfiguration configuration;
    private final BrowserLauncher     browser;
    private final SceneDirectory      directory;
    private final FileRegistry        registry = new FileRegistry();
    private final SubscriptionHub     hub;
    private final EventSequencer      sequencer;
    private final ChangeDebouncer     debouncer;
    private final DirectoryWatcher    watcher;
    private final KitbashServer       server;
    private final CountDownLatch      stopped  = new CountDownLatch(1);
    private final AtomicBoolean       closed   = new AtomicBoolean();

    private volatile int exitCode = EXIT_OK;

    public KitbashPortal(PortalConfiguration configuration, BrowserLauncher browser) {
        this.configuration = Objects.requireNonNull(configuration);
        this.browser = Objects.requireNonNull(browser);
        var codec = new EventCodec();
        directory = new SceneDirectory(configuration.scenePath(), new HashSet<>(configuration.extensions()));
        hub = new SubscriptionHub(registry::resync, codec, configuration.queueCapacity());
        sequencer = new EventSequencer(registry, directory, hub, configuration.digestContent());
        debouncer = new ChangeDebouncer(configuration.debounce(), directory::stat, registry::contains, sequencer);
        watcher = new DirectoryWatcher(directory, debouncer, sequencer::rescan, this::watchLost);
        server = new KitbashServer(configuration, directory, registry, hub, codec);
        if (configuration.exitOnQuit()) {
            hub.setQuitListener(id -> {
                log.info("Viewer {} quit, stopping portal", id);
                shutdown(EXIT_OK);
            });
        }
    }

    /**
     * Bind the server, start watching, and publish the initial snapshot.
     *
     * @throws PortBindException  if the HTTP port cannot be bound
     * @throws WatchLostException if the scene directory cannot be watched or scanned
     * @throws IOException        if the scene directory cannot be created
     */
    public void start() throws IOException {
        var root = directory.root();
        if (!Files.exists(root)) {
            Files.createDirectories(root);
            log.info("Created scene directory {}", root);
        }

        server.start();
        watcher.start();
        try {
            var baseline = sequencer.start().join();
            log.info("Serving {} scene files from {}", baseline.files().size(), root);
        } catch (CompletionException e) {
            throw new WatchLostException(root, "Initial scan of " + root + " failed", e.getCause());
        }

        if (configuration.openBrowser()) {
            var uri = URI.create(server.url() + "/index.html");
            try {
                browser.open(uri);
            } catch (IOException | RuntimeException e) {
                log.warn("Unable to open browser, open {} manually: {}", uri, e.getMessage());
            }
        } else {
            log.info("Open your browser to {}", server.url());
        }
    }

    public KitbashServer server() {
        return server;
    }

    public FileRegistry registry() {
        return registry;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Block until the portal stops on its own (watch loss, quit) or is closed.
     *
     * @return true if stopped within the timeout
     */
    public boolean awaitStop(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        watcher.close();
        debouncer.close();
        sequencer.close();
        server.stop();
        stopped.countDown();
    }

    private void watchLost(WatchLostException e) {
        log.error("Lost watch on {}: {}", e.getDirectory(), e.getMessage());
        shutdown(EXIT_WATCH_LOST);
    }

    private void shutdown(int code) {
        exitCode = code;
        stopped.countDown();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        var commandLine = KitbashCommandLine.parse(args);
        switch (commandLine.action) {
            case HELP -> {
                KitbashCommandLine.printUsage(System.out);
                return;
            }
            case HELP_KEYS -> {
                KitbashCommandLine.printKeyboardHelp(System.out);
                return;
            }
            case HELP_SETTINGS -> {
                KitbashCommandLine.printSettingsHelp(System.out);
                return;
            }
            case VERSION -> {
                System.out.println("kitbash-portal " + KitbashServer.VERSION);
                return;
            }
            case RUN -> {
            }
        }

        PortalConfiguration configuration;
        try {
            configuration = commandLine.applyTo(PortalConfiguration.load(commandLine.configPath()));
        } catch (IOException e) {
            System.err.println("Unable to load configuration: " + e.getMessage());
            System.exit(EXIT_BAD_ARGS);
            return;
        }
        if (!KitbashCommandLine.validate(commandLine, configuration, System.err)) {
            System.exit(EXIT_BAD_ARGS);
        }
        log.info("Configuration: {}", configuration);

        var portal = new KitbashPortal(configuration, BrowserLauncher.desktop());
        try {
            portal.start();
        } catch (PortBindException e) {
            log.error(e.getMessage());
            portal.close();
            System.exit(EXIT_BIND_FAILURE);
        } catch (IOException e) {
            log.error("Unable to watch {}: {}", configuration.sceneDir(), e.getMessage());
            portal.close();
            System.exit(EXIT_WATCH_LOST);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(portal::close, "kitbash-shutdown"));
        try {
            portal.awaitStop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        portal.close();
        System.exit(portal.exitCode());
    }
}
