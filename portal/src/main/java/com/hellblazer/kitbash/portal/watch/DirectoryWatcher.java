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
package com.hellblazer.kitbash.portal.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Raw-event ingestion for one watched directory.
 * <p>
 * Registers the directory with the platform {@link WatchService} (non-recursive) and runs one thread that turns watch
 * keys into {@link RawChange}s for accepted scene names. Nothing here is debounced; bursts are passed through as they
 * arrive.
 * <ul>
 *   <li>{@code OVERFLOW}: events were lost, the overflow handler is invoked so the caller can rescan</li>
 *   <li>invalid key: the directory became unwatchable, the loss handler receives a {@link WatchLostException}</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class DirectoryWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    private final SceneDirectory                directory;
    private final Consumer<RawChange>           changes;
    private final Runnable                      overflowHandler;
    private final Consumer<WatchLostException>  lossHandler;

    private volatile WatchService watchService;
    private volatile boolean      running;
    private          Thread       thread;

    public DirectoryWatcher(SceneDirectory directory, Consumer<RawChange> changes, Runnable overflowHandler,
                            Consumer<WatchLostException> lossHandler) {
        this.directory = Objects.requireNonNull(directory);
        this.changes = Objects.requireNonNull(changes);
        this.overflowHandler = Objects.requireNonNull(overflowHandler);
        this.lossHandler = Objects.requireNonNull(lossHandler);
    }

    /**
     * Register the directory and start the watch thread.
     * <p>
     * Registration happens before this method returns, so a scan performed afterwards cannot miss a change.
     *
     * @throws WatchLostException if the directory does not exist or cannot be registered
     */
    public synchronized void start() throws WatchLostException {
        if (running) {
            return;
        }
        var root = directory.root();
        if (!Files.isDirectory(root)) {
            throw new WatchLostException(root, "Watched directory does not exist: " + root);
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            root.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_DELETE,
                          StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            closeQuietly();
            throw new WatchLostException(root, "Unable to watch " + root + ": " + e.getMessage(), e);
        }
        running = true;
        thread = new Thread(this::watchLoop, "kitbash-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} for {}", root, directory.extensions());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        closeQuietly();
        if (thread != null) {
            thread.interrupt();
        }
        log.debug("Directory watcher for {} closed", directory.root());
    }

    private void watchLoop() {
        var service = watchService;
        while (running) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            dispatch(key);

            if (!key.reset()) {
                if (running) {
                    running = false;
                    var root = directory.root();
                    log.error("Watch key for {} is no longer valid", root);
                    closeQuietly();
                    lossHandler.accept(new WatchLostException(root, "Watched directory became unwatchable: " + root));
                }
                return;
            }
        }
    }

    private void dispatch(WatchKey key) {
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                log.warn("Watch events overflowed for {}, requesting rescan", directory.root());
                overflowHandler.run();
                continue;
            }
            if (!(event.context() instanceof Path context)) {
                log.warn("Watch event has no path: {}", event);
                continue;
            }
            var name = context.getFileName().toString();
            if (!directory.accepts(name)) {
                continue;
            }
            var kind = toKind(event.kind());
            log.trace("Raw {} {}", kind, name);
            changes.accept(new RawChange(name, kind));
        }
    }

    private static RawChange.Kind toKind(WatchEvent.Kind<?> kind) {
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            return RawChange.Kind.CREATE;
        }
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            return RawChange.Kind.DELETE;
        }
        return RawChange.Kind.MODIFY;
    }

    private void closeQuietly() {
        var service = watchService;
        if (service == null) {
            return;
        }
        try {
            service.close();
        } catch (IOException e) {
            log.debug("Error closing watch service: {}", e.getMessage());
        }
    }
}
