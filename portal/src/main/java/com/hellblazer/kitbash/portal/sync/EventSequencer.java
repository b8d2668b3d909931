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
package com.hellblazer.kitbash.portal.sync;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.FileEntry;
import com.hellblazer.kitbash.portal.registry.FileRegistry;
import com.hellblazer.kitbash.portal.watch.FileMetadata;
import com.hellblazer.kitbash.portal.watch.SceneDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * The single writer of the {@link FileRegistry}.
 * <p>
 * Settled changes are applied one at a time on a dedicated thread: the registry is mutated first, then the resulting
 * {@link ChangeEvent} is emitted to the sink. Because application is serial, events for one name leave in version
 * order, and the registry always equals the replay of everything emitted so far.
 * <p>
 * Startup scans the directory and emits the result as a single {@link ChangeEvent.ResyncAll} before any per-file
 * event.
 *
 * @author hal.hildebrand
 */
public class EventSequencer implements Consumer<SettledChange>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventSequencer.class);

    private final FileRegistry          registry;
    private final SceneDirectory        directory;
    private final Consumer<ChangeEvent> sink;
    private final boolean               digestContent;
    private final ExecutorService       writer;
    private final AtomicLong            emitted = new AtomicLong();

    private volatile boolean started;

    public EventSequencer(FileRegistry registry, SceneDirectory directory, Consumer<ChangeEvent> sink,
                          boolean digestContent) {
        this.registry = Objects.requireNonNull(registry);
        this.directory = Objects.requireNonNull(directory);
        this.sink = Objects.requireNonNull(sink);
        this.digestContent = digestContent;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "kitbash-sequencer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Perform the initial scan and emit the baseline snapshot.
     * <p>
     * Changes accepted before the scan completes are queued behind it.
     *
     * @return the emitted baseline; completes exceptionally with an {@link UncheckedIOException} if the directory
     *         cannot be listed
     */
    public synchronized CompletableFuture<ChangeEvent.ResyncAll> start() {
        if (started) {
            throw new IllegalStateException("Sequencer already started");
        }
        started = true;
        var baseline = new CompletableFuture<ChangeEvent.ResyncAll>();
        writer.execute(() -> {
            try {
                for (var metadata : directory.scan()) {
                    upsert(metadata);
                }
                var resync = registry.resync();
                log.info("Initial scan of {}: {} files", directory.root(), resync.files().size());
                emit(resync);
                baseline.complete(resync);
            } catch (IOException e) {
                baseline.completeExceptionally(new UncheckedIOException("Initial scan failed", e));
            } catch (RuntimeException e) {
                baseline.completeExceptionally(e);
            }
        });
        return baseline;
    }

    /**
     * Queue a settled change for application.
     */
    @Override
    public void accept(SettledChange change) {
        submit(() -> apply(change));
    }

    /**
     * Queue a full rescan, used after the watcher lost events.
     * <p>
     * The registry is reconciled against the directory and a single {@link ChangeEvent.ResyncAll} is emitted.
     */
    public void rescan() {
        submit(this::reconcile);
    }

    /**
     * @return number of events emitted so far, including snapshots
     */
    public long emittedCount() {
        return emitted.get();
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(1, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
        log.debug("Event sequencer closed after {} events", emitted.get());
    }

    private void submit(Runnable task) {
        try {
            writer.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Failed to sequence change", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Sequencer closed, dropping change");
        }
    }

    private void apply(SettledChange change) {
        if (change instanceof SettledChange.Present present) {
            var existed = registry.contains(present.name());
            var entry = upsert(present.metadata());
            emit(existed ? new ChangeEvent.Modified(entry) : new ChangeEvent.Added(entry));
        } else {
            var name = change.name();
            var tombstone = registry.remove(name);
            if (tombstone.isPresent()) {
                emit(new ChangeEvent.Removed(name, tombstone.getAsLong()));
            } else {
                log.debug("Ignoring removal of unknown {}", name);
            }
        }
    }

    private void reconcile() {
        try {
            var present = new HashSet<String>();
            for (var metadata : directory.scan()) {
                present.add(metadata.name());
                var current = registry.get(metadata.name());
                if (current.isEmpty() || current.get().mtime() != metadata.mtime()
                || current.get().size() != metadata.size()) {
                    upsert(metadata);
                }
            }
            for (var entry : registry.snapshot()) {
                if (!present.contains(entry.name())) {
                    registry.remove(entry.name());
                }
            }
            emit(registry.resync());
            log.info("Rescanned {}: {} files", directory.root(), registry.size());
        } catch (IOException e) {
            log.warn("Rescan of {} failed, keeping current registry: {}", directory.root(), e.getMessage());
        }
    }

    private FileEntry upsert(FileMetadata metadata) {
        String digest = null;
        if (digestContent) {
            try {
                digest = directory.digest(metadata.name());
            } catch (IOException e) {
                log.warn("Unable to digest {}: {}", metadata.name(), e.getMessage());
            }
        }
        return registry.upsert(metadata.name(), metadata.mtime(), metadata.size(), digest);
    }

    private void emit(ChangeEvent event) {
        emitted.incrementAndGet();
        log.debug("Emitting {}", event);
        sink.accept(event);
    }
}
