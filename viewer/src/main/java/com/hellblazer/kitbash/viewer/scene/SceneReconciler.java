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
package com.hellblazer.kitbash.viewer.scene;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Maintains the viewer's replica of the portal's file set and drives the renderer from it.
 * <p>
 * All replica state is confined to the loop executor; events and user actions are queued onto it. Fetching and
 * parsing run off the loop and post their results back. For each name:
 * <ul>
 *   <li>events with a version at or below the last applied one are discarded, so replays are harmless</li>
 *   <li>a removal leaves a tombstone that suppresses older additions arriving late</li>
 *   <li>a load result is applied only if it is for the most recently requested version</li>
 *   <li>a failed load keeps the previously rendered representation</li>
 * </ul>
 * A {@link ChangeEvent.ResyncAll} replaces the replica wholesale: names missing from it are unloaded, names new in it
 * are fetched, names in both keep their flags and are refetched only if their version moved. A resync from a different
 * server epoch means the portal restarted and its versions started over: every surviving object is rebased onto the
 * snapshot's versions and refetched.
 *
 * @param <R> renderer representation
 * @author hal.hildebrand
 */
public class SceneReconciler<R> implements Consumer<ChangeEvent> {
    private static final Logger log = LoggerFactory.getLogger(SceneReconciler.class);

    private final ContentFetcher   fetcher;
    private final SceneRenderer<R> renderer;
    private final SceneOverlay     overlay;
    private final Executor         loop;

    private final TreeMap<String, Tracked> replica    = new TreeMap<>();
    private final Map<String, Long>           tombstones = new HashMap<>();

    private volatile List<SceneObjectState> view = List.of();
    private          long                   fetchSequence;
    private          long                   epoch;
    private          boolean                baselined;

    public SceneReconciler(ContentFetcher fetcher, SceneRenderer<R> renderer, SceneOverlay overlay, Executor loop) {
        this.fetcher = Objects.requireNonNull(fetcher);
        this.renderer = Objects.requireNonNull(renderer);
        this.overlay = Objects.requireNonNull(overlay);
        this.loop = Objects.requireNonNull(loop);
    }

    /**
     * Queue an event from the portal.
     */
    @Override
    public void accept(ChangeEvent event) {
        loop.execute(() -> {
            apply(event);
            publish();
        });
    }

    /**
     * @return immutable replica in name order, safe to call from any thread
     */
    public List<SceneObjectState> objects() {
        return view;
    }

    public Optional<SceneObjectState> object(String name) {
        return view.stream().filter(o -> o.name().equals(name)).findFirst();
    }

    public Optional<String> selected() {
        return view.stream().filter(SceneObjectState::selected).map(SceneObjectState::name).findFirst();
    }

    public void select(String name) {
        onLoop(() -> {
            var target = replica.get(name);
            if (target == null) {
                log.debug("Cannot select unknown {}", name);
                return;
            }
            selectOnly(name);
        });
    }

    public void clearSelection() {
        onLoop(() -> selectOnly(null));
    }

    /**
     * Move the selection to the next name, wrapping around. Selects the first object when nothing is selected.
     */
    public void selectNext() {
        onLoop(() -> {
            if (replica.isEmpty()) {
                return;
            }
            var current = selectedName();
            var next = current == null ? null : replica.higherKey(current);
            selectOnly(next == null ? replica.firstKey() : next);
        });
    }

    /**
     * Move the selection to the previous name, wrapping around. Selects the last object when nothing is selected.
     */
    public void selectPrevious() {
        onLoop(() -> {
            if (replica.isEmpty()) {
                return;
            }
            var current = selectedName();
            var previous = current == null ? null : replica.lowerKey(current);
            selectOnly(previous == null ? replica.lastKey() : previous);
        });
    }

    public void toggleVisibility(String name) {
        onLoop(() -> {
            var tracked = replica.get(name);
            if (tracked == null) {
                return;
            }
            tracked.visible = !tracked.visible;
            renderer.applyFlags(name, tracked.state(name));
        });
    }

    /**
     * Toggle the visibility of the selected object, if any.
     */
    public void toggleSelectedVisibility() {
        onLoop(() -> {
            var name = selectedName();
            if (name != null) {
                var tracked = replica.get(name);
                tracked.visible = !tracked.visible;
                renderer.applyFlags(name, tracked.state(name));
            }
        });
    }

    public void showAll() {
        onLoop(() -> replica.forEach((name, tracked) -> {
            if (!tracked.visible) {
                tracked.visible = true;
                renderer.applyFlags(name, tracked.state(name));
            }
        }));
    }

    /**
     * Refetch every object at its last applied version.
     */
    public void reloadAll() {
        onLoop(() -> {
            log.info("Reloading {} objects", replica.size());
            for (var e : new ArrayList<>(replica.entrySet())) {
                fetch(e.getKey(), e.getValue(), e.getValue().lastAppliedVersion);
            }
        });
    }

    private void apply(ChangeEvent event) {
        if (event instanceof ChangeEvent.ResyncAll resync) {
            resync(resync);
        } else if (event instanceof ChangeEvent.Added added) {
            upsert(added.entry());
        } else if (event instanceof ChangeEvent.Modified modified) {
            upsert(modified.entry());
        } else if (event instanceof ChangeEvent.Removed removed) {
            remove(removed.name(), removed.version());
        }
    }

    private void upsert(FileEntry entry) {
        var name = entry.name();
        var tracked = replica.get(name);
        if (tracked != null) {
            if (entry.version() <= tracked.lastAppliedVersion) {
                log.trace("Discarding stale {} v{}", name, entry.version());
                return;
            }
            tracked.lastAppliedVersion = entry.version();
            fetch(name, tracked, entry.version());
            return;
        }
        var tombstone = tombstones.get(name);
        if (tombstone != null && entry.version() <= tombstone) {
            log.trace("Discarding {} v{}, removed at v{}", name, entry.version(), tombstone);
            return;
        }
        tombstones.remove(name);
        tracked = new Tracked(entry.version());
        replica.put(name, tracked);
        fetch(name, tracked, entry.version());
    }

    private void remove(String name, long version) {
        var tracked = replica.get(name);
        if (tracked == null) {
            tombstones.merge(name, version, Math::max);
            return;
        }
        if (version <= tracked.lastAppliedVersion) {
            log.trace("Discarding stale removal of {} v{}", name, version);
            return;
        }
        unload(name, tracked);
        tombstones.put(name, version);
    }

    private void resync(ChangeEvent.ResyncAll resync) {
        var files = resync.files();
        var rebase = baselined && resync.epoch() != epoch;
        if (rebase) {
            log.info("Portal restarted (epoch {} -> {}), rebasing {} objects", epoch, resync.epoch(), replica.size());
        }
        epoch = resync.epoch();
        baselined = true;
        tombstones.clear();
        var present = new HashSet<String>();
        for (var entry : files) {
            present.add(entry.name());
        }
        for (var e : new ArrayList<>(replica.entrySet())) {
            if (!present.contains(e.getKey())) {
                unload(e.getKey(), e.getValue());
                if (!rebase) {
                    tombstones.put(e.getKey(), e.getValue().lastAppliedVersion);
                }
            }
        }
        for (var entry : files) {
            var name = entry.name();
            var tracked = replica.get(name);
            if (tracked == null) {
                tracked = new Tracked(entry.version());
                replica.put(name, tracked);
                fetch(name, tracked, entry.version());
                continue;
            }
            if (rebase) {
                tracked.lastAppliedVersion = entry.version();
                tracked.fetchedVersion = 0;
                fetch(name, tracked, entry.version());
                continue;
            }
            if (entry.version() > tracked.lastAppliedVersion) {
                tracked.lastAppliedVersion = entry.version();
            }
            var wanted = tracked.lastAppliedVersion;
            if (wanted != tracked.fetchedVersion && wanted != tracked.requestedVersion) {
                fetch(name, tracked, wanted);
            }
        }
        log.debug("Resynchronized {} objects", replica.size());
    }

    private void unload(String name, Tracked tracked) {
        replica.remove(name);
        if (tracked.inFlight != null) {
            tracked.inFlight.cancel(false);
        }
        renderer.unload(name);
    }

    private void fetch(String name, Tracked tracked, long version) {
        var sequence = ++fetchSequence;
        tracked.pendingFetch = sequence;
        tracked.requestedVersion = version;
        if (tracked.inFlight != null) {
            tracked.inFlight.cancel(false);
        }
        CompletableFuture<byte[]> request;
        try {
            request = fetcher.fetch(name, version);
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }
        tracked.inFlight = request;
        request.thenApply(bytes -> renderer.load(name, bytes))
               .exceptionally(SceneReconciler::failure)
               .thenAccept(result -> onLoop(() -> loaded(name, sequence, version, result)));
    }

    private void loaded(String name, long sequence, long version, LoadResult<R> result) {
        var tracked = replica.get(name);
        if (tracked == null || tracked.pendingFetch != sequence) {
            log.trace("Dropping superseded load of {} v{}", name, version);
            return;
        }
        tracked.inFlight = null;
        tracked.pendingFetch = 0;
        tracked.requestedVersion = 0;
        if (result instanceof LoadResult.Loaded<R> success) {
            tracked.fetchedVersion = version;
            tracked.loadError = null;
            renderer.swap(name, success.representation(), tracked.state(name));
            log.debug("Loaded {} v{}", name, version);
        } else if (result instanceof LoadResult.Failed<R> failure) {
            tracked.loadError = failure.error();
            log.warn("Unable to load {} v{}: {}", name, version, failure.error());
            overlay.loadFailed(name, failure.error());
        }
    }

    private static <R> LoadResult<R> failure(Throwable t) {
        var cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        var message = cause.getMessage();
        return LoadResult.failed(message == null ? cause.getClass().getSimpleName() : message);
    }

    private void selectOnly(String name) {
        replica.forEach((key, tracked) -> {
            var wanted = key.equals(name);
            if (tracked.selected != wanted) {
                tracked.selected = wanted;
                renderer.applyFlags(key, tracked.state(key));
            }
        });
    }

    private String selectedName() {
        for (var e : replica.entrySet()) {
            if (e.getValue().selected) {
                return e.getKey();
            }
        }
        return null;
    }

    private void onLoop(Runnable action) {
        loop.execute(() -> {
            action.run();
            publish();
        });
    }

    private void publish() {
        var states = new ArrayList<SceneObjectState>(replica.size());
        replica.forEach((name, tracked) -> states.add(tracked.state(name)));
        var next = List.copyOf(states);
        if (!next.equals(view)) {
            view = next;
            overlay.sceneChanged(next);
        }
    }

    private static class Tracked {
        boolean            visible = true;
        boolean            selected;
        long               lastAppliedVersion;
        long               fetchedVersion;
        long               requestedVersion;
        long               pendingFetch;
        String             loadError;
        CompletableFuture<?> inFlight;

        Tracked(long version) {
            this.lastAppliedVersion = version;
        }

        SceneObjectState state(String name) {
            return new SceneObjectState(name, visible, selected, lastAppliedVersion, loadError);
        }
    }
}
