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

import com.hellblazer.kitbash.portal.watch.FileMetadata;
import com.hellblazer.kitbash.portal.watch.RawChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Coalesces bursts of raw notifications into one settled change per name.
 * <p>
 * Every raw event for a name (re)starts that name's quiet-period timer. When a timer expires without being restarted
 * the file is stat'ed at that moment, so a half-written file seen at the first notification is never acted upon, and
 * a single {@link SettledChange} is forwarded downstream. Names debounce independently.
 * <p>
 * A burst that began with a create and ends with the file gone is a net-zero change and is dropped, unless the name
 * is already known downstream (it then really was removed).
 *
 * @author hal.hildebrand
 */
public class ChangeDebouncer implements Consumer<RawChange>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChangeDebouncer.class);

    public static final Duration DEFAULT_QUIET_PERIOD = Duration.ofMillis(100);

    /**
     * Reads the current metadata of a name; empty when the file does not exist.
     */
    @FunctionalInterface
    public interface MetadataSource {
        Optional<FileMetadata> stat(String name) throws IOException;
    }

    private static class Pending {
        final RawChange.Kind     firstKind;
        final long               generation;
        final ScheduledFuture<?> timer;

        Pending(RawChange.Kind firstKind, long generation, ScheduledFuture<?> timer) {
            this.firstKind = firstKind;
            this.generation = generation;
            this.timer = timer;
        }
    }

    private final Duration                  quietPeriod;
    private final MetadataSource            metadataSource;
    private final Predicate<String>         known;
    private final Consumer<SettledChange>   downstream;
    private final ScheduledExecutorService  timers;
    private final boolean                   ownsTimers;
    private final Map<String, Pending>      pending = new HashMap<>();
    private       long                      generations;
    private       boolean                   closed;

    /**
     * Create a debouncer with its own timer thread.
     *
     * @param quietPeriod time a name must stay quiet before its change settles
     * @param metadata    metadata source consulted at timer expiry
     * @param known       true for names the downstream registry currently holds
     * @param downstream  receiver of settled changes
     */
    public ChangeDebouncer(Duration quietPeriod, MetadataSource metadata, Predicate<String> known,
                           Consumer<SettledChange> downstream) {
        this(quietPeriod, metadata, known, downstream, Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "kitbash-debounce");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    public ChangeDebouncer(Duration quietPeriod, MetadataSource metadata, Predicate<String> known,
                           Consumer<SettledChange> downstream, ScheduledExecutorService timers) {
        this(quietPeriod, metadata, known, downstream, timers, false);
    }

    private ChangeDebouncer(Duration quietPeriod, MetadataSource metadata, Predicate<String> known,
                            Consumer<SettledChange> downstream, ScheduledExecutorService timers, boolean ownsTimers) {
        if (quietPeriod.isNegative() || quietPeriod.isZero()) {
            throw new IllegalArgumentException("Quiet period must be positive: " + quietPeriod);
        }
        this.quietPeriod = quietPeriod;
        this.metadataSource = Objects.requireNonNull(metadata);
        this.known = Objects.requireNonNull(known);
        this.downstream = Objects.requireNonNull(downstream);
        this.timers = Objects.requireNonNull(timers);
        this.ownsTimers = ownsTimers;
    }

    /**
     * Record a raw notification, restarting the name's quiet period.
     */
    @Override
    public synchronized void accept(RawChange change) {
        if (closed) {
            return;
        }
        var name = change.name();
        var previous = pending.get(name);
        var firstKind = change.kind();
        if (previous != null) {
            previous.timer.cancel(false);
            firstKind = previous.firstKind;
        }
        var generation = ++generations;
        var timer = timers.schedule(() -> settle(name, generation), quietPeriod.toNanos(), TimeUnit.NANOSECONDS);
        pending.put(name, new Pending(firstKind, generation, timer));
    }

    /**
     * @return number of names currently inside their quiet period
     */
    public synchronized int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            pending.values().forEach(p -> p.timer.cancel(false));
            pending.clear();
        }
        if (ownsTimers) {
            timers.shutdownNow();
        }
    }

    private void settle(String name, long generation) {
        RawChange.Kind firstKind;
        synchronized (this) {
            var current = pending.get(name);
            if (current == null || current.generation != generation) {
                return; // restarted after this timer was already running
            }
            pending.remove(name);
            firstKind = current.firstKind;
        }

        Optional<FileMetadata> metadata;
        try {
            metadata = metadataSource.stat(name);
        } catch (IOException e) {
            log.warn("Unable to read metadata of {}, waiting for the next change: {}", name, e.getMessage());
            return;
        }

        SettledChange settled;
        if (metadata.isPresent()) {
            settled = new SettledChange.Present(metadata.get());
        } else if (firstKind == RawChange.Kind.CREATE && !known.test(name)) {
            log.debug("{} created and deleted within {} ms, dropping", name, quietPeriod.toMillis());
            return;
        } else {
            settled = new SettledChange.Absent(name);
        }

        log.debug("Settled {}", settled);
        try {
            downstream.accept(settled);
        } catch (RuntimeException e) {
            log.error("Downstream failed to accept settled change {}", settled, e);
        }
    }
}
