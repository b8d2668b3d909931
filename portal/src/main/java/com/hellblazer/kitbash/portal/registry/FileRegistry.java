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
package com.hellblazer.kitbash.portal.registry;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative in-memory map of the watched directory's contents.
 * <p>
 * Writers serialize on the write lock, which makes version assignment linearizable: two updates of the same name never
 * receive the same version, and versions for one name strictly increase in call order. Snapshot readers share the
 * read lock.
 * <p>
 * A removed name is tombstoned with {@code lastVersion + 1} and purged from the live map. Its high-water mark is kept
 * so that a re-created file continues after the tombstone instead of restarting at 1.
 * <p>
 * Versions start over with every registry instance. The registry's epoch, its creation time by default, tells viewers
 * which run a snapshot belongs to.
 *
 * @author hal.hildebrand
 */
public class FileRegistry {
    private static final Logger log = LoggerFactory.getLogger(FileRegistry.class);

    private final Map<String, FileEntry> live       = new HashMap<>();
    private final Map<String, Long>      highWater  = new HashMap<>();
    private final ReadWriteLock          lock       = new ReentrantReadWriteLock();
    private final long                   epoch;

    public FileRegistry() {
        this(System.currentTimeMillis());
    }

    /**
     * @param epoch positive identifier of this server run
     */
    public FileRegistry(long epoch) {
        if (epoch < 1) {
            throw new IllegalArgumentException("Epoch must be positive: " + epoch);
        }
        this.epoch = epoch;
    }

    public long epoch() {
        return epoch;
    }

    /**
     * Create or update an entry, incrementing its version.
     *
     * @param name  file name
     * @param mtime modification time in epoch milliseconds
     * @param size  file size in bytes
     * @return the resulting entry
     */
    public FileEntry upsert(String name, long mtime, long size) {
        return upsert(name, mtime, size, null);
    }

    /**
     * Create or update an entry with a content digest, incrementing its version.
     *
     * @param name          file name
     * @param mtime         modification time in epoch milliseconds
     * @param size          file size in bytes
     * @param contentDigest opaque digest, or null
     * @return the resulting entry
     */
    public FileEntry upsert(String name, long mtime, long size, String contentDigest) {
        Objects.requireNonNull(name, "name");
        lock.writeLock().lock();
        try {
            var version = highWater.getOrDefault(name, 0L) + 1;
            var entry = new FileEntry(name, mtime, size, version, contentDigest);
            highWater.put(name, version);
            var previous = live.put(name, entry);
            if (log.isTraceEnabled()) {
                log.trace("{} {} -> v{}", previous == null ? "Created" : "Updated", name, version);
            }
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Tombstone and purge an entry.
     *
     * @param name file name
     * @return the tombstone version, or empty if the name was not live
     */
    public OptionalLong remove(String name) {
        lock.writeLock().lock();
        try {
            var removed = live.remove(name);
            if (removed == null) {
                return OptionalLong.empty();
            }
            var tombstone = removed.version() + 1;
            highWater.put(name, tombstone);
            log.trace("Removed {} -> tombstone v{}", name, tombstone);
            return OptionalLong.of(tombstone);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * All live entries, newest first, ties broken by name.
     *
     * @return an immutable ordered snapshot
     */
    public List<FileEntry> snapshot() {
        List<FileEntry> entries;
        lock.readLock().lock();
        try {
            entries = new ArrayList<>(live.values());
        } finally {
            lock.readLock().unlock();
        }
        entries.sort(FileEntry.NEWEST_FIRST);
        return List.copyOf(entries);
    }

    /**
     * @return the current snapshot stamped with this registry's epoch
     */
    public ChangeEvent.ResyncAll resync() {
        return new ChangeEvent.ResyncAll(snapshot(), epoch);
    }

    public Optional<FileEntry> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(live.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return live.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
