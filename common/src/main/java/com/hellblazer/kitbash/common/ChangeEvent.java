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
package com.hellblazer.kitbash.common;

import java.util.List;
import java.util.Objects;

/**
 * Sealed interface for the canonical, ordered stream of watched-directory changes.
 * <p>
 * Events are immutable records produced by the server's sequencer and consumed by every connected viewer. Per file
 * name, events are emitted in version order and never reordered; events for different names may interleave.
 * <pre>
 * Added(cube.obj, v1) → Modified(cube.obj, v2) → Removed(cube.obj, v3)
 *                    ↘ Added(sphere.obj, v1) may appear anywhere
 * </pre>
 * A {@link ResyncAll} carries the complete registry and supersedes everything sent before it on a connection.
 *
 * @author hal.hildebrand
 */
public sealed interface ChangeEvent permits ChangeEvent.Added, ChangeEvent.Modified, ChangeEvent.Removed,
                                            ChangeEvent.ResyncAll {

    /**
     * Wire discriminator of this event, the {@code type} field of its JSON form.
     *
     * @return event type name
     */
    String type();

    /**
     * Event emitted when the watched directory gains a file the registry did not know.
     *
     * @param entry the new registry entry
     */
    record Added(FileEntry entry) implements ChangeEvent {
        public static final String TYPE = "added";

        public Added {
            Objects.requireNonNull(entry, "entry");
        }

        @Override
        public String type() {
            return TYPE;
        }

        public String name() {
            return entry.name();
        }

        public long version() {
            return entry.version();
        }
    }

    /**
     * Event emitted when a known file settles after a modification.
     *
     * @param entry the updated registry entry
     */
    record Modified(FileEntry entry) implements ChangeEvent {
        public static final String TYPE = "modified";

        public Modified {
            Objects.requireNonNull(entry, "entry");
        }

        @Override
        public String type() {
            return TYPE;
        }

        public String name() {
            return entry.name();
        }

        public long version() {
            return entry.version();
        }
    }

    /**
     * Event emitted when a file disappears from the watched directory.
     *
     * @param name    removed file name
     * @param version tombstone version, one greater than the last live version
     */
    record Removed(String name, long version) implements ChangeEvent {
        public static final String TYPE = "removed";

        public Removed {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String type() {
            return TYPE;
        }
    }

    /**
     * Full registry snapshot, newest first.
     * <p>
     * Versions are only comparable within one epoch. A snapshot whose epoch differs from the previous one comes from
     * a restarted server, whose versions started over.
     *
     * @param files every live entry at the time the snapshot was taken
     * @param epoch identifies the server run that produced the snapshot, 0 when unknown
     */
    record ResyncAll(List<FileEntry> files, long epoch) implements ChangeEvent {
        public static final String TYPE = "resync_all";

        public ResyncAll {
            files = List.copyOf(files);
            if (epoch < 0) {
                throw new IllegalArgumentException("Epoch must not be negative: " + epoch);
            }
        }

        public ResyncAll(List<FileEntry> files) {
            this(files, 0);
        }

        @Override
        public String type() {
            return TYPE;
        }

        public boolean isEmpty() {
            return files.isEmpty();
        }
    }
}
