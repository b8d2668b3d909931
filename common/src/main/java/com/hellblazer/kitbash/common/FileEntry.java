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

import java.util.Comparator;
import java.util.Objects;

/**
 * One live file of the watched directory, as tracked by the server registry and mirrored in resync snapshots.
 * <p>
 * Versions are assigned per name by the registry. For a given name the version strictly increases for as long as the
 * server runs, so {@code (name, version)} identifies exactly one observed state of a file.
 *
 * @param name          file name relative to the watched directory, the unique key
 * @param mtime         last modification time in epoch milliseconds, as observed when the change settled
 * @param size          file size in bytes
 * @param version       per-name version, starting at 1
 * @param contentDigest optional opaque content token, null when digests are disabled
 * @author hal.hildebrand
 */
public record FileEntry(String name, long mtime, long size, long version, String contentDigest) {

    /**
     * Externally visible snapshot order: newest first, ties broken lexicographically by name.
     */
    public static final Comparator<FileEntry> NEWEST_FIRST = Comparator.comparingLong(FileEntry::mtime)
                                                                        .reversed()
                                                                        .thenComparing(FileEntry::name);

    public FileEntry {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("File name must not be empty");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Version must be positive: " + version);
        }
        if (size < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + size);
        }
    }

    public FileEntry(String name, long mtime, long size, long version) {
        this(name, mtime, size, version, null);
    }

    /**
     * @return true if this entry carries a content digest
     */
    public boolean hasDigest() {
        return contentDigest != null;
    }
}
