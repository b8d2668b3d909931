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

import java.util.Objects;

/**
 * A coalesced change for one name, reported only after its quiet period elapsed without further notifications.
 *
 * @author hal.hildebrand
 */
public sealed interface SettledChange permits SettledChange.Present, SettledChange.Absent {

    String name();

    /**
     * The file exists when the change settled.
     *
     * @param metadata metadata read at timer expiry
     */
    record Present(FileMetadata metadata) implements SettledChange {
        public Present {
            Objects.requireNonNull(metadata, "metadata");
        }

        @Override
        public String name() {
            return metadata.name();
        }
    }

    /**
     * The file no longer exists when the change settled.
     *
     * @param name file name
     */
    record Absent(String name) implements SettledChange {
        public Absent {
            Objects.requireNonNull(name, "name");
        }
    }
}
