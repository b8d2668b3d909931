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

import java.io.IOException;
import java.nio.file.Path;

/**
 * The watched directory can no longer be watched (deleted, unmounted, permissions revoked).
 * <p>
 * Fatal for the watch: no further synchronization is possible for the directory.
 *
 * @author hal.hildebrand
 */
public class WatchLostException extends IOException {

    private final Path directory;

    public WatchLostException(Path directory, String message) {
        super(message);
        this.directory = directory;
    }

    public WatchLostException(Path directory, String message, Throwable cause) {
        super(message, cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
