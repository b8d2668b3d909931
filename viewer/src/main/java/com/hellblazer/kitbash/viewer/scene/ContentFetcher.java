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

import java.util.concurrent.CompletableFuture;

/**
 * Retrieves current file bytes from the portal.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ContentFetcher {

    /**
     * @param name    file name
     * @param version version the caller expects, for logging; the server always returns current bytes
     * @return the content; cancelling the future abandons the request
     */
    CompletableFuture<byte[]> fetch(String name, long version);
}
