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

import java.util.Objects;

/**
 * Outcome of turning fetched bytes into a renderable representation. Parse errors are data, not exceptions.
 *
 * @param <R> renderer representation
 * @author hal.hildebrand
 */
public sealed interface LoadResult<R> permits LoadResult.Loaded, LoadResult.Failed {

    static <R> LoadResult<R> loaded(R representation) {
        return new Loaded<>(representation);
    }

    static <R> LoadResult<R> failed(String error) {
        return new Failed<>(error);
    }

    record Loaded<R>(R representation) implements LoadResult<R> {
        public Loaded {
            Objects.requireNonNull(representation, "representation");
        }
    }

    record Failed<R>(String error) implements LoadResult<R> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
