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

/**
 * The rendering side of the viewer, driven by the {@link SceneReconciler}.
 * <p>
 * {@link #load} may be called from any thread; the other operations are invoked only from the reconciler's loop.
 *
 * @param <R> representation produced by {@link #load}
 * @author hal.hildebrand
 */
public interface SceneRenderer<R> {

    /**
     * Parse fetched content.
     */
    LoadResult<R> load(String name, byte[] content);

    /**
     * Attach a freshly loaded representation, replacing any previous one for the name.
     */
    void swap(String name, R representation, SceneObjectState state);

    /**
     * Visibility or selection changed.
     */
    void applyFlags(String name, SceneObjectState state);

    /**
     * The file is gone; release everything held for it.
     */
    void unload(String name);
}
