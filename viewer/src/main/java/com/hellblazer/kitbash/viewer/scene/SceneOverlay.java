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

import com.hellblazer.kitbash.common.ConnectionState;

import java.util.List;

/**
 * Status display of the viewer. All methods default to doing nothing.
 *
 * @author hal.hildebrand
 */
public interface SceneOverlay {

    SceneOverlay NONE = new SceneOverlay() {
    };

    /**
     * @param objects current replica in name order
     */
    default void sceneChanged(List<SceneObjectState> objects) {
    }

    default void loadFailed(String name, String error) {
    }

    default void connectionChanged(ConnectionState state) {
    }
}
