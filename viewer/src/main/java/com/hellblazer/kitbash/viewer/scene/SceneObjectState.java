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
 * What the viewer currently shows for one file.
 *
 * @param name               file name
 * @param visible            hidden objects stay loaded but are not drawn
 * @param selected           at most one object is selected
 * @param lastAppliedVersion highest version applied from the event stream
 * @param loadError          message of the last failed load, null when the last load succeeded
 * @author hal.hildebrand
 */
public record SceneObjectState(String name, boolean visible, boolean selected, long lastAppliedVersion,
                               String loadError) {

    public boolean hasError() {
        return loadError != null;
    }
}
