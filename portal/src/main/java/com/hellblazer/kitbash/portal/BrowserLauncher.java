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
package com.hellblazer.kitbash.portal;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;

/**
 * Opens a URL for the user.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface BrowserLauncher {

    void open(URI uri) throws IOException;

    /**
     * The platform browser through {@link Desktop}.
     */
    static BrowserLauncher desktop() {
        return uri -> {
            if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
                throw new IOException("No desktop browser available to open " + uri);
            }
            Desktop.getDesktop().browse(uri);
        };
    }
}
