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
package com.hellblazer.kitbash.viewer.connect;

/**
 * Opens event-channel connections to the portal.
 *
 * @author hal.hildebrand
 */
public interface EventConnector {

    /**
     * Start one connection attempt. The outcome is reported to the listener, possibly before this method returns.
     */
    Connection connect(Listener listener);

    /**
     * An open or opening connection.
     */
    interface Connection {

        /**
         * @return false if the message could not be queued for sending
         */
        boolean send(String text);

        void close();
    }

    /**
     * Callbacks of one connection attempt.
     */
    interface Listener {

        void onOpen();

        void onMessage(String text);

        /**
         * The connection ended normally.
         */
        void onClosed(String reason);

        /**
         * The attempt failed or the connection broke.
         */
        void onFailure(Throwable cause);
    }
}
