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
package com.hellblazer.kitbash.portal.hub;

import java.io.IOException;

/**
 * One subscriber's outbound transport, as seen by the {@link SubscriptionHub}.
 *
 * @author hal.hildebrand
 */
public interface EventChannel {

    /**
     * @return identity of the connection, unique among live connections
     */
    String id();

    /**
     * Send one encoded message. Called by at most one thread at a time per channel.
     *
     * @throws IOException if the message could not be written
     */
    void send(String text) throws IOException;

    boolean isOpen();

    void close();
}
